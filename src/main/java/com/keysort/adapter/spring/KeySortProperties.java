package com.keysort.adapter.spring;

import com.keysort.config.ConfigLoader;
import com.keysort.config.GroupingMode;
import com.keysort.config.SortField;
import com.keysort.config.TieBreakMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot configuration properties for keysort.
 */
@ConfigurationProperties(prefix = "keysort")
public class KeySortProperties {

    /**
     * Whether keysort is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the classification profile file.
     * Supports classpath: prefix for classpath resources.
     */
    private String profilesPath = ConfigLoader.DEFAULT_PROFILES;

    /**
     * Input document; "-" or empty reads standard input.
     */
    private String input = "";

    private SortField primary = SortField.TRIGGER;

    private SortField secondary = SortField.NONE;

    private GroupingMode grouping = GroupingMode.NONE;

    private TieBreakMode tieBreak = TieBreakMode.ALPHABETICAL;

    /**
     * Identifiers moved to the front of every conjunction, in order.
     */
    private List<String> priorityPrefixes = new ArrayList<>();

    /**
     * Regular expressions checked after the literal prefixes, in order.
     */
    private List<String> priorityRegexes = new ArrayList<>();

    private String triggerField = "key";

    private String actionField = "command";

    private String conditionField = "when";

    /**
     * Check rule identifiers and annotate duplicates or missing ones.
     */
    private boolean detectIds = false;

    /**
     * Seed for generated identifiers; random when unset.
     */
    private Long idSeed;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProfilesPath() {
        return profilesPath;
    }

    public void setProfilesPath(String profilesPath) {
        this.profilesPath = profilesPath;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public SortField getPrimary() {
        return primary;
    }

    public void setPrimary(SortField primary) {
        this.primary = primary;
    }

    public SortField getSecondary() {
        return secondary;
    }

    public void setSecondary(SortField secondary) {
        this.secondary = secondary;
    }

    public GroupingMode getGrouping() {
        return grouping;
    }

    public void setGrouping(GroupingMode grouping) {
        this.grouping = grouping;
    }

    public TieBreakMode getTieBreak() {
        return tieBreak;
    }

    public void setTieBreak(TieBreakMode tieBreak) {
        this.tieBreak = tieBreak;
    }

    public List<String> getPriorityPrefixes() {
        return priorityPrefixes;
    }

    public void setPriorityPrefixes(List<String> priorityPrefixes) {
        this.priorityPrefixes = priorityPrefixes;
    }

    public List<String> getPriorityRegexes() {
        return priorityRegexes;
    }

    public void setPriorityRegexes(List<String> priorityRegexes) {
        this.priorityRegexes = priorityRegexes;
    }

    public String getTriggerField() {
        return triggerField;
    }

    public void setTriggerField(String triggerField) {
        this.triggerField = triggerField;
    }

    public String getActionField() {
        return actionField;
    }

    public void setActionField(String actionField) {
        this.actionField = actionField;
    }

    public String getConditionField() {
        return conditionField;
    }

    public void setConditionField(String conditionField) {
        this.conditionField = conditionField;
    }

    public boolean isDetectIds() {
        return detectIds;
    }

    public void setDetectIds(boolean detectIds) {
        this.detectIds = detectIds;
    }

    public Long getIdSeed() {
        return idSeed;
    }

    public void setIdSeed(Long idSeed) {
        this.idSeed = idSeed;
    }
}
