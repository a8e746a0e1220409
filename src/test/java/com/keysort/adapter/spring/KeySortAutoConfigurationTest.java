package com.keysort.adapter.spring;

import com.keysort.config.ClassificationProfiles;
import com.keysort.config.GroupingMode;
import com.keysort.config.SortField;
import com.keysort.config.SortPolicy;
import com.keysort.config.TieBreakMode;
import com.keysort.document.RuleFieldNames;
import com.keysort.exception.ConfigurationException;
import com.keysort.sort.IdAnnotator;
import com.keysort.sort.KeybindingSorter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for KeySortAutoConfiguration.
 */
class KeySortAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(KeySortAutoConfiguration.class);

    @Test
    @DisplayName("Defaults create a sorter without identifier checks")
    void defaults() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertNotNull(context.getBean(KeybindingSorter.class));
            assertEquals(SortPolicy.defaults(), context.getBean(SortPolicy.class));
            assertEquals(RuleFieldNames.defaults(), context.getBean(RuleFieldNames.class));
            assertTrue(context.getBeansOfType(IdAnnotator.class).isEmpty());
        });
    }

    @Test
    @DisplayName("Properties bind onto the sort policy")
    void bindsPolicy() {
        contextRunner
                .withPropertyValues(
                        "keysort.primary=condition",
                        "keysort.secondary=trigger",
                        "keysort.grouping=focus-invariant",
                        "keysort.tie-break=natural-numeric+negation-preferred",
                        "keysort.priority-prefixes=editorFocus, view.",
                        "keysort.priority-regexes=^config\\.")
                .run(context -> {
                    SortPolicy policy = context.getBean(SortPolicy.class);
                    assertEquals(SortField.CONDITION, policy.primary());
                    assertEquals(SortField.TRIGGER, policy.secondary());
                    assertEquals(GroupingMode.FOCUS_INVARIANT, policy.grouping());
                    assertEquals(TieBreakMode.NATURAL_NUMERIC_NEGATION_PREFERRED, policy.tieBreak());
                    assertEquals(List.of("editorFocus", "view.", "^config\\."),
                            policy.priorities().stream().map(p -> p.entry()).toList());
                    assertTrue(policy.priorities().get(2).isRegex());
                });
    }

    @Test
    @DisplayName("Field names and profile path are configurable")
    void bindsFieldNamesAndProfiles() {
        contextRunner
                .withPropertyValues(
                        "keysort.trigger-field=chord",
                        "keysort.condition-field=if",
                        "keysort.profiles-path=classpath:profiles/minimal.yaml")
                .run(context -> {
                    assertEquals(new RuleFieldNames("chord", "command", "if"), context.getBean(RuleFieldNames.class));
                    assertEquals(List.of("ctrl", "alt"), context.getBean(ClassificationProfiles.class).modifierOrder());
                });
    }

    @Test
    @DisplayName("Identifier checks are created on demand")
    void detectIds() {
        contextRunner
                .withPropertyValues("keysort.detect-ids=true", "keysort.id-seed=42")
                .run(context -> assertNotNull(context.getBean(IdAnnotator.class)));
    }

    @Test
    @DisplayName("Invalid priority regex fails startup")
    void invalidRegex() {
        contextRunner
                .withPropertyValues("keysort.priority-regexes=[unclosed")
                .run(context -> {
                    Throwable failure = context.getStartupFailure();
                    assertNotNull(failure);
                    assertTrue(hasCause(failure, ConfigurationException.class), failure::toString);
                });
    }

    @Test
    @DisplayName("Disabled configuration creates no beans")
    void disabled() {
        contextRunner
                .withPropertyValues("keysort.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(KeybindingSorter.class).isEmpty()));
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }
}
