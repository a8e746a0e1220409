package com.keysort.adapter.spring;

import com.keysort.canonical.Canonicalizer;
import com.keysort.config.ClassificationProfiles;
import com.keysort.config.ConfigLoader;
import com.keysort.config.PriorityMatcher;
import com.keysort.config.SortPolicy;
import com.keysort.document.FieldExtractor;
import com.keysort.document.RuleFieldNames;
import com.keysort.document.StructuralSegmenter;
import com.keysort.sort.ChordNormalizer;
import com.keysort.sort.DuplicateDetector;
import com.keysort.sort.IdAllocator;
import com.keysort.sort.IdAnnotator;
import com.keysort.sort.IdExtractor;
import com.keysort.sort.KeybindingSorter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Spring Boot auto-configuration for keysort.
 */
@Configuration
@ConditionalOnProperty(prefix = "keysort", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(KeySortProperties.class)
public class KeySortAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(KeySortAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ClassificationProfiles classificationProfiles(KeySortProperties properties) {
        log.debug("Loading classification profiles from: {}", properties.getProfilesPath());
        return ConfigLoader.load(properties.getProfilesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public SortPolicy sortPolicy(KeySortProperties properties) {
        List<PriorityMatcher> priorities = new ArrayList<>();
        for (String prefix : properties.getPriorityPrefixes()) {
            if (!prefix.isBlank()) {
                priorities.add(PriorityMatcher.literal(prefix.strip()));
            }
        }
        for (String regex : properties.getPriorityRegexes()) {
            if (!regex.isBlank()) {
                priorities.add(PriorityMatcher.regex(regex.strip()));
            }
        }
        SortPolicy policy = new SortPolicy(properties.getPrimary(), properties.getSecondary(),
                properties.getGrouping(), properties.getTieBreak(), priorities);
        log.debug("Sort policy: {}", policy);
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleFieldNames ruleFieldNames(KeySortProperties properties) {
        return new RuleFieldNames(properties.getTriggerField(), properties.getActionField(),
                properties.getConditionField());
    }

    @Bean
    @ConditionalOnMissingBean
    public Canonicalizer canonicalizer(ClassificationProfiles profiles) {
        return new Canonicalizer(profiles);
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldExtractor fieldExtractor(RuleFieldNames names) {
        return new FieldExtractor(names);
    }

    @Bean
    @ConditionalOnMissingBean
    public DuplicateDetector duplicateDetector(ClassificationProfiles profiles, RuleFieldNames names) {
        return new DuplicateDetector(new ChordNormalizer(profiles.modifierOrder()), names);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "keysort", name = "detect-ids", havingValue = "true")
    public IdAnnotator idAnnotator(KeySortProperties properties, RuleFieldNames names) {
        Random random = properties.getIdSeed() != null ? new Random(properties.getIdSeed()) : new Random();
        return new IdAnnotator(new IdExtractor(names), new IdAllocator(random), names);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeybindingSorter keybindingSorter(SortPolicy policy,
                                             FieldExtractor fieldExtractor,
                                             Canonicalizer canonicalizer,
                                             DuplicateDetector duplicateDetector,
                                             ObjectProvider<IdAnnotator> idAnnotator) {
        return new KeybindingSorter(policy, new StructuralSegmenter(), fieldExtractor, canonicalizer,
                duplicateDetector, idAnnotator.getIfAvailable());
    }
}
