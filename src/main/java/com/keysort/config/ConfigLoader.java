package com.keysort.config;

import com.keysort.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads operand classification profiles from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Location of the bundled profiles.
     */
    public static final String DEFAULT_PROFILES = "classpath:keysort-profiles.yaml";

    /**
     * Load classification profiles from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the profile file
     * @return Loaded profiles
     */
    public static ClassificationProfiles load(String path) {
        log.debug("Loading classification profiles from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load classification profiles from: " + path, e);
        }
    }

    /**
     * Load the bundled classification profiles.
     */
    public static ClassificationProfiles loadDefaults() {
        return load(DEFAULT_PROFILES);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static ClassificationProfiles parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Classification profile file is empty");
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ConfigurationException("Classification profile file must contain a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) document;

        // Profiles may sit at root or under the 'keysort' key
        Map<String, Object> profileConfig = root;
        if (root.containsKey("keysort")) {
            if (!(root.get("keysort") instanceof Map<?, ?>)) {
                throw new ConfigurationException("Section 'keysort' must be a mapping");
            }
            profileConfig = (Map<String, Object>) root.get("keysort");
        }

        Map<String, TokenBucket> buckets = parseBuckets(getMap(profileConfig, "buckets"));
        Map<GroupingMode, List<TokenBucket>> orders = parseGrouping(getMap(profileConfig, "grouping"), buckets);
        String focusBucket = getString(profileConfig, "focus-bucket", "focus");
        List<String> modifierOrder = getStringList(profileConfig, "modifier-order");

        ClassificationProfiles profiles = new ClassificationProfiles(buckets, orders, focusBucket, modifierOrder);

        log.debug("Loaded classification profiles: {} buckets, groupings {}, focus bucket '{}'",
                buckets.size(), orders.keySet(), focusBucket);

        return profiles;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, TokenBucket> parseBuckets(Map<String, Object> bucketsMap) {
        if (bucketsMap == null || bucketsMap.isEmpty()) {
            throw new ConfigurationException("Classification profiles define no buckets");
        }

        Map<String, TokenBucket> buckets = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : bucketsMap.entrySet()) {
            String name = entry.getKey();
            if (!(entry.getValue() instanceof Map<?, ?>)) {
                throw new ConfigurationException("Bucket '" + name + "' must be a mapping");
            }
            Map<String, Object> bucketMap = (Map<String, Object>) entry.getValue();

            String matchStr = getString(bucketMap, "match", "EXACT");
            MatchStyle match;
            try {
                match = MatchStyle.valueOf(matchStr.toUpperCase(Locale.ROOT).replace("-", "_"));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Bucket '" + name + "' has unknown match style '" + matchStr + "'", e);
            }

            List<String> tokens = getStringList(bucketMap, "tokens");
            buckets.put(name, new TokenBucket(name, match, tokens));

            log.debug("Parsed bucket: name={}, match={}, tokens={}", name, match, tokens.size());
        }
        return buckets;
    }

    private static Map<GroupingMode, List<TokenBucket>> parseGrouping(Map<String, Object> groupingMap,
                                                                      Map<String, TokenBucket> buckets) {
        Map<GroupingMode, List<TokenBucket>> orders = new EnumMap<>(GroupingMode.class);
        orders.put(GroupingMode.NONE, List.of());

        for (GroupingMode mode : GroupingMode.values()) {
            if (mode == GroupingMode.NONE) {
                continue;
            }
            List<String> names = groupingMap == null ? List.of() : getStringList(groupingMap, mode.profileKey());
            if (names.isEmpty()) {
                throw new ConfigurationException("No bucket order configured for grouping '" + mode.profileKey() + "'");
            }
            List<TokenBucket> order = new ArrayList<>();
            for (String name : names) {
                TokenBucket bucket = buckets.get(name);
                if (bucket == null) {
                    throw new ConfigurationException("Grouping '" + mode.profileKey()
                            + "' references unknown bucket '" + name + "'");
                }
                order.add(bucket);
            }
            orders.put(mode, order);
        }
        return orders;
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Map<?, ?>) return (Map<String, Object>) value;
        throw new ConfigurationException("'" + key + "' must be a mapping");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
