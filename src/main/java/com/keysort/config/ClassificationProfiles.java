package com.keysort.config;

import com.keysort.exception.ConfigurationException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operand classification data loaded from the profile YAML.
 *
 * @param buckets       Buckets by name
 * @param orders        Bucket order per grouping mode (NONE has no buckets)
 * @param focusBucket   Name of the bucket marking focus-dependent rules
 * @param modifierOrder Canonical order of chord modifiers
 */
public record ClassificationProfiles(
        Map<String, TokenBucket> buckets,
        Map<GroupingMode, List<TokenBucket>> orders,
        String focusBucket,
        List<String> modifierOrder
) {
    public ClassificationProfiles {
        buckets = Map.copyOf(buckets);
        Map<GroupingMode, List<TokenBucket>> copy = new EnumMap<>(GroupingMode.class);
        orders.forEach((mode, list) -> copy.put(mode, List.copyOf(list)));
        copy.putIfAbsent(GroupingMode.NONE, List.of());
        orders = copy;
        modifierOrder = List.copyOf(modifierOrder);
        if (!buckets.containsKey(focusBucket)) {
            throw new ConfigurationException("Focus bucket '" + focusBucket + "' is not defined");
        }
    }

    /**
     * Buckets in rank order for the given mode; rank of the first is 1.
     */
    public List<TokenBucket> bucketsFor(GroupingMode mode) {
        List<TokenBucket> order = orders.get(mode);
        if (order == null) {
            throw new ConfigurationException("No bucket order configured for grouping " + mode.profileKey());
        }
        return order;
    }

    /**
     * Rank of operands that match no bucket in the given mode.
     */
    public int otherRank(GroupingMode mode) {
        return bucketsFor(mode).size() + 1;
    }

    /**
     * Rank of the focus bucket in the given mode, or -1 when the mode does not use it.
     */
    public int focusRank(GroupingMode mode) {
        List<TokenBucket> order = bucketsFor(mode);
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).name().equals(focusBucket)) {
                return i + 1;
            }
        }
        return -1;
    }
}
