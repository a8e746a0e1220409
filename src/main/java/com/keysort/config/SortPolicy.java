package com.keysort.config;

import com.keysort.exception.ConfigurationException;

import java.util.List;
import java.util.Objects;

/**
 * Immutable sorting and canonicalization policy.
 * Passed explicitly to every canonicalize and sort call.
 *
 * @param primary    Primary document sort field (TRIGGER or CONDITION)
 * @param secondary  Secondary document sort field (NONE when unset)
 * @param grouping   Operand grouping mode
 * @param tieBreak   Ordering of operands within a bucket
 * @param priorities Explicit priority list, checked in order
 */
public record SortPolicy(
        SortField primary,
        SortField secondary,
        GroupingMode grouping,
        TieBreakMode tieBreak,
        List<PriorityMatcher> priorities
) {
    public SortPolicy {
        Objects.requireNonNull(primary, "primary cannot be null");
        Objects.requireNonNull(grouping, "grouping cannot be null");
        Objects.requireNonNull(tieBreak, "tieBreak cannot be null");
        if (primary == SortField.NONE) {
            throw new ConfigurationException("Primary sort field must be trigger or condition");
        }
        secondary = secondary == null ? SortField.NONE : secondary;
        priorities = priorities == null ? List.of() : List.copyOf(priorities);
    }

    /**
     * Default policy: by trigger, no grouping, alphabetical tie-break.
     */
    public static SortPolicy defaults() {
        return new SortPolicy(SortField.TRIGGER, SortField.NONE, GroupingMode.NONE,
                TieBreakMode.ALPHABETICAL, List.of());
    }

    public SortPolicy withPrimary(SortField primary) {
        return new SortPolicy(primary, secondary, grouping, tieBreak, priorities);
    }

    public SortPolicy withSecondary(SortField secondary) {
        return new SortPolicy(primary, secondary, grouping, tieBreak, priorities);
    }

    public SortPolicy withGrouping(GroupingMode grouping) {
        return new SortPolicy(primary, secondary, grouping, tieBreak, priorities);
    }

    public SortPolicy withTieBreak(TieBreakMode tieBreak) {
        return new SortPolicy(primary, secondary, grouping, tieBreak, priorities);
    }

    public SortPolicy withPriorities(List<PriorityMatcher> priorities) {
        return new SortPolicy(primary, secondary, grouping, tieBreak, priorities);
    }

    /**
     * Index of the first priority entry matching the identifier, or -1.
     */
    public int priorityIndex(String identifier) {
        for (int i = 0; i < priorities.size(); i++) {
            if (priorities.get(i).matches(identifier)) {
                return i;
            }
        }
        return -1;
    }
}
