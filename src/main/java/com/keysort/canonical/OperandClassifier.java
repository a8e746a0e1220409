package com.keysort.canonical;

import com.keysort.config.ClassificationProfiles;
import com.keysort.config.GroupingMode;
import com.keysort.config.IdentifierPatterns;
import com.keysort.config.SortPolicy;
import com.keysort.config.TokenBucket;

import java.util.List;

/**
 * Assigns condition operands to semantic buckets.
 * <p>
 * Rank 0 is reserved for operands matching the explicit priority list; the
 * grouping mode's buckets follow from rank 1 and unmatched operands rank last.
 * Ranks never depend on the tie-break mode.
 */
public class OperandClassifier {

    /**
     * Rank of operands matching the priority list.
     */
    public static final int PRIORITY_RANK = 0;

    private final ClassificationProfiles profiles;

    public OperandClassifier(ClassificationProfiles profiles) {
        this.profiles = profiles;
    }

    public ClassificationProfiles getProfiles() {
        return profiles;
    }

    /**
     * Rank of a rendered operand under the policy, priority list included.
     */
    public int rank(String operand, SortPolicy policy) {
        String left = IdentifierPatterns.leftIdentifier(operand);
        if (policy.priorityIndex(left) >= 0) {
            return PRIORITY_RANK;
        }
        return bucketRank(left, policy.grouping());
    }

    /**
     * Rank of a left identifier from the grouping mode alone.
     */
    public int bucketRank(String identifier, GroupingMode mode) {
        if (mode == GroupingMode.NONE) {
            return 1;
        }
        List<TokenBucket> order = profiles.bucketsFor(mode);
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).matches(identifier)) {
                return i + 1;
            }
        }
        return profiles.otherRank(mode);
    }
}
