package com.raditha.smells.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard index of two token sets: |A ∩ B| / |A ∪ B|.
 */
public class JaccardSimilarity {

    /**
     * Calculate the similarity of two sets.
     *
     * @return score between 0.0 and 1.0; 0.0 when both sets are empty
     */
    public double calculate(Set<String> tokens1, Set<String> tokens2) {
        if (tokens1 == null || tokens2 == null) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);
        return (double) intersection.size() / union.size();
    }
}
