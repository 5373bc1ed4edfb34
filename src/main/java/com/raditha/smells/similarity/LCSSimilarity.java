package com.raditha.smells.similarity;

import java.util.List;

/**
 * Similarity of two label sequences based on their Longest Common Subsequence.
 * The score is {@code 2 * LCS / (|a| + |b|)}, so two identical sequences score 1.0
 * and an extra label on either side lowers the score evenly.
 */
public class LCSSimilarity {

    /**
     * Calculate LCS-based similarity between two sequences.
     *
     * @return score between 0.0 and 1.0; 1.0 when both sequences are empty
     */
    public double calculate(List<String> labels1, List<String> labels2) {
        if (labels1 == null || labels2 == null) {
            return 0.0;
        }

        if (labels1.isEmpty() && labels2.isEmpty()) {
            return 1.0;
        }

        if (labels1.isEmpty() || labels2.isEmpty()) {
            return 0.0;
        }

        int lcsLength = computeLCSLength(labels1, labels2);
        return 2.0 * lcsLength / (labels1.size() + labels2.size());
    }

    /**
     * Compute LCS length using space-optimized DP.
     * Uses only O(min(m,n)) space instead of O(m*n).
     */
    int computeLCSLength(List<String> labels1, List<String> labels2) {
        List<String> shorter = labels1.size() <= labels2.size() ? labels1 : labels2;
        List<String> longer = shorter == labels1 ? labels2 : labels1;

        int m = shorter.size();
        int n = longer.size();

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            for (int i = 1; i <= m; i++) {
                if (shorter.get(i - 1).equals(longer.get(j - 1))) {
                    curr[i] = prev[i - 1] + 1;
                } else {
                    curr[i] = Math.max(curr[i - 1], prev[i]);
                }
            }
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }

        return prev[m];
    }
}
