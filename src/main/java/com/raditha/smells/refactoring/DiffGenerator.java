package com.raditha.smells.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for refactoring previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {
    public static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the original and refactored source.
     *
     * @param original  Original source text
     * @param revised   Refactored source text
     * @param fileName  Name shown in the diff headers
     * @return Unified diff, empty when the texts have the same lines
     */
    public String generateUnifiedDiff(String original, String revised, String fileName) {
        return generateUnifiedDiff(original, revised, fileName, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String original, String revised, String fileName, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\\R", -1));
    }
}
