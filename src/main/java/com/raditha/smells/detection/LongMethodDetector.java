package com.raditha.smells.detection;

import com.github.javaparser.Range;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags functions that span too many non-empty source lines.
 * <p>
 * Lines are counted in the original text between the first and last line of the
 * declaration, so a statement spread over several lines counts once per line.
 */
public class LongMethodDetector {

    public static final int DEFAULT_THRESHOLD = 15;

    private final int threshold;

    public LongMethodDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public LongMethodDetector(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Long method threshold must be >= 0");
        }
        this.threshold = threshold;
    }

    /**
     * @throws AnalyzerPreconditionException if the tree has no source text or a
     *                                       function has no position range
     */
    public List<Finding> detect(SourceTree tree) {
        String source = tree.source().orElseThrow(() -> new AnalyzerPreconditionException(
                "Tree has no source text; long method detection needs a parsed file"));
        String[] lines = source.split("\\R", -1);

        List<Finding> findings = new ArrayList<>();
        for (FunctionDecl function : tree.functions()) {
            Range range = function.method().getRange().orElseThrow(() -> new AnalyzerPreconditionException(
                    "Function " + function.name() + " has no position information"));
            int count = countNonEmptyLines(lines, range.begin.line, range.end.line);
            if (count > threshold) {
                findings.add(new Finding(SmellKind.LONG_METHOD, function.name(), count,
                        String.format("Function %s has %d non-empty lines.", function.name(), count)));
            }
        }
        return findings;
    }

    /**
     * Count non-blank lines between two 1-based line numbers, inclusive.
     */
    static int countNonEmptyLines(String[] lines, int beginLine, int endLine) {
        int count = 0;
        int last = Math.min(endLine, lines.length);
        for (int i = beginLine - 1; i < last; i++) {
            if (!lines[i].isBlank()) {
                count++;
            }
        }
        return count;
    }
}
