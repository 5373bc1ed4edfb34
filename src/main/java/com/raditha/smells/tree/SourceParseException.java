package com.raditha.smells.tree;

import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.raditha.smells.SmellDetectorException;

import java.util.Optional;

/**
 * Thrown when the input is not a valid Java compilation unit.
 * Carries the location of the first problem reported by the parser, when known.
 */
public class SourceParseException extends SmellDetectorException {

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /**
     * Build from the first problem reported by JavaParser.
     */
    static SourceParseException from(Problem problem) {
        if (problem == null) {
            return new SourceParseException("Could not parse file: unknown parse failure", -1, -1);
        }
        Optional<Range> range = problem.getLocation().flatMap(TokenRange::toRange);
        int line = range.map(r -> r.begin.line).orElse(-1);
        int column = range.map(r -> r.begin.column).orElse(-1);
        return new SourceParseException("Could not parse file: " + problem.getMessage(), line, column);
    }

    /**
     * @return 1-based line of the problem, or -1 when the parser gave no position
     */
    public int getLine() {
        return line;
    }

    /**
     * @return 1-based column of the problem, or -1 when the parser gave no position
     */
    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line > 0;
    }
}
