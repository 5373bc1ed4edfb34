package com.raditha.smells.refactoring;

import com.raditha.smells.SmellDetectorException;

/**
 * Thrown when a rewrite refers to a function that is not in the tree, or to a block
 * that no longer fits in its function. The rewrite is abandoned as a whole.
 */
public class RewriteException extends SmellDetectorException {

    private final String functionName;

    public RewriteException(String message, String functionName) {
        super(message);
        this.functionName = functionName;
    }

    static RewriteException missingFunction(String name) {
        return new RewriteException("Function not found in tree: " + name, name);
    }

    /**
     * @return name of the function the failure is about
     */
    public String getFunctionName() {
        return functionName;
    }
}
