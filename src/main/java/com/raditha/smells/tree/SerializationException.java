package com.raditha.smells.tree;

import com.raditha.smells.SmellDetectorException;

/**
 * Thrown when a (rewritten) tree cannot be rendered back to valid source text.
 * Callers must treat the rewrite that produced the tree as not applied.
 */
public class SerializationException extends SmellDetectorException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
