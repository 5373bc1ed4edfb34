package com.raditha.smells.detection;

import com.raditha.smells.SmellDetectorException;

/**
 * Thrown when a tree lacks information a detector depends on, such as source
 * positions. Fatal for the detector that raised it.
 */
public class AnalyzerPreconditionException extends SmellDetectorException {

    public AnalyzerPreconditionException(String message) {
        super(message);
    }
}
