package com.raditha.smells.detection;

import com.raditha.smells.model.Finding;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags functions that declare more parameters than the threshold.
 */
public class LongParameterListDetector {

    public static final int DEFAULT_THRESHOLD = 3;

    private final int threshold;

    public LongParameterListDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public LongParameterListDetector(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Parameter threshold must be >= 0");
        }
        this.threshold = threshold;
    }

    public List<Finding> detect(SourceTree tree) {
        List<Finding> findings = new ArrayList<>();
        for (FunctionDecl function : tree.functions()) {
            int count = function.parameterCount();
            if (count > threshold) {
                findings.add(new Finding(SmellKind.LONG_PARAMETER_LIST, function.name(), count,
                        String.format("Function %s has %d parameters.", function.name(), count)));
            }
        }
        return findings;
    }
}
