package com.raditha.smells.analyzer;

import com.raditha.smells.config.SmellDetectorConfig;
import com.raditha.smells.detection.BlockDuplicateDetector;
import com.raditha.smells.detection.FunctionDuplicateDetector;
import com.raditha.smells.detection.LongMethodDetector;
import com.raditha.smells.detection.LongParameterListDetector;
import com.raditha.smells.detection.StructuralDuplicateDetector;
import com.raditha.smells.model.DuplicateBlockGroup;
import com.raditha.smells.model.DuplicateFunctionPair;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.StructuralDuplicatePair;
import com.raditha.smells.tree.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Main orchestrator for smell detection.
 * Runs every detector on the same tree and aggregates their results. A detector that
 * throws is recorded as an error in the report; the others still run.
 */
public class SmellAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(SmellAnalyzer.class);

    private final SmellDetectorConfig config;
    private final LongMethodDetector longMethodDetector;
    private final LongParameterListDetector parameterListDetector;
    private final FunctionDuplicateDetector functionDuplicateDetector;
    private final BlockDuplicateDetector blockDuplicateDetector;
    private final StructuralDuplicateDetector structuralDuplicateDetector;

    /**
     * Create analyzer with default configuration.
     */
    public SmellAnalyzer() {
        this(SmellDetectorConfig.standard());
    }

    public SmellAnalyzer(SmellDetectorConfig config) {
        this.config = config;
        this.longMethodDetector = new LongMethodDetector(config.longMethodThreshold());
        this.parameterListDetector = new LongParameterListDetector(config.parameterThreshold());
        this.functionDuplicateDetector = new FunctionDuplicateDetector();
        this.blockDuplicateDetector = new BlockDuplicateDetector(config.windowSize(), config.similarityThreshold());
        this.structuralDuplicateDetector = new StructuralDuplicateDetector(config.structuralThreshold());
    }

    /**
     * Analyze a single file.
     *
     * @param tree       Parsed file
     * @param sourceName Name used in the report
     */
    public SmellReport analyze(SourceTree tree, String sourceName) {
        List<SmellReport.DetectorError> errors = new ArrayList<>();
        List<Finding> findings = new ArrayList<>();

        findings.addAll(run("long-method", longMethodDetector::detect, tree, errors));
        findings.addAll(run("long-parameter-list", parameterListDetector::detect, tree, errors));

        List<DuplicateFunctionPair> functionPairs =
                run("duplicate-function", functionDuplicateDetector::detect, tree, errors);
        functionPairs.forEach(pair -> findings.add(pair.toFinding()));

        List<DuplicateBlockGroup> blockGroups =
                run("duplicate-block", blockDuplicateDetector::detect, tree, errors);
        blockGroups.forEach(group -> findings.add(group.toFinding()));

        List<StructuralDuplicatePair> structural = withoutExactDuplicates(
                run("structural-duplicate", structuralDuplicateDetector::detect, tree, errors), functionPairs);
        structural.forEach(pair -> findings.add(pair.toFinding()));

        logger.info("Analyzed {}: {} findings, {} detector errors", sourceName, findings.size(), errors.size());
        return new SmellReport(sourceName, findings, functionPairs, blockGroups, structural, errors, config);
    }

    public SmellReport analyze(SourceTree tree) {
        return analyze(tree, "<source>");
    }

    private static <T> List<T> run(String detector, Detector<T> body, SourceTree tree,
            List<SmellReport.DetectorError> errors) {
        try {
            return body.detect(tree);
        } catch (RuntimeException e) {
            logger.warn("Detector {} failed: {}", detector, e.getMessage());
            logger.debug("Detector failure", e);
            errors.add(new SmellReport.DetectorError(detector, String.valueOf(e.getMessage())));
            return List.of();
        }
    }

    /**
     * Exact duplicates are already reported; a structural match on the same pair adds
     * nothing.
     */
    private static List<StructuralDuplicatePair> withoutExactDuplicates(List<StructuralDuplicatePair> pairs,
            List<DuplicateFunctionPair> exact) {
        Set<List<Integer>> known = new HashSet<>();
        exact.forEach(p -> known.add(pairKey(p.primaryIndex(), p.duplicateIndex())));
        return pairs.stream()
                .filter(p -> !known.contains(pairKey(p.firstIndex(), p.secondIndex())))
                .toList();
    }

    private static List<Integer> pairKey(int a, int b) {
        return a <= b ? List.of(a, b) : List.of(b, a);
    }

    @FunctionalInterface
    private interface Detector<T> {
        List<T> detect(SourceTree tree);
    }
}
