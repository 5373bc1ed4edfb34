package com.raditha.smells.workflow;

import com.raditha.smells.config.SmellDetectorConfig;
import com.raditha.smells.detection.BlockDuplicateDetector;
import com.raditha.smells.detection.FunctionDuplicateDetector;
import com.raditha.smells.model.DuplicateBlockGroup;
import com.raditha.smells.model.DuplicateFunctionPair;
import com.raditha.smells.refactoring.BlockDuplicateRefactorer;
import com.raditha.smells.refactoring.DiffGenerator;
import com.raditha.smells.refactoring.FunctionDuplicateRefactorer;
import com.raditha.smells.refactoring.NamingOracle;
import com.raditha.smells.tree.SourceSerializer;
import com.raditha.smells.tree.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs both refactorings on one file.
 * <p>
 * Duplicate functions are handled first. Block duplicates are then detected again on
 * the rewritten tree, since delegating bodies removes some of them, and extracted.
 */
public class RefactoringWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(RefactoringWorkflow.class);

    private final FunctionDuplicateDetector functionDetector;
    private final BlockDuplicateDetector blockDetector;
    private final FunctionDuplicateRefactorer functionRefactorer;
    private final BlockDuplicateRefactorer blockRefactorer;
    private final SourceSerializer serializer;
    private final DiffGenerator diffGenerator = new DiffGenerator();

    public RefactoringWorkflow(SmellDetectorConfig config, NamingOracle namingOracle) {
        this.serializer = new SourceSerializer();
        this.functionDetector = new FunctionDuplicateDetector();
        this.blockDetector = new BlockDuplicateDetector(config.windowSize(), config.similarityThreshold());
        this.functionRefactorer = new FunctionDuplicateRefactorer(serializer);
        this.blockRefactorer = new BlockDuplicateRefactorer(namingOracle, serializer);
    }

    /**
     * @param tree     Parsed file, left untouched
     * @param fileName Name used in the diff headers
     * @throws com.raditha.smells.refactoring.RewriteException      if a rewrite cannot be applied
     * @throws com.raditha.smells.tree.SerializationException if a result is not valid Java
     */
    public RefactoringResult run(SourceTree tree, String fileName) {
        String original = tree.source().orElseGet(() -> serializer.print(tree));

        List<DuplicateFunctionPair> pairs = functionDetector.detect(tree);
        SourceTree current = tree;
        List<DuplicateFunctionPair> replaced = List.of();
        List<DuplicateFunctionPair> skippedPairs = List.of();
        if (!pairs.isEmpty()) {
            logger.info("Delegating {} duplicate functions", pairs.size());
            FunctionDuplicateRefactorer.Result functions = functionRefactorer.refactor(current, pairs);
            current = functions.tree();
            replaced = functions.replaced();
            skippedPairs = functions.skipped();
        }

        List<DuplicateBlockGroup> groups = blockDetector.detect(current);
        BlockDuplicateRefactorer.Result blocks = blockRefactorer.refactor(current, groups);
        current = blocks.tree();

        if (replaced.isEmpty() && blocks.helpers().isEmpty()) {
            logger.info("Nothing to refactor in {}", fileName);
            return new RefactoringResult(tree, original, "", List.of(), skippedPairs, List.of(), blocks.skipped());
        }

        String refactored = serializer.print(current);
        String diff = diffGenerator.generateUnifiedDiff(original, refactored, fileName);
        return new RefactoringResult(current, refactored, diff, replaced, skippedPairs,
                blocks.helpers(), blocks.skipped());
    }
}
