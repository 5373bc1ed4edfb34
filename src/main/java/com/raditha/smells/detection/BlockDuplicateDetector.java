package com.raditha.smells.detection;

import com.github.javaparser.ast.stmt.Statement;
import com.raditha.smells.model.BlockOccurrence;
import com.raditha.smells.model.DuplicateBlockGroup;
import com.raditha.smells.similarity.JaccardSimilarity;
import com.raditha.smells.tree.FunctionDecl;
import com.raditha.smells.tree.SourceSerializer;
import com.raditha.smells.tree.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds similar runs of statements in different functions.
 * <p>
 * Every function body is cut into overlapping windows of {@code windowSize}
 * statements. Windows are compared by the Jaccard similarity of their token sets and
 * grouped greedily: each window that is not yet taken seeds a group, and the later
 * untaken windows similar enough <em>to the seed</em> join it. Grouping is therefore
 * order dependent and not transitive.
 */
public class BlockDuplicateDetector {
    private static final Logger logger = LoggerFactory.getLogger(BlockDuplicateDetector.class);

    public static final int DEFAULT_WINDOW_SIZE = 2;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.75;

    private final int windowSize;
    private final double similarityThreshold;
    private final JaccardSimilarity similarity = new JaccardSimilarity();

    public BlockDuplicateDetector() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_SIMILARITY_THRESHOLD);
    }

    /**
     * @param windowSize          number of consecutive statements per window
     * @param similarityThreshold minimum similarity to the seed window, 0.0 to 1.0
     */
    public BlockDuplicateDetector(int windowSize, double similarityThreshold) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be at least 1");
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be between 0.0 and 1.0");
        }
        this.windowSize = windowSize;
        this.similarityThreshold = similarityThreshold;
    }

    public List<DuplicateBlockGroup> detect(SourceTree tree) {
        List<BlockOccurrence> windows = extractWindows(tree);
        List<DuplicateBlockGroup> groups = groupWindows(windows);
        logger.debug("Compared {} windows, found {} duplicate block groups", windows.size(), groups.size());
        return groups;
    }

    /**
     * All windows of all functions, in function order then start index.
     */
    public List<BlockOccurrence> extractWindows(SourceTree tree) {
        List<BlockOccurrence> windows = new ArrayList<>();
        for (FunctionDecl function : tree.functions()) {
            List<Statement> body = function.body();
            if (body.size() < windowSize) {
                continue;
            }
            for (int start = 0; start <= body.size() - windowSize; start++) {
                String code = SourceSerializer.render(body.subList(start, start + windowSize));
                windows.add(new BlockOccurrence(function.name(), function.index(), start, code, tokenize(code)));
            }
        }
        return windows;
    }

    private List<DuplicateBlockGroup> groupWindows(List<BlockOccurrence> windows) {
        List<DuplicateBlockGroup> groups = new ArrayList<>();
        boolean[] used = new boolean[windows.size()];

        for (int i = 0; i < windows.size(); i++) {
            if (used[i]) {
                continue;
            }
            used[i] = true;
            BlockOccurrence seed = windows.get(i);
            List<BlockOccurrence> group = new ArrayList<>();
            group.add(seed);
            Set<Integer> owners = new HashSet<>();
            owners.add(seed.functionIndex());

            for (int j = i + 1; j < windows.size(); j++) {
                BlockOccurrence candidate = windows.get(j);
                if (used[j] || owners.contains(candidate.functionIndex())) {
                    continue;
                }
                if (seed.tokenSet().isEmpty() || candidate.tokenSet().isEmpty()) {
                    continue;
                }
                if (similarity.calculate(seed.tokenSet(), candidate.tokenSet()) >= similarityThreshold) {
                    group.add(candidate);
                    owners.add(candidate.functionIndex());
                    used[j] = true;
                }
            }

            if (group.size() > 1) {
                groups.add(new DuplicateBlockGroup(group, windowSize));
            }
        }
        return groups;
    }

    static Set<String> tokenize(String code) {
        return Arrays.stream(code.split("\\s+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
