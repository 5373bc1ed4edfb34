package com.raditha.smells.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Mutually similar windows from different functions. The first occurrence is the
 * representative that the extracted helper is built from.
 *
 * @param occurrences At least two windows, no two from the same function
 * @param windowSize  Number of statements in each window
 */
public record DuplicateBlockGroup(List<BlockOccurrence> occurrences, int windowSize) {

    public DuplicateBlockGroup {
        if (occurrences == null || occurrences.size() < 2) {
            throw new IllegalArgumentException("A duplicate block group needs at least two occurrences");
        }
        long owners = occurrences.stream().map(BlockOccurrence::functionIndex).distinct().count();
        if (owners != occurrences.size()) {
            throw new IllegalArgumentException("Occurrences of a group must come from different functions");
        }
        occurrences = List.copyOf(occurrences);
    }

    public BlockOccurrence representative() {
        return occurrences.get(0);
    }

    public int size() {
        return occurrences.size();
    }

    public Finding toFinding() {
        String functions = occurrences.stream()
                .map(BlockOccurrence::owningFunction)
                .sorted()
                .collect(Collectors.joining(", "));
        String indices = occurrences.stream()
                .map(BlockOccurrence::startIndex)
                .distinct()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        return new Finding(SmellKind.DUPLICATE_BLOCK, representative().owningFunction(), occurrences.size(),
                String.format("In functions %s, duplicate block starts at indices: %s", functions, indices));
    }
}
