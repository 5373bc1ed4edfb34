package com.raditha.smells.model;

/**
 * Two functions whose bodies have a similar shape once names and literals are ignored.
 *
 * @param first       Earlier function in declaration order
 * @param firstIndex  Declaration index of {@code first}
 * @param second      Later function in declaration order
 * @param secondIndex Declaration index of {@code second}
 * @param similarity  Similarity of the two shapes, 0.0 to 1.0
 */
public record StructuralDuplicatePair(String first, int firstIndex, String second, int secondIndex,
        double similarity) {

    public Finding toFinding() {
        int percent = (int) Math.round(similarity * 100);
        return new Finding(SmellKind.STRUCTURAL_DUPLICATE, second, percent,
                String.format("Functions %s and %s are structurally similar (%d%%)", first, second, percent));
    }
}
