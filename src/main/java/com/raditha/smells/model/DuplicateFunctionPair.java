package com.raditha.smells.model;

/**
 * Two functions with identical canonical bodies. Functions are identified by their
 * position in the tree's declaration order; the names are kept for reporting, since
 * overloads share one.
 *
 * @param primary        Name of the first function encountered with this body
 * @param primaryIndex   Declaration index of the primary
 * @param duplicate      Name of a later function with the same body
 * @param duplicateIndex Declaration index of the duplicate
 */
public record DuplicateFunctionPair(String primary, int primaryIndex, String duplicate, int duplicateIndex) {

    public DuplicateFunctionPair {
        if (primaryIndex == duplicateIndex) {
            throw new IllegalArgumentException("A function cannot duplicate itself: " + primary);
        }
    }

    public Finding toFinding() {
        return new Finding(SmellKind.DUPLICATE_FUNCTION, duplicate, 2,
                String.format("Duplicate functions detected: %s and %s", primary, duplicate));
    }
}
