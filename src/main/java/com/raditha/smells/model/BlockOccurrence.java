package com.raditha.smells.model;

import java.util.Set;

/**
 * One window of consecutive statements inside a function body.
 *
 * @param owningFunction Name of the function containing the window
 * @param functionIndex  Declaration index of that function, which tells overloads apart
 * @param startIndex     0-based index of the first statement in the body
 * @param code           Rendered text of the window
 * @param tokenSet       Whitespace-delimited tokens of {@code code}
 */
public record BlockOccurrence(
        String owningFunction,
        int functionIndex,
        int startIndex,
        String code,
        Set<String> tokenSet) {

    public BlockOccurrence {
        tokenSet = Set.copyOf(tokenSet);
    }
}
