package com.raditha.smells.refactoring;

import java.util.Optional;

/**
 * Proposes a name for a method extracted from a code snippet.
 * <p>
 * Implementations may call remote services and may fail; they report failure by
 * returning an empty result rather than throwing. Callers validate the answer and
 * fall back to a default name.
 */
@FunctionalInterface
public interface NamingOracle {

    /**
     * @param snippet source text of the code being extracted
     * @return a single-line name candidate, or empty when none is available
     */
    Optional<String> suggestName(String snippet);

    /**
     * An oracle that never has a suggestion.
     */
    static NamingOracle unavailable() {
        return snippet -> Optional.empty();
    }
}
