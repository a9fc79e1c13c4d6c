package de.mirkosertic.bayes.analysis;

import java.util.Map;

/**
 * Turns raw text into normalized terms and their occurrence counts.
 *
 * <p>Implementations must be deterministic: the same text always yields the same table.
 * Empty text yields an empty table.</p>
 */
@FunctionalInterface
public interface TermTokenizer {

    /**
     * @param text the raw text, may be empty
     * @return term to occurrence count, never null
     */
    Map<String, Integer> tokenize(String text);
}
