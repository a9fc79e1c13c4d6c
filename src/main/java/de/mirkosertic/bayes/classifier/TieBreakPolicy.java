package de.mirkosertic.bayes.classifier;

import java.util.Locale;

/**
 * Decides which category wins when two categories reach the same maximum score.
 */
public enum TieBreakPolicy {

    /**
     * The later category in declaration order wins a tie. The running best is replaced
     * whenever it is not strictly greater than the candidate.
     */
    LAST_ON_TIE {
        @Override
        boolean replaces(final double bestScore, final double candidateScore) {
            return !(bestScore > candidateScore);
        }
    },

    /**
     * The earlier category in declaration order wins a tie. The running best is only
     * replaced by a strictly greater candidate.
     */
    FIRST_ON_TIE {
        @Override
        boolean replaces(final double bestScore, final double candidateScore) {
            return candidateScore > bestScore;
        }
    };

    abstract boolean replaces(double bestScore, double candidateScore);

    /**
     * Parses {@code last-on-tie}, {@code FIRST_ON_TIE} and similar spellings.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static TieBreakPolicy parse(final String value) {
        if (value == null || value.isBlank()) {
            return LAST_ON_TIE;
        }
        final String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tie-break policy: " + value
                    + " (expected last-on-tie or first-on-tie)", e);
        }
    }
}
