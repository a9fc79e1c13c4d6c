package de.mirkosertic.bayes.cli.dto;

import org.jspecify.annotations.Nullable;

/**
 * Response for the term command: corpus-wide count of one normalized term.
 */
public record TermCountResponse(
        boolean success,
        @Nullable String term,
        long count,
        @Nullable String error
) {
    public static TermCountResponse success(final String term, final long count) {
        return new TermCountResponse(true, term, count, null);
    }

    public static TermCountResponse error(final String errorMessage) {
        return new TermCountResponse(false, null, 0, errorMessage);
    }
}
