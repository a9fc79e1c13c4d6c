package de.mirkosertic.bayes.cli.dto;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response for the stats command.
 */
public record CorpusStatsResponse(
        boolean success,
        long countTerms,
        int countUniqueTerms,
        @Nullable List<CategoryStats> categories,
        @Nullable String error
) {
    public record CategoryStats(String name, long countTerms, int countUniqueTerms) {
    }

    public static CorpusStatsResponse success(final long countTerms, final int countUniqueTerms,
                                              final List<CategoryStats> categories) {
        return new CorpusStatsResponse(true, countTerms, countUniqueTerms, categories, null);
    }

    public static CorpusStatsResponse error(final String errorMessage) {
        return new CorpusStatsResponse(false, 0, 0, null, errorMessage);
    }
}
