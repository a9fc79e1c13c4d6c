package de.mirkosertic.bayes.cli.dto;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response for the classify command: the winning category and the score of every category.
 */
public record ClassificationResponse(
        boolean success,
        @Nullable String category,
        @Nullable List<CategoryScore> scores,
        @Nullable String error
) {
    /**
     * Score of one category. {@code score} is the plain-space product and may underflow to 0,
     * {@code logScore} is the value the decision is based on.
     */
    public record CategoryScore(String category, double score, double logScore) {
    }

    public static ClassificationResponse success(final String category, final List<CategoryScore> scores) {
        return new ClassificationResponse(true, category, scores, null);
    }

    public static ClassificationResponse error(final String errorMessage) {
        return new ClassificationResponse(false, null, null, errorMessage);
    }
}
