package de.mirkosertic.bayes.cli.dto;

import org.jspecify.annotations.Nullable;

/**
 * Response for commands that only report success or failure (train, untrain, errors).
 */
public record SimpleMessageResponse(
        boolean success,
        @Nullable String message,
        @Nullable String error
) {
    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
