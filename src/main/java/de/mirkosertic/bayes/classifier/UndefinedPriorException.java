package de.mirkosertic.bayes.classifier;

/**
 * Thrown when a prior is requested while no category holds any training volume.
 */
public class UndefinedPriorException extends IllegalStateException {

    public UndefinedPriorException(final String message) {
        super(message);
    }
}
