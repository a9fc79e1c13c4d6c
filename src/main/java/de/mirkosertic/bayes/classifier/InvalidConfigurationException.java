package de.mirkosertic.bayes.classifier;

/**
 * Thrown when a classifier is created without categories or with an unusable category name.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(final String message) {
        super(message);
    }
}
