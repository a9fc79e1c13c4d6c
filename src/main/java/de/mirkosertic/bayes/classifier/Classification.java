package de.mirkosertic.bayes.classifier;

/**
 * Score of one category for one document. Depending on the producing call the score is
 * either a plain probability product or its log-space equivalent.
 */
public record Classification(double score, Category category) {

    public String categoryName() {
        return category.getName();
    }
}
