package de.mirkosertic.bayes.classifier;

import java.util.List;

/**
 * Thrown when train, untrain or a category lookup names a category the classifier was not
 * created with. Categories are never created on demand.
 */
public class UnknownCategoryException extends IllegalArgumentException {

    private final String categoryName;
    private final List<String> knownCategories;

    public UnknownCategoryException(final String categoryName, final List<String> knownCategories) {
        super("Unknown category '" + categoryName + "', known categories: " + knownCategories);
        this.categoryName = categoryName;
        this.knownCategories = List.copyOf(knownCategories);
    }

    public String getCategoryName() {
        return categoryName;
    }

    public List<String> getKnownCategories() {
        return knownCategories;
    }
}
