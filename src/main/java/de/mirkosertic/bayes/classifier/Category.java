package de.mirkosertic.bayes.classifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One class label and the term frequencies learned for it.
 *
 * <p>Categories are created by {@link BayesClassifier} and mutated only through it, so the
 * corpus-wide table and the category table always change together. Public readers lock
 * on the owning classifier, the same monitor its mutators hold.</p>
 */
public final class Category {

    private final String name;
    private final TermFrequencies termFrequencies = new TermFrequencies();
    private final Object lock;

    Category(final String name, final Object lock) {
        this.name = Objects.requireNonNull(name, "name");
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    public String getName() {
        return name;
    }

    /**
     * Adds every term count of the document to this category.
     */
    void train(final TermDocument document) {
        document.forEachTerm(termFrequencies::add);
    }

    /**
     * Removes the term counts of the document, clamping every term at zero.
     * Terms this category never saw are ignored.
     *
     * <p>Clamping means untrain is not an exact inverse of train once counts were already
     * reduced by other untraining.</p>
     *
     * @return the counts that were actually removed, per term
     */
    Map<String, Long> untrain(final TermDocument document) {
        final Map<String, Long> removed = new LinkedHashMap<>();
        document.forEachTerm((term, count) -> {
            final long delta = termFrequencies.removeClamped(term, count);
            if (delta > 0) {
                removed.put(term, delta);
            }
        });
        return removed;
    }

    /**
     * Prior: this category's share of the training volume of all categories.
     *
     * @throws UndefinedPriorException if no category holds any training volume
     */
    public double probability(final BayesClassifier classifier) {
        synchronized (lock) {
            return (double) termFrequencies.total() / priorDenominator(classifier);
        }
    }

    /**
     * Natural log of {@link #probability(BayesClassifier)}. Negative infinity for a category
     * without training volume.
     */
    public double logProbability(final BayesClassifier classifier) {
        synchronized (lock) {
            return Math.log(termFrequencies.total()) - Math.log(priorDenominator(classifier));
        }
    }

    /**
     * Plain-space likelihood: product of {@code likelihood(term)^count}. Underflows to 0
     * for longer documents, prefer {@link #logProbabilityOfDocument(TermDocument, double)}.
     */
    public double probabilityOfDocument(final TermDocument document, final double defaultProb) {
        final double[] product = {1.0};
        synchronized (lock) {
            document.forEachTerm((term, count) -> product[0] *= Math.pow(termLikelihood(term, defaultProb), count));
        }
        return product[0];
    }

    /**
     * Log-space likelihood: sum of {@code count * log(likelihood(term))}.
     */
    public double logProbabilityOfDocument(final TermDocument document, final double defaultProb) {
        final double[] sum = {0.0};
        synchronized (lock) {
            document.forEachTerm((term, count) -> sum[0] += count * Math.log(termLikelihood(term, defaultProb)));
        }
        return sum[0];
    }

    /**
     * Relative frequency of {@code term} in this category, or {@code defaultProb} if the
     * category holds no occurrence of it.
     */
    public double termLikelihood(final String term, final double defaultProb) {
        synchronized (lock) {
            final long count = termFrequencies.get(term);
            if (count <= 0) {
                return defaultProb;
            }
            return (double) count / termFrequencies.total();
        }
    }

    public long countTerm(final String term) {
        synchronized (lock) {
            return termFrequencies.get(term);
        }
    }

    public long countTerms() {
        synchronized (lock) {
            return termFrequencies.total();
        }
    }

    public int countUniqueTerms() {
        synchronized (lock) {
            return termFrequencies.uniqueTerms();
        }
    }

    /**
     * Snapshot of this category's term counts in insertion order.
     */
    public Map<String, Long> getTermFrequencies() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(termFrequencies.asMap()));
        }
    }

    private static long priorDenominator(final BayesClassifier classifier) {
        final long volume = classifier.totalCategoryVolume();
        if (volume <= 0) {
            throw new UndefinedPriorException("No category has been trained yet, priors are undefined");
        }
        return volume;
    }

    @Override
    public String toString() {
        return "Category[" + name + ", terms=" + countTerms() + "]";
    }
}
