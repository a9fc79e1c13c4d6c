package de.mirkosertic.bayes.classifier;

import de.mirkosertic.bayes.analysis.AnalyzerTermTokenizer;
import de.mirkosertic.bayes.analysis.StemmedTermAnalyzer;
import de.mirkosertic.bayes.analysis.TermTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Naive Bayes text classifier over a fixed set of categories.
 *
 * <p>For a text split into terms B1..Bn the classifier picks the category A maximizing</p>
 * <pre>
 *     P(A) * P(B1 | A) * ... * P(Bn | A)
 * </pre>
 * <p>where P(A) is the category's share of the total training volume and P(Bi | A) is the
 * relative frequency of Bi within A. Terms a category never saw get a fixed default
 * probability instead. Decisions are made in log space so long texts do not underflow.</p>
 *
 * <p>Besides the per-category tables the classifier keeps a corpus-wide table used for
 * the statistics methods ({@link #countTerm(String)}, {@link #countTerms()},
 * {@link #countUniqueTerms()}).</p>
 *
 * <p>All public methods synchronize on the classifier, and so do the readers of the
 * {@link Category} instances it hands out, so a single instance may be shared between threads.
 * Callers that need several reads to agree with each other hold the classifier's monitor
 * around them.</p>
 */
public class BayesClassifier {

    private static final Logger logger = LoggerFactory.getLogger(BayesClassifier.class);

    public static final double DEFAULT_PROBABILITY = 0.05;

    private final Map<String, Category> categories;
    private final TermFrequencies termFrequencies = new TermFrequencies();
    private final TermTokenizer tokenizer;
    private final TieBreakPolicy tieBreakPolicy;
    private final double defaultProbability;

    /**
     * Creates a classifier with one category per distinct name, in iteration order of
     * {@code categoryNames}.
     *
     * @throws InvalidConfigurationException if no names are given or a name is blank
     */
    public BayesClassifier(final Collection<String> categoryNames,
                           final TermTokenizer tokenizer,
                           final TieBreakPolicy tieBreakPolicy,
                           final double defaultProbability) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.tieBreakPolicy = Objects.requireNonNull(tieBreakPolicy, "tieBreakPolicy");
        this.defaultProbability = checkDefaultProbability(defaultProbability);
        this.categories = createCategories(categoryNames, this);

        logger.debug("Created classifier with categories {} (tieBreak={}, defaultProbability={})",
                categories.keySet(), tieBreakPolicy, defaultProbability);
    }

    /**
     * Classifier over the English stemming analyzer with last-on-tie and the default probability.
     */
    public static BayesClassifier create(final Collection<String> categoryNames) {
        return create(categoryNames, new AnalyzerTermTokenizer(StemmedTermAnalyzer.english()));
    }

    public static BayesClassifier create(final Collection<String> categoryNames, final TermTokenizer tokenizer) {
        return new BayesClassifier(categoryNames, tokenizer, TieBreakPolicy.LAST_ON_TIE, DEFAULT_PROBABILITY);
    }

    private static Map<String, Category> createCategories(final Collection<String> categoryNames, final Object lock) {
        if (categoryNames == null || categoryNames.isEmpty()) {
            throw new InvalidConfigurationException("At least one category is required");
        }
        final Map<String, Category> result = new LinkedHashMap<>();
        for (final String name : categoryNames) {
            if (name == null || name.isBlank()) {
                throw new InvalidConfigurationException("Category names must not be blank: " + categoryNames);
            }
            result.putIfAbsent(name, new Category(name, lock));
        }
        return Collections.unmodifiableMap(result);
    }

    // ==================== Training ====================

    /**
     * Trains {@code text} into the named category.
     *
     * @throws UnknownCategoryException if the category was not declared; nothing is changed then
     */
    public synchronized void train(final String name, final String text) {
        final Category category = getCategory(name);
        final TermDocument document = TermDocument.of(text, tokenizer);

        document.forEachTerm(termFrequencies::add);
        category.train(document);

        logger.debug("Trained category '{}' with {} distinct terms", name, document.termCounts().size());
    }

    /**
     * Removes {@code text} from the named category. Counts are clamped at zero; terms the
     * category never saw are ignored. The corpus-wide table loses exactly what the category
     * released.
     *
     * @throws UnknownCategoryException if the category was not declared; nothing is changed then
     */
    public synchronized void untrain(final String name, final String text) {
        final Category category = getCategory(name);
        final TermDocument document = TermDocument.of(text, tokenizer);

        final Map<String, Long> removed = category.untrain(document);
        removed.forEach(termFrequencies::removeClamped);

        logger.debug("Untrained category '{}': {} of {} terms affected", name, removed.size(),
                document.termCounts().size());
    }

    // ==================== Classification ====================

    /**
     * Plain-space score {@code prior * likelihood} per category, in declaration order, using
     * the configured default probability. Scores of longer texts may underflow to 0.
     *
     * @throws UndefinedPriorException if nothing has been trained yet
     */
    public List<Classification> classifications(final String text) {
        return classifications(text, defaultProbability);
    }

    public synchronized List<Classification> classifications(final String text, final double defaultProb) {
        checkDefaultProbability(defaultProb);
        final TermDocument document = TermDocument.of(text, tokenizer);
        final List<Classification> result = new ArrayList<>(categories.size());
        for (final Category category : categories.values()) {
            final double prior = category.probability(this);
            final double likelihood = category.probabilityOfDocument(document, defaultProb);
            result.add(new Classification(prior * likelihood, category));
        }
        return result;
    }

    /**
     * Log-space score {@code log(prior) + log(likelihood)} per category, in declaration order,
     * using the configured default probability. {@link #classify(String)} picks the maximum of
     * exactly these scores.
     *
     * @throws UndefinedPriorException if nothing has been trained yet
     */
    public List<Classification> logClassifications(final String text) {
        return logClassifications(text, defaultProbability);
    }

    public synchronized List<Classification> logClassifications(final String text, final double defaultProb) {
        checkDefaultProbability(defaultProb);
        final TermDocument document = TermDocument.of(text, tokenizer);
        final List<Classification> result = new ArrayList<>(categories.size());
        for (final Category category : categories.values()) {
            final double logPrior = category.logProbability(this);
            final double logLikelihood = category.logProbabilityOfDocument(document, defaultProb);
            result.add(new Classification(logPrior + logLikelihood, category));
        }
        return result;
    }

    /**
     * Returns the name of the category with the highest log score, using the configured
     * default probability and tie-break policy.
     *
     * @throws UndefinedPriorException if nothing has been trained yet
     */
    public String classify(final String text) {
        return classify(text, defaultProbability);
    }

    public String classify(final String text, final double defaultProb) {
        return best(logClassifications(text, defaultProb), tieBreakPolicy).categoryName();
    }

    /**
     * Folds the scores left from a negative infinity sentinel and keeps whichever entry the
     * policy prefers. With {@link TieBreakPolicy#LAST_ON_TIE} the last category reaching the
     * maximum wins.
     */
    static Classification best(final List<Classification> scored, final TieBreakPolicy policy) {
        double bestScore = Double.NEGATIVE_INFINITY;
        Classification best = null;
        for (final Classification candidate : scored) {
            if (best == null || policy.replaces(bestScore, candidate.score())) {
                best = candidate;
                bestScore = candidate.score();
            }
        }
        if (best == null) {
            throw new IllegalStateException("No categories to choose from");
        }
        return best;
    }

    // ==================== Corpus statistics ====================

    /**
     * Corpus-wide count of {@code term}, 0 if never seen.
     */
    public synchronized long countTerm(final String term) {
        return termFrequencies.get(term);
    }

    public synchronized long countTerms() {
        return termFrequencies.total();
    }

    /**
     * Number of distinct terms ever trained, including terms untrained down to zero.
     */
    public synchronized int countUniqueTerms() {
        return termFrequencies.uniqueTerms();
    }

    // ==================== Categories ====================

    /**
     * @throws UnknownCategoryException if no category with this name exists
     */
    public Category getCategory(final String name) {
        final Category category = name == null ? null : categories.get(name);
        if (category == null) {
            throw new UnknownCategoryException(name, getCategoryNames());
        }
        return category;
    }

    public List<String> getCategoryNames() {
        return List.copyOf(categories.keySet());
    }

    public Collection<Category> getCategories() {
        return categories.values();
    }

    /**
     * Read-only view of the corpus-wide term counts.
     */
    public synchronized Map<String, Long> getTermFrequencies() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(termFrequencies.asMap()));
    }

    public TieBreakPolicy getTieBreakPolicy() {
        return tieBreakPolicy;
    }

    public double getDefaultProbability() {
        return defaultProbability;
    }

    public TermTokenizer getTokenizer() {
        return tokenizer;
    }

    /**
     * Sum of the training volume of all categories, the denominator of every prior.
     */
    synchronized long totalCategoryVolume() {
        long volume = 0;
        for (final Category category : categories.values()) {
            volume += category.countTerms();
        }
        return volume;
    }

    private static double checkDefaultProbability(final double defaultProb) {
        if (!(defaultProb > 0.0 && defaultProb <= 1.0)) {
            throw new IllegalArgumentException("default probability must be in (0, 1], got " + defaultProb);
        }
        return defaultProb;
    }
}
