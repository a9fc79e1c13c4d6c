package de.mirkosertic.bayes.cli;

import de.mirkosertic.bayes.classifier.BayesClassifier;
import de.mirkosertic.bayes.classifier.Category;
import de.mirkosertic.bayes.classifier.Classification;
import de.mirkosertic.bayes.classifier.UndefinedPriorException;
import de.mirkosertic.bayes.classifier.UnknownCategoryException;
import de.mirkosertic.bayes.cli.dto.ClassificationResponse;
import de.mirkosertic.bayes.cli.dto.CorpusStatsResponse;
import de.mirkosertic.bayes.cli.dto.SimpleMessageResponse;
import de.mirkosertic.bayes.cli.dto.TermCountResponse;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Executes one line of the command protocol against a classifier and returns the response DTO.
 *
 * <pre>
 *     train &lt;category&gt; &lt;text&gt;
 *     untrain &lt;category&gt; &lt;text&gt;
 *     classify &lt;text&gt;
 *     stats
 *     term &lt;word&gt;
 * </pre>
 *
 * <p>The word given to {@code term} goes through the classifier's tokenizer, so
 * {@code term Rails} reports the count of the stored term {@code rail}.</p>
 *
 * <p>Any other non-blank line is classified as a whole. Failures never escape, they become
 * error responses so the command loop keeps running.</p>
 */
public class CommandProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    private static final String TERM_USAGE = "Usage: term <word>";

    private final BayesClassifier classifier;

    public CommandProcessor(final BayesClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * @return the response for {@code line}, or null for a blank line
     */
    public @Nullable Object process(final String line) {
        if (line == null || line.isBlank()) {
            return null;
        }

        final String trimmed = line.trim();
        final int firstSpace = trimmed.indexOf(' ');
        final String command = (firstSpace < 0 ? trimmed : trimmed.substring(0, firstSpace)).toLowerCase(Locale.ROOT);
        final String arguments = firstSpace < 0 ? "" : trimmed.substring(firstSpace + 1).trim();

        return switch (command) {
            case "train" -> train(arguments);
            case "untrain" -> untrain(arguments);
            case "classify" -> classify(arguments);
            case "stats" -> stats();
            case "term" -> countTerm(arguments);
            default -> classify(trimmed);
        };
    }

    // ==================== Training ====================

    private SimpleMessageResponse train(final String arguments) {
        final String[] parts = splitCategoryAndText(arguments);
        if (parts == null) {
            return SimpleMessageResponse.error("Usage: train <category> <text>");
        }

        try {
            classifier.train(parts[0], parts[1]);
            logger.debug("Trained '{}' with {} characters", parts[0], parts[1].length());
            return SimpleMessageResponse.success("Trained category " + parts[0]);
        } catch (final UnknownCategoryException e) {
            logger.warn("Train rejected: {}", e.getMessage());
            return SimpleMessageResponse.error(e.getMessage());
        } catch (final Exception e) {
            logger.error("Unexpected error during training", e);
            return SimpleMessageResponse.error("Unexpected error: " + e.getMessage());
        }
    }

    private SimpleMessageResponse untrain(final String arguments) {
        final String[] parts = splitCategoryAndText(arguments);
        if (parts == null) {
            return SimpleMessageResponse.error("Usage: untrain <category> <text>");
        }

        try {
            classifier.untrain(parts[0], parts[1]);
            logger.debug("Untrained '{}' with {} characters", parts[0], parts[1].length());
            return SimpleMessageResponse.success("Untrained category " + parts[0]);
        } catch (final UnknownCategoryException e) {
            logger.warn("Untrain rejected: {}", e.getMessage());
            return SimpleMessageResponse.error(e.getMessage());
        } catch (final Exception e) {
            logger.error("Unexpected error during untraining", e);
            return SimpleMessageResponse.error("Unexpected error: " + e.getMessage());
        }
    }

    private static String @Nullable [] splitCategoryAndText(final String arguments) {
        final int space = arguments.indexOf(' ');
        if (space <= 0) {
            return null;
        }
        final String text = arguments.substring(space + 1).trim();
        if (text.isEmpty()) {
            return null;
        }
        return new String[]{arguments.substring(0, space), text};
    }

    // ==================== Classification ====================

    private ClassificationResponse classify(final String text) {
        if (text.isEmpty()) {
            return ClassificationResponse.error("Usage: classify <text>");
        }

        try {
            final List<ClassificationResponse.CategoryScore> scores;
            final String winner;
            synchronized (classifier) {
                final List<Classification> plain = classifier.classifications(text);
                final List<Classification> logs = classifier.logClassifications(text);

                scores = new ArrayList<>(logs.size());
                for (int i = 0; i < logs.size(); i++) {
                    scores.add(new ClassificationResponse.CategoryScore(
                            logs.get(i).categoryName(), plain.get(i).score(), logs.get(i).score()));
                }
                winner = classifier.classify(text);
            }
            logger.debug("Classified {} characters as '{}'", text.length(), winner);
            return ClassificationResponse.success(winner, scores);
        } catch (final UndefinedPriorException e) {
            logger.warn("Classification rejected: {}", e.getMessage());
            return ClassificationResponse.error(e.getMessage());
        } catch (final Exception e) {
            logger.error("Unexpected error during classification", e);
            return ClassificationResponse.error("Unexpected error: " + e.getMessage());
        }
    }

    // ==================== Statistics ====================

    private CorpusStatsResponse stats() {
        try {
            // One snapshot, a concurrent train must not land between the corpus and the category counts
            synchronized (classifier) {
                final List<CorpusStatsResponse.CategoryStats> categories = new ArrayList<>();
                for (final Category category : classifier.getCategories()) {
                    categories.add(new CorpusStatsResponse.CategoryStats(
                            category.getName(), category.countTerms(), category.countUniqueTerms()));
                }
                return CorpusStatsResponse.success(classifier.countTerms(), classifier.countUniqueTerms(), categories);
            }
        } catch (final Exception e) {
            logger.error("Unexpected error collecting statistics", e);
            return CorpusStatsResponse.error("Unexpected error: " + e.getMessage());
        }
    }

    private TermCountResponse countTerm(final String word) {
        if (word.isEmpty()) {
            return TermCountResponse.error(TERM_USAGE);
        }

        final Map<String, Integer> terms = classifier.getTokenizer().tokenize(word);
        if (terms.size() > 1) {
            return TermCountResponse.error(TERM_USAGE + " (a single word, got " + terms.keySet() + ")");
        }
        // Stop words and too short words normalize to nothing and were never counted
        final String term = terms.isEmpty() ? word : terms.keySet().iterator().next();
        return TermCountResponse.success(term, classifier.countTerm(term));
    }
}
