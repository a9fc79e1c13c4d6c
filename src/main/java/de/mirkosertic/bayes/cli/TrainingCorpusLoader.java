package de.mirkosertic.bayes.cli;

import de.mirkosertic.bayes.classifier.BayesClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bulk-trains a classifier from plain text files, one training text per non-blank line.
 */
public class TrainingCorpusLoader {

    private static final Logger logger = LoggerFactory.getLogger(TrainingCorpusLoader.class);

    private final BayesClassifier classifier;

    public TrainingCorpusLoader(final BayesClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Trains every file of every category. Unreadable files are logged and skipped; an
     * unknown category fails before any of its files is read.
     *
     * @param filesByCategory category name to corpus file paths
     * @return number of texts trained
     * @throws de.mirkosertic.bayes.classifier.UnknownCategoryException for an undeclared category
     */
    public int load(final Map<String, List<String>> filesByCategory) {
        int trained = 0;
        for (final Map.Entry<String, List<String>> entry : filesByCategory.entrySet()) {
            final String category = entry.getKey();
            classifier.getCategory(category);
            for (final String file : entry.getValue()) {
                try {
                    trained += trainFile(category, Paths.get(file));
                } catch (final IOException e) {
                    logger.error("Failed to read training file {} for category '{}'", file, category, e);
                }
            }
        }
        logger.info("Trained {} texts from {} categories", trained, filesByCategory.size());
        return trained;
    }

    /**
     * Trains each non-blank line of {@code file} into {@code category}.
     *
     * @return number of lines trained
     */
    public int trainFile(final String category, final Path file) throws IOException {
        int lines = 0;
        try (final BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                classifier.train(category, line);
                lines++;
            }
        }
        logger.debug("Trained {} lines from {} into '{}'", lines, file, category);
        return lines;
    }
}
