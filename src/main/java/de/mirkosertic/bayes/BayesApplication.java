package de.mirkosertic.bayes;

import de.mirkosertic.bayes.analysis.AnalyzerTermTokenizer;
import de.mirkosertic.bayes.analysis.CachingTermTokenizer;
import de.mirkosertic.bayes.analysis.StemmedTermAnalyzer;
import de.mirkosertic.bayes.analysis.TermTokenizer;
import de.mirkosertic.bayes.analysis.TokenizerCacheStats;
import de.mirkosertic.bayes.classifier.BayesClassifier;
import de.mirkosertic.bayes.cli.CommandProcessor;
import de.mirkosertic.bayes.cli.JsonOutput;
import de.mirkosertic.bayes.cli.TrainingCorpusLoader;
import de.mirkosertic.bayes.config.ApplicationConfig;
import de.mirkosertic.bayes.config.BuildInfo;
import de.mirkosertic.bayes.config.LoggingConfigurator;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

/**
 * Main entry point.
 * Builds the analyzer and classifier from configuration, trains the configured corpora and
 * then answers commands read line by line from standard input with one JSON line each.
 */
public class BayesApplication {

    private static final Logger logger = LoggerFactory.getLogger(BayesApplication.class);

    private final ApplicationConfig config;
    private final AnalyzerTermTokenizer analyzerTokenizer;
    private final TokenizerCacheStats cacheStats;
    private final BayesClassifier classifier;
    private final CommandProcessor commandProcessor;

    public BayesApplication(final ApplicationConfig config) {
        this.config = config;

        this.analyzerTokenizer = new AnalyzerTermTokenizer(createAnalyzer(config));
        this.cacheStats = new TokenizerCacheStats();
        final TermTokenizer tokenizer = CachingTermTokenizer.wrap(
                analyzerTokenizer, config.getTokenizerCacheSize(), cacheStats);

        this.classifier = new BayesClassifier(
                config.getCategories(),
                tokenizer,
                config.getTieBreakPolicy(),
                config.getDefaultProbability()
        );

        this.commandProcessor = new CommandProcessor(classifier);
    }

    /**
     * Builds the analyzer chain from the analyzer section of the configuration.
     */
    static StemmedTermAnalyzer createAnalyzer(final ApplicationConfig config) {
        return new StemmedTermAnalyzer(
                config.getAnalyzerLanguage(),
                stopWordSet(config),
                config.getMinTermLength(),
                config.getMaxTermLength()
        );
    }

    static CharArraySet stopWordSet(final ApplicationConfig config) {
        final String mode = config.getStopWordsMode();
        if (mode == null) {
            return new CharArraySet(config.getStopWords(), true);
        }
        return switch (mode) {
            case ApplicationConfig.STOP_WORDS_ENGLISH -> EnglishAnalyzer.ENGLISH_STOP_WORDS_SET;
            case "none" -> CharArraySet.EMPTY_SET;
            default -> throw new IllegalArgumentException("Unknown stop-words setting: " + mode
                    + " (expected english, none or a list)");
        };
    }

    /**
     * Train the configured corpora.
     */
    public void init() {
        logger.info("Initializing classifier with categories {}", classifier.getCategoryNames());
        if (!config.getTrainingFiles().isEmpty()) {
            new TrainingCorpusLoader(classifier).load(config.getTrainingFiles());
        }
        logger.info("Corpus ready: {} terms, {} unique", classifier.countTerms(), classifier.countUniqueTerms());
    }

    /**
     * Process commands until {@code in} is exhausted.
     */
    public void run(final InputStream in, final PrintStream out) throws IOException {
        final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            final Object response = commandProcessor.process(line);
            if (response != null) {
                out.println(JsonOutput.toJson(response));
                out.flush();
            }
        }
        logger.info("Input exhausted");
    }

    /**
     * Release the analyzer.
     */
    public void shutdown() {
        logger.info("Shutting down, tokenizer cache: {}", cacheStats);
        try {
            analyzerTokenizer.close();
        } catch (final Exception e) {
            logger.error("Error closing analyzer", e);
        }
    }

    public BayesClassifier getClassifier() {
        return classifier;
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            LoggingConfigurator.configure(LoggingConfigurator.isDeployedProfile());

            final ApplicationConfig config = ApplicationConfig.load(args.length > 0 ? Paths.get(args[0]) : null);
            logger.info("Simple Bayes {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());

            final BayesApplication app = new BayesApplication(config);
            try {
                app.init();
                app.run(System.in, System.out);
            } finally {
                app.shutdown();
            }

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to run classifier: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
