package de.mirkosertic.bayes.config;

import de.mirkosertic.bayes.classifier.BayesClassifier;
import de.mirkosertic.bayes.classifier.TieBreakPolicy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the classifier application.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.simplebayes/config.yaml, or the path given on the command line)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CATEGORIES = "BAYES_CATEGORIES";
    private static final String ENV_DEFAULT_PROBABILITY = "BAYES_DEFAULT_PROBABILITY";
    private static final String PROP_CATEGORIES = "bayes.categories";
    private static final String CONFIG_DIR = ".simplebayes";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    /**
     * Stop word setting selecting the Lucene English stop set.
     */
    public static final String STOP_WORDS_ENGLISH = "english";

    // Classifier settings
    private List<String> categories = new ArrayList<>();
    private double defaultProbability = BayesClassifier.DEFAULT_PROBABILITY;
    private TieBreakPolicy tieBreakPolicy = TieBreakPolicy.LAST_ON_TIE;

    // Analyzer settings
    private String analyzerLanguage = "English";
    private @Nullable String stopWordsMode = STOP_WORDS_ENGLISH;
    private List<String> stopWords = List.of();
    private int minTermLength = 3;
    private int maxTermLength = 255;
    private long tokenizerCacheSize = 10_000;

    // Training corpus: category -> files
    private Map<String, List<String>> trainingFiles = new LinkedHashMap<>();

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(null);
    }

    /**
     * Load configuration, reading the user layer from {@code userConfigPath} instead of
     * ~/.simplebayes/config.yaml when given.
     */
    public static ApplicationConfig load(@Nullable final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigPath != null ? userConfigPath : getUserConfigPath());

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: categories={}, defaultProbability={}, tieBreak={}, language={}, deployedMode={}",
                config.categories, config.defaultProbability, config.tieBreakPolicy,
                config.analyzerLanguage, config.deployedMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        } else {
            logger.debug("No user config at: {}", userConfigPath);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to bayes section
        final Map<String, Object> bayesConfig = (Map<String, Object>) config.get("bayes");
        if (bayesConfig == null) {
            return;
        }

        if (bayesConfig.containsKey("categories")) {
            final Object names = bayesConfig.get("categories");
            if (names instanceof List) {
                this.categories = toStringList((List<Object>) names);
            }
        }
        if (bayesConfig.containsKey("default-probability")) {
            this.defaultProbability = ((Number) bayesConfig.get("default-probability")).doubleValue();
        }
        if (bayesConfig.containsKey("tie-break")) {
            this.tieBreakPolicy = TieBreakPolicy.parse(String.valueOf(bayesConfig.get("tie-break")));
        }

        final Map<String, Object> analyzerConfig = (Map<String, Object>) bayesConfig.get("analyzer");
        if (analyzerConfig != null) {
            applyAnalyzerConfig(analyzerConfig);
        }

        final Map<String, Object> tokenizerConfig = (Map<String, Object>) bayesConfig.get("tokenizer");
        if (tokenizerConfig != null && tokenizerConfig.containsKey("cache-size")) {
            this.tokenizerCacheSize = ((Number) tokenizerConfig.get("cache-size")).longValue();
        }

        final Map<String, Object> trainingConfig = (Map<String, Object>) bayesConfig.get("training");
        if (trainingConfig != null) {
            applyTrainingConfig(trainingConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyAnalyzerConfig(final Map<String, Object> analyzerConfig) {
        if (analyzerConfig.containsKey("language")) {
            this.analyzerLanguage = String.valueOf(analyzerConfig.get("language"));
        }
        if (analyzerConfig.containsKey("stop-words")) {
            final Object value = analyzerConfig.get("stop-words");
            if (value instanceof List) {
                this.stopWordsMode = null;
                this.stopWords = toStringList((List<Object>) value);
            } else if (value != null) {
                this.stopWordsMode = value.toString().trim().toLowerCase(Locale.ROOT);
                this.stopWords = List.of();
            }
        }
        if (analyzerConfig.containsKey("min-term-length")) {
            this.minTermLength = ((Number) analyzerConfig.get("min-term-length")).intValue();
        }
        if (analyzerConfig.containsKey("max-term-length")) {
            this.maxTermLength = ((Number) analyzerConfig.get("max-term-length")).intValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyTrainingConfig(final Map<String, Object> trainingConfig) {
        final Map<String, List<String>> files = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : trainingConfig.entrySet()) {
            final Object value = entry.getValue();
            final List<String> paths = new ArrayList<>();
            if (value instanceof List) {
                for (final String path : toStringList((List<Object>) value)) {
                    paths.add(resolveVariables(path));
                }
            } else if (value != null) {
                paths.add(resolveVariables(value.toString()));
            }
            files.put(String.valueOf(entry.getKey()), paths);
        }
        this.trainingFiles = files;
    }

    private void applyEnvironmentOverrides() {
        // System property for categories
        final String propCategories = System.getProperty(PROP_CATEGORIES);
        if (propCategories != null && !propCategories.trim().isEmpty()) {
            this.categories = splitList(propCategories);
        }

        // Categories from environment (overrides all other sources)
        final String envCategories = System.getenv(ENV_CATEGORIES);
        if (envCategories != null && !envCategories.trim().isEmpty()) {
            this.categories = splitList(envCategories);
            logger.info("Categories from environment: {}", this.categories);
        }

        final String envDefaultProbability = System.getenv(ENV_DEFAULT_PROBABILITY);
        if (envDefaultProbability != null && !envDefaultProbability.trim().isEmpty()) {
            try {
                this.defaultProbability = Double.parseDouble(envDefaultProbability.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}: {}", ENV_DEFAULT_PROBABILITY, envDefaultProbability);
            }
        }
    }

    private void determineProfile() {
        this.deployedMode = LoggingConfigurator.isDeployedProfile();
    }

    private static List<String> splitList(final String value) {
        final List<String> result = new ArrayList<>();
        for (final String part : value.split(",")) {
            final String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static List<String> toStringList(final List<Object> values) {
        final List<String> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public List<String> getCategories() {
        return categories;
    }

    public double getDefaultProbability() {
        return defaultProbability;
    }

    public TieBreakPolicy getTieBreakPolicy() {
        return tieBreakPolicy;
    }

    public String getAnalyzerLanguage() {
        return analyzerLanguage;
    }

    /**
     * {@code "english"}, {@code "none"}, or null when an explicit list is configured.
     */
    public @Nullable String getStopWordsMode() {
        return stopWordsMode;
    }

    /**
     * Explicit stop words, empty unless configured as a list.
     */
    public List<String> getStopWords() {
        return stopWords;
    }

    public int getMinTermLength() {
        return minTermLength;
    }

    public int getMaxTermLength() {
        return maxTermLength;
    }

    public long getTokenizerCacheSize() {
        return tokenizerCacheSize;
    }

    public Map<String, List<String>> getTrainingFiles() {
        return trainingFiles;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
