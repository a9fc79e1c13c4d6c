package de.mirkosertic.bayes.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Chooses where the classifier logs before the first logger is created.
 * <p>
 * Standard output belongs to the JSON command responses. Without a profile, logback.xml sends
 * everything to standard error. With {@code -Dprofile=deployed} (or
 * {@code -Dspring.profiles.active=deployed}) logback-deployed.xml replaces it and logs to a
 * rolling file in {@code ~/.simplebayes/log}, keeping both console streams quiet.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_PROFILE = "deployed";
    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Whether the system properties select the deployed profile.
     */
    public static boolean isDeployedProfile() {
        final String profile = System.getProperty("spring.profiles.active", System.getProperty("profile"));
        return DEPLOYED_PROFILE.equalsIgnoreCase(profile);
    }

    /**
     * Switches to file logging for the deployed profile, leaves logback.xml in place otherwise.
     *
     * @return true if logback-deployed.xml was applied
     */
    public static boolean configure(final boolean deployedMode) {
        if (!deployedMode) {
            return false;
        }
        createLogDirectory(getLogDirectory());
        return applyClasspathConfiguration(DEPLOYED_CONFIG);
    }

    /**
     * Directory the deployed configuration writes to, next to the user config file. Resolved
     * without touching {@link ApplicationConfig}, whose logger must not exist yet.
     */
    public static Path getLogDirectory() {
        return Paths.get(System.getProperty("user.home"), ".simplebayes", "log");
    }

    private static void createLogDirectory(final Path logDir) {
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
    }

    static boolean applyClasspathConfiguration(final String resource) {
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(resource)) {
            if (configStream == null) {
                System.err.println("Warning: " + resource + " not found on classpath, keeping current logging");
                return false;
            }
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Could not apply " + resource + ": " + e.getMessage());
            return false;
        }
    }
}
