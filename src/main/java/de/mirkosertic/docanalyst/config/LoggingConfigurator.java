package de.mirkosertic.docanalyst.config;

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
 * Switches Logback to the file based configuration when the analyst runs in deployed mode.
 * <p>
 * Deployed runs (batch container, scheduled jobs) load logback-deployed.xml, which writes a
 * rolling log file into the directory passed as the {@code LOG_DIR} context property. Every other run keeps the console
 * configuration from logback.xml that Logback picks up on its own.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "LOG_DIR";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used, otherwise early messages go to the console.
     *
     * @param deployedMode true if running in deployed mode
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            configure(defaultLogDirectory());
        }
    }

    /**
     * Load the deployed configuration and write log files into the given directory.
     */
    public static void configure(final Path logDirectory) {
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);

        try (final InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(DEPLOYED_CONFIG)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + DEPLOYED_CONFIG + " on classpath");
                return;
            }
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }

    static Path defaultLogDirectory() {
        return Paths.get(System.getProperty("user.home"), ".docanalyst", "log");
    }
}
