package de.mirkosertic.docanalyst.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Identifies the analyst build that produced a batch run, so log files can be matched to a release.
 *
 * <p>Maven filters {@code build-info.properties} while packaging. When the classes run straight
 * from an IDE or an unfiltered resource directory, the placeholders are still in the file and the
 * build is reported as a development build.</p>
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String RESOURCE = "build-info.properties";
    static final String DEVELOPMENT_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final BuildInfo CURRENT = loadFromClasspath();

    private final String version;
    private final String buildTimestamp;

    private BuildInfo(final String version, final String buildTimestamp) {
        this.version = version;
        this.buildTimestamp = buildTimestamp;
    }

    /**
     * The build the running classes belong to.
     */
    public static BuildInfo current() {
        return CURRENT;
    }

    static BuildInfo fromProperties(final Properties properties) {
        return new BuildInfo(
                filteredOr(properties.getProperty("build.version"), DEVELOPMENT_VERSION),
                filteredOr(properties.getProperty("build.timestamp"), UNKNOWN_TIMESTAMP));
    }

    private static BuildInfo loadFromClasspath() {
        final Properties properties = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input == null) {
                logger.debug("{} not on classpath, reporting a development build", RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Could not read {}, reporting a development build", RESOURCE, e);
        }
        return fromProperties(properties);
    }

    private static String filteredOr(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value.trim();
    }

    public String getVersion() {
        return version;
    }

    public String getBuildTimestamp() {
        return buildTimestamp;
    }

    public boolean isDevelopmentBuild() {
        return DEVELOPMENT_VERSION.equals(version);
    }

    /**
     * One-line description for the startup banner, e.g. {@code 0.1.0 (built 2025-03-01T10:15:30Z)}.
     */
    public String describe() {
        if (UNKNOWN_TIMESTAMP.equals(buildTimestamp)) {
            return version;
        }
        return version + " (built " + buildTimestamp + ")";
    }
}
