package de.mirkosertic.docanalyst.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the document analyst.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.docanalyst/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INPUT_DIR = "ANALYST_INPUT_DIR";
    private static final String ENV_OUTPUT_DIR = "ANALYST_OUTPUT_DIR";
    private static final String ENV_PERSONA = "PERSONA_DESCRIPTION";
    private static final String ENV_JOB = "JOB_TO_BE_DONE";
    private static final String PROP_INPUT_DIR = "analyst.input.dir";
    private static final String PROP_OUTPUT_DIR = "analyst.output.dir";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String PROP_PROFILE = "profile";
    private static final String DEPLOYED_PROFILE = "deployed";
    private static final String CONFIG_DIR = ".docanalyst";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Input settings
    private String inputDirectory = "/app/input";
    private List<String> includePatterns = List.of("*.pdf");
    private List<String> excludePatterns = List.of();
    private boolean recursive = false;

    // Output settings
    private String outputDirectory = "/app/output";

    // Request settings
    private String persona = "Default persona: a general researcher";
    private String jobToBeDone = "Default job: find the most relevant sections";

    // Ranking settings
    private int maxSections = 10;
    private int maxTitleLength = 100;

    // Lexical resource
    private String language = "english";

    // Executor settings
    private int threadPoolSize = 4;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        config.validate();

        logger.info("Configuration loaded: inputDirectory={}, outputDirectory={}, maxSections={}, language={}, deployedMode={}",
                config.inputDirectory, config.outputDirectory, config.maxSections, config.language, config.deployedMode);

        return config;
    }

    /**
     * Build a configuration from an already parsed YAML document, without consulting
     * the classpath defaults, the user config file or the environment.
     */
    public static ApplicationConfig fromYaml(final Map<String, Object> yamlConfig) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(yamlConfig);
        config.validate();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> analystConfig = (Map<String, Object>) config.get("analyst");
        if (analystConfig == null) {
            return;
        }

        final Map<String, Object> inputConfig = (Map<String, Object>) analystConfig.get("input");
        if (inputConfig != null) {
            applyInputConfig(inputConfig);
        }

        final Map<String, Object> outputConfig = (Map<String, Object>) analystConfig.get("output");
        if (outputConfig != null && outputConfig.get("directory") != null) {
            this.outputDirectory = resolveVariables(outputConfig.get("directory").toString());
        }

        final Map<String, Object> requestConfig = (Map<String, Object>) analystConfig.get("request");
        if (requestConfig != null) {
            if (requestConfig.containsKey("persona")) {
                this.persona = stringValue(requestConfig.get("persona"));
            }
            if (requestConfig.containsKey("job-to-be-done")) {
                this.jobToBeDone = stringValue(requestConfig.get("job-to-be-done"));
            }
        }

        final Map<String, Object> rankingConfig = (Map<String, Object>) analystConfig.get("ranking");
        if (rankingConfig != null) {
            if (rankingConfig.containsKey("max-sections")) {
                this.maxSections = ((Number) rankingConfig.get("max-sections")).intValue();
            }
            if (rankingConfig.containsKey("max-title-length")) {
                this.maxTitleLength = ((Number) rankingConfig.get("max-title-length")).intValue();
            }
        }

        final Map<String, Object> lexicalConfig = (Map<String, Object>) analystConfig.get("lexical");
        if (lexicalConfig != null && lexicalConfig.get("language") != null) {
            this.language = lexicalConfig.get("language").toString().trim();
        }

        final Map<String, Object> executorConfig = (Map<String, Object>) analystConfig.get("executor");
        if (executorConfig != null && executorConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) executorConfig.get("thread-pool-size")).intValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyInputConfig(final Map<String, Object> inputConfig) {
        if (inputConfig.get("directory") != null) {
            this.inputDirectory = resolveVariables(inputConfig.get("directory").toString());
        }
        if (inputConfig.containsKey("include-patterns")) {
            final Object patterns = inputConfig.get("include-patterns");
            if (patterns instanceof List) {
                this.includePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (inputConfig.containsKey("exclude-patterns")) {
            final Object patterns = inputConfig.get("exclude-patterns");
            if (patterns instanceof List) {
                this.excludePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (inputConfig.containsKey("recursive")) {
            this.recursive = (Boolean) inputConfig.get("recursive");
        }
    }

    private void applyEnvironmentOverrides() {
        // System properties first, environment wins over them
        final String propInputDir = System.getProperty(PROP_INPUT_DIR);
        if (propInputDir != null && !propInputDir.isBlank()) {
            this.inputDirectory = propInputDir.trim();
        }
        final String propOutputDir = System.getProperty(PROP_OUTPUT_DIR);
        if (propOutputDir != null && !propOutputDir.isBlank()) {
            this.outputDirectory = propOutputDir.trim();
        }

        final String envInputDir = System.getenv(ENV_INPUT_DIR);
        if (envInputDir != null && !envInputDir.trim().isEmpty()) {
            this.inputDirectory = envInputDir.trim();
            logger.info("Input directory from environment: {}", this.inputDirectory);
        }
        final String envOutputDir = System.getenv(ENV_OUTPUT_DIR);
        if (envOutputDir != null && !envOutputDir.trim().isEmpty()) {
            this.outputDirectory = envOutputDir.trim();
            logger.info("Output directory from environment: {}", this.outputDirectory);
        }

        // An empty persona or job is a legal request, so only an absent variable keeps the configured text
        final String envPersona = System.getenv(ENV_PERSONA);
        if (envPersona != null) {
            this.persona = envPersona;
        }
        final String envJob = System.getenv(ENV_JOB);
        if (envJob != null) {
            this.jobToBeDone = envJob;
        }
    }

    private void determineProfile() {
        this.deployedMode = isDeployedProfileActive();
    }

    /**
     * Whether the {@code deployed} profile is active, read from {@code spring.profiles.active} or,
     * if that is unset, {@code profile}. Case is ignored. Usable before any configuration is loaded,
     * which the logging setup in {@code main} relies on.
     */
    public static boolean isDeployedProfileActive() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE, System.getProperty(PROP_PROFILE, "default"));
        return DEPLOYED_PROFILE.equalsIgnoreCase(profile.trim());
    }

    private void validate() {
        if (maxSections <= 0) {
            throw new IllegalArgumentException("ranking.max-sections must be positive, was " + maxSections);
        }
        if (maxTitleLength <= 0) {
            throw new IllegalArgumentException("ranking.max-title-length must be positive, was " + maxTitleLength);
        }
        if (threadPoolSize <= 0) {
            throw new IllegalArgumentException("executor.thread-pool-size must be positive, was " + threadPoolSize);
        }
        if (language == null || language.isEmpty()) {
            throw new IllegalArgumentException("lexical.language must not be empty");
        }
    }

    private static String stringValue(final Object value) {
        return value == null ? "" : value.toString();
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

    // Getters
    public String getInputDirectory() {
        return inputDirectory;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public String getPersona() {
        return persona;
    }

    public String getJobToBeDone() {
        return jobToBeDone;
    }

    public int getMaxSections() {
        return maxSections;
    }

    public int getMaxTitleLength() {
        return maxTitleLength;
    }

    public String getLanguage() {
        return language;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
