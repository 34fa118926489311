package de.mirkosertic.docanalyst.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    private static ApplicationConfig parse(final String yaml) {
        final Map<String, Object> map = new Yaml().load(yaml);
        return ApplicationConfig.fromYaml(map);
    }

    @Test
    @DisplayName("Should use defaults when the analyst section is missing")
    void shouldUseDefaults() {
        final ApplicationConfig config = parse("other: {}");

        assertThat(config.getInputDirectory()).isEqualTo("/app/input");
        assertThat(config.getOutputDirectory()).isEqualTo("/app/output");
        assertThat(config.getIncludePatterns()).containsExactly("*.pdf");
        assertThat(config.getExcludePatterns()).isEmpty();
        assertThat(config.isRecursive()).isFalse();
        assertThat(config.getPersona()).isEqualTo("Default persona: a general researcher");
        assertThat(config.getJobToBeDone()).isEqualTo("Default job: find the most relevant sections");
        assertThat(config.getMaxSections()).isEqualTo(10);
        assertThat(config.getMaxTitleLength()).isEqualTo(100);
        assertThat(config.getLanguage()).isEqualTo("english");
        assertThat(config.getThreadPoolSize()).isEqualTo(4);
        assertThat(config.isDeployedMode()).isFalse();
    }

    @Test
    @DisplayName("Should read all analyst settings")
    void shouldReadAllSettings() {
        final ApplicationConfig config = parse("""
                analyst:
                  input:
                    directory: /data/in
                    include-patterns: ["*.pdf", "*.txt"]
                    exclude-patterns: ["**/drafts/**"]
                    recursive: true
                  output:
                    directory: /data/out
                  request:
                    persona: HR professional
                    job-to-be-done: Create fillable forms
                  ranking:
                    max-sections: 5
                    max-title-length: 60
                  lexical:
                    language: english
                  executor:
                    thread-pool-size: 2
                """);

        assertThat(config.getInputDirectory()).isEqualTo("/data/in");
        assertThat(config.getIncludePatterns()).containsExactly("*.pdf", "*.txt");
        assertThat(config.getExcludePatterns()).containsExactly("**/drafts/**");
        assertThat(config.isRecursive()).isTrue();
        assertThat(config.getOutputDirectory()).isEqualTo("/data/out");
        assertThat(config.getPersona()).isEqualTo("HR professional");
        assertThat(config.getJobToBeDone()).isEqualTo("Create fillable forms");
        assertThat(config.getMaxSections()).isEqualTo(5);
        assertThat(config.getMaxTitleLength()).isEqualTo(60);
        assertThat(config.getThreadPoolSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept an empty persona and job")
    void shouldAcceptEmptyRequest() {
        final ApplicationConfig config = parse("""
                analyst:
                  request:
                    persona: ""
                    job-to-be-done:
                """);

        assertThat(config.getPersona()).isEmpty();
        assertThat(config.getJobToBeDone()).isEmpty();
    }

    @Test
    @DisplayName("Should reject non-positive limits")
    void shouldRejectInvalidLimits() {
        assertThatThrownBy(() -> parse("analyst: {ranking: {max-sections: 0}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-sections");
        assertThatThrownBy(() -> parse("analyst: {ranking: {max-title-length: -5}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-title-length");
        assertThatThrownBy(() -> parse("analyst: {executor: {thread-pool-size: 0}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("thread-pool-size");
    }

    @Test
    @DisplayName("Should resolve placeholders with defaults")
    void shouldResolvePlaceholders() {
        System.setProperty("docanalyst.test.base", "/srv");
        try {
            assertThat(ApplicationConfig.resolveVariables("${DOCANALYST_TEST_UNSET_VARIABLE:/fallback}/in"))
                    .isEqualTo("/fallback/in");
            assertThat(ApplicationConfig.resolveVariables("${docanalyst.test.base}/out"))
                    .isEqualTo("/srv/out");
            assertThat(ApplicationConfig.resolveVariables("/plain/path")).isEqualTo("/plain/path");
        } finally {
            System.clearProperty("docanalyst.test.base");
        }
    }

    @Test
    @DisplayName("Should load the packaged application.yaml")
    void shouldLoadClasspathDefaults() {
        final ApplicationConfig config = ApplicationConfig.load();

        assertThat(config.getMaxSections()).isEqualTo(10);
        assertThat(config.getLanguage()).isEqualTo("english");
        assertThat(config.getIncludePatterns()).contains("*.pdf");
    }

    @Test
    @DisplayName("Should detect the deployed profile regardless of case")
    void shouldDetectDeployedProfileIgnoringCase() {
        final String previousSpring = System.getProperty("spring.profiles.active");
        final String previousProfile = System.getProperty("profile");
        try {
            System.clearProperty("spring.profiles.active");
            System.setProperty("profile", "Deployed");
            assertThat(ApplicationConfig.isDeployedProfileActive()).isTrue();
            assertThat(ApplicationConfig.load().isDeployedMode()).isTrue();

            System.setProperty("spring.profiles.active", "DEPLOYED");
            System.setProperty("profile", "default");
            assertThat(ApplicationConfig.isDeployedProfileActive()).isTrue();

            System.setProperty("spring.profiles.active", "dev");
            assertThat(ApplicationConfig.isDeployedProfileActive()).isFalse();
        } finally {
            restore("spring.profiles.active", previousSpring);
            restore("profile", previousProfile);
        }
    }

    private static void restore(final String key, final String value) {
        if (value == null) {
            System.clearProperty(key);
        } else {
            System.setProperty(key, value);
        }
    }
}
