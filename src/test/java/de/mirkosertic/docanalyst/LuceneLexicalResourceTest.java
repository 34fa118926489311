package de.mirkosertic.docanalyst;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LuceneLexicalResource")
class LuceneLexicalResourceTest {

    private static LuceneLexicalResource resource;

    @BeforeAll
    static void loadResource() throws IOException {
        resource = LuceneLexicalResource.load("english");
    }

    @AfterAll
    static void closeResource() {
        resource.close();
    }

    @Test
    @DisplayName("Should load the English stop word list")
    void shouldLoadEnglishStopWords() {
        assertThat(resource.language()).isEqualTo("english");
        assertThat(resource.stopWordCount()).isEqualTo(179);
        assertThat(resource.isStopWord("the")).isTrue();
        assertThat(resource.isStopWord("should've")).isTrue();
        assertThat(resource.isStopWord("climate")).isFalse();
    }

    @Test
    @DisplayName("Should accept the language name case-insensitively")
    void shouldNormalizeLanguageName() throws IOException {
        try (final LuceneLexicalResource upperCase = LuceneLexicalResource.load(" English ")) {
            assertThat(upperCase.language()).isEqualTo("english");
            assertThat(upperCase.isStopWord("and")).isTrue();
        }
    }

    @Test
    @DisplayName("Should fail for a language without stop word list")
    void shouldFailForUnknownLanguage() {
        assertThatThrownBy(() -> LuceneLexicalResource.load("klingon"))
                .isInstanceOf(FileNotFoundException.class)
                .hasMessageContaining("klingon");
    }

    @Test
    @DisplayName("Should split text into word tokens and drop punctuation")
    void shouldTokenizeWords() {
        assertThat(resource.tokenize("Climate risk, assessed (quickly)!"))
                .containsExactly("Climate", "risk", "assessed", "quickly");
    }

    @Test
    @DisplayName("Should keep case of tokens")
    void shouldKeepCase() {
        assertThat(resource.tokenize("GDP Growth")).containsExactly("GDP", "Growth");
    }

    @Test
    @DisplayName("Should return no tokens for empty, null or punctuation-only text")
    void shouldHandleEmptyText() {
        assertThat(resource.tokenize("")).isEmpty();
        assertThat(resource.tokenize(null)).isEmpty();
        assertThat(resource.tokenize("... --- !!!")).isEmpty();
    }

    @Test
    @DisplayName("Should strip possessive endings")
    void shouldStripPossessives() {
        assertThat(resource.tokenize("investor's portfolio")).containsExactly("investor", "portfolio");
    }

    @Test
    @DisplayName("Should tokenize concurrently with identical results")
    void shouldTokenizeConcurrently() throws Exception {
        final String text = "Independent documents are analysed on several threads at the same time";
        final List<String> expected = resource.tokenize(text);

        final ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            final List<Future<List<String>>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(pool.submit(() -> resource.tokenize(text)));
            }
            final List<List<String>> results = Collections.synchronizedList(new ArrayList<>());
            for (final Future<List<String>> future : futures) {
                results.add(future.get());
            }
            assertThat(results).allSatisfy(tokens -> assertThat(tokens).isEqualTo(expected));
        } finally {
            pool.shutdownNow();
        }
    }
}
