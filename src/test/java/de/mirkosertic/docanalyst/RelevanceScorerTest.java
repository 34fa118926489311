package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.model.ContentUnit;
import de.mirkosertic.docanalyst.model.ScoredUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RelevanceScorer")
class RelevanceScorerTest {

    private static final KeywordSet KEYWORDS = KeywordSet.of(Set.of("climate", "risk", "scientist", "assess"));

    private static LuceneLexicalResource resource;
    private static RelevanceScorer scorer;

    @BeforeAll
    static void setUp() throws IOException {
        resource = LuceneLexicalResource.load("english");
        scorer = new RelevanceScorer(new TextNormalizer(resource));
    }

    @AfterAll
    static void tearDown() {
        resource.close();
    }

    @Test
    @DisplayName("Should divide distinct matches by total token count")
    void shouldComputeDensity() {
        // 2 distinct matches (climate, risk) out of 5 tokens
        assertThat(scorer.score("Climate risk is growing fast", KEYWORDS)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("Should score 1.0 when every token is a distinct keyword")
    void shouldScoreFullMatch() {
        assertThat(scorer.score("Climate risk.", KEYWORDS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not increase the score when a matching word is repeated")
    void shouldNotRewardRepetition() {
        final double once = scorer.score("climate risk today", KEYWORDS);
        final double repeated = scorer.score("climate climate climate risk today", KEYWORDS);

        assertThat(once).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(repeated).isCloseTo(2.0 / 5.0, within(1e-9));
        assertThat(repeated).isLessThanOrEqualTo(once);
    }

    @Test
    @DisplayName("Should match keywords after punctuation is removed")
    void shouldMatchAfterNormalization() {
        assertThat(scorer.score("RISK!!! (climate)", KEYWORDS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score 0.0 when no keyword appears")
    void shouldScoreZeroWithoutMatch() {
        assertThat(scorer.score("Unrelated filler text about cooking.", KEYWORDS)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should score 0.0 for an empty keyword set")
    void shouldScoreZeroForEmptyKeywords() {
        assertThat(scorer.score("Climate risk.", KeywordSet.empty())).isEqualTo(0.0);
    }

    @ParameterizedTest(name = "text \"{0}\"")
    @ValueSource(strings = {"", "   ", "!!! ???", "—"})
    @DisplayName("Should score 0.0 for text without tokens")
    void shouldScoreZeroForTextWithoutTokens(final String text) {
        assertThat(scorer.score(text, KEYWORDS)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should keep scores within (0, 1] whenever a keyword matches")
    void shouldStayInRange() {
        final String[] texts = {
                "risk",
                "a very long paragraph that mentions risk only once among many other words",
                "assess assess assess",
                "climate scientist assess risk climate scientist assess risk"
        };
        for (final String text : texts) {
            assertThat(scorer.score(text, KEYWORDS)).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Should attach the score to a content unit")
    void shouldScoreContentUnit() {
        final ContentUnit unit = new ContentUnit("doc.pdf", 2, "climate filler", 1);

        final ScoredUnit scored = scorer.score(unit, KEYWORDS);

        assertThat(scored.unit()).isSameAs(unit);
        assertThat(scored.score()).isEqualTo(0.5);
        assertThat(scored.isRelevant()).isTrue();
    }
}
