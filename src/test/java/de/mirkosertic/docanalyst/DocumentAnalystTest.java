package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.model.AnalysisResult;
import de.mirkosertic.docanalyst.model.PageText;
import de.mirkosertic.docanalyst.model.RankedSection;
import de.mirkosertic.docanalyst.model.RefinedSection;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the ranking pipeline, from page text to the assembled result.
 */
@DisplayName("DocumentAnalyst")
class DocumentAnalystTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:15:30Z"), ZoneOffset.UTC);

    private static LuceneLexicalResource resource;
    private static DocumentAnalyst analyst;
    private static KeywordExtractor keywordExtractor;

    @BeforeAll
    static void setUp() throws IOException {
        resource = LuceneLexicalResource.load("english");
        keywordExtractor = new KeywordExtractor(resource);
        analyst = new DocumentAnalyst(
                new ParagraphSegmenter(),
                keywordExtractor,
                new RelevanceScorer(new TextNormalizer(resource)),
                new SectionRanker(),
                new ResultAssembler(FIXED_CLOCK)
        );
    }

    @AfterAll
    static void tearDown() {
        resource.close();
    }

    @Test
    @DisplayName("Should rank the climate paragraph first for a climate scientist assessing risk")
    void shouldRankRelevantParagraphFirst() {
        final List<PageText> pages = List.of(new PageText(1, "Climate risk.\n\nUnrelated filler text about cooking."));

        assertThat(keywordExtractor.extract("climate scientist", "assess risk").terms())
                .contains("climate", "risk", "scientist", "assess");

        final AnalysisResult result = analyst.analyze("report.pdf", pages, "climate scientist", "assess risk");

        assertThat(result.extractedSections()).containsExactly(
                new RankedSection("report.pdf", 1, "Climate risk.", 1));
        assertThat(result.subSectionAnalysis()).containsExactly(
                new RefinedSection("report.pdf", 1, "Climate risk."));
    }

    @Test
    @DisplayName("Should match paragraphs on the word of a possessive in the persona")
    void shouldMatchPossessivePersona() {
        final List<PageText> pages = List.of(new PageText(2, "Cooking tips.\n\nInvestor returns."));

        final AnalysisResult result = analyst.analyze("fund.pdf", pages, "Investor's analyst", "Summarize");

        assertThat(result.extractedSections()).containsExactly(
                new RankedSection("fund.pdf", 2, "Investor returns.", 1));
    }

    @Test
    @DisplayName("Should fill the metadata from the request and the clock")
    void shouldFillMetadata() {
        final AnalysisResult result = analyst.analyze("report.pdf", List.of(), "Travel planner", "Plan a trip");

        assertThat(result.metadata().inputDocument()).isEqualTo("report.pdf");
        assertThat(result.metadata().persona()).isEqualTo("Travel planner");
        assertThat(result.metadata().jobToBeDone()).isEqualTo("Plan a trip");
        assertThat(result.metadata().processingTimestamp()).isEqualTo("2025-03-01T10:15:30");
    }

    @Test
    @DisplayName("Should align refined sections with ranked sections across pages")
    void shouldAlignSectionsAcrossPages() {
        final List<PageText> pages = List.of(
                new PageText(1, "Budget overview for the year.\n\nNothing to see here at all, move along please."),
                new PageText(2, "Budget risk and budget planning\n\nDetails of the risk register.")
        );

        final AnalysisResult result = analyst.analyze("plan.pdf", pages, "Finance analyst", "Review budget risk");

        assertThat(result.extractedSections()).hasSameSizeAs(result.subSectionAnalysis());
        for (int i = 0; i < result.extractedSections().size(); i++) {
            final RankedSection section = result.extractedSections().get(i);
            final RefinedSection refined = result.subSectionAnalysis().get(i);
            assertThat(section.importanceRank()).isEqualTo(i + 1);
            assertThat(refined.pageNumber()).isEqualTo(section.pageNumber());
            assertThat(refined.refinedText()).startsWith(section.sectionTitle());
        }
        // "budget risk and budget planning": 2 distinct of 5 tokens beats the other paragraphs
        assertThat(result.extractedSections().get(0).sectionTitle()).isEqualTo("Budget risk and budget planning");
        assertThat(result.extractedSections()).extracting(RankedSection::sectionTitle)
                .doesNotContain("Nothing to see here at all, move along please.");
    }

    @Test
    @DisplayName("Should produce empty section lists when persona and job are empty")
    void shouldProduceEmptyResultWithoutKeywords() {
        final List<PageText> pages = List.of(new PageText(1, "Climate risk.\n\nMore text."));

        final AnalysisResult result = analyst.analyze("report.pdf", pages, "", "");

        assertThat(result.extractedSections()).isEmpty();
        assertThat(result.subSectionAnalysis()).isEmpty();
    }

    @Test
    @DisplayName("Should produce empty section lists for a document without content")
    void shouldProduceEmptyResultWithoutContent() {
        final AnalysisResult result = analyst.analyze("empty.pdf", List.of(), "climate scientist", "assess risk");

        assertThat(result.extractedSections()).isEmpty();
        assertThat(result.subSectionAnalysis()).isEmpty();
    }
}
