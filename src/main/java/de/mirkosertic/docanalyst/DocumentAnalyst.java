package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.model.AnalysisResult;
import de.mirkosertic.docanalyst.model.ContentUnit;
import de.mirkosertic.docanalyst.model.PageText;
import de.mirkosertic.docanalyst.model.ScoredUnit;
import de.mirkosertic.docanalyst.model.SelectedSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Relevance ranking pipeline for a single document.
 *
 * <p>Segments the pages into paragraphs, scores every paragraph against the keywords of the
 * persona and the job, ranks the relevant ones and assembles the result. An instance holds no
 * per-document state, so one analyst serves any number of documents concurrently.</p>
 */
public class DocumentAnalyst {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAnalyst.class);

    private final ParagraphSegmenter segmenter;
    private final KeywordExtractor keywordExtractor;
    private final RelevanceScorer scorer;
    private final SectionRanker ranker;
    private final ResultAssembler assembler;

    public DocumentAnalyst(final ParagraphSegmenter segmenter,
                           final KeywordExtractor keywordExtractor,
                           final RelevanceScorer scorer,
                           final SectionRanker ranker,
                           final ResultAssembler assembler) {
        this.segmenter = segmenter;
        this.keywordExtractor = keywordExtractor;
        this.scorer = scorer;
        this.ranker = ranker;
        this.assembler = assembler;
    }

    /**
     * Analyse one document, extracting the keywords from persona and job first.
     */
    public AnalysisResult analyze(final String documentName,
                                  final List<PageText> pages,
                                  final String persona,
                                  final String jobToBeDone) {
        return analyze(documentName, pages, persona, jobToBeDone, keywordExtractor.extract(persona, jobToBeDone));
    }

    /**
     * Analyse one document with keywords that were already extracted, e.g. once for a whole batch.
     */
    public AnalysisResult analyze(final String documentName,
                                  final List<PageText> pages,
                                  final String persona,
                                  final String jobToBeDone,
                                  final KeywordSet keywords) {
        final List<ContentUnit> units = segmenter.segment(documentName, pages);

        final List<ScoredUnit> scoredUnits = new ArrayList<>(units.size());
        for (final ContentUnit unit : units) {
            scoredUnits.add(scorer.score(unit, keywords));
        }

        final List<SelectedSection> selected = ranker.rank(scoredUnits);
        logger.debug("Document {}: {} pages, {} paragraphs, {} keywords, {} sections selected",
                documentName, pages.size(), units.size(), keywords.size(), selected.size());

        return assembler.assemble(documentName, persona, jobToBeDone, selected);
    }
}
