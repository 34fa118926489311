package de.mirkosertic.docanalyst.batch;

import de.mirkosertic.docanalyst.DocumentAnalyst;
import de.mirkosertic.docanalyst.KeywordExtractor;
import de.mirkosertic.docanalyst.KeywordSet;
import de.mirkosertic.docanalyst.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs the analysis for every document of the input directory.
 * <p>
 * Persona and job are applied identically to all documents, their keywords are extracted once per
 * batch. Each document is extracted, analysed and written on its own pool thread; a failure in any of
 * these steps is logged with the document name and recorded in the {@link BatchReport}, and never
 * stops the remaining documents. Documents whose output name is already taken by an earlier document
 * in discovery order are not analysed and are reported as {@link DocumentOutcome.Status#SINK_FAILED}.
 */
public class BatchAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final DocumentDiscovery discovery;
    private final DocumentTextProvider textProvider;
    private final KeywordExtractor keywordExtractor;
    private final DocumentAnalyst analyst;
    private final ResultSink resultSink;
    private final AnalysisExecutorService executor;

    public BatchAnalysisService(final DocumentDiscovery discovery,
                                final DocumentTextProvider textProvider,
                                final KeywordExtractor keywordExtractor,
                                final DocumentAnalyst analyst,
                                final ResultSink resultSink,
                                final AnalysisExecutorService executor) {
        this.discovery = discovery;
        this.textProvider = textProvider;
        this.keywordExtractor = keywordExtractor;
        this.analyst = analyst;
        this.resultSink = resultSink;
        this.executor = executor;
    }

    /**
     * @throws IOException if the input directory cannot be listed
     */
    public BatchReport run(final String persona, final String jobToBeDone) throws IOException {
        final long startTime = System.currentTimeMillis();

        final List<Path> documents = discovery.discover();
        if (documents.isEmpty()) {
            logger.info("No documents found in {}", discovery.getInputDirectory());
            return BatchReport.empty();
        }

        final KeywordSet keywords = keywordExtractor.extract(persona, jobToBeDone);
        if (keywords.isEmpty()) {
            logger.warn("Persona and job yield no keywords, every document will get an empty ranking");
        } else {
            logger.info("Ranking with {} keywords: {}", keywords.size(), keywords.terms());
        }

        // Output names are compared case-insensitively, report.pdf and REPORT.PDF collide on some filesystems
        final Map<String, Path> claimedOutputs = new HashMap<>();
        final List<Future<DocumentOutcome>> futures = new ArrayList<>(documents.size());
        for (final Path document : documents) {
            final String outputName = resultSink.outputName(documentName(document));
            final Path owner = claimedOutputs.putIfAbsent(outputName.toLowerCase(Locale.ROOT), document);
            if (owner != null) {
                futures.add(CompletableFuture.completedFuture(outputCollision(document, outputName, owner)));
                continue;
            }
            futures.add(executor.submit(() -> processDocument(document, persona, jobToBeDone, keywords)));
        }

        final List<DocumentOutcome> outcomes = new ArrayList<>(documents.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(awaitOutcome(futures.get(i), documentName(documents.get(i))));
        }

        final BatchReport report = new BatchReport(outcomes, System.currentTimeMillis() - startTime);
        logger.info("Batch finished in {}ms: {} documents, {} written, {} failed",
                report.durationMs(), outcomes.size(), report.successCount(), report.failureCount());
        for (final DocumentOutcome failure : report.failures()) {
            logger.warn("{}: {} - {}", failure.document(), failure.status(), failure.message());
        }
        return report;
    }

    DocumentOutcome processDocument(final Path file,
                                    final String persona,
                                    final String jobToBeDone,
                                    final KeywordSet keywords) {
        final String documentName = documentName(file);
        logger.info("Processing '{}'", documentName);

        final ExtractedDocument extracted;
        try {
            extracted = textProvider.extract(file);
        } catch (final IOException | RuntimeException e) {
            logger.error("Skipping '{}', text extraction failed", documentName, e);
            return DocumentOutcome.failed(documentName, DocumentOutcome.Status.EXTRACTION_FAILED, 0, describe(e));
        }

        final AnalysisResult result;
        try {
            result = analyst.analyze(documentName, extracted.pages(), persona, jobToBeDone, keywords);
        } catch (final RuntimeException e) {
            logger.error("Analysis of '{}' failed", documentName, e);
            return DocumentOutcome.failed(documentName, DocumentOutcome.Status.ANALYSIS_FAILED, 0, describe(e));
        }

        final int sections = result.extractedSections().size();
        try {
            final Path outputFile = resultSink.write(result);
            logger.info("-> '{}': {} sections written to {}", documentName, sections, outputFile);
            return DocumentOutcome.written(documentName, outputFile, sections);
        } catch (final IOException | RuntimeException e) {
            logger.error("Could not persist result of '{}'", documentName, e);
            return DocumentOutcome.failed(documentName, DocumentOutcome.Status.SINK_FAILED, sections, describe(e));
        }
    }

    private static DocumentOutcome outputCollision(final Path document, final String outputName, final Path owner) {
        final String documentName = documentName(document);
        final String message = "Output " + outputName + " is already taken by " + owner + ", skipping " + document;
        logger.error("Skipping '{}': {}", documentName, message);
        return DocumentOutcome.failed(documentName, DocumentOutcome.Status.SINK_FAILED, 0, message);
    }

    private DocumentOutcome awaitOutcome(final Future<DocumentOutcome> future, final String documentName) {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            // processDocument handles its own failures, this only catches errors such as OutOfMemoryError
            logger.error("Processing of '{}' terminated abnormally", documentName, e.getCause());
            return DocumentOutcome.failed(documentName, DocumentOutcome.Status.ANALYSIS_FAILED, 0, describe(e.getCause()));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DocumentOutcome.failed(documentName, DocumentOutcome.Status.ANALYSIS_FAILED, 0, "Interrupted");
        }
    }

    static String documentName(final Path file) {
        return file.getFileName().toString();
    }

    private static String describe(final Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
