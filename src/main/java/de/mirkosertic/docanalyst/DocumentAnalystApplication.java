package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.batch.AnalysisExecutorService;
import de.mirkosertic.docanalyst.batch.BatchAnalysisService;
import de.mirkosertic.docanalyst.batch.BatchReport;
import de.mirkosertic.docanalyst.batch.DocumentDiscovery;
import de.mirkosertic.docanalyst.batch.FileContentExtractor;
import de.mirkosertic.docanalyst.batch.JsonFileResultSink;
import de.mirkosertic.docanalyst.config.ApplicationConfig;
import de.mirkosertic.docanalyst.config.BuildInfo;
import de.mirkosertic.docanalyst.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Main entry point of the document analyst.
 * Loads the lexical resource, analyses every document of the input directory for the configured
 * persona and job, writes one JSON result per document and exits.
 */
public class DocumentAnalystApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAnalystApplication.class);

    private final ApplicationConfig config;
    private LuceneLexicalResource lexicalResource;
    private AnalysisExecutorService executor;
    private BatchAnalysisService batchService;

    public DocumentAnalystApplication(final ApplicationConfig config) {
        this.config = config;
    }

    /**
     * Initialize all services. The lexical resource is loaded here, before any document is touched:
     * without it no document can be analysed, so a failure aborts the whole run.
     */
    public void init() throws IOException {
        logger.info("Initializing Document Analyst {}...", BuildInfo.current().describe());

        lexicalResource = LuceneLexicalResource.load(config.getLanguage());

        final Path outputDirectory = Paths.get(config.getOutputDirectory());
        Files.createDirectories(outputDirectory);

        final TextNormalizer normalizer = new TextNormalizer(lexicalResource);
        final KeywordExtractor keywordExtractor = new KeywordExtractor(lexicalResource);
        final DocumentAnalyst analyst = new DocumentAnalyst(
                new ParagraphSegmenter(),
                keywordExtractor,
                new RelevanceScorer(normalizer),
                new SectionRanker(config.getMaxSections(), config.getMaxTitleLength()),
                new ResultAssembler(Clock.systemDefaultZone())
        );

        executor = new AnalysisExecutorService(config);

        batchService = new BatchAnalysisService(
                new DocumentDiscovery(config),
                new FileContentExtractor(),
                keywordExtractor,
                analyst,
                new JsonFileResultSink(outputDirectory),
                executor
        );

        logger.info("All services initialized successfully");
    }

    /**
     * Analyse all documents of the input directory.
     */
    public BatchReport run() throws IOException {
        logger.info("Using persona: '{}'", config.getPersona());
        logger.info("Using job to be done: '{}'", config.getJobToBeDone());
        return batchService.run(config.getPersona(), config.getJobToBeDone());
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down Document Analyst...");

        // Shutdown in reverse order of initialization
        try {
            if (executor != null) {
                executor.shutdown();
            }
        } catch (final Exception e) {
            logger.error("Error shutting down analysis executor", e);
        }

        try {
            if (lexicalResource != null) {
                lexicalResource.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing lexical resource", e);
        }

        logger.info("Document Analyst shutdown complete");
    }

    public static void main(final String[] args) {
        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(ApplicationConfig.isDeployedProfileActive());

        final DocumentAnalystApplication app;
        try {
            final ApplicationConfig config = ApplicationConfig.load();
            logger.info("Input directory: {}", config.getInputDirectory());
            logger.info("Output directory: {}", config.getOutputDirectory());

            app = new DocumentAnalystApplication(config);
            app.init();
        } catch (final Exception e) {
            System.err.println("Failed to start Document Analyst: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
            return;
        }

        try {
            final BatchReport report = app.run();
            logger.info("All documents processed: {} written, {} failed", report.successCount(), report.failureCount());
        } catch (final IOException e) {
            logger.error("Batch aborted", e);
            app.shutdown();
            System.exit(1);
        }

        app.shutdown();
    }
}
