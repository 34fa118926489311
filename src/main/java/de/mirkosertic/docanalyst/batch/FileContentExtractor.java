package de.mirkosertic.docanalyst.batch;

import de.mirkosertic.docanalyst.model.PageText;
import de.mirkosertic.docanalyst.util.TextCleaner;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts per-page text from documents.
 * <p>
 * PDFs are read page by page with PDFBox. Every other format Tika can parse (plain text,
 * Office and OpenOffice documents) has no reliable page layout and is returned as a single page.
 */
public class FileContentExtractor implements DocumentTextProvider {

    private static final Logger logger = LoggerFactory.getLogger(FileContentExtractor.class);

    static final String PDF_MIME_TYPE = "application/pdf";

    private final Tika tika;
    private final Parser parser;

    public FileContentExtractor() {
        this.tika = new Tika();
        this.parser = new AutoDetectParser();
    }

    @Override
    public ExtractedDocument extract(final Path file) throws IOException {
        final long fileSize = Files.size(file);
        final String fileType = tika.detect(file);

        final List<PageText> pages;
        if (PDF_MIME_TYPE.equals(fileType)) {
            pages = extractPdfPages(file);
        } else {
            pages = extractSinglePage(file);
        }

        logger.debug("Extracted {} non-empty pages from {} ({}, {} bytes)", pages.size(), file, fileType, fileSize);
        return new ExtractedDocument(pages, fileType, fileSize);
    }

    private List<PageText> extractPdfPages(final Path file) throws IOException {
        try (final PDDocument document = Loader.loadPDF(file.toFile())) {
            final int totalPages = document.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");

            final List<PageText> pages = new ArrayList<>(totalPages);
            for (int pageNumber = 1; pageNumber <= totalPages; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                final String text;
                try {
                    text = stripper.getText(document);
                } catch (final IOException e) {
                    // A broken page costs only that page, the rest of the document is still usable
                    logger.warn("Could not extract text of page {} in {}: {}", pageNumber, file, e.getMessage());
                    continue;
                }
                addIfNotBlank(pages, pageNumber, text);
            }
            return pages;
        }
    }

    private List<PageText> extractSinglePage(final Path file) throws IOException {
        try (final InputStream stream = Files.newInputStream(file)) {
            final Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());

            // -1 means unlimited (extract full content regardless of size)
            final BodyContentHandler handler = new BodyContentHandler(-1);

            final ParseContext context = new ParseContext();
            context.set(Parser.class, parser);

            try {
                parser.parse(stream, handler, metadata, context);
            } catch (final SAXException | TikaException e) {
                throw new IOException("Failed to parse document " + file, e);
            }

            final List<PageText> pages = new ArrayList<>(1);
            addIfNotBlank(pages, 1, handler.toString());
            return pages;
        }
    }

    private static void addIfNotBlank(final List<PageText> pages, final int pageNumber, final String rawText) {
        final String cleaned = TextCleaner.cleanPreservingLines(rawText);
        if (cleaned != null && !cleaned.isBlank()) {
            pages.add(new PageText(pageNumber, cleaned));
        }
    }
}
