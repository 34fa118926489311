package de.mirkosertic.docanalyst.batch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a document file into per-page plain text.
 */
public interface DocumentTextProvider {

    /**
     * Pages whose text could not be extracted or is blank are left out of the result,
     * so the page list may be shorter than the document.
     *
     * @throws IOException if the document cannot be read or parsed at all
     */
    ExtractedDocument extract(Path file) throws IOException;
}
