package de.mirkosertic.docanalyst.model;

/**
 * Extracted plain text of a single document page.
 *
 * @param pageNumber 1-based page number
 * @param text       the page text as delivered by the extractor, line breaks preserved
 */
public record PageText(int pageNumber, String text) {

    public PageText {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page numbers start at 1, was " + pageNumber);
        }
        if (text == null) {
            throw new IllegalArgumentException("Page text must not be null");
        }
    }
}
