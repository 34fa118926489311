package de.mirkosertic.docanalyst.model;

/**
 * A paragraph of a document page, the unit that gets scored and ranked.
 *
 * @param document       name of the source document
 * @param pageNumber     1-based page the paragraph was found on
 * @param text           trimmed paragraph text, never blank
 * @param paragraphIndex 0-based position of the paragraph within its page
 */
public record ContentUnit(String document, int pageNumber, String text, int paragraphIndex) {

    public ContentUnit {
        if (document == null) {
            throw new IllegalArgumentException("Document name must not be null");
        }
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page numbers start at 1, was " + pageNumber);
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Content unit text must not be blank");
        }
        if (paragraphIndex < 0) {
            throw new IllegalArgumentException("Paragraph index must not be negative, was " + paragraphIndex);
        }
    }

    public ScoredUnit withScore(final double score) {
        return new ScoredUnit(this, score);
    }
}
