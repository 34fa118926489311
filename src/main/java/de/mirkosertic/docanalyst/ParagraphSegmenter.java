package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.model.ContentUnit;
import de.mirkosertic.docanalyst.model.PageText;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits the page texts of a document into paragraphs.
 *
 * <p>A paragraph boundary is a blank line, i.e. two consecutive newlines. Text that only uses
 * single newlines stays one paragraph per page. Parts are trimmed and blank parts dropped, so a
 * page with visible text always yields at least one paragraph. The whole-page fallback below is a
 * guard for that guarantee and is not reached by any input.</p>
 */
public class ParagraphSegmenter {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n\n");

    /**
     * @param document name of the document, copied into every content unit
     * @param pages    pages in document order
     * @return paragraphs in page order, then in order within the page; paragraph indexes restart at 0 per page
     */
    public List<ContentUnit> segment(final String document, final List<PageText> pages) {
        final List<ContentUnit> units = new ArrayList<>();
        for (final PageText page : pages) {
            final List<String> paragraphs = splitParagraphs(page.text());
            for (int i = 0; i < paragraphs.size(); i++) {
                units.add(new ContentUnit(document, page.pageNumber(), paragraphs.get(i), i));
            }
        }
        return units;
    }

    static List<String> splitParagraphs(final String pageText) {
        final List<String> paragraphs = new ArrayList<>();
        for (final String candidate : PARAGRAPH_BREAK.split(pageText, -1)) {
            final String trimmed = candidate.strip();
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }
        // Guard only: a page whose parts all trim to empty is itself blank
        if (paragraphs.isEmpty()) {
            final String whole = pageText.strip();
            if (!whole.isEmpty()) {
                paragraphs.add(whole);
            }
        }
        return paragraphs;
    }
}
