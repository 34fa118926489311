package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.model.ScoredUnit;
import de.mirkosertic.docanalyst.model.SelectedSection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored paragraphs by relevance and keeps the best ones.
 *
 * <p>Paragraphs with a score of 0 are never ranked. The remaining ones are sorted by descending
 * score with a stable sort, so paragraphs with equal scores keep their order in the document.
 * At most {@code maxSections} paragraphs are selected and ranked 1..n.</p>
 */
public class SectionRanker {

    public static final int DEFAULT_MAX_SECTIONS = 10;
    public static final int DEFAULT_MAX_TITLE_LENGTH = 100;

    static final String ELLIPSIS = "...";
    static final String UNTITLED_SECTION = "Untitled Section";
    static final String BLANK_FIRST_LINE_TITLE = "Relevant Content";

    private static final Comparator<ScoredUnit> BY_SCORE_DESCENDING =
            Comparator.comparingDouble(ScoredUnit::score).reversed();

    private final int maxSections;
    private final int maxTitleLength;

    public SectionRanker() {
        this(DEFAULT_MAX_SECTIONS, DEFAULT_MAX_TITLE_LENGTH);
    }

    public SectionRanker(final int maxSections, final int maxTitleLength) {
        if (maxSections <= 0) {
            throw new IllegalArgumentException("maxSections must be positive, was " + maxSections);
        }
        if (maxTitleLength <= 0) {
            throw new IllegalArgumentException("maxTitleLength must be positive, was " + maxTitleLength);
        }
        this.maxSections = maxSections;
        this.maxTitleLength = maxTitleLength;
    }

    /**
     * @param scoredUnits all scored paragraphs of one document, in segmentation order
     * @return the selected sections ordered by rank; empty if no paragraph scored above 0
     */
    public List<SelectedSection> rank(final List<ScoredUnit> scoredUnits) {
        final List<ScoredUnit> relevant = new ArrayList<>();
        for (final ScoredUnit scoredUnit : scoredUnits) {
            if (scoredUnit.isRelevant()) {
                relevant.add(scoredUnit);
            }
        }
        // List.sort is a stable merge sort
        relevant.sort(BY_SCORE_DESCENDING);

        final int selectedCount = Math.min(maxSections, relevant.size());
        final List<SelectedSection> selected = new ArrayList<>(selectedCount);
        for (int i = 0; i < selectedCount; i++) {
            final ScoredUnit scoredUnit = relevant.get(i);
            selected.add(new SelectedSection(scoredUnit, deriveTitle(scoredUnit.unit().text(), maxTitleLength), i + 1));
        }
        return selected;
    }

    /**
     * Title of a paragraph: its first line, trimmed.
     *
     * <p>A first line longer than {@code maxLength} is cut to {@code maxLength} characters, then back
     * to the last whitespace, and {@value #ELLIPSIS} is appended. A prefix without whitespace is kept
     * whole.</p>
     *
     * @param text      paragraph text
     * @param maxLength maximum title length before the ellipsis
     * @return the title, or a placeholder for empty text or a blank first line
     */
    public static String deriveTitle(final String text, final int maxLength) {
        if (text == null || text.isEmpty()) {
            return UNTITLED_SECTION;
        }
        final String firstLine = firstLine(text.strip()).strip();
        if (firstLine.isEmpty()) {
            return BLANK_FIRST_LINE_TITLE;
        }
        if (firstLine.length() <= maxLength) {
            return firstLine;
        }
        int end = maxLength;
        if (Character.isHighSurrogate(firstLine.charAt(end - 1))) {
            end--;
        }
        final String prefix = firstLine.substring(0, end);
        return cutAtLastWhitespace(prefix) + ELLIPSIS;
    }

    private static String firstLine(final String text) {
        final int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }

    private static String cutAtLastWhitespace(final String prefix) {
        for (int i = prefix.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(prefix.charAt(i))) {
                return prefix.substring(0, i);
            }
        }
        return prefix;
    }

    public int getMaxSections() {
        return maxSections;
    }

    public int getMaxTitleLength() {
        return maxTitleLength;
    }
}
