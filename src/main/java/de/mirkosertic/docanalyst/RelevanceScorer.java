package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.model.ContentUnit;
import de.mirkosertic.docanalyst.model.ScoredUnit;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keyword density score of a paragraph.
 *
 * <p>score = |distinct normalized tokens that are keywords| / |all normalized tokens|</p>
 *
 * <p>Repeating a keyword grows the denominator only, so repetition never raises the score.
 * The result is 0.0 when there are no keywords, no tokens or no match, and at most 1.0.</p>
 */
public class RelevanceScorer {

    private final TextNormalizer normalizer;

    public RelevanceScorer(final TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public double score(final String text, final KeywordSet keywords) {
        if (text == null || text.isEmpty() || keywords.isEmpty()) {
            return 0.0;
        }
        final List<String> tokens = normalizer.normalize(text);
        if (tokens.isEmpty()) {
            return 0.0;
        }
        final Set<String> matched = new HashSet<>();
        for (final String token : tokens) {
            if (keywords.contains(token)) {
                matched.add(token);
            }
        }
        return (double) matched.size() / tokens.size();
    }

    public ScoredUnit score(final ContentUnit unit, final KeywordSet keywords) {
        return unit.withScore(score(unit.text(), keywords));
    }
}
