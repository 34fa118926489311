package de.mirkosertic.docanalyst.model;

/**
 * A content unit together with its relevance score in the range 0.0-1.0.
 */
public record ScoredUnit(ContentUnit unit, double score) {

    public ScoredUnit {
        if (unit == null) {
            throw new IllegalArgumentException("Content unit must not be null");
        }
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Relevance score must be within [0, 1], was " + score);
        }
    }

    public boolean isRelevant() {
        return score > 0.0;
    }
}
