package de.mirkosertic.docanalyst.model;

/**
 * A scored paragraph that made it into the top sections, with its derived title and rank.
 */
public record SelectedSection(ScoredUnit source, String title, int rank) {

    public SelectedSection {
        if (rank < 1) {
            throw new IllegalArgumentException("Ranks start at 1, was " + rank);
        }
    }

    public RankedSection toRankedSection() {
        return new RankedSection(source.unit().document(), source.unit().pageNumber(), title, rank);
    }

    public RefinedSection toRefinedSection() {
        return new RefinedSection(source.unit().document(), source.unit().pageNumber(), source.unit().text());
    }
}
