package de.mirkosertic.docanalyst;

import de.mirkosertic.docanalyst.model.AnalysisMetadata;
import de.mirkosertic.docanalyst.model.AnalysisResult;
import de.mirkosertic.docanalyst.model.RankedSection;
import de.mirkosertic.docanalyst.model.RefinedSection;
import de.mirkosertic.docanalyst.model.SelectedSection;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Packages run metadata and the selected sections into an {@link AnalysisResult}.
 */
public class ResultAssembler {

    private final Clock clock;

    public ResultAssembler(final Clock clock) {
        this.clock = clock;
    }

    public AnalysisResult assemble(final String documentName,
                                   final String persona,
                                   final String jobToBeDone,
                                   final List<SelectedSection> selected) {
        final List<RankedSection> rankedSections = new ArrayList<>(selected.size());
        final List<RefinedSection> refinedSections = new ArrayList<>(selected.size());
        for (final SelectedSection section : selected) {
            rankedSections.add(section.toRankedSection());
            refinedSections.add(section.toRefinedSection());
        }

        final AnalysisMetadata metadata = new AnalysisMetadata(
                documentName,
                persona,
                jobToBeDone,
                LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        );
        return new AnalysisResult(metadata, rankedSections, refinedSections);
    }
}
