package de.mirkosertic.docanalyst.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The complete analysis of one document: run metadata, the ranked sections and,
 * aligned by rank, the full text of every ranked section.
 */
@JsonPropertyOrder({"metadata", "extracted_sections", "sub_section_analysis"})
public record AnalysisResult(
        @JsonProperty("metadata")
        AnalysisMetadata metadata,

        @JsonProperty("extracted_sections")
        List<RankedSection> extractedSections,

        @JsonProperty("sub_section_analysis")
        List<RefinedSection> subSectionAnalysis
) {

    public AnalysisResult {
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata must not be null");
        }
        extractedSections = List.copyOf(extractedSections);
        subSectionAnalysis = List.copyOf(subSectionAnalysis);
        if (extractedSections.size() != subSectionAnalysis.size()) {
            throw new IllegalArgumentException("Every extracted section needs exactly one refined section, got "
                    + extractedSections.size() + " sections and " + subSectionAnalysis.size() + " refined sections");
        }
    }
}
