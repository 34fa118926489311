package de.mirkosertic.docanalyst.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A selected paragraph as it appears in the extracted sections list of a result.
 * Ranks start at 1 for the most relevant section.
 */
@JsonPropertyOrder({"document", "page_number", "section_title", "importance_rank"})
public record RankedSection(
        @JsonProperty("document")
        String document,

        @JsonProperty("page_number")
        int pageNumber,

        @JsonProperty("section_title")
        String sectionTitle,

        @JsonProperty("importance_rank")
        int importanceRank
) {
}
