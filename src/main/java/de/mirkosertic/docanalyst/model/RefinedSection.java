package de.mirkosertic.docanalyst.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Full text of a selected paragraph. Refined sections are listed in the same order as
 * the {@link RankedSection ranked sections} they belong to.
 */
@JsonPropertyOrder({"document", "page_number", "refined_text"})
public record RefinedSection(
        @JsonProperty("document")
        String document,

        @JsonProperty("page_number")
        int pageNumber,

        @JsonProperty("refined_text")
        String refinedText
) {
}
