package de.mirkosertic.docanalyst.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Describes the run that produced an {@link AnalysisResult}.
 *
 * @param processingTimestamp ISO-8601 local date-time of the analysis
 */
@JsonPropertyOrder({"input_document", "persona", "job_to_be_done", "processing_timestamp"})
public record AnalysisMetadata(
        @JsonProperty("input_document")
        String inputDocument,

        @JsonProperty("persona")
        String persona,

        @JsonProperty("job_to_be_done")
        String jobToBeDone,

        @JsonProperty("processing_timestamp")
        String processingTimestamp
) {
}
