package de.mirkosertic.docanalyst.batch;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * What happened to one document of a batch.
 *
 * @param document   file name of the input document
 * @param status     processing status
 * @param outputFile written result file, only set for {@link Status#WRITTEN}
 * @param sections   number of ranked sections in the result, 0 unless analysed
 * @param message    failure description, null for {@link Status#WRITTEN}
 */
public record DocumentOutcome(
        String document,
        Status status,
        @Nullable Path outputFile,
        int sections,
        @Nullable String message
) {

    public enum Status {
        WRITTEN,
        EXTRACTION_FAILED,
        ANALYSIS_FAILED,
        SINK_FAILED
    }

    public static DocumentOutcome written(final String document, final Path outputFile, final int sections) {
        return new DocumentOutcome(document, Status.WRITTEN, outputFile, sections, null);
    }

    public static DocumentOutcome failed(final String document, final Status status, final int sections, final String message) {
        return new DocumentOutcome(document, status, null, sections, message);
    }

    public boolean isSuccess() {
        return status == Status.WRITTEN;
    }
}
