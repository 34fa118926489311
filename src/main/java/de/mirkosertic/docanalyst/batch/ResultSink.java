package de.mirkosertic.docanalyst.batch;

import de.mirkosertic.docanalyst.model.AnalysisResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists the analysis result of one document.
 */
public interface ResultSink {

    /**
     * @return where the result was written
     * @throws IOException if the result cannot be persisted
     */
    Path write(AnalysisResult result) throws IOException;

    /**
     * Name under which the result of the given document is stored. Two documents with the same
     * output name would overwrite each other.
     */
    String outputName(String documentName);
}
