package de.mirkosertic.docanalyst.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.docanalyst.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes each result as pretty-printed JSON into the output directory. The file is named after
 * the input document with its extension replaced by {@code .json}, e.g. {@code report.pdf} becomes
 * {@code report.json}.
 */
public class JsonFileResultSink implements ResultSink {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileResultSink.class);

    private static final String JSON_EXTENSION = ".json";

    private final Path outputDirectory;
    private final ObjectMapper objectMapper;

    public JsonFileResultSink(final Path outputDirectory) {
        this(outputDirectory, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonFileResultSink(final Path outputDirectory, final ObjectMapper objectMapper) {
        this.outputDirectory = outputDirectory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Path write(final AnalysisResult result) throws IOException {
        Files.createDirectories(outputDirectory);
        final Path target = outputDirectory.resolve(outputName(result.metadata().inputDocument()));

        // A failed write must not leave a partial result file behind
        final Path temp = Files.createTempFile(outputDirectory, ".result-", JSON_EXTENSION);
        try {
            objectMapper.writeValue(temp.toFile(), result);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        logger.debug("Wrote {} sections to {}", result.extractedSections().size(), target);
        return target;
    }

    @Override
    public String outputName(final String documentName) {
        return outputFileName(documentName);
    }

    static String outputFileName(final String documentName) {
        final int dot = documentName.lastIndexOf('.');
        final String baseName = dot > 0 ? documentName.substring(0, dot) : documentName;
        return baseName + JSON_EXTENSION;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }
}
