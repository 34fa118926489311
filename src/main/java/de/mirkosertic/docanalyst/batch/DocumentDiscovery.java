package de.mirkosertic.docanalyst.batch;

import de.mirkosertic.docanalyst.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the documents to analyse in the configured input directory.
 */
public class DocumentDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(DocumentDiscovery.class);

    private final Path inputDirectory;
    private final FilePatternMatcher matcher;
    private final boolean recursive;

    public DocumentDiscovery(final ApplicationConfig config) {
        this(Paths.get(config.getInputDirectory()),
                new FilePatternMatcher(config.getIncludePatterns(), config.getExcludePatterns()),
                config.isRecursive());
    }

    DocumentDiscovery(final Path inputDirectory, final FilePatternMatcher matcher, final boolean recursive) {
        this.inputDirectory = inputDirectory;
        this.matcher = matcher;
        this.recursive = recursive;
    }

    /**
     * @return matching regular files, sorted by path
     * @throws IOException if the input directory is missing, not a directory or cannot be listed
     */
    public List<Path> discover() throws IOException {
        if (!Files.exists(inputDirectory)) {
            throw new IOException("Input directory does not exist: " + inputDirectory);
        }
        if (!Files.isDirectory(inputDirectory)) {
            throw new IOException("Input path is not a directory: " + inputDirectory);
        }

        final int maxDepth = recursive ? Integer.MAX_VALUE : 1;
        try (final Stream<Path> paths = Files.walk(inputDirectory, maxDepth)) {
            final List<Path> documents = paths
                    .filter(Files::isRegularFile)
                    .filter(matcher::shouldInclude)
                    .sorted()
                    .collect(Collectors.toList());
            logger.info("Found {} documents in {}", documents.size(), inputDirectory);
            return documents;
        }
    }

    public Path getInputDirectory() {
        return inputDirectory;
    }
}
