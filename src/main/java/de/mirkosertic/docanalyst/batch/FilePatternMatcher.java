package de.mirkosertic.docanalyst.batch;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

/**
 * Glob based include/exclude filter for input documents.
 * <p>
 * Include patterns are matched case-insensitively against the file name, so {@code *.pdf} also
 * picks up {@code REPORT.PDF}. Exclude patterns are matched as written against the full path.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(pattern -> glob(pattern.toLowerCase(Locale.ROOT)))
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(FilePatternMatcher::glob)
                .toList();
    }

    private static PathMatcher glob(final String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    public boolean shouldInclude(final Path file) {
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(file)) {
                return false;
            }
        }

        if (includeMatchers.isEmpty()) {
            return true;
        }

        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final Path lowerCaseName = Path.of(fileName.toString().toLowerCase(Locale.ROOT));
        return includeMatchers.stream().anyMatch(matcher -> matcher.matches(lowerCaseName));
    }
}
