package de.mirkosertic.docanalyst;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.WordlistLoader;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link LexicalResource} backed by Lucene: tokens come from {@link WordTokenizingAnalyzer},
 * stop words from a Snowball formatted word list on the classpath
 * ({@code stopwords/<language>.txt}).
 *
 * <p>Lucene analyzers keep their token stream components per thread, which makes
 * {@link #tokenize(String)} safe to call from several analysis threads at once.</p>
 */
public class LuceneLexicalResource implements LexicalResource, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LuceneLexicalResource.class);

    private static final String STOP_WORD_RESOURCE_PATTERN = "stopwords/%s.txt";
    private static final String FIELD_NAME = "content";

    private final String language;
    private final CharArraySet stopWords;
    private final Analyzer analyzer;

    LuceneLexicalResource(final String language, final CharArraySet stopWords) {
        this.language = language;
        this.stopWords = CharArraySet.unmodifiableSet(stopWords);
        this.analyzer = new WordTokenizingAnalyzer();
    }

    /**
     * Load the stop word list for the given language.
     *
     * @param language language name as used in the resource file name, e.g. {@code "english"}
     * @throws IOException if no word list exists for the language or it cannot be read
     */
    public static LuceneLexicalResource load(final String language) throws IOException {
        final String normalizedLanguage = language.trim().toLowerCase(Locale.ROOT);
        final String resource = String.format(Locale.ROOT, STOP_WORD_RESOURCE_PATTERN, normalizedLanguage);

        try (final InputStream is = LuceneLexicalResource.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new FileNotFoundException("No stop word list for language '" + language
                        + "' (expected classpath resource " + resource + ")");
            }
            try (final Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                final CharArraySet stopWords = WordlistLoader.getSnowballWordSet(reader);
                logger.info("Loaded {} stop words for language '{}'", stopWords.size(), normalizedLanguage);
                return new LuceneLexicalResource(normalizedLanguage, stopWords);
            }
        }
    }

    @Override
    public List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        try (final TokenStream tokenStream = analyzer.tokenStream(FIELD_NAME, text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            tokenStream.end();
        } catch (final IOException e) {
            // Only reachable through a broken analyzer, the input is an in-memory string
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return tokens;
    }

    @Override
    public boolean isStopWord(final String token) {
        return stopWords.contains(token);
    }

    @Override
    public String language() {
        return language;
    }

    public int stopWordCount() {
        return stopWords.size();
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
