package de.mirkosertic.docanalyst;

import java.util.List;

/**
 * Language dependent tokenization rules and stop words.
 *
 * <p>Implementations are loaded once before the first document is analysed and are
 * read-only afterwards, so one instance is shared by all concurrently running analyses.</p>
 */
public interface LexicalResource {

    /**
     * Split text into word tokens in order of appearance. Punctuation does not produce tokens.
     */
    List<String> tokenize(String text);

    /**
     * @param token a lowercase token
     */
    boolean isStopWord(String token);

    String language();
}
