package de.mirkosertic.docanalyst;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes paragraph text for keyword matching: lowercase, everything except ASCII
 * letters, digits and whitespace removed, then split into word tokens.
 */
public class TextNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");

    private final LexicalResource lexicalResource;

    public TextNormalizer(final LexicalResource lexicalResource) {
        this.lexicalResource = lexicalResource;
    }

    /**
     * @param text raw text, may be null or empty
     * @return normalized tokens in order of appearance, repeats included; empty for empty input
     */
    public List<String> normalize(final String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return lexicalResource.tokenize(canonicalize(text));
    }

    static String canonicalize(final String text) {
        return NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
