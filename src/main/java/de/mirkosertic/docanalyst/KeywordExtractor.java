package de.mirkosertic.docanalyst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Derives the significant terms of a free text description such as a persona or a job to be done.
 *
 * <p>The description is lowercased and tokenized, possessive {@code 's} endings are removed by the
 * tokenizer. Only tokens made up entirely of letters and digits survive, and stop words of the
 * configured language are dropped. Hyphenated words are split into their parts, so
 * {@code data-driven} contributes {@code data} and {@code driven}.</p>
 */
public class KeywordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(KeywordExtractor.class);

    private final LexicalResource lexicalResource;

    public KeywordExtractor(final LexicalResource lexicalResource) {
        this.lexicalResource = lexicalResource;
    }

    /**
     * @param description free text, may be null, empty or span several sentences
     * @return the keywords; empty when nothing significant remains
     */
    public KeywordSet extract(final String description) {
        if (description == null || description.isBlank()) {
            return KeywordSet.empty();
        }
        final Set<String> keywords = new HashSet<>();
        for (final String token : lexicalResource.tokenize(description.toLowerCase(Locale.ROOT))) {
            if (isAlphanumeric(token) && !lexicalResource.isStopWord(token)) {
                keywords.add(token);
            }
        }
        return KeywordSet.of(keywords);
    }

    /**
     * Keywords of persona and job, extracted independently and united.
     */
    public KeywordSet extract(final String persona, final String jobToBeDone) {
        final KeywordSet keywords = extract(persona).union(extract(jobToBeDone));
        logger.debug("Extracted {} keywords from persona and job: {}", keywords.size(), keywords.terms());
        return keywords;
    }

    static boolean isAlphanumeric(final String token) {
        if (token.isEmpty()) {
            return false;
        }
        return token.codePoints().allMatch(Character::isLetterOrDigit);
    }
}
