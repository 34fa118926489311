package de.mirkosertic.docanalyst;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.en.EnglishPossessiveFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer that only splits text into word tokens.
 *
 * <p>Token chain: {@code StandardTokenizer -> EnglishPossessiveFilter}. Punctuation is dropped by the
 * Unicode word break rules and a trailing {@code 's} is cut off, so {@code investor's} yields
 * {@code investor}. Case and diacritics are left untouched so that callers decide how to
 * canonicalize the text before or after tokenization.</p>
 */
public class WordTokenizingAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        final TokenStream stream = new EnglishPossessiveFilter(tokenizer);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
