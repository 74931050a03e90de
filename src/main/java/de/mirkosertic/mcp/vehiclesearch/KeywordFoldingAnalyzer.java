package de.mirkosertic.mcp.vehiclesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.KeywordTokenizer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;

/**
 * Single-token analyzer producing the comparison key for equality and membership filters
 * on identity and categorical attributes.
 *
 * <p>ICU folding covers case folding and diacritic removal, so "Volkswagen", "VOLKSWAGEN"
 * and "Völkswagen" share one key. This is the same folding the {@link SearchVectorAnalyzer}
 * applies, which keeps filter matches and text matches consistent.</p>
 */
public class KeywordFoldingAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new KeywordTokenizer();
        final TokenStream stream = new ICUFoldingFilter(tokenizer);
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new ICUFoldingFilter(in);
    }

    /**
     * Folds a raw value into its comparison key. Surrounding and repeated inner whitespace
     * is collapsed first.
     */
    public String fold(final String fieldName, final String value) {
        final String collapsed = value.strip().replaceAll("\\s+", " ");
        return normalize(fieldName, collapsed).utf8ToString();
    }
}
