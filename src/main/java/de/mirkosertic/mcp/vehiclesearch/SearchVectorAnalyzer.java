package de.mirkosertic.mcp.vehiclesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.pt.PortugueseAnalyzer;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer for the {@code search_vector} field and for free-text queries against it.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> StopFilter(Portuguese)
 * -> ICUFoldingFilter -> SnowballFilter("Portuguese")}</p>
 *
 * <p>Stop words are removed before folding because the Portuguese stop set is accented
 * ("não", "às"). Folding runs before stemming, so "Automática" and "automatica" both
 * reduce to the same stem and a query never depends on the caller's accents or case.</p>
 */
public class SearchVectorAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new StopFilter(stream, PortugueseAnalyzer.getDefaultStopSet());
        stream = new ICUFoldingFilter(stream);
        stream = new SnowballFilter(stream, "Portuguese");
        return new TokenStreamComponents(tokenizer, stream);
    }
}
