package de.mirkosertic.mcp.vehiclesearch.index;

import org.apache.lucene.search.FieldDoc;
import org.apache.lucene.util.BytesRef;

/**
 * Position of one hit in a {@link SortMode} order.
 *
 * <p>For {@link SortMode#DEFAULT} {@code primary} is the manufacture year and {@code secondary}
 * the price in cents. For {@link SortMode#RELEVANCE} {@code primary} holds the raw int bits of the
 * float score, so the key survives a round trip without precision loss, and {@code secondary}
 * is the creation time in epoch milliseconds.</p>
 *
 * <p>Scores are only comparable within one index reader, so relevance keys also carry the
 * version of the searcher snapshot they were read from. Default keys use {@link #NO_SNAPSHOT}.</p>
 */
public record SortKey(SortMode mode, long primary, long secondary, String id, long snapshot) {

    public static final long NO_SNAPSHOT = -1L;

    public SortKey(final SortMode mode, final long primary, final long secondary, final String id) {
        this(mode, primary, secondary, id, NO_SNAPSHOT);
    }

    static SortKey fromFieldDoc(final SortMode mode, final FieldDoc fieldDoc, final long snapshot) {
        final Object[] values = fieldDoc.fields;
        final long primary = mode == SortMode.RELEVANCE
                ? Float.floatToIntBits((Float) values[0])
                : (Long) values[0];
        final long secondary = (Long) values[1];
        final String id = ((BytesRef) values[2]).utf8ToString();
        return new SortKey(mode, primary, secondary, id, snapshot);
    }

    /**
     * Builds the {@code after} marker for {@code IndexSearcher.searchAfter}. All sort fields are
     * populated, so only documents strictly after this key are returned; {@code doc} just has to
     * be a valid document number for the reader and is otherwise irrelevant because ids are unique.
     */
    FieldDoc toFieldDoc(final int doc) {
        if (mode == SortMode.RELEVANCE) {
            final float score = Float.intBitsToFloat((int) primary);
            return new FieldDoc(doc, score, new Object[]{score, secondary, new BytesRef(id)});
        }
        return new FieldDoc(doc, Float.NaN, new Object[]{primary, secondary, new BytesRef(id)});
    }
}
