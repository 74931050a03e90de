package de.mirkosertic.mcp.vehiclesearch.index;

import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;

/**
 * The two total orders a scan can produce. Both end in the vehicle id, so the order never
 * depends on physical document order and a sort key identifies exactly one position.
 */
public enum SortMode {

    /**
     * No free text: newest manufacture year first, then cheapest, then id.
     */
    DEFAULT(new Sort(
            new SortField(VehicleDocumentMapper.FIELD_MANUFACTURE_YEAR, SortField.Type.LONG, true),
            new SortField(VehicleDocumentMapper.FIELD_PRICE, SortField.Type.LONG, false),
            new SortField(VehicleDocumentMapper.FIELD_ID, SortField.Type.STRING, false))),

    /**
     * Free text present: best score first, then most recently created, then id.
     */
    RELEVANCE(new Sort(
            SortField.FIELD_SCORE,
            new SortField(VehicleDocumentMapper.FIELD_CREATED_AT, SortField.Type.LONG, true),
            new SortField(VehicleDocumentMapper.FIELD_ID, SortField.Type.STRING, false)));

    private final Sort sort;

    SortMode(final Sort sort) {
        this.sort = sort;
    }

    public Sort sort() {
        return sort;
    }

    public boolean needsScores() {
        return this == RELEVANCE;
    }
}
