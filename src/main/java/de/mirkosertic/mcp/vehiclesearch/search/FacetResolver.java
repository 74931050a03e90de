package de.mirkosertic.mcp.vehiclesearch.search;

import de.mirkosertic.mcp.vehiclesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vehiclesearch.error.StorageException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleDocumentMapper;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleIndexService;
import de.mirkosertic.mcp.vehiclesearch.model.VehicleField;
import org.apache.lucene.facet.FacetResult;
import org.apache.lucene.facet.FacetsCollector;
import org.apache.lucene.facet.LabelAndValue;
import org.apache.lucene.facet.sortedset.DefaultSortedSetDocValuesReaderState;
import org.apache.lucene.facet.sortedset.SortedSetDocValuesFacetCounts;
import org.apache.lucene.facet.sortedset.SortedSetDocValuesReaderState;
import org.apache.lucene.index.DocValues;
import org.apache.lucene.index.NumericDocValues;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermInSetQuery;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Read-only summaries over the current store state: distinct values and min/max ranges.
 * Every call reads a fresh point-in-time searcher; nothing is cached.
 */
public class FacetResolver {

    private static final Logger logger = LoggerFactory.getLogger(FacetResolver.class);

    static final String LIST_DISTINCT = "list_distinct";
    static final String GET_RANGE = "get_range";

    private static final Comparator<String> TEXT_ORDER =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private final VehicleIndexService indexService;
    private final int maxDistinctValues;

    public FacetResolver(final ApplicationConfig config, final VehicleIndexService indexService) {
        this.indexService = indexService;
        this.maxDistinctValues = config.getMaxDistinctValues();
    }

    /**
     * Distinct values of {@code field} present in at least one record, optionally restricted to
     * records of the given brands (folded keys). Text values sort case-insensitively, numbers
     * ascending.
     */
    public DistinctValues listDistinct(final VehicleField field, final List<String> brandKeys)
            throws ValidationException, StorageException {
        if (!field.isDistinctSupported()) {
            throw new ValidationException("Field '" + field.wireName() + "' does not support distinct values. Supported: "
                    + String.join(", ", VehicleField.distinctWireNames()));
        }

        final Query query = brandKeys.isEmpty()
                ? new MatchAllDocsQuery()
                : new TermInSetQuery(VehicleDocumentMapper.keyField(VehicleField.BRAND),
                brandKeys.stream().map(BytesRef::new).toList());

        return indexService.aggregate(LIST_DISTINCT, query, (searcher, matches) ->
                field.kind() == VehicleField.Kind.TEXT
                        ? textValues(searcher, matches, field)
                        : numericValues(matches, field));
    }

    /**
     * Minimum and maximum of a numeric field over all records, or {@link FieldRange#noData()}
     * when the store holds no records.
     */
    public FieldRange getRange(final VehicleField field) throws ValidationException, StorageException {
        if (!field.isRangeSupported()) {
            throw new ValidationException("Field '" + field.wireName() + "' does not support ranges. Supported: "
                    + String.join(", ", VehicleField.rangeWireNames()));
        }

        return indexService.aggregate(GET_RANGE, new MatchAllDocsQuery(), (searcher, matches) -> {
            long min = Long.MAX_VALUE;
            long max = Long.MIN_VALUE;
            boolean found = false;
            for (final FacetsCollector.MatchingDocs matchingDocs : matches.getMatchingDocs()) {
                final NumericDocValues values = DocValues.getNumeric(matchingDocs.context.reader(), field.indexField());
                final DocIdSetIterator docs = matchingDocs.bits.iterator();
                if (docs == null) {
                    continue;
                }
                for (int doc = docs.nextDoc(); doc != DocIdSetIterator.NO_MORE_DOCS; doc = docs.nextDoc()) {
                    if (values.advanceExact(doc)) {
                        final long value = values.longValue();
                        min = Math.min(min, value);
                        max = Math.max(max, value);
                        found = true;
                    }
                }
            }
            return found
                    ? FieldRange.of(field.toDisplayValue(min), field.toDisplayValue(max))
                    : FieldRange.noData();
        });
    }

    private DistinctValues textValues(final IndexSearcher searcher, final FacetsCollector matches,
                                      final VehicleField field) throws IOException {
        if (searcher.getIndexReader().numDocs() == 0 || matches.getMatchingDocs().isEmpty()) {
            return new DistinctValues(List.of(), false);
        }

        final SortedSetDocValuesReaderState state =
                new DefaultSortedSetDocValuesReaderState(searcher.getIndexReader(), indexService.getMapper().getFacetsConfig());
        final SortedSetDocValuesFacetCounts counts = new SortedSetDocValuesFacetCounts(state, matches);
        final FacetResult result = counts.getTopChildren(maxDistinctValues, field.indexField());
        if (result == null) {
            return new DistinctValues(List.of(), false);
        }

        final List<String> labels = new ArrayList<>(result.labelValues.length);
        for (final LabelAndValue labelAndValue : result.labelValues) {
            if (labelAndValue.value.intValue() > 0) {
                labels.add(labelAndValue.label);
            }
        }
        labels.sort(TEXT_ORDER);

        final boolean truncated = result.childCount > labels.size();
        if (truncated) {
            logger.warn("Distinct values of {} truncated to {} of {}", field.wireName(), labels.size(), result.childCount);
        }
        return new DistinctValues(new ArrayList<>(labels), truncated);
    }

    private DistinctValues numericValues(final FacetsCollector matches, final VehicleField field) throws IOException {
        final TreeSet<Long> distinct = new TreeSet<>();
        for (final FacetsCollector.MatchingDocs matchingDocs : matches.getMatchingDocs()) {
            final NumericDocValues values = DocValues.getNumeric(matchingDocs.context.reader(), field.indexField());
            final DocIdSetIterator docs = matchingDocs.bits.iterator();
            if (docs == null) {
                continue;
            }
            for (int doc = docs.nextDoc(); doc != DocIdSetIterator.NO_MORE_DOCS; doc = docs.nextDoc()) {
                if (values.advanceExact(doc)) {
                    distinct.add(values.longValue());
                }
            }
        }

        final List<Object> result = new ArrayList<>();
        for (final Long value : distinct) {
            if (result.size() == maxDistinctValues) {
                break;
            }
            result.add(field.toDisplayValue(value));
        }
        final boolean truncated = distinct.size() > result.size();
        if (truncated) {
            logger.warn("Distinct values of {} truncated to {} of {}", field.wireName(), result.size(), distinct.size());
        }
        return new DistinctValues(result, truncated);
    }
}
