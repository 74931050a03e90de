package de.mirkosertic.mcp.vehiclesearch.search;

import de.mirkosertic.mcp.vehiclesearch.SearchVectorAnalyzer;
import de.mirkosertic.mcp.vehiclesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vehiclesearch.error.InvalidPageTokenException;
import de.mirkosertic.mcp.vehiclesearch.error.StorageException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import de.mirkosertic.mcp.vehiclesearch.index.SortKey;
import de.mirkosertic.mcp.vehiclesearch.index.SortMode;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleDocumentMapper;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleIndexService;
import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;
import de.mirkosertic.mcp.vehiclesearch.model.VehicleField;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexOrDocValuesQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermInSetQuery;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.QueryBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link VehicleFilter} into one Lucene query, runs it as an ordered keyset scan and
 * wraps the hits into a {@link SearchPage}.
 *
 * <p>Every constraint becomes a non-scoring {@code FILTER} clause, so clause order never changes
 * the result. Free text becomes a single scoring {@code MUST} clause in which every analysed
 * term has to match.</p>
 */
public class QueryComposer {

    private static final Logger logger = LoggerFactory.getLogger(QueryComposer.class);

    static final String OPERATION = "search_records";

    private final VehicleIndexService indexService;
    private final PageTokenCodec pageTokenCodec;
    private final QueryBuilder textQueryBuilder;
    private final int defaultPageSize;
    private final int maxPageSize;

    public QueryComposer(final ApplicationConfig config, final VehicleIndexService indexService,
                         final PageTokenCodec pageTokenCodec) {
        this(config, indexService, pageTokenCodec, new SearchVectorAnalyzer());
    }

    QueryComposer(final ApplicationConfig config, final VehicleIndexService indexService,
                  final PageTokenCodec pageTokenCodec, final Analyzer searchVectorAnalyzer) {
        this.indexService = indexService;
        this.pageTokenCodec = pageTokenCodec;
        this.textQueryBuilder = new QueryBuilder(searchVectorAnalyzer);
        this.defaultPageSize = config.getDefaultPageSize();
        this.maxPageSize = config.getMaxPageSize();
    }

    public SearchPage search(final SearchArguments arguments)
            throws ValidationException, InvalidPageTokenException, StorageException {
        return search(arguments.filter(), arguments.pageToken(), arguments.pageSize());
    }

    /**
     * Returns the page of records following {@code pageToken} (or the first page).
     * {@code pageSize} defaults to the configured default and is truncated to the configured
     * maximum.
     */
    public SearchPage search(final VehicleFilter filter, final @Nullable String pageToken, final @Nullable Integer pageSize)
            throws ValidationException, InvalidPageTokenException, StorageException {
        if (pageSize != null && pageSize < 1) {
            throw new ValidationException("'pageSize' must be at least 1");
        }
        final int effectivePageSize = pageSize == null ? defaultPageSize : Math.min(pageSize, maxPageSize);

        final SortMode mode = filter.hasFreeText() ? SortMode.RELEVANCE : SortMode.DEFAULT;
        final String fingerprint = filter.fingerprint();
        final SortKey after = pageToken != null ? pageTokenCodec.decode(pageToken, mode, fingerprint) : null;

        final Query query = composeQuery(filter);
        logger.debug("Executing {} scan: query={}, after={}, pageSize={}", mode, query, after, effectivePageSize);

        // One extra hit tells whether another page exists
        final VehicleIndexService.ScanResult scan = indexService.scan(OPERATION, query, mode, after, effectivePageSize + 1);
        final List<VehicleIndexService.Hit> hits = scan.hits();

        final int returned = Math.min(hits.size(), effectivePageSize);
        final List<Vehicle> records = new ArrayList<>(returned);
        for (int i = 0; i < returned; i++) {
            records.add(hits.get(i).vehicle());
        }

        String nextPageToken = null;
        if (hits.size() > effectivePageSize) {
            nextPageToken = pageTokenCodec.encode(hits.get(returned - 1).sortKey(), fingerprint);
        }

        return new SearchPage(records, nextPageToken, scan.totalMatches(), effectivePageSize);
    }

    Query composeQuery(final VehicleFilter filter) {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        boolean constrained = false;

        if (filter.freeText() != null) {
            builder.add(textQuery(filter.freeText()), BooleanClause.Occur.MUST);
            constrained = true;
        }

        constrained |= addMembership(builder, VehicleField.BRAND, filter.brands());
        constrained |= addMembership(builder, VehicleField.MODEL, filter.models());
        constrained |= addMembership(builder, VehicleField.FUEL_TYPE, filter.fuelTypes());
        constrained |= addMembership(builder, VehicleField.COLOR, filter.colors());
        constrained |= addMembership(builder, VehicleField.TRANSMISSION, filter.transmissions());

        constrained |= addRange(builder, VehicleField.YEAR, filter.manufactureYear());
        constrained |= addRange(builder, VehicleField.MODEL_YEAR, filter.modelYear());
        constrained |= addRange(builder, VehicleField.PRICE, filter.price());
        constrained |= addRange(builder, VehicleField.MILEAGE, filter.mileage());
        constrained |= addRange(builder, VehicleField.DOORS, filter.doors());
        constrained |= addRange(builder, VehicleField.ENGINE_SIZE, filter.engineSize());

        if (!filter.doorsIn().isEmpty()) {
            builder.add(LongPoint.newSetQuery(VehicleField.DOORS.indexField(), filter.doorsIn()), BooleanClause.Occur.FILTER);
            constrained = true;
        }

        return constrained ? builder.build() : new MatchAllDocsQuery();
    }

    private Query textQuery(final String freeText) {
        final Query query = textQueryBuilder.createBooleanQuery(VehicleDocumentMapper.FIELD_SEARCH_VECTOR, freeText,
                BooleanClause.Occur.MUST);
        // Only stop words left after analysis
        return query != null ? query : new MatchNoDocsQuery("free text has no searchable terms");
    }

    private static boolean addMembership(final BooleanQuery.Builder builder, final VehicleField field, final List<String> keys) {
        if (keys.isEmpty()) {
            return false;
        }
        final String keyField = VehicleDocumentMapper.keyField(field);
        if (keys.size() == 1) {
            builder.add(new TermQuery(new Term(keyField, keys.get(0))), BooleanClause.Occur.FILTER);
        } else {
            builder.add(new TermInSetQuery(keyField, keys.stream().map(BytesRef::new).toList()), BooleanClause.Occur.FILTER);
        }
        return true;
    }

    private static boolean addRange(final BooleanQuery.Builder builder, final VehicleField field, final @Nullable LongRange range) {
        if (range == null) {
            return false;
        }
        final String name = field.indexField();
        builder.add(new IndexOrDocValuesQuery(
                LongPoint.newRangeQuery(name, range.lower(), range.upper()),
                NumericDocValuesField.newSlowRangeQuery(name, range.lower(), range.upper())), BooleanClause.Occur.FILTER);
        return true;
    }
}
