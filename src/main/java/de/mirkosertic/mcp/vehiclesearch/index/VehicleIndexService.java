package de.mirkosertic.mcp.vehiclesearch.index;

import de.mirkosertic.mcp.vehiclesearch.KeywordFoldingAnalyzer;
import de.mirkosertic.mcp.vehiclesearch.SearchVectorAnalyzer;
import de.mirkosertic.mcp.vehiclesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vehiclesearch.config.BuildInfo;
import de.mirkosertic.mcp.vehiclesearch.error.ConstraintViolationException;
import de.mirkosertic.mcp.vehiclesearch.error.InvalidPageTokenException;
import de.mirkosertic.mcp.vehiclesearch.error.StorageException;
import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.apache.lucene.document.Document;
import org.apache.lucene.facet.FacetsCollector;
import org.apache.lucene.facet.FacetsCollectorManager;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.FieldDoc;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherLifetimeManager;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Core Lucene index service that manages IndexWriter and SearcherManager for the vehicle inventory.
 *
 * <p>Writes go through {@link #index(Vehicle)}, which validates the storage constraints and
 * upserts the whole document, search vector included, in one {@code updateDocument} call.
 * Reads ({@link #scan} and {@link #aggregate}) run on the {@link QueryExecutor} against a
 * point-in-time searcher acquired from the SearcherManager. Relevance scans record that searcher
 * in a {@link SearcherLifetimeManager} and continue on the same snapshot for later pages, because
 * BM25 scores shift with every write.</p>
 */
public class VehicleIndexService {

    private static final Logger logger = LoggerFactory.getLogger(VehicleIndexService.class);

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String SOFTWARE_VERSION_KEY = "software_version";

    /**
     * One page of a scan, in sort order, with the exact number of matching records.
     */
    public record ScanResult(List<Hit> hits, long totalMatches) {
    }

    public record Hit(Vehicle vehicle, SortKey sortKey) {
    }

    /**
     * Aggregates over the set of documents matching a query.
     */
    @FunctionalInterface
    public interface MatchAggregation<T> {
        T aggregate(IndexSearcher searcher, FacetsCollector matches) throws IOException;
    }

    private final String indexPath;
    private final long nrtRefreshIntervalMs;
    private final double snapshotTtlSeconds;
    private final VehicleDocumentMapper mapper;
    private final VehicleConstraints constraints;
    private final QueryExecutor queryExecutor;
    private final Analyzer analyzer;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private SearcherLifetimeManager snapshots;
    private ScheduledExecutorService refreshScheduler;

    private volatile boolean schemaUpgradeRequired;

    public VehicleIndexService(final ApplicationConfig config, final VehicleDocumentMapper mapper,
                               final VehicleConstraints constraints, final QueryExecutor queryExecutor) {
        this.indexPath = config.getIndexPath();
        this.nrtRefreshIntervalMs = config.getNrtRefreshIntervalMs();
        this.snapshotTtlSeconds = config.getRelevanceSnapshotTtlSeconds();
        this.mapper = mapper;
        this.constraints = constraints;
        this.queryExecutor = queryExecutor;
        this.analyzer = new PerFieldAnalyzerWrapper(new KeywordFoldingAnalyzer(),
                Map.of(VehicleDocumentMapper.FIELD_SEARCH_VECTOR, new SearchVectorAnalyzer()));
    }

    /**
     * Initialize the Lucene index. Must be called before using the service.
     */
    public void init() throws IOException {
        final Path path = Path.of(indexPath);
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            logger.info("Created index directory: {}", path.toAbsolutePath());
        }

        directory = FSDirectory.open(path);

        final boolean indexExisted = DirectoryReader.indexExists(directory);
        final Map<String, String> previousCommitData = indexExisted
                ? SegmentInfos.readLatestCommit(directory).getUserData()
                : Map.of();

        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);

        final String storedVersion = previousCommitData.get(SCHEMA_VERSION_KEY);
        final String currentVersion = String.valueOf(VehicleDocumentMapper.SCHEMA_VERSION);
        schemaUpgradeRequired = indexExisted
                && indexWriter.getDocStats().numDocs > 0
                && !currentVersion.equals(storedVersion);
        if (schemaUpgradeRequired) {
            logger.warn("Index schema version {} differs from current version {}, the inventory must be reloaded",
                    storedVersion, currentVersion);
        }

        indexWriter.setLiveCommitData(Map.of(
                SCHEMA_VERSION_KEY, currentVersion,
                SOFTWARE_VERSION_KEY, BuildInfo.getVersion()
        ).entrySet());
        indexWriter.commit();

        // Searchers see uncommitted changes directly from the writer
        searcherManager = new SearcherManager(indexWriter, null);
        snapshots = new SearcherLifetimeManager();

        refreshScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "lucene-nrt-refresh");
            t.setDaemon(true);
            return t;
        });
        refreshScheduler.scheduleAtFixedRate(this::maybeRefreshSearcher,
                nrtRefreshIntervalMs, nrtRefreshIntervalMs, TimeUnit.MILLISECONDS);

        logger.info("Lucene index initialized at: {} with NRT refresh interval {}ms",
                path.toAbsolutePath(), nrtRefreshIntervalMs);
    }

    private void maybeRefreshSearcher() {
        try {
            searcherManager.maybeRefresh();
            snapshots.prune(new SearcherLifetimeManager.PruneByAge(snapshotTtlSeconds));
        } catch (final IOException | AlreadyClosedException e) {
            logger.warn("Failed to refresh SearcherManager", e);
        }
    }

    /**
     * Close the index service and release all resources.
     */
    public void close() throws IOException {
        if (refreshScheduler != null) {
            refreshScheduler.shutdown();
            try {
                if (!refreshScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    refreshScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                refreshScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // Close searchers before IndexWriter
        if (snapshots != null) {
            snapshots.close();
        }
        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Lucene index closed");
    }

    public boolean isSchemaUpgradeRequired() {
        return schemaUpgradeRequired;
    }

    public int getIndexSchemaVersion() {
        final String value = liveCommitData().get(SCHEMA_VERSION_KEY);
        return value != null ? Integer.parseInt(value) : -1;
    }

    public @Nullable String getIndexSoftwareVersion() {
        return liveCommitData().get(SOFTWARE_VERSION_KEY);
    }

    private Map<String, String> liveCommitData() {
        final Map<String, String> data = new HashMap<>();
        final Iterable<Map.Entry<String, String>> live = indexWriter.getLiveCommitData();
        if (live != null) {
            for (final Map.Entry<String, String> entry : live) {
                data.put(entry.getKey(), entry.getValue());
            }
        }
        return data;
    }

    /**
     * Validates and upserts a single vehicle. The change becomes visible with the next
     * searcher refresh and durable with the next {@link #commit()}.
     */
    public void index(final Vehicle vehicle) throws ConstraintViolationException, IOException {
        constraints.check(vehicle);
        final Document document = mapper.createDocument(vehicle);
        indexWriter.updateDocument(new Term(VehicleDocumentMapper.FIELD_ID, vehicle.id()), document);
    }

    /**
     * Validates all vehicles first, then writes and commits them. A single constraint
     * violation rejects the whole batch before anything is written.
     */
    public void indexAll(final Collection<Vehicle> vehicles) throws ConstraintViolationException, IOException {
        for (final Vehicle vehicle : vehicles) {
            constraints.check(vehicle);
        }
        for (final Vehicle vehicle : vehicles) {
            indexWriter.updateDocument(new Term(VehicleDocumentMapper.FIELD_ID, vehicle.id()), mapper.createDocument(vehicle));
        }
        commit();
        logger.info("Indexed {} vehicles", vehicles.size());
    }

    /**
     * Removes every vehicle, used before reloading an index whose schema is outdated.
     */
    public void deleteAll() throws IOException {
        indexWriter.deleteAll();
        commit();
        schemaUpgradeRequired = false;
        logger.info("All vehicles deleted from index");
    }

    public void commit() throws IOException {
        indexWriter.commit();
    }

    /**
     * Makes all writes so far visible to subsequent searches without waiting for the
     * background refresh.
     */
    public void refreshSearcher() throws IOException {
        searcherManager.maybeRefreshBlocking();
    }

    public long getDocumentCount() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Ordered, keyset-paginated scan. Returns at most {@code limit} hits strictly after
     * {@code after} in the order of {@code mode}.
     *
     * <p>A relevance scan without {@code after} records its searcher as a snapshot; a relevance
     * scan with {@code after} runs on the snapshot named by the key.</p>
     *
     * @throws InvalidPageTokenException if the snapshot of a relevance key has already been released
     */
    public ScanResult scan(final String operation, final Query query, final SortMode mode,
                           final @Nullable SortKey after, final int limit)
            throws StorageException, InvalidPageTokenException {
        if (mode.needsScores() && after != null) {
            return scanSnapshot(operation, query, mode, after, limit);
        }
        return queryExecutor.execute(operation, () -> {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final long snapshot = mode.needsScores() ? snapshots.record(searcher) : SortKey.NO_SNAPSHOT;
                return collectPage(searcher, query, mode, after, limit, snapshot);
            } catch (final AlreadyClosedException e) {
                throw new IOException("Index is closed", e);
            } finally {
                searcherManager.release(searcher);
            }
        });
    }

    private ScanResult scanSnapshot(final String operation, final Query query, final SortMode mode,
                                    final SortKey after, final int limit)
            throws StorageException, InvalidPageTokenException {
        final ScanResult result = queryExecutor.execute(operation, () -> {
            final IndexSearcher searcher;
            try {
                searcher = snapshots.acquire(after.snapshot());
            } catch (final AlreadyClosedException e) {
                throw new IOException("Index is closed", e);
            }
            if (searcher == null) {
                return null;
            }
            try {
                return collectPage(searcher, query, mode, after, limit, after.snapshot());
            } finally {
                snapshots.release(searcher);
            }
        });
        if (result == null) {
            throw new InvalidPageTokenException("Page token has expired, restart pagination without a token");
        }
        return result;
    }

    private ScanResult collectPage(final IndexSearcher searcher, final Query query, final SortMode mode,
                                   final @Nullable SortKey after, final int limit, final long snapshot)
            throws IOException {
        final int maxDoc = searcher.getIndexReader().maxDoc();
        if (maxDoc == 0) {
            return new ScanResult(List.of(), 0);
        }
        // Any valid doc id works as the marker, the id sort field makes every key unique
        final FieldDoc afterDoc = after != null ? after.toFieldDoc(maxDoc - 1) : null;
        final TopFieldDocs topDocs = searcher.searchAfter(afterDoc, query, limit, mode.sort(), mode.needsScores());
        final long totalMatches = searcher.count(query);

        final StoredFields storedFields = searcher.storedFields();
        final List<Hit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
            final FieldDoc fieldDoc = (FieldDoc) scoreDoc;
            final Vehicle vehicle = mapper.toVehicle(storedFields.document(fieldDoc.doc));
            hits.add(new Hit(vehicle, SortKey.fromFieldDoc(mode, fieldDoc, snapshot)));
        }
        return new ScanResult(hits, totalMatches);
    }

    /**
     * Drops recorded relevance snapshots that {@code pruner} selects, as the background refresh
     * does by age.
     */
    void pruneSnapshots(final SearcherLifetimeManager.Pruner pruner) throws IOException {
        snapshots.prune(pruner);
    }

    /**
     * Collects the documents matching {@code query} and hands them to {@code aggregation}
     * together with the searcher they belong to.
     */
    public <T> T aggregate(final String operation, final Query query, final MatchAggregation<T> aggregation)
            throws StorageException {
        return queryExecutor.execute(operation, () -> {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final FacetsCollector matches = searcher.search(query, new FacetsCollectorManager());
                return aggregation.aggregate(searcher, matches);
            } catch (final AlreadyClosedException e) {
                throw new IOException("Index is closed", e);
            } finally {
                searcherManager.release(searcher);
            }
        });
    }

    public VehicleDocumentMapper getMapper() {
        return mapper;
    }
}
