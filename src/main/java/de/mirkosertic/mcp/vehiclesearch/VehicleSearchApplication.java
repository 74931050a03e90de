package de.mirkosertic.mcp.vehiclesearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.vehiclesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vehiclesearch.config.BuildInfo;
import de.mirkosertic.mcp.vehiclesearch.config.LoggingConfigurator;
import de.mirkosertic.mcp.vehiclesearch.error.ConstraintViolationException;
import de.mirkosertic.mcp.vehiclesearch.gateway.GetRangeOperation;
import de.mirkosertic.mcp.vehiclesearch.gateway.ListDistinctOperation;
import de.mirkosertic.mcp.vehiclesearch.gateway.SearchRecordsOperation;
import de.mirkosertic.mcp.vehiclesearch.gateway.ToolGateway;
import de.mirkosertic.mcp.vehiclesearch.index.QueryExecutor;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleConstraints;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleDocumentMapper;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleIndexService;
import de.mirkosertic.mcp.vehiclesearch.search.FacetResolver;
import de.mirkosertic.mcp.vehiclesearch.search.FilterModelBuilder;
import de.mirkosertic.mcp.vehiclesearch.search.PageTokenCodec;
import de.mirkosertic.mcp.vehiclesearch.search.QueryComposer;
import de.mirkosertic.mcp.vehiclesearch.seed.InventorySeeder;
import de.mirkosertic.mcp.vehiclesearch.seed.SyntheticInventoryGenerator;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point for the MCP Vehicle Search Server.
 * Initializes all services and starts the MCP server using STDIO transport.
 */
public class VehicleSearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(VehicleSearchApplication.class);

    private final QueryExecutor queryExecutor;
    private final VehicleIndexService indexService;
    private final InventorySeeder seeder;
    private final VehicleSearchTools searchTools;
    private McpSyncServer mcpServer;

    public VehicleSearchApplication(final ApplicationConfig config) {
        final Clock clock = Clock.systemUTC();
        final ObjectMapper objectMapper = new ObjectMapper();
        final KeywordFoldingAnalyzer foldingAnalyzer = new KeywordFoldingAnalyzer();

        // Initialize services in dependency order
        this.queryExecutor = new QueryExecutor(config);
        this.indexService = new VehicleIndexService(
                config,
                new VehicleDocumentMapper(foldingAnalyzer),
                new VehicleConstraints(clock),
                queryExecutor
        );

        this.seeder = new InventorySeeder(
                config,
                indexService,
                new SyntheticInventoryGenerator(config.getSeedRandomSeed(), clock)
        );

        final FilterModelBuilder filterModelBuilder = new FilterModelBuilder(foldingAnalyzer);
        final QueryComposer queryComposer = new QueryComposer(config, indexService, new PageTokenCodec(config, objectMapper));
        final FacetResolver facetResolver = new FacetResolver(config, indexService);

        final ToolGateway gateway = new ToolGateway(List.of(
                new SearchRecordsOperation(filterModelBuilder, queryComposer),
                new ListDistinctOperation(filterModelBuilder, facetResolver),
                new GetRangeOperation(facetResolver)
        ), objectMapper);

        this.searchTools = new VehicleSearchTools(gateway);
    }

    /**
     * Initialize all services.
     */
    public void init() throws IOException, ConstraintViolationException {
        logger.info("Initializing MCP Vehicle Search Server...");

        indexService.init();
        seeder.seedIfNeeded();

        logger.info("All services initialized successfully, inventory holds {} vehicles", indexService.getDocumentCount());
    }

    /**
     * Start the MCP server.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Vehicle Search Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(searchTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // Block main thread - the STDIO transport handles communication
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down MCP Vehicle Search Server...");

        // Shutdown in reverse order of initialization
        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            queryExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down query executor", e);
        }

        try {
            indexService.close();
        } catch (final Exception e) {
            logger.error("Error closing index service", e);
        }

        logger.info("MCP Vehicle Search Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("spring.profiles.active"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}", config.getIndexPath());
            }

            final VehicleSearchApplication app = new VehicleSearchApplication(config);
            app.init();
            app.start();

            logger.info("MCP Vehicle Search Server finished.");

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP Vehicle Search Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
