package de.mirkosertic.mcp.vehiclesearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the MCP Vehicle Search Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpvehicles/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "INVENTORY_INDEX_PATH";
    private static final String ENV_SEED_ENABLED = "INVENTORY_SEED_ENABLED";
    private static final String ENV_PAGE_TOKEN_SECRET = "INVENTORY_PAGE_TOKEN_SECRET";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcpvehicles";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Index settings
    private String indexPath;
    private long nrtRefreshIntervalMs = 100;

    // Search settings
    private int defaultPageSize = 10;
    private int maxPageSize = 50;
    private long queryTimeoutMs = 2000;
    private int workerThreads = 4;
    private String pageTokenSecret = "";
    private long relevanceSnapshotTtlSeconds = 600;

    // Facet settings
    private int maxDistinctValues = 1000;

    // Seed settings
    private boolean seedEnabled = true;
    private int seedCount = 250;
    private long seedRandomSeed = 42;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();
        config.validate();

        logger.info("Configuration loaded: indexPath={}, maxPageSize={}, queryTimeoutMs={}, seedEnabled={}, deployedMode={}",
                config.indexPath, config.maxPageSize, config.queryTimeoutMs, config.seedEnabled, config.deployedMode);

        return config;
    }

    /**
     * Build a configuration from an already parsed YAML tree, without consulting
     * the classpath, the user config file or the environment.
     */
    public static ApplicationConfig fromYaml(final Map<String, Object> yaml) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(yaml);
        config.validate();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> inventoryConfig = (Map<String, Object>) config.get("inventory");
        if (inventoryConfig == null) {
            return;
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) inventoryConfig.get("index");
        if (indexConfig != null) {
            final Object path = indexConfig.get("path");
            if (path != null) {
                this.indexPath = resolveVariables(path.toString());
            }
            if (indexConfig.containsKey("nrt-refresh-interval-ms")) {
                this.nrtRefreshIntervalMs = ((Number) indexConfig.get("nrt-refresh-interval-ms")).longValue();
            }
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) inventoryConfig.get("search");
        if (searchConfig != null) {
            applySearchConfig(searchConfig);
        }

        final Map<String, Object> facetConfig = (Map<String, Object>) inventoryConfig.get("facets");
        if (facetConfig != null && facetConfig.containsKey("max-distinct-values")) {
            this.maxDistinctValues = ((Number) facetConfig.get("max-distinct-values")).intValue();
        }

        final Map<String, Object> seedConfig = (Map<String, Object>) inventoryConfig.get("seed");
        if (seedConfig != null) {
            if (seedConfig.containsKey("enabled")) {
                this.seedEnabled = (Boolean) seedConfig.get("enabled");
            }
            if (seedConfig.containsKey("count")) {
                this.seedCount = ((Number) seedConfig.get("count")).intValue();
            }
            if (seedConfig.containsKey("random-seed")) {
                this.seedRandomSeed = ((Number) seedConfig.get("random-seed")).longValue();
            }
        }
    }

    private void applySearchConfig(final Map<String, Object> searchConfig) {
        if (searchConfig.containsKey("default-page-size")) {
            this.defaultPageSize = ((Number) searchConfig.get("default-page-size")).intValue();
        }
        if (searchConfig.containsKey("max-page-size")) {
            this.maxPageSize = ((Number) searchConfig.get("max-page-size")).intValue();
        }
        if (searchConfig.containsKey("query-timeout-ms")) {
            this.queryTimeoutMs = ((Number) searchConfig.get("query-timeout-ms")).longValue();
        }
        if (searchConfig.containsKey("worker-threads")) {
            this.workerThreads = ((Number) searchConfig.get("worker-threads")).intValue();
        }
        if (searchConfig.containsKey("relevance-snapshot-ttl-seconds")) {
            this.relevanceSnapshotTtlSeconds = ((Number) searchConfig.get("relevance-snapshot-ttl-seconds")).longValue();
        }
        final Object secret = searchConfig.get("page-token-secret");
        if (secret != null) {
            this.pageTokenSecret = resolveVariables(secret.toString());
        }
    }

    private void applyEnvironmentOverrides() {
        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "vehicleindex").toString();
        }

        final String envSeed = System.getenv(ENV_SEED_ENABLED);
        if (envSeed != null && !envSeed.trim().isEmpty()) {
            this.seedEnabled = Boolean.parseBoolean(envSeed.trim());
        }

        final String envSecret = System.getenv(ENV_PAGE_TOKEN_SECRET);
        if (envSecret != null && !envSecret.isEmpty()) {
            this.pageTokenSecret = envSecret;
        }

        final String propIndexPath = System.getProperty("inventory.index.path");
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    private void validate() {
        if (defaultPageSize < 1 || maxPageSize < 1) {
            throw new IllegalStateException("Page sizes must be positive: default-page-size=" + defaultPageSize
                    + ", max-page-size=" + maxPageSize);
        }
        if (defaultPageSize > maxPageSize) {
            logger.warn("default-page-size {} exceeds max-page-size {}, clamping", defaultPageSize, maxPageSize);
            defaultPageSize = maxPageSize;
        }
        if (queryTimeoutMs <= 0 || workerThreads < 1) {
            throw new IllegalStateException("query-timeout-ms and worker-threads must be positive");
        }
        if (relevanceSnapshotTtlSeconds < 1) {
            throw new IllegalStateException("relevance-snapshot-ttl-seconds must be positive");
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public String getIndexPath() {
        return indexPath;
    }

    public long getNrtRefreshIntervalMs() {
        return nrtRefreshIntervalMs;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public long getQueryTimeoutMs() {
        return queryTimeoutMs;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * How long a relevance-ordered search keeps its index snapshot for follow-up pages.
     */
    public long getRelevanceSnapshotTtlSeconds() {
        return relevanceSnapshotTtlSeconds;
    }

    public String getPageTokenSecret() {
        return pageTokenSecret;
    }

    public int getMaxDistinctValues() {
        return maxDistinctValues;
    }

    public boolean isSeedEnabled() {
        return seedEnabled;
    }

    public int getSeedCount() {
        return seedCount;
    }

    public long getSeedRandomSeed() {
        return seedRandomSeed;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
