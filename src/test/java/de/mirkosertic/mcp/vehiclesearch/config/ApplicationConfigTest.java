package de.mirkosertic.mcp.vehiclesearch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig")
class ApplicationConfigTest {

    @Nested
    @DisplayName("YAML parsing")
    class YamlParsing {

        @Test
        @DisplayName("Should apply all inventory sections")
        void shouldApplyAllSections() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(Map.of("inventory", Map.of(
                    "index", Map.of("path", "/tmp/vehicles", "nrt-refresh-interval-ms", 250),
                    "search", Map.of(
                            "default-page-size", 5,
                            "max-page-size", 20,
                            "query-timeout-ms", 1500,
                            "worker-threads", 3,
                            "relevance-snapshot-ttl-seconds", 120,
                            "page-token-secret", "s3cret"),
                    "facets", Map.of("max-distinct-values", 77),
                    "seed", Map.of("enabled", false, "count", 12, "random-seed", 7))));

            assertThat(config.getIndexPath()).isEqualTo("/tmp/vehicles");
            assertThat(config.getNrtRefreshIntervalMs()).isEqualTo(250L);
            assertThat(config.getDefaultPageSize()).isEqualTo(5);
            assertThat(config.getMaxPageSize()).isEqualTo(20);
            assertThat(config.getQueryTimeoutMs()).isEqualTo(1500L);
            assertThat(config.getWorkerThreads()).isEqualTo(3);
            assertThat(config.getRelevanceSnapshotTtlSeconds()).isEqualTo(120L);
            assertThat(config.getPageTokenSecret()).isEqualTo("s3cret");
            assertThat(config.getMaxDistinctValues()).isEqualTo(77);
            assertThat(config.isSeedEnabled()).isFalse();
            assertThat(config.getSeedCount()).isEqualTo(12);
            assertThat(config.getSeedRandomSeed()).isEqualTo(7L);
        }

        @Test
        @DisplayName("Should keep defaults for missing sections")
        void shouldKeepDefaults() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(Map.of());

            assertThat(config.getDefaultPageSize()).isEqualTo(10);
            assertThat(config.getMaxPageSize()).isEqualTo(50);
            assertThat(config.getQueryTimeoutMs()).isEqualTo(2000L);
            assertThat(config.getRelevanceSnapshotTtlSeconds()).isEqualTo(600L);
            assertThat(config.isSeedEnabled()).isTrue();
            assertThat(config.getSeedCount()).isEqualTo(250);
        }

        @Test
        @DisplayName("Should resolve placeholders with defaults")
        void shouldResolvePlaceholders() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(Map.of("inventory", Map.of(
                    "index", Map.of("path", "${INVENTORY_TEST_UNSET_VARIABLE:/fallback}/index"))));

            assertThat(config.getIndexPath()).isEqualTo("/fallback/index");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should clamp default page size to the maximum")
        void shouldClampDefaultPageSize() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(Map.of("inventory", Map.of(
                    "search", Map.of("default-page-size", 80, "max-page-size", 50))));

            assertThat(config.getDefaultPageSize()).isEqualTo(50);
        }

        @Test
        @DisplayName("Should reject non-positive page sizes")
        void shouldRejectNonPositivePageSize() {
            assertThatThrownBy(() -> ApplicationConfig.fromYaml(Map.of("inventory", Map.of(
                    "search", Map.of("max-page-size", 0)))))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Page sizes must be positive");
        }

        @Test
        @DisplayName("Should reject a non-positive query timeout")
        void shouldRejectNonPositiveTimeout() {
            assertThatThrownBy(() -> ApplicationConfig.fromYaml(Map.of("inventory", Map.of(
                    "search", Map.of("query-timeout-ms", 0)))))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("Classpath defaults should match application.yaml")
    void shouldLoadClasspathDefaults() {
        final ApplicationConfig config = ApplicationConfig.load();

        assertThat(config.getIndexPath()).isNotBlank();
        assertThat(config.getMaxPageSize()).isEqualTo(50);
        assertThat(config.getDefaultPageSize()).isEqualTo(10);
    }
}
