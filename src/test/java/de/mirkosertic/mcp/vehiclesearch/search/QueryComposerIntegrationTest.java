package de.mirkosertic.mcp.vehiclesearch.search;

import de.mirkosertic.mcp.vehiclesearch.TestInventory;
import de.mirkosertic.mcp.vehiclesearch.error.InvalidPageTokenException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static de.mirkosertic.mcp.vehiclesearch.TestVehicles.NOW;
import static de.mirkosertic.mcp.vehiclesearch.TestVehicles.vehicle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs composed queries against a real index in a temporary directory.
 */
@DisplayName("QueryComposer against a real index")
class QueryComposerIntegrationTest {

    @TempDir
    Path tempDir;

    private TestInventory inventory;
    private FilterModelBuilder filterModelBuilder;
    private QueryComposer composer;

    @BeforeEach
    void setUp() throws Exception {
        inventory = TestInventory.open(tempDir.resolve("index"));
        filterModelBuilder = new FilterModelBuilder(inventory.foldingAnalyzer);
        composer = new QueryComposer(inventory.config, inventory.indexService, inventory.pageTokenCodec);
    }

    @AfterEach
    void tearDown() throws Exception {
        inventory.close();
    }

    private SearchPage search(final Object... keyValues) throws Exception {
        final Map<String, Object> args = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            args.put((String) keyValues[i], keyValues[i + 1]);
        }
        return composer.search(filterModelBuilder.buildSearchArguments(args));
    }

    private static List<String> ids(final SearchPage page) {
        return page.records().stream().map(Vehicle::id).toList();
    }

    @Test
    @DisplayName("an empty store returns an empty last page")
    void emptyStore() throws Exception {
        final SearchPage page = search();

        assertThat(page.records()).isEmpty();
        assertThat(page.nextPageToken()).isNull();
        assertThat(page.totalMatches()).isZero();
    }

    @Test
    @DisplayName("no constraints compose to a match-all query")
    void unconstrainedQuery() {
        assertThat(composer.composeQuery(VehicleFilter.unconstrained())).isInstanceOf(MatchAllDocsQuery.class);
    }

    @Nested
    @DisplayName("Filters")
    class Filters {

        @BeforeEach
        void seed() throws Exception {
            inventory.add(
                    vehicle("gol").brand("Volkswagen").model("Gol").year(2021).price("62000.00").color("Prata").build(),
                    vehicle("polo").brand("Volkswagen").model("Polo").year(2023).price("98000.00").color("Branco")
                            .transmission("Automática").engineSize("1.6").doors(4).build(),
                    vehicle("uno").brand("Fiat").model("Uno").year(2015).price("28000.00").color("Vermelho")
                            .mileage(120000).doors(2).build(),
                    vehicle("toro").brand("Fiat").model("Toro").year(2022).price("145000.00").color("Preto")
                            .fuelType("Diesel").transmission("Automática").engineSize("2.0").build());
        }

        @Test
        @DisplayName("Volkswagen Gol under 80000 is found, under 50000 is not")
        void golPriceExample() throws Exception {
            final Map<String, Object> identity = Map.of("brand", "Volkswagen", "model", "Gol");

            assertThat(ids(search("identityFilters", identity, "priceMax", 80000))).containsExactly("gol");

            final SearchPage none = search("identityFilters", identity, "priceMax", 50000);
            assertThat(none.records()).isEmpty();
            assertThat(none.totalMatches()).isZero();
            assertThat(none.nextPageToken()).isNull();
        }

        @Test
        @DisplayName("identity and categorical equality ignore case and accents")
        void foldedEquality() throws Exception {
            assertThat(ids(search("identityFilters", Map.of("brand", "VÖLKSWAGEN")))).containsExactlyInAnyOrder("gol", "polo");
            assertThat(ids(search("transmission", "automatica"))).containsExactlyInAnyOrder("polo", "toro");
            assertThat(ids(search("color", List.of("preto", "VERMELHO")))).containsExactlyInAnyOrder("uno", "toro");
        }

        @Test
        @DisplayName("all constraints must hold together")
        void conjunction() throws Exception {
            assertThat(ids(search("identityFilters", Map.of("brand", "Fiat"), "yearMin", 2020))).containsExactly("toro");
            assertThat(ids(search("engineSizeMin", 1.5, "engineSizeMax", 1.6))).containsExactly("polo");
            assertThat(ids(search("doors", 2))).containsExactly("uno");
            assertThat(ids(search("mileageMin", 100000, "fuelType", "Flex"))).containsExactly("uno");
        }

        @Test
        @DisplayName("range bounds are inclusive")
        void inclusiveBounds() throws Exception {
            assertThat(ids(search("priceMin", 62000, "priceMax", 62000))).containsExactly("gol");
            assertThat(ids(search("yearMin", 2022, "yearMax", 2023))).containsExactly("polo", "toro");
        }

        @Test
        @DisplayName("results follow the default order: newest year, then cheapest, then id")
        void defaultOrdering() throws Exception {
            assertThat(ids(search())).containsExactly("polo", "toro", "gol", "uno");
        }

        @Test
        @DisplayName("the same call twice gives the same answer")
        void idempotent() throws Exception {
            final SearchPage first = search("identityFilters", Map.of("brand", "fiat"), "pageSize", 1);
            final SearchPage second = search("identityFilters", Map.of("brand", "fiat"), "pageSize", 1);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("free text matches words regardless of case and accents")
        void freeText() throws Exception {
            assertThat(ids(search("freeText", "FÍAT vermelho"))).containsExactly("uno");
            assertThat(ids(search("freeText", "diesel"))).containsExactly("toro");
        }

        @Test
        @DisplayName("free text made only of stop words matches nothing")
        void stopWordsOnly() throws Exception {
            final SearchPage page = search("freeText", "de");

            assertThat(page.records()).isEmpty();
            assertThat(page.totalMatches()).isZero();
        }

        @Test
        @DisplayName("free text combines with filters")
        void freeTextWithFilters() throws Exception {
            assertThat(ids(search("freeText", "volkswagen", "priceMax", 70000))).containsExactly("gol");
        }
    }

    @Nested
    @DisplayName("Relevance ordering")
    class Relevance {

        @Test
        @DisplayName("equal scores fall back to newest first")
        void tiesByCreation() throws Exception {
            inventory.add(
                    vehicle("old").createdAt(NOW.minusSeconds(86400)).build(),
                    vehicle("new").createdAt(NOW.minusSeconds(60)).build(),
                    vehicle("mid").createdAt(NOW.minusSeconds(3600)).build());

            assertThat(ids(search("freeText", "gol"))).containsExactly("new", "mid", "old");
        }

        @Test
        @DisplayName("relevance pages continue without gaps")
        void relevancePagination() throws Exception {
            for (int i = 0; i < 5; i++) {
                inventory.add(vehicle("v" + i).createdAt(NOW.minusSeconds(60L * i)).build());
            }

            final SearchPage first = search("freeText", "gol", "pageSize", 3);
            final SearchPage second = search("freeText", "gol", "pageSize", 3, "pageToken", first.nextPageToken());

            assertThat(ids(first)).containsExactly("v0", "v1", "v2");
            assertThat(ids(second)).containsExactly("v3", "v4");
            assertThat(second.nextPageToken()).isNull();
        }

        @Test
        @DisplayName("relevance pages stay complete while the inventory is written between pages")
        void relevancePaginationAcrossWrites() throws Exception {
            for (int i = 0; i < 6; i++) {
                inventory.add(vehicle("a" + i).createdAt(NOW.minusSeconds(60L * i)).build());
            }

            final SearchPage first = search("freeText", "gol", "pageSize", 3);

            final List<Vehicle> others = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                others.add(vehicle("uno-" + i).brand("Fiat").model("Uno").build());
            }
            others.add(vehicle("late-gol").createdAt(NOW.minusSeconds(30)).build());
            inventory.add(others.toArray(new Vehicle[0]));

            final List<String> walked = new ArrayList<>(ids(first));
            String token = first.nextPageToken();
            while (token != null) {
                final SearchPage page = search("freeText", "gol", "pageSize", 3, "pageToken", token);
                walked.addAll(ids(page));
                token = page.nextPageToken();
            }

            assertThat(walked).containsExactly("a0", "a1", "a2", "a3", "a4", "a5");
            assertThat(ids(search("freeText", "gol", "pageSize", 50))).contains("late-gol").hasSize(7);
        }
    }

    @Nested
    @DisplayName("Pagination")
    class Pagination {

        @BeforeEach
        void seed() throws Exception {
            final List<Vehicle> vehicles = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                vehicles.add(vehicle(String.format("id-%02d", i))
                        .year(2015 + i % 4)
                        .price((50000 + (i % 3) * 1000) + ".00")
                        .build());
            }
            inventory.add(vehicles.toArray(new Vehicle[0]));
        }

        @Test
        @DisplayName("walking every page visits every match exactly once, in order")
        void completeWalk() throws Exception {
            final List<String> walked = new ArrayList<>();
            String token = null;
            int pages = 0;
            do {
                final SearchPage page = token == null
                        ? search("pageSize", 7)
                        : search("pageSize", 7, "pageToken", token);
                assertThat(page.totalMatches()).isEqualTo(25);
                walked.addAll(ids(page));
                token = page.nextPageToken();
                pages++;
            } while (token != null);

            assertThat(pages).isEqualTo(4);
            assertThat(walked).hasSize(25).doesNotHaveDuplicates();
            assertThat(walked).isEqualTo(ids(search("pageSize", 50)));
        }

        @Test
        @DisplayName("a page exactly at the end carries no token")
        void exactLastPage() throws Exception {
            final SearchPage page = search("pageSize", 25);

            assertThat(page.records()).hasSize(25);
            assertThat(page.nextPageToken()).isNull();
        }

        @Test
        @DisplayName("page size defaults and is clamped to the maximum")
        void pageSizes() throws Exception {
            assertThat(search().pageSize()).isEqualTo(10);
            assertThat(search().records()).hasSize(10);

            final SearchPage clamped = search("pageSize", 500);
            assertThat(clamped.pageSize()).isEqualTo(50);
            assertThat(clamped.records()).hasSize(25);
        }

        @Test
        @DisplayName("page size below one is rejected")
        void invalidPageSize() {
            assertThatThrownBy(() -> composer.search(VehicleFilter.unconstrained(), null, 0))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("a garbage token is rejected")
        void garbageToken() {
            assertThatThrownBy(() -> search("pageToken", "garbage"))
                    .isInstanceOf(InvalidPageTokenException.class);
        }

        @Test
        @DisplayName("a token cannot be reused with other criteria")
        void tokenBoundToFilter() throws Exception {
            final String token = search("yearMin", 2016, "pageSize", 2).nextPageToken();
            assertThat(token).isNotNull();

            assertThatThrownBy(() -> search("yearMin", 2017, "pageSize", 2, "pageToken", token))
                    .isInstanceOf(InvalidPageTokenException.class)
                    .hasMessageContaining("different search criteria");
        }

        @Test
        @DisplayName("a token survives a change of page size")
        void tokenIndependentOfPageSize() throws Exception {
            final SearchPage first = search("pageSize", 5);
            final SearchPage rest = search("pageSize", 20, "pageToken", first.nextPageToken());

            final List<String> combined = new ArrayList<>(ids(first));
            combined.addAll(ids(rest));
            assertThat(combined).isEqualTo(ids(search("pageSize", 50)));
        }
    }
}
