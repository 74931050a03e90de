package de.mirkosertic.mcp.vehiclesearch.gateway;

import de.mirkosertic.mcp.vehiclesearch.TestInventory;
import de.mirkosertic.mcp.vehiclesearch.error.ErrorCode;
import de.mirkosertic.mcp.vehiclesearch.error.StorageException;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.DistinctValuesResponse;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.RangeResponse;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.SearchRecordsResponse;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.VehicleDto;
import de.mirkosertic.mcp.vehiclesearch.search.FacetResolver;
import de.mirkosertic.mcp.vehiclesearch.search.FilterModelBuilder;
import de.mirkosertic.mcp.vehiclesearch.search.QueryComposer;
import de.mirkosertic.mcp.vehiclesearch.search.SearchArguments;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static de.mirkosertic.mcp.vehiclesearch.TestVehicles.vehicle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ToolGateway")
class ToolGatewayTest {

    @TempDir
    Path tempDir;

    private TestInventory inventory;
    private ToolGateway gateway;

    @BeforeEach
    void setUp() throws Exception {
        inventory = TestInventory.open(tempDir.resolve("index"));
        final FilterModelBuilder filterModelBuilder = new FilterModelBuilder(inventory.foldingAnalyzer);
        final QueryComposer queryComposer = new QueryComposer(inventory.config, inventory.indexService, inventory.pageTokenCodec);
        final FacetResolver facetResolver = new FacetResolver(inventory.config, inventory.indexService);
        gateway = new ToolGateway(List.of(
                new SearchRecordsOperation(filterModelBuilder, queryComposer),
                new ListDistinctOperation(filterModelBuilder, facetResolver),
                new GetRangeOperation(facetResolver)), inventory.objectMapper);

        inventory.add(
                vehicle("gol").brand("Volkswagen").model("Gol").year(2021).price("62000.00").build(),
                vehicle("polo").brand("Volkswagen").model("Polo").year(2023).price("98000.00").build(),
                vehicle("argo").brand("Fiat").model("Argo").year(2020).price("58000.00").build());
    }

    @AfterEach
    void tearDown() throws Exception {
        inventory.close();
    }

    private static void assertError(final CallResponse response, final ErrorCode code) {
        assertThat(response.failed()).isTrue();
        assertThat(response.result()).isNull();
        assertThat(response.error()).isNotNull();
        assertThat(response.error().code()).isEqualTo(code);
        assertThat(response.error().retryable()).isEqualTo(code.isRetryable());
    }

    @Test
    @DisplayName("operations are published in registration order")
    void operationNames() {
        assertThat(gateway.operations()).extracting(ToolOperation::name)
                .containsExactly("search_records", "list_distinct", "get_range");
    }

    @Test
    @DisplayName("duplicate operation names are refused")
    void duplicateOperations() {
        final GetRangeOperation operation = new GetRangeOperation(mock(FacetResolver.class));

        assertThatThrownBy(() -> new ToolGateway(List.of(operation, operation), inventory.objectMapper))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("search_records")
    class SearchRecords {

        @Test
        void returnsMatchingRecords() {
            final CallResponse response = gateway.call(new CallRequest("search_records",
                    Map.of("identityFilters", Map.of("brand", "volkswagen"), "priceMax", 80000)));

            assertThat(response.failed()).isFalse();
            final SearchRecordsResponse result = (SearchRecordsResponse) response.result();
            assertThat(result.records()).extracting(VehicleDto::id).containsExactly("gol");
            assertThat(result.totalMatches()).isEqualTo(1);
            assertThat(result.nextPageToken()).isNull();
        }

        @Test
        void nullArgumentsMeanNoConstraints() {
            final CallResponse response = gateway.call(new CallRequest("search_records", null));

            final SearchRecordsResponse result = (SearchRecordsResponse) response.result();
            assertThat(result.records()).extracting(VehicleDto::id).containsExactly("polo", "gol", "argo");
        }

        @Test
        void unknownArgumentIsInvalid() {
            final CallResponse response = gateway.call(new CallRequest("search_records", Map.of("make", "Fiat")));

            assertError(response, ErrorCode.INVALID_ARGUMENT);
            assertThat(response.error().message()).contains("make");
        }

        @Test
        void invertedRangeIsInvalid() {
            assertError(gateway.call(new CallRequest("search_records", Map.of("yearMin", 2023, "yearMax", 2020))),
                    ErrorCode.INVALID_ARGUMENT);
        }

        @Test
        void badTokenIsInvalidPageToken() {
            assertError(gateway.call(new CallRequest("search_records", Map.of("pageToken", "bogus"))),
                    ErrorCode.INVALID_PAGE_TOKEN);
        }
    }

    @Nested
    @DisplayName("list_distinct and get_range")
    class Facets {

        @Test
        void listsModelsOfBrand() {
            final CallResponse response = gateway.call(new CallRequest("list_distinct",
                    Map.of("field", "model", "brand", "VOLKSWAGEN")));

            final DistinctValuesResponse result = (DistinctValuesResponse) response.result();
            assertThat(result.field()).isEqualTo("model");
            assertThat(result.values()).containsExactly("Gol", "Polo");
            assertThat(result.truncated()).isFalse();
        }

        @Test
        void fieldNameIsCaseInsensitive() {
            final CallResponse response = gateway.call(new CallRequest("list_distinct", Map.of("field", "Brand")));

            assertThat(((DistinctValuesResponse) response.result()).values()).containsExactly("Fiat", "Volkswagen");
        }

        @Test
        void missingFieldIsInvalid() {
            final CallResponse response = gateway.call(new CallRequest("list_distinct", Map.of()));

            assertError(response, ErrorCode.INVALID_ARGUMENT);
            assertThat(response.error().message()).isEqualTo("'field' is required");
        }

        @Test
        void unsupportedFieldIsInvalid() {
            assertError(gateway.call(new CallRequest("list_distinct", Map.of("field", "price"))), ErrorCode.INVALID_ARGUMENT);
            assertError(gateway.call(new CallRequest("get_range", Map.of("field", "brand"))), ErrorCode.INVALID_ARGUMENT);
        }

        @Test
        void rangeOfPrice() {
            final CallResponse response = gateway.call(new CallRequest("get_range", Map.of("field", "price")));

            final RangeResponse result = (RangeResponse) response.result();
            assertThat(result.min()).isEqualTo(new BigDecimal("58000.00"));
            assertThat(result.max()).isEqualTo(new BigDecimal("98000.00"));
            assertThat(result.empty()).isNull();
        }
    }

    @Nested
    @DisplayName("Envelope handling")
    class Envelope {

        @Test
        void unknownOperation() {
            final CallResponse response = gateway.call(new CallRequest("delete_everything", Map.of()));

            assertError(response, ErrorCode.UNKNOWN_OPERATION);
            assertThat(response.error().message())
                    .isEqualTo("Unknown operation 'delete_everything'. Available: search_records, list_distinct, get_range");
        }

        @Test
        void jsonEnvelopeIsDispatched() {
            final CallResponse response = gateway.callJson(
                    "{\"operation\":\"get_range\",\"arguments\":{\"field\":\"year\"}}");

            final RangeResponse result = (RangeResponse) response.result();
            assertThat(result.min()).isEqualTo(2020L);
            assertThat(result.max()).isEqualTo(2023L);
        }

        @Test
        void jsonArgumentsMayBeOmittedOrNull() {
            assertThat(gateway.callJson("{\"operation\":\"search_records\"}").failed()).isFalse();
            assertThat(gateway.callJson("{\"operation\":\"search_records\",\"arguments\":null}").failed()).isFalse();
        }

        @Test
        void malformedJsonIsInvalid() {
            assertError(gateway.callJson("{\"operation\":"), ErrorCode.INVALID_ARGUMENT);
            assertError(gateway.callJson("[1,2]"), ErrorCode.INVALID_ARGUMENT);
        }

        @Test
        void envelopeShapeIsChecked() {
            assertError(gateway.callJson("{\"operation\":42}"), ErrorCode.INVALID_ARGUMENT);
            assertError(gateway.callJson("{\"operation\":\"search_records\",\"arguments\":[]}"), ErrorCode.INVALID_ARGUMENT);
            assertError(gateway.callJson("{\"operation\":\"search_records\",\"extra\":1}"), ErrorCode.INVALID_ARGUMENT);
        }

        @Test
        void unknownOperationViaJson() {
            assertError(gateway.callJson("{\"operation\":\"nope\"}"), ErrorCode.UNKNOWN_OPERATION);
        }
    }

    @Nested
    @DisplayName("Storage failures")
    class StorageFailures {

        private final QueryComposer failingComposer = mock(QueryComposer.class);
        private ToolGateway failingGateway;

        @BeforeEach
        void setUp() {
            failingGateway = new ToolGateway(List.of(
                    new SearchRecordsOperation(new FilterModelBuilder(inventory.foldingAnalyzer), failingComposer)),
                    inventory.objectMapper);
        }

        @Test
        void unavailableStoreIsRetryable() throws Exception {
            when(failingComposer.search(any(SearchArguments.class)))
                    .thenThrow(StorageException.unavailable("search_records", new IOException("connection reset")));

            final CallResponse response = failingGateway.call(new CallRequest("search_records", Map.of()));

            assertError(response, ErrorCode.STORAGE_UNAVAILABLE);
            assertThat(response.error().retryable()).isTrue();
            assertThat(response.error().message()).doesNotContain("connection reset");
        }

        @Test
        void timeoutIsRetryable() throws Exception {
            when(failingComposer.search(any(SearchArguments.class)))
                    .thenThrow(StorageException.timeout("search_records", 5000, new TimeoutException()));

            assertError(failingGateway.call(new CallRequest("search_records", Map.of())), ErrorCode.TIMEOUT);
        }

        @Test
        void unexpectedFailureDoesNotLeakDetails() throws Exception {
            when(failingComposer.search(any(SearchArguments.class)))
                    .thenThrow(new IllegalStateException("index file _3.cfs corrupt"));

            final CallResponse response = failingGateway.call(new CallRequest("search_records", Map.of()));

            assertError(response, ErrorCode.STORAGE_UNAVAILABLE);
            assertThat(response.error().message()).doesNotContain("_3.cfs");
        }

        @Test
        void invalidArgumentsNeverReachStorage() throws Exception {
            final CallResponse response = failingGateway.call(new CallRequest("search_records", Map.of("yearMin", "2020")));

            assertError(response, ErrorCode.INVALID_ARGUMENT);
            verify(failingComposer, never()).search(any(SearchArguments.class));
        }
    }
}
