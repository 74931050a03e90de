package de.mirkosertic.mcp.vehiclesearch.gateway;

import de.mirkosertic.mcp.vehiclesearch.error.InventoryException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.SearchRecordsRequest;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.SearchRecordsResponse;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.VehicleDto;
import de.mirkosertic.mcp.vehiclesearch.search.FilterModelBuilder;
import de.mirkosertic.mcp.vehiclesearch.search.QueryComposer;
import de.mirkosertic.mcp.vehiclesearch.search.SearchArguments;
import de.mirkosertic.mcp.vehiclesearch.search.SearchPage;

import java.util.Map;

public class SearchRecordsOperation implements ToolOperation<SearchArguments> {

    public static final String NAME = "search_records";

    private static final String DESCRIPTION = """
            Search the vehicle inventory. All criteria are optional and combined with AND; \
            omit a criterion instead of sending an empty value. \
            Without freeText, results are ordered by manufacture year (newest first), then price (lowest first). \
            With freeText, results are ordered by relevance, then by most recently added. \
            Text criteria ignore case and accents. Any min greater than its max is rejected. \
            Use list_distinct and get_range first to learn which values exist. \
            Returns: records, totalMatches and, if more records exist, a nextPageToken to pass back unchanged \
            together with the same criteria.""";

    private final FilterModelBuilder filterModelBuilder;
    private final QueryComposer queryComposer;

    public SearchRecordsOperation(final FilterModelBuilder filterModelBuilder, final QueryComposer queryComposer) {
        this.filterModelBuilder = filterModelBuilder;
        this.queryComposer = queryComposer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    @Override
    public Class<? extends Record> argumentSchema() {
        return SearchRecordsRequest.class;
    }

    @Override
    public SearchArguments parseArguments(final Map<String, Object> arguments) throws ValidationException {
        return filterModelBuilder.buildSearchArguments(arguments);
    }

    @Override
    public Object execute(final SearchArguments arguments) throws InventoryException {
        final SearchPage page = queryComposer.search(arguments);
        return new SearchRecordsResponse(
                page.records().stream().map(VehicleDto::from).toList(),
                page.nextPageToken(),
                page.totalMatches(),
                page.pageSize());
    }
}
