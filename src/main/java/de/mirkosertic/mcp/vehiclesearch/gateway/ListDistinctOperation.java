package de.mirkosertic.mcp.vehiclesearch.gateway;

import de.mirkosertic.mcp.vehiclesearch.error.InventoryException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.DistinctValuesResponse;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.ListDistinctRequest;
import de.mirkosertic.mcp.vehiclesearch.model.VehicleField;
import de.mirkosertic.mcp.vehiclesearch.search.ArgumentChecks;
import de.mirkosertic.mcp.vehiclesearch.search.DistinctValues;
import de.mirkosertic.mcp.vehiclesearch.search.FacetResolver;
import de.mirkosertic.mcp.vehiclesearch.search.FilterModelBuilder;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class ListDistinctOperation implements ToolOperation<ListDistinctOperation.Arguments> {

    public static final String NAME = "list_distinct";

    static final String FIELD = "field";
    static final String BRAND = "brand";

    private static final String DESCRIPTION = """
            List the distinct values currently present for one vehicle attribute, e.g. all brands, \
            all fuel types, or (with the brand argument) all models of a brand. \
            Text values are sorted alphabetically, numbers ascending. \
            Call this before search_records to avoid filtering on values that do not exist.""";

    /**
     * Validated arguments: the attribute and the folded brand keys restricting the scan.
     */
    public record Arguments(VehicleField field, List<String> brandKeys) {
    }

    private final FilterModelBuilder filterModelBuilder;
    private final FacetResolver facetResolver;

    public ListDistinctOperation(final FilterModelBuilder filterModelBuilder, final FacetResolver facetResolver) {
        this.filterModelBuilder = filterModelBuilder;
        this.facetResolver = facetResolver;
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
        return ListDistinctRequest.class;
    }

    @Override
    public Arguments parseArguments(final Map<String, Object> arguments) throws ValidationException {
        ArgumentChecks.rejectUnknownKeys(arguments, Set.of(FIELD, BRAND), "");
        final String name = ArgumentChecks.requiredText(arguments, FIELD);
        final VehicleField field = VehicleField.fromWireName(name.toLowerCase(Locale.ROOT));
        if (field == null || !field.isDistinctSupported()) {
            throw new ValidationException("Unknown field '" + name + "' for " + NAME + ". Supported: "
                    + String.join(", ", VehicleField.distinctWireNames()));
        }
        final List<String> brandKeys = filterModelBuilder.foldedValues(arguments, BRAND, VehicleField.BRAND, BRAND);
        return new Arguments(field, brandKeys);
    }

    @Override
    public Object execute(final Arguments arguments) throws InventoryException {
        final DistinctValues values = facetResolver.listDistinct(arguments.field(), arguments.brandKeys());
        return new DistinctValuesResponse(arguments.field().wireName(), values.values(), values.truncated());
    }
}
