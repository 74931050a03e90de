package de.mirkosertic.mcp.vehiclesearch.gateway;

import de.mirkosertic.mcp.vehiclesearch.error.InventoryException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.GetRangeRequest;
import de.mirkosertic.mcp.vehiclesearch.mcp.dto.RangeResponse;
import de.mirkosertic.mcp.vehiclesearch.model.VehicleField;
import de.mirkosertic.mcp.vehiclesearch.search.ArgumentChecks;
import de.mirkosertic.mcp.vehiclesearch.search.FacetResolver;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class GetRangeOperation implements ToolOperation<VehicleField> {

    public static final String NAME = "get_range";

    static final String FIELD = "field";

    private static final String DESCRIPTION = """
            Return the minimum and maximum value currently present for a numeric vehicle attribute \
            (year, model_year, engine_size, price, mileage). Returns {empty: true} when the inventory is empty. \
            Use it to propose realistic bounds for search_records.""";

    private final FacetResolver facetResolver;

    public GetRangeOperation(final FacetResolver facetResolver) {
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
        return GetRangeRequest.class;
    }

    @Override
    public VehicleField parseArguments(final Map<String, Object> arguments) throws ValidationException {
        ArgumentChecks.rejectUnknownKeys(arguments, Set.of(FIELD), "");
        final String name = ArgumentChecks.requiredText(arguments, FIELD);
        final VehicleField field = VehicleField.fromWireName(name.toLowerCase(Locale.ROOT));
        if (field == null || !field.isRangeSupported()) {
            throw new ValidationException("Unknown field '" + name + "' for " + NAME + ". Supported: "
                    + String.join(", ", VehicleField.rangeWireNames()));
        }
        return field;
    }

    @Override
    public Object execute(final VehicleField field) throws InventoryException {
        return RangeResponse.from(field.wireName(), facetResolver.getRange(field));
    }
}
