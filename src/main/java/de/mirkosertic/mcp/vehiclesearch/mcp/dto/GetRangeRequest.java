package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import de.mirkosertic.mcp.vehiclesearch.mcp.Choices;
import de.mirkosertic.mcp.vehiclesearch.mcp.Description;

public record GetRangeRequest(
        @Description("The numeric attribute whose minimum and maximum are returned.")
        @Choices({"year", "model_year", "engine_size", "price", "mileage"})
        String field
) {
}
