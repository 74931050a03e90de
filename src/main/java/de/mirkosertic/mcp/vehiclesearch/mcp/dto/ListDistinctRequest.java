package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import de.mirkosertic.mcp.vehiclesearch.mcp.Choices;
import de.mirkosertic.mcp.vehiclesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record ListDistinctRequest(
        @Description("The attribute whose distinct values are listed.")
        @Choices({"brand", "model", "fuel_type", "color", "transmission", "year", "model_year", "engine_size", "doors"})
        String field,

        @Nullable
        @Description("Only consider vehicles of these brand(s), e.g. to list the models of a brand. A single string is accepted too.")
        List<String> brand
) {
}
