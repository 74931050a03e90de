package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import de.mirkosertic.mcp.vehiclesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record IdentityFilters(
        @Nullable
        @Description("Brand name(s). A single string is accepted too. Matching ignores case and accents.")
        List<String> brand,

        @Nullable
        @Description("Model name(s). A single string is accepted too. Matching ignores case and accents.")
        List<String> model
) {
}
