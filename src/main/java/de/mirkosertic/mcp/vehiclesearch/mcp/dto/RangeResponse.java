package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import de.mirkosertic.mcp.vehiclesearch.search.FieldRange;
import org.jspecify.annotations.Nullable;

/**
 * Either {@code min}/{@code max} or {@code empty: true}; the unused side is omitted from JSON.
 */
public record RangeResponse(
        String field,
        @Nullable Number min,
        @Nullable Number max,
        @Nullable Boolean empty
) {
    public static RangeResponse from(final String field, final FieldRange range) {
        if (range.empty()) {
            return new RangeResponse(field, null, null, true);
        }
        return new RangeResponse(field, range.min(), range.max(), null);
    }
}
