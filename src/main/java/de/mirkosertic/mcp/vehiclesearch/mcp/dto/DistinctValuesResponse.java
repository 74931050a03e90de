package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import java.util.List;

public record DistinctValuesResponse(
        String field,
        List<Object> values,
        boolean truncated
) {
}
