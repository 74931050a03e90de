package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import org.jspecify.annotations.Nullable;

import java.util.List;

public record SearchRecordsResponse(
        List<VehicleDto> records,
        @Nullable String nextPageToken,
        long totalMatches,
        int pageSize
) {
}
