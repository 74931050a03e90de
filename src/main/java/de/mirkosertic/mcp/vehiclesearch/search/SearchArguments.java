package de.mirkosertic.mcp.vehiclesearch.search;

import org.jspecify.annotations.Nullable;

/**
 * Validated arguments of one {@code search_records} call: the filter plus paging input.
 */
public record SearchArguments(VehicleFilter filter, @Nullable String pageToken, @Nullable Integer pageSize) {
}
