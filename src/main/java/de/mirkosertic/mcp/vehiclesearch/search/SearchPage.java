package de.mirkosertic.mcp.vehiclesearch.search;

import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of search results. {@code nextPageToken} is absent on the last page.
 */
public record SearchPage(List<Vehicle> records, @Nullable String nextPageToken, long totalMatches, int pageSize) {
}
