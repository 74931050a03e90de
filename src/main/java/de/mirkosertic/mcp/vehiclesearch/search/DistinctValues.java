package de.mirkosertic.mcp.vehiclesearch.search;

import java.util.List;

/**
 * Distinct values of one attribute. {@code truncated} is set when more values exist than the
 * configured limit allows to return.
 */
public record DistinctValues(List<Object> values, boolean truncated) {

    public DistinctValues {
        values = List.copyOf(values);
    }
}
