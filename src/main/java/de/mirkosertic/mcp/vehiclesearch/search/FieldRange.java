package de.mirkosertic.mcp.vehiclesearch.search;

import org.jspecify.annotations.Nullable;

/**
 * Extrema of a numeric attribute, or the "no data" sentinel for an empty store.
 */
public record FieldRange(@Nullable Number min, @Nullable Number max, boolean empty) {

    public static FieldRange of(final Number min, final Number max) {
        return new FieldRange(min, max, false);
    }

    public static FieldRange noData() {
        return new FieldRange(null, null, true);
    }
}
