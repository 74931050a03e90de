package de.mirkosertic.mcp.vehiclesearch.search;

import org.jspecify.annotations.Nullable;

/**
 * Inclusive bounds on an indexed long, either side optional. Values are in index units,
 * i.e. cents for prices and tenths of a litre for engine sizes.
 */
public record LongRange(@Nullable Long min, @Nullable Long max) {

    public LongRange {
        if (min == null && max == null) {
            throw new IllegalArgumentException("A range needs at least one bound");
        }
    }

    public long lower() {
        return min != null ? min : Long.MIN_VALUE;
    }

    public long upper() {
        return max != null ? max : Long.MAX_VALUE;
    }
}
