package de.mirkosertic.mcp.vehiclesearch.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed payload of a page token: the sort key of the last record on the previous page, the
 * index snapshot it was read from, and the fingerprint of the filter it was issued for.
 */
record PageToken(
        @JsonProperty("v") int version,
        @JsonProperty("m") String mode,
        @JsonProperty("p") long primary,
        @JsonProperty("s") long secondary,
        @JsonProperty("id") String id,
        @JsonProperty("r") long snapshot,
        @JsonProperty("f") String filterFingerprint
) {
}
