package de.mirkosertic.mcp.vehiclesearch.gateway;

import java.util.Map;

/**
 * Inbound call envelope: an operation name and its untyped arguments.
 * Missing arguments are treated as an empty map.
 */
public record CallRequest(String operation, Map<String, Object> arguments) {

    public CallRequest {
        arguments = arguments != null ? arguments : Map.of();
    }
}
