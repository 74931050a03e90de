package de.mirkosertic.mcp.vehiclesearch.gateway;

/**
 * Lifecycle of one gateway call. {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum CallState {
    RECEIVED,
    VALIDATING,
    DISPATCHING,
    COMPLETED,
    FAILED
}
