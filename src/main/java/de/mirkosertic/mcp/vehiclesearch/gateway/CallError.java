package de.mirkosertic.mcp.vehiclesearch.gateway;

import de.mirkosertic.mcp.vehiclesearch.error.ErrorCode;

public record CallError(ErrorCode code, String message, boolean retryable) {

    public static CallError of(final ErrorCode code, final String message) {
        return new CallError(code, message, code.isRetryable());
    }
}
