package de.mirkosertic.mcp.vehiclesearch.gateway;

import de.mirkosertic.mcp.vehiclesearch.error.ErrorCode;
import org.jspecify.annotations.Nullable;

/**
 * Outbound envelope: exactly one of {@code result} and {@code error} is set.
 * Serialized with non-null inclusion, so callers see {@code {"result": ...}} or
 * {@code {"error": {"code", "message", "retryable"}}}.
 */
public record CallResponse(@Nullable Object result, @Nullable CallError error) {

    public static CallResponse success(final Object result) {
        return new CallResponse(result, null);
    }

    public static CallResponse failure(final ErrorCode code, final String message) {
        return new CallResponse(null, CallError.of(code, message));
    }

    public boolean failed() {
        return error != null;
    }
}
