package de.mirkosertic.mcp.vehiclesearch.error;

/**
 * Caller-visible error codes of the tool gateway.
 */
public enum ErrorCode {
    UNKNOWN_OPERATION(false),
    INVALID_ARGUMENT(false),
    INVALID_PAGE_TOKEN(false),
    STORAGE_UNAVAILABLE(true),
    TIMEOUT(true),
    /**
     * Only raised by the write path (seeding); never produced by a read operation.
     */
    CONSTRAINT_VIOLATION(false);

    private final boolean retryable;

    ErrorCode(final boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
