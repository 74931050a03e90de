package de.mirkosertic.mcp.vehiclesearch.error;

/**
 * Transient failure of the inventory store. Always retryable by the caller; the core itself
 * never retries. The message is generic, the underlying fault is kept as the cause only.
 */
public class StorageException extends InventoryException {

    public enum Kind {
        UNAVAILABLE,
        TIMEOUT
    }

    private final Kind kind;

    private StorageException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StorageException unavailable(final String operation, final Throwable cause) {
        return new StorageException(Kind.UNAVAILABLE,
                "The inventory store is temporarily unavailable (" + operation + "), retry later", cause);
    }

    public static StorageException timeout(final String operation, final long timeoutMs, final Throwable cause) {
        return new StorageException(Kind.TIMEOUT,
                "The inventory store did not answer within " + timeoutMs + "ms (" + operation + "), retry later", cause);
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public ErrorCode errorCode() {
        return kind == Kind.TIMEOUT ? ErrorCode.TIMEOUT : ErrorCode.STORAGE_UNAVAILABLE;
    }
}
