package de.mirkosertic.mcp.vehiclesearch.error;

/**
 * Base class of all failures the search core reports. Every subclass maps to exactly one
 * {@link ErrorCode}; the message is safe to show to a caller.
 */
public abstract class InventoryException extends Exception {

    protected InventoryException(final String message) {
        super(message);
    }

    protected InventoryException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode errorCode();
}
