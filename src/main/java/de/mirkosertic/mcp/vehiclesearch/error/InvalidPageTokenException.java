package de.mirkosertic.mcp.vehiclesearch.error;

/**
 * Malformed, tampered or foreign pagination cursor. The caller recovers by restarting
 * pagination without a token.
 */
public class InvalidPageTokenException extends InventoryException {

    public InvalidPageTokenException(final String message) {
        super(message);
    }

    public InvalidPageTokenException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.INVALID_PAGE_TOKEN;
    }
}
