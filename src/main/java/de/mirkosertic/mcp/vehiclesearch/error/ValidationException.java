package de.mirkosertic.mcp.vehiclesearch.error;

/**
 * Caller-fixable argument problem: unknown key, wrong type, inconsistent bounds.
 * Raised before any storage access.
 */
public class ValidationException extends InventoryException {

    public ValidationException(final String message) {
        super(message);
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.INVALID_ARGUMENT;
    }
}
