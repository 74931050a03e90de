package de.mirkosertic.mcp.vehiclesearch.error;

import java.util.List;

/**
 * A vehicle violates one or more storage constraints. Reported as a single failure class
 * regardless of which attribute triggered it; {@link #violations()} lists the details.
 */
public class ConstraintViolationException extends InventoryException {

    private final String vehicleId;
    private final List<String> violations;

    public ConstraintViolationException(final String vehicleId, final List<String> violations) {
        super("Vehicle " + vehicleId + " violates constraints: " + String.join("; ", violations));
        this.vehicleId = vehicleId;
        this.violations = List.copyOf(violations);
    }

    public String vehicleId() {
        return vehicleId;
    }

    public List<String> violations() {
        return violations;
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.CONSTRAINT_VIOLATION;
    }
}
