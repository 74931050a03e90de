package de.mirkosertic.mcp.vehiclesearch.gateway;

import de.mirkosertic.mcp.vehiclesearch.error.InventoryException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;

import java.util.Map;

/**
 * One operation exposed through the {@link ToolGateway}.
 *
 * @param <A> the validated argument type
 */
public interface ToolOperation<A> {

    String name();

    String description();

    /**
     * Record type describing the accepted arguments, used to publish the input schema.
     */
    Class<? extends Record> argumentSchema();

    /**
     * Validates untrusted arguments. Must not touch storage.
     */
    A parseArguments(Map<String, Object> arguments) throws ValidationException;

    Object execute(A arguments) throws InventoryException;
}
