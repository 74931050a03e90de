package de.mirkosertic.mcp.vehiclesearch.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.vehiclesearch.error.ErrorCode;
import de.mirkosertic.mcp.vehiclesearch.error.InventoryException;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Validates and dispatches structured tool calls.
 *
 * <p>Each call runs through {@code RECEIVED -> VALIDATING -> DISPATCHING -> COMPLETED | FAILED}.
 * Failures are mapped to an {@link ErrorCode}; internal exception text never reaches the caller.
 * Calls share no mutable state and are never retried here.</p>
 */
public class ToolGateway {

    private static final Logger logger = LoggerFactory.getLogger(ToolGateway.class);

    private static final String ENVELOPE_OPERATION = "operation";
    private static final String ENVELOPE_ARGUMENTS = "arguments";

    private static final TypeReference<Map<String, Object>> ARGUMENT_MAP = new TypeReference<>() {
    };

    private final Map<String, ToolOperation<?>> operations;
    private final ObjectMapper objectMapper;
    private final AtomicLong callCounter = new AtomicLong();

    public ToolGateway(final List<ToolOperation<?>> operations, final ObjectMapper objectMapper) {
        final Map<String, ToolOperation<?>> byName = new LinkedHashMap<>();
        for (final ToolOperation<?> operation : operations) {
            if (byName.put(operation.name(), operation) != null) {
                throw new IllegalArgumentException("Duplicate operation " + operation.name());
            }
        }
        this.operations = Collections.unmodifiableMap(byName);
        this.objectMapper = objectMapper;
    }

    public Collection<ToolOperation<?>> operations() {
        return operations.values();
    }

    public CallResponse call(final CallRequest request) {
        final long callId = callCounter.incrementAndGet();
        logger.debug("Call #{} {}: operation={}", callId, CallState.RECEIVED, request.operation());

        final ToolOperation<?> operation = operations.get(request.operation());
        if (operation == null) {
            return fail(callId, CallState.RECEIVED, ErrorCode.UNKNOWN_OPERATION,
                    "Unknown operation '" + request.operation() + "'. Available: " + String.join(", ", operations.keySet()));
        }
        return run(callId, operation, request.arguments());
    }

    /**
     * Entry point for a raw JSON envelope {@code {"operation": ..., "arguments": {...}}}.
     */
    public CallResponse callJson(final String envelope) {
        final CallRequest request;
        try {
            request = parseEnvelope(envelope);
        } catch (final ValidationException e) {
            final long callId = callCounter.incrementAndGet();
            return fail(callId, CallState.RECEIVED, ErrorCode.INVALID_ARGUMENT, e.getMessage());
        }
        return call(request);
    }

    private CallRequest parseEnvelope(final String envelope) throws ValidationException {
        final JsonNode root;
        try {
            root = objectMapper.readTree(envelope);
        } catch (final JsonProcessingException e) {
            throw new ValidationException("Call envelope is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Call envelope must be a JSON object");
        }

        final Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            final String name = names.next();
            if (!ENVELOPE_OPERATION.equals(name) && !ENVELOPE_ARGUMENTS.equals(name)) {
                throw new ValidationException("Unknown envelope member '" + name + "'");
            }
        }

        final JsonNode operation = root.get(ENVELOPE_OPERATION);
        if (operation == null || !operation.isTextual() || operation.asText().isBlank()) {
            throw new ValidationException("Call envelope requires a string 'operation'");
        }

        final JsonNode arguments = root.get(ENVELOPE_ARGUMENTS);
        if (arguments == null || arguments.isNull()) {
            return new CallRequest(operation.asText(), Map.of());
        }
        if (!arguments.isObject()) {
            throw new ValidationException("'arguments' must be a JSON object");
        }
        return new CallRequest(operation.asText(), objectMapper.convertValue(arguments, ARGUMENT_MAP));
    }

    private <A> CallResponse run(final long callId, final ToolOperation<A> operation, final Map<String, Object> arguments) {
        transition(callId, CallState.RECEIVED, CallState.VALIDATING);
        final A parsed;
        try {
            parsed = operation.parseArguments(arguments);
        } catch (final ValidationException e) {
            return fail(callId, CallState.VALIDATING, e.errorCode(), e.getMessage());
        }

        transition(callId, CallState.VALIDATING, CallState.DISPATCHING);
        try {
            final Object result = operation.execute(parsed);
            transition(callId, CallState.DISPATCHING, CallState.COMPLETED);
            return CallResponse.success(result);
        } catch (final InventoryException e) {
            if (e.errorCode().isRetryable()) {
                logger.warn("Call #{} {} failed: {}", callId, operation.name(), e.getMessage(), e.getCause());
            }
            return fail(callId, CallState.DISPATCHING, e.errorCode(), e.getMessage());
        } catch (final RuntimeException e) {
            logger.error("Call #{} {} failed unexpectedly", callId, operation.name(), e);
            return fail(callId, CallState.DISPATCHING, ErrorCode.STORAGE_UNAVAILABLE,
                    "The inventory store is temporarily unavailable, retry later");
        }
    }

    private static CallResponse fail(final long callId, final CallState from, final ErrorCode code, final String message) {
        transition(callId, from, CallState.FAILED);
        logger.debug("Call #{} failed with {}: {}", callId, code, message);
        return CallResponse.failure(code, message);
    }

    private static void transition(final long callId, final CallState from, final CallState to) {
        logger.debug("Call #{} {} -> {}", callId, from, to);
    }
}
