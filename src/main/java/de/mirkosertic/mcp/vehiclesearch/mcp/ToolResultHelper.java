package de.mirkosertic.mcp.vehiclesearch.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.mcp.vehiclesearch.gateway.CallResponse;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;

/**
 * Turns gateway envelopes into MCP tool results.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * The envelope is serialized to JSON and wrapped in a TextContent; {@code isError} is set
     * for error envelopes.
     */
    public static McpSchema.CallToolResult createResult(final CallResponse response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(response.failed())
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return "{\"error\":{\"code\":\"STORAGE_UNAVAILABLE\",\"message\":\"Response could not be serialized\",\"retryable\":true}}";
        }
    }
}
