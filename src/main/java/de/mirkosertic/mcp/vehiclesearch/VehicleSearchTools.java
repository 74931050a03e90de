package de.mirkosertic.mcp.vehiclesearch;

import de.mirkosertic.mcp.vehiclesearch.gateway.CallRequest;
import de.mirkosertic.mcp.vehiclesearch.gateway.ToolGateway;
import de.mirkosertic.mcp.vehiclesearch.gateway.ToolOperation;
import de.mirkosertic.mcp.vehiclesearch.mcp.SchemaGenerator;
import de.mirkosertic.mcp.vehiclesearch.mcp.ToolResultHelper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * MCP tools for the vehicle inventory. Every gateway operation is published as one tool;
 * the tool call is handed to the {@link ToolGateway} unchanged.
 */
public class VehicleSearchTools {

    private final ToolGateway gateway;

    public VehicleSearchTools(final ToolGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        for (final ToolOperation<?> operation : gateway.operations()) {
            final String name = operation.name();
            tools.add(McpServerFeatures.SyncToolSpecification.builder()
                    .tool(McpSchema.Tool.builder()
                            .name(name)
                            .description(operation.description())
                            .inputSchema(SchemaGenerator.generateSchema(operation.argumentSchema()))
                            .build())
                    .callHandler((exchange, request) ->
                            ToolResultHelper.createResult(gateway.call(new CallRequest(name, request.arguments()))))
                    .build());
        }

        return tools;
    }
}
