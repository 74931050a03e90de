package de.mirkosertic.mcp.vehiclesearch.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates JSON Schema from Java record classes for MCP tool definitions.
 * Objects are closed ({@code additionalProperties: false}), matching the gateway, which
 * rejects unknown arguments.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), generatePropertySchema(component.getGenericType(), component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, false, null, null);
    }

    // JSpecify's @Nullable is a type-use annotation, so it sits on the component's type
    private static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> generatePropertySchema(final Type type, final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();

        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        if (type instanceof Class<?> clazz) {
            addTypeSchema(schema, clazz);
        } else if (type instanceof ParameterizedType paramType) {
            addParameterizedTypeSchema(schema, paramType);
        } else {
            schema.put("type", "string");
        }

        final Choices choices = component.getAnnotation(Choices.class);
        if (choices != null) {
            schema.put("enum", List.of(choices.value()));
        }

        return schema;
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Class<?> clazz) {
        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class || clazz == BigDecimal.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isRecord()) {
            // Nested record - inline the schema
            schema.put("type", "object");
            final Map<String, Object> nestedProperties = new LinkedHashMap<>();
            for (final RecordComponent component : clazz.getRecordComponents()) {
                nestedProperties.put(component.getName(),
                        generatePropertySchema(component.getGenericType(), component));
            }
            schema.put("properties", nestedProperties);
            schema.put("additionalProperties", false);
        } else {
            schema.put("type", "object");
        }
    }

    private static void addParameterizedTypeSchema(final Map<String, Object> schema,
                                                   final ParameterizedType paramType) {
        if (paramType.getRawType() instanceof Class<?> rawClass && List.class.isAssignableFrom(rawClass)) {
            schema.put("type", "array");
            final Type[] typeArgs = paramType.getActualTypeArguments();
            final Map<String, Object> itemSchema = new LinkedHashMap<>();
            if (typeArgs.length > 0 && typeArgs[0] instanceof Class<?> itemClass) {
                addTypeSchema(itemSchema, itemClass);
            } else {
                itemSchema.put("type", "object");
            }
            schema.put("items", itemSchema);
        } else {
            schema.put("type", "object");
        }
    }
}
