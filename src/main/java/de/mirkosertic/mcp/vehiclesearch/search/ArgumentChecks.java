package de.mirkosertic.mcp.vehiclesearch.search;

import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks shared by all operations that accept an untyped argument map.
 */
public final class ArgumentChecks {

    private ArgumentChecks() {
    }

    public static void rejectUnknownKeys(final Map<String, ?> args, final Set<String> allowed, final String prefix)
            throws ValidationException {
        final List<String> unknown = new ArrayList<>();
        for (final String key : args.keySet()) {
            if (!allowed.contains(key)) {
                unknown.add(prefix + key);
            }
        }
        if (!unknown.isEmpty()) {
            unknown.sort(null);
            throw new ValidationException("Unknown argument(s): " + String.join(", ", unknown)
                    + ". Allowed: " + String.join(", ", new TreeSet<>(allowed)));
        }
    }

    /**
     * A string argument; {@code null} and blank strings count as absent.
     */
    public static @Nullable String optionalText(final Map<String, ?> args, final String key) throws ValidationException {
        final Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ValidationException("'" + key + "' must be a string, got " + describe(value));
        }
        return text.isBlank() ? null : text;
    }

    public static String requiredText(final Map<String, ?> args, final String key) throws ValidationException {
        final String value = optionalText(args, key);
        if (value == null) {
            throw new ValidationException("'" + key + "' is required");
        }
        return value.strip();
    }

    static String describe(final Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
