package de.mirkosertic.mcp.vehiclesearch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Vehicle attributes addressable by facet operations.
 *
 * <p>Numeric attributes are indexed as scaled longs: {@code price} in cents, {@code engine_size}
 * in tenths of a litre. {@link #scale()} is the number of implied decimal places.</p>
 */
public enum VehicleField {

    BRAND("brand", "brand", Kind.TEXT, 0, true, false),
    MODEL("model", "model", Kind.TEXT, 0, true, false),
    FUEL_TYPE("fuel_type", "fuel_type", Kind.TEXT, 0, true, false),
    COLOR("color", "color", Kind.TEXT, 0, true, false),
    TRANSMISSION("transmission", "transmission", Kind.TEXT, 0, true, false),
    YEAR("year", "manufacture_year", Kind.NUMERIC, 0, true, true),
    MODEL_YEAR("model_year", "model_year", Kind.NUMERIC, 0, true, true),
    ENGINE_SIZE("engine_size", "engine_size", Kind.NUMERIC, 1, true, true),
    DOORS("doors", "doors", Kind.NUMERIC, 0, true, false),
    PRICE("price", "price", Kind.NUMERIC, 2, false, true),
    MILEAGE("mileage", "mileage", Kind.NUMERIC, 0, false, true);

    public enum Kind {
        TEXT,
        NUMERIC
    }

    private final String wireName;
    private final String indexField;
    private final Kind kind;
    private final int scale;
    private final boolean distinctSupported;
    private final boolean rangeSupported;

    VehicleField(final String wireName, final String indexField, final Kind kind, final int scale,
                 final boolean distinctSupported, final boolean rangeSupported) {
        this.wireName = wireName;
        this.indexField = indexField;
        this.kind = kind;
        this.scale = scale;
        this.distinctSupported = distinctSupported;
        this.rangeSupported = rangeSupported;
    }

    public String wireName() {
        return wireName;
    }

    public String indexField() {
        return indexField;
    }

    public Kind kind() {
        return kind;
    }

    public int scale() {
        return scale;
    }

    public boolean isDistinctSupported() {
        return distinctSupported;
    }

    public boolean isRangeSupported() {
        return rangeSupported;
    }

    /**
     * Converts an indexed long back to the value callers see: a {@code Long} for integral
     * fields, a {@code BigDecimal} with {@link #scale()} decimals otherwise.
     */
    public Number toDisplayValue(final long indexed) {
        if (scale == 0) {
            return indexed;
        }
        return BigDecimal.valueOf(indexed, scale);
    }

    public static @Nullable VehicleField fromWireName(final String name) {
        for (final VehicleField field : values()) {
            if (field.wireName.equals(name)) {
                return field;
            }
        }
        return null;
    }

    public static List<String> distinctWireNames() {
        return Arrays.stream(values()).filter(VehicleField::isDistinctSupported).map(VehicleField::wireName).toList();
    }

    public static List<String> rangeWireNames() {
        return Arrays.stream(values()).filter(VehicleField::isRangeSupported).map(VehicleField::wireName).toList();
    }
}
