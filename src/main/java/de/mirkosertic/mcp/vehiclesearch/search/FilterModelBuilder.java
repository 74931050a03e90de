package de.mirkosertic.mcp.vehiclesearch.search;

import de.mirkosertic.mcp.vehiclesearch.KeywordFoldingAnalyzer;
import de.mirkosertic.mcp.vehiclesearch.error.ValidationException;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleConstraints;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleDocumentMapper;
import de.mirkosertic.mcp.vehiclesearch.model.VehicleField;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns untrusted {@code search_records} arguments into a {@link VehicleFilter}.
 *
 * <p>Rules applied, all before any storage access:</p>
 * <ul>
 *   <li>unknown argument names are rejected, at the top level and inside {@code identityFilters}</li>
 *   <li>numbers must be JSON numbers; integral fields reject fractions</li>
 *   <li>{@code min > max} is rejected, never swapped</li>
 *   <li>{@code null}, blank strings and empty arrays mean "unset"</li>
 *   <li>text values are folded with the same folding the search vector uses</li>
 * </ul>
 */
public class FilterModelBuilder {

    public static final String FREE_TEXT = "freeText";
    public static final String IDENTITY_FILTERS = "identityFilters";
    public static final String BRAND = "brand";
    public static final String MODEL = "model";
    public static final String YEAR_MIN = "yearMin";
    public static final String YEAR_MAX = "yearMax";
    public static final String MODEL_YEAR_MIN = "modelYearMin";
    public static final String MODEL_YEAR_MAX = "modelYearMax";
    public static final String PRICE_MIN = "priceMin";
    public static final String PRICE_MAX = "priceMax";
    public static final String MILEAGE_MIN = "mileageMin";
    public static final String MILEAGE_MAX = "mileageMax";
    public static final String DOORS_MIN = "doorsMin";
    public static final String DOORS_MAX = "doorsMax";
    public static final String DOORS = "doors";
    public static final String ENGINE_SIZE_MIN = "engineSizeMin";
    public static final String ENGINE_SIZE_MAX = "engineSizeMax";
    public static final String FUEL_TYPE = "fuelType";
    public static final String COLOR = "color";
    public static final String TRANSMISSION = "transmission";
    public static final String PAGE_TOKEN = "pageToken";
    public static final String PAGE_SIZE = "pageSize";

    static final Set<String> FILTER_KEYS = Set.of(
            FREE_TEXT, IDENTITY_FILTERS,
            YEAR_MIN, YEAR_MAX, MODEL_YEAR_MIN, MODEL_YEAR_MAX,
            PRICE_MIN, PRICE_MAX, MILEAGE_MIN, MILEAGE_MAX,
            DOORS_MIN, DOORS_MAX, DOORS, ENGINE_SIZE_MIN, ENGINE_SIZE_MAX,
            FUEL_TYPE, COLOR, TRANSMISSION);

    private static final Set<String> SEARCH_KEYS;
    private static final Set<String> IDENTITY_KEYS = Set.of(BRAND, MODEL);

    static {
        final Set<String> keys = new LinkedHashSet<>(FILTER_KEYS);
        keys.add(PAGE_TOKEN);
        keys.add(PAGE_SIZE);
        SEARCH_KEYS = Set.copyOf(keys);
    }

    /**
     * How a numeric argument is checked.
     */
    private enum NumberRule {
        INTEGER(false, false),
        NON_NEGATIVE_INTEGER(false, true),
        NON_NEGATIVE_DECIMAL(true, true);

        private final boolean fractional;
        private final boolean nonNegative;

        NumberRule(final boolean fractional, final boolean nonNegative) {
            this.fractional = fractional;
            this.nonNegative = nonNegative;
        }
    }

    private final KeywordFoldingAnalyzer foldingAnalyzer;

    public FilterModelBuilder(final KeywordFoldingAnalyzer foldingAnalyzer) {
        this.foldingAnalyzer = foldingAnalyzer;
    }

    /**
     * Validates the complete {@code search_records} argument map, paging arguments included.
     */
    public SearchArguments buildSearchArguments(final @Nullable Map<String, ?> rawArgs) throws ValidationException {
        final Map<String, ?> args = rawArgs != null ? rawArgs : Map.of();
        ArgumentChecks.rejectUnknownKeys(args, SEARCH_KEYS, "");

        final String pageToken = ArgumentChecks.optionalText(args, PAGE_TOKEN);
        Integer pageSize = null;
        final BigDecimal rawPageSize = number(args, PAGE_SIZE, NumberRule.INTEGER);
        if (rawPageSize != null) {
            if (rawPageSize.signum() <= 0) {
                throw new ValidationException("'" + PAGE_SIZE + "' must be at least 1");
            }
            pageSize = rawPageSize.min(BigDecimal.valueOf(Integer.MAX_VALUE)).intValue();
        }

        return new SearchArguments(buildFilter(args, SEARCH_KEYS), pageToken, pageSize);
    }

    /**
     * Validates filter arguments only; paging arguments are unknown keys here.
     */
    public VehicleFilter buildFilter(final @Nullable Map<String, ?> rawArgs) throws ValidationException {
        final Map<String, ?> args = rawArgs != null ? rawArgs : Map.of();
        return buildFilter(args, FILTER_KEYS);
    }

    private VehicleFilter buildFilter(final Map<String, ?> args, final Set<String> allowedKeys) throws ValidationException {
        ArgumentChecks.rejectUnknownKeys(args, allowedKeys, "");

        final VehicleFilter.Builder filter = VehicleFilter.builder();

        final String freeText = ArgumentChecks.optionalText(args, FREE_TEXT);
        filter.freeText(freeText != null ? freeText.strip().replaceAll("\\s+", " ") : null);

        final Object identity = args.get(IDENTITY_FILTERS);
        if (identity != null) {
            if (!(identity instanceof Map<?, ?> identityMap)) {
                throw new ValidationException("'" + IDENTITY_FILTERS + "' must be an object with optional 'brand' and 'model'");
            }
            final Map<String, ?> identityArgs = stringKeyed(identityMap);
            ArgumentChecks.rejectUnknownKeys(identityArgs, IDENTITY_KEYS, IDENTITY_FILTERS + ".");
            filter.brands(foldedValues(identityArgs, BRAND, VehicleField.BRAND, IDENTITY_FILTERS + "." + BRAND));
            filter.models(foldedValues(identityArgs, MODEL, VehicleField.MODEL, IDENTITY_FILTERS + "." + MODEL));
        }

        filter.manufactureYear(range(args, YEAR_MIN, YEAR_MAX, NumberRule.INTEGER, VehicleField.YEAR));
        filter.modelYear(range(args, MODEL_YEAR_MIN, MODEL_YEAR_MAX, NumberRule.INTEGER, VehicleField.MODEL_YEAR));
        filter.price(range(args, PRICE_MIN, PRICE_MAX, NumberRule.NON_NEGATIVE_DECIMAL, VehicleField.PRICE));
        filter.mileage(range(args, MILEAGE_MIN, MILEAGE_MAX, NumberRule.NON_NEGATIVE_INTEGER, VehicleField.MILEAGE));
        filter.doors(range(args, DOORS_MIN, DOORS_MAX, NumberRule.NON_NEGATIVE_INTEGER, VehicleField.DOORS));
        filter.engineSize(range(args, ENGINE_SIZE_MIN, ENGINE_SIZE_MAX, NumberRule.NON_NEGATIVE_DECIMAL, VehicleField.ENGINE_SIZE));
        filter.doorsIn(doorValues(args));

        filter.fuelTypes(foldedValues(args, FUEL_TYPE, VehicleField.FUEL_TYPE, FUEL_TYPE));
        filter.colors(foldedValues(args, COLOR, VehicleField.COLOR, COLOR));
        filter.transmissions(foldedValues(args, TRANSMISSION, VehicleField.TRANSMISSION, TRANSMISSION));

        return filter.build();
    }

    /**
     * Folds a single string-or-array argument into a sorted, duplicate-free list of keys.
     * Shared with the facet operations, which accept the same shape for their brand restriction.
     */
    public List<String> foldedValues(final Map<String, ?> args, final String key, final VehicleField field,
                                     final String displayName) throws ValidationException {
        final Object value = args.get(key);
        if (value == null) {
            return List.of();
        }
        final Collection<?> elements;
        if (value instanceof String) {
            elements = List.of(value);
        } else if (value instanceof Collection<?> collection) {
            elements = collection;
        } else {
            throw new ValidationException("'" + displayName + "' must be a string or an array of strings");
        }

        final TreeSet<String> folded = new TreeSet<>();
        for (final Object element : elements) {
            if (element == null) {
                continue;
            }
            if (!(element instanceof String text)) {
                throw new ValidationException("'" + displayName + "' must contain only strings");
            }
            if (!text.isBlank()) {
                folded.add(foldingAnalyzer.fold(VehicleDocumentMapper.keyField(field), text));
            }
        }
        return List.copyOf(folded);
    }

    private @Nullable LongRange range(final Map<String, ?> args, final String minKey, final String maxKey,
                                      final NumberRule rule, final VehicleField field) throws ValidationException {
        final BigDecimal min = number(args, minKey, rule);
        final BigDecimal max = number(args, maxKey, rule);
        if (min == null && max == null) {
            return null;
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new ValidationException("'" + minKey + "' (" + min.toPlainString() + ") must not be greater than '"
                    + maxKey + "' (" + max.toPlainString() + ")");
        }
        // Lower bounds round up and upper bounds round down, so sub-unit precision never widens a range
        final Long lower = min != null ? toIndexUnits(min, field, RoundingMode.CEILING) : null;
        final Long upper = max != null ? toIndexUnits(max, field, RoundingMode.FLOOR) : null;
        return new LongRange(lower, upper);
    }

    private static long toIndexUnits(final BigDecimal value, final VehicleField field, final RoundingMode rounding) {
        final BigInteger scaled = value.movePointRight(field.scale()).setScale(0, rounding).toBigInteger();
        if (scaled.bitLength() > 63) {
            return scaled.signum() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return scaled.longValue();
    }

    private static boolean isAllowedDoorCount(final BigDecimal number) {
        try {
            return VehicleConstraints.ALLOWED_DOORS.contains(number.intValueExact());
        } catch (final ArithmeticException e) {
            return false;
        }
    }

    private List<Long> doorValues(final Map<String, ?> args) throws ValidationException {
        final Object value = args.get(DOORS);
        if (value == null) {
            return List.of();
        }
        final Collection<?> elements = value instanceof Collection<?> collection ? collection : List.of(value);
        final TreeSet<Long> doors = new TreeSet<>();
        for (final Object element : elements) {
            if (element == null) {
                continue;
            }
            final BigDecimal number = toNumber(DOORS, element, NumberRule.INTEGER);
            if (!isAllowedDoorCount(number)) {
                throw new ValidationException("'" + DOORS + "' values must be one of 2, 3, 4, 5");
            }
            doors.add(number.longValue());
        }
        return List.copyOf(doors);
    }

    private static @Nullable BigDecimal number(final Map<String, ?> args, final String key, final NumberRule rule)
            throws ValidationException {
        final Object value = args.get(key);
        if (value == null) {
            return null;
        }
        return toNumber(key, value, rule);
    }

    private static BigDecimal toNumber(final String key, final Object value, final NumberRule rule) throws ValidationException {
        final BigDecimal number;
        if (value instanceof BigDecimal decimal) {
            number = decimal;
        } else if (value instanceof BigInteger integer) {
            number = new BigDecimal(integer);
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            number = BigDecimal.valueOf(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            final double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValidationException("'" + key + "' must be a finite number");
            }
            number = BigDecimal.valueOf(d);
        } else {
            throw new ValidationException("'" + key + "' must be a number, got " + ArgumentChecks.describe(value));
        }

        if (!rule.fractional && number.stripTrailingZeros().scale() > 0) {
            throw new ValidationException("'" + key + "' must be a whole number");
        }
        if (rule.nonNegative && number.signum() < 0) {
            throw new ValidationException("'" + key + "' must not be negative");
        }
        return number;
    }

    private static Map<String, ?> stringKeyed(final Map<?, ?> map) throws ValidationException {
        for (final Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new ValidationException("'" + IDENTITY_FILTERS + "' keys must be strings");
            }
        }
        @SuppressWarnings("unchecked")
        final Map<String, ?> typed = (Map<String, ?>) map;
        return typed;
    }
}
