package de.mirkosertic.mcp.vehiclesearch.index;

import de.mirkosertic.mcp.vehiclesearch.error.ConstraintViolationException;
import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Storage-boundary checks applied to every vehicle before it is written.
 * All violations of one vehicle are collected and reported together.
 */
public class VehicleConstraints {

    public static final int MIN_MANUFACTURE_YEAR = 1990;
    public static final Set<Integer> ALLOWED_DOORS = Set.of(2, 3, 4, 5);

    private static final BigDecimal MAX_ENGINE_SIZE = new BigDecimal("10");

    private final Clock clock;

    public VehicleConstraints(final Clock clock) {
        this.clock = clock;
    }

    public void check(final Vehicle vehicle) throws ConstraintViolationException {
        final List<String> violations = new ArrayList<>();
        final int currentYear = clock.instant().atZone(ZoneOffset.UTC).getYear();

        requireText(violations, "brand", vehicle.brand(), 100);
        requireText(violations, "model", vehicle.model(), 100);
        requireText(violations, "fuel_type", vehicle.fuelType(), 50);
        requireText(violations, "color", vehicle.color(), 50);
        requireText(violations, "transmission", vehicle.transmission(), 50);

        if (vehicle.manufactureYear() < MIN_MANUFACTURE_YEAR) {
            violations.add("manufacture_year must be >= " + MIN_MANUFACTURE_YEAR);
        }
        if (vehicle.modelYear() < vehicle.manufactureYear()) {
            violations.add("model_year must be >= manufacture_year");
        }
        if (vehicle.modelYear() > currentYear + 1) {
            violations.add("model_year must be <= " + (currentYear + 1));
        }
        if (vehicle.price().signum() <= 0) {
            violations.add("price must be > 0");
        }
        if (vehicle.price().stripTrailingZeros().scale() > 2) {
            violations.add("price must have at most 2 decimal places");
        }
        if (vehicle.engineSize().signum() <= 0 || vehicle.engineSize().compareTo(MAX_ENGINE_SIZE) >= 0) {
            violations.add("engine_size must be > 0 and < " + MAX_ENGINE_SIZE);
        }
        if (vehicle.engineSize().stripTrailingZeros().scale() > 1) {
            violations.add("engine_size must have at most 1 decimal place");
        }
        if (vehicle.mileage() < 0) {
            violations.add("mileage must be >= 0");
        }
        if (!ALLOWED_DOORS.contains(vehicle.doors())) {
            violations.add("doors must be one of 2, 3, 4, 5");
        }

        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(vehicle.id(), violations);
        }
    }

    private static void requireText(final List<String> violations, final String name, final String value, final int maxLength) {
        if (value.isBlank()) {
            violations.add(name + " must not be blank");
        } else if (value.length() > maxLength) {
            violations.add(name + " must be at most " + maxLength + " characters");
        }
    }
}
