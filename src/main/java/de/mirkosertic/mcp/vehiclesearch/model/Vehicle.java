package de.mirkosertic.mcp.vehiclesearch.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One inventory item. Values are immutable; {@link #id()} identifies the vehicle for its
 * whole lifetime and doubles as the final tiebreak in every result ordering.
 *
 * <p>{@code engineSize} carries one decimal place (e.g. {@code 1.6}), {@code price} two.</p>
 */
public record Vehicle(
        String id,
        String brand,
        String model,
        int manufactureYear,
        int modelYear,
        BigDecimal engineSize,
        String fuelType,
        String color,
        int mileage,
        int doors,
        String transmission,
        BigDecimal price,
        Instant createdAt
) {
    public Vehicle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(brand, "brand");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(engineSize, "engineSize");
        Objects.requireNonNull(fuelType, "fuelType");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(transmission, "transmission");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
