package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;

import java.math.BigDecimal;

public record VehicleDto(
        String id,
        String brand,
        String model,
        int year,
        int modelYear,
        BigDecimal engineSize,
        String fuelType,
        String color,
        int mileage,
        int doors,
        String transmission,
        BigDecimal price,
        String createdAt
) {
    public static VehicleDto from(final Vehicle vehicle) {
        return new VehicleDto(
                vehicle.id(),
                vehicle.brand(),
                vehicle.model(),
                vehicle.manufactureYear(),
                vehicle.modelYear(),
                vehicle.engineSize(),
                vehicle.fuelType(),
                vehicle.color(),
                vehicle.mileage(),
                vehicle.doors(),
                vehicle.transmission(),
                vehicle.price(),
                vehicle.createdAt().toString());
    }
}
