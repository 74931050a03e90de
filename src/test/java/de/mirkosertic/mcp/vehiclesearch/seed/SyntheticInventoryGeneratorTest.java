package de.mirkosertic.mcp.vehiclesearch.seed;

import de.mirkosertic.mcp.vehiclesearch.TestVehicles;
import de.mirkosertic.mcp.vehiclesearch.index.VehicleConstraints;
import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SyntheticInventoryGeneratorTest {

    private final SyntheticInventoryGenerator generator = new SyntheticInventoryGenerator(42L, TestVehicles.CLOCK);

    @Test
    void sameSeedSameInventory() {
        assertThat(generator.generate(100))
                .isEqualTo(new SyntheticInventoryGenerator(42L, TestVehicles.CLOCK).generate(100));
        assertThat(generator.generate(100))
                .isNotEqualTo(new SyntheticInventoryGenerator(7L, TestVehicles.CLOCK).generate(100));
    }

    @Test
    void everyVehicleSatisfiesTheStorageConstraints() {
        final VehicleConstraints constraints = new VehicleConstraints(TestVehicles.CLOCK);

        for (final Vehicle vehicle : generator.generate(500)) {
            assertThatCode(() -> constraints.check(vehicle)).doesNotThrowAnyException();
        }
    }

    @Test
    void modelsBelongToTheirBrand() {
        for (final Vehicle vehicle : generator.generate(200)) {
            assertThat(SyntheticInventoryGenerator.MODELS_BY_BRAND.get(vehicle.brand())).contains(vehicle.model());
        }
    }

    @Test
    void olderVehiclesAreCheaperOnAverage() {
        final List<Vehicle> vehicles = generator.generate(2000);

        final double oldAverage = vehicles.stream().filter(v -> v.manufactureYear() <= 2012)
                .mapToDouble(v -> v.price().doubleValue()).average().orElseThrow();
        final double newAverage = vehicles.stream().filter(v -> v.manufactureYear() >= 2023)
                .mapToDouble(v -> v.price().doubleValue()).average().orElseThrow();

        assertThat(oldAverage).isLessThan(newAverage);
    }

    @Test
    void idsAreUniqueVersion7Uuids() {
        final List<Vehicle> vehicles = generator.generate(1000);

        assertThat(vehicles).extracting(Vehicle::id).doesNotHaveDuplicates();
        for (final Vehicle vehicle : vehicles) {
            final UUID uuid = UUID.fromString(vehicle.id());
            assertThat(uuid.version()).isEqualTo(7);
            assertThat(uuid.variant()).isEqualTo(2);
            assertThat(uuid.getMostSignificantBits() >>> 16).isEqualTo(vehicle.createdAt().toEpochMilli());
        }
    }
}
