package de.mirkosertic.mcp.vehiclesearch.seed;

import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Deterministic generator of a plausible Brazilian used-car inventory.
 *
 * <p>Prices depreciate exponentially with age ({@code 120000 * e^(-0.15 * age)}, +/-20% noise),
 * mileage grows about 15000 km per year (+/-30%). The same seed and clock always produce the
 * same vehicles, ids included.</p>
 */
public class SyntheticInventoryGenerator {

    static final Map<String, List<String>> MODELS_BY_BRAND = new LinkedHashMap<>();

    static {
        MODELS_BY_BRAND.put("Ford", List.of("Ka", "Fiesta", "Focus", "EcoSport", "Ranger"));
        MODELS_BY_BRAND.put("Chevrolet", List.of("Onix", "Prisma", "Cruze", "S10", "Tracker"));
        MODELS_BY_BRAND.put("Volkswagen", List.of("Gol", "Polo", "Virtus", "T-Cross", "Nivus", "Saveiro"));
        MODELS_BY_BRAND.put("Toyota", List.of("Corolla", "Hilux", "Yaris", "RAV4"));
        MODELS_BY_BRAND.put("Honda", List.of("Civic", "Fit", "HR-V", "WR-V", "City"));
        MODELS_BY_BRAND.put("Fiat", List.of("Mobi", "Argo", "Toro", "Strada", "Pulse"));
        MODELS_BY_BRAND.put("Hyundai", List.of("HB20", "Creta", "HB20S"));
        MODELS_BY_BRAND.put("Jeep", List.of("Renegade", "Compass", "Commander"));
        MODELS_BY_BRAND.put("Renault", List.of("Kwid", "Sandero", "Logan", "Duster", "Captur"));
    }

    static final List<String> FUEL_TYPES = List.of("Flex", "Gasolina", "Diesel", "Etanol", "Híbrido");
    static final List<String> TRANSMISSIONS = List.of("Manual", "Automática", "CVT", "Automatizada");
    static final List<String> COLORS = List.of("Preto", "Branco", "Prata", "Cinza", "Vermelho", "Azul");
    static final List<Integer> DOORS = List.of(2, 4);
    static final List<BigDecimal> ENGINE_SIZES = List.of(
            new BigDecimal("1.0"), new BigDecimal("1.3"), new BigDecimal("1.4"), new BigDecimal("1.5"),
            new BigDecimal("1.6"), new BigDecimal("1.8"), new BigDecimal("2.0"));

    static final int FIRST_YEAR = 2010;

    private static final double BASE_PRICE = 120_000.0;
    private static final double DEPRECIATION_RATE = 0.15;
    private static final int KM_PER_YEAR = 15_000;

    private final long seed;
    private final Clock clock;

    public SyntheticInventoryGenerator(final long seed, final Clock clock) {
        this.seed = seed;
        this.clock = clock;
    }

    public List<Vehicle> generate(final int count) {
        final Random random = new Random(seed);
        final Instant base = clock.instant();
        final int currentYear = base.atZone(ZoneOffset.UTC).getYear();
        final List<String> brands = List.copyOf(MODELS_BY_BRAND.keySet());

        final List<Vehicle> vehicles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final String brand = pick(random, brands);
            final String model = pick(random, MODELS_BY_BRAND.get(brand));
            final int manufactureYear = FIRST_YEAR + random.nextInt(currentYear - FIRST_YEAR);
            final int modelYear = manufactureYear + random.nextInt(2);
            final int age = currentYear - manufactureYear;

            final double price = BASE_PRICE * Math.exp(-DEPRECIATION_RATE * age) * uniform(random, 0.8, 1.2);
            final int mileage = Math.max(0, (int) (age * KM_PER_YEAR * uniform(random, 0.7, 1.3)));
            final Instant createdAt = base.plusMillis(i);

            vehicles.add(new Vehicle(
                    timeOrderedId(random, createdAt),
                    brand,
                    model,
                    manufactureYear,
                    modelYear,
                    pick(random, ENGINE_SIZES),
                    pick(random, FUEL_TYPES),
                    pick(random, COLORS),
                    mileage,
                    pick(random, DOORS),
                    pick(random, TRANSMISSIONS),
                    BigDecimal.valueOf(price).setScale(2, RoundingMode.HALF_UP),
                    createdAt));
        }
        return vehicles;
    }

    private static <T> T pick(final Random random, final List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    private static double uniform(final Random random, final double min, final double max) {
        return min + (max - min) * random.nextDouble();
    }

    /**
     * UUID version 7: 48 bits of epoch milliseconds followed by random bits, so ids sort by
     * creation time.
     */
    static String timeOrderedId(final Random random, final Instant timestamp) {
        final long millis = timestamp.toEpochMilli();
        final long msb = (millis << 16) | 0x7000L | (random.nextInt() & 0x0FFFL);
        final long lsb = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb).toString();
    }
}
