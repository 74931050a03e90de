package de.mirkosertic.mcp.vehiclesearch.search;

import com.google.common.hash.Hashing;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Validated, call-scoped search criteria. Every component is optional: a {@code null} range or
 * an empty membership list means "no constraint". Membership values are folded keys, sorted
 * and free of duplicates, so two filters with the same meaning are equal.
 *
 * <p>Instances are produced by {@link FilterModelBuilder}; nothing else should construct one
 * from untrusted input.</p>
 */
public record VehicleFilter(
        @Nullable String freeText,
        List<String> brands,
        List<String> models,
        @Nullable LongRange manufactureYear,
        @Nullable LongRange modelYear,
        @Nullable LongRange price,
        @Nullable LongRange mileage,
        @Nullable LongRange doors,
        @Nullable LongRange engineSize,
        List<Long> doorsIn,
        List<String> fuelTypes,
        List<String> colors,
        List<String> transmissions
) {

    public VehicleFilter {
        brands = List.copyOf(brands);
        models = List.copyOf(models);
        doorsIn = List.copyOf(doorsIn);
        fuelTypes = List.copyOf(fuelTypes);
        colors = List.copyOf(colors);
        transmissions = List.copyOf(transmissions);
    }

    public static VehicleFilter unconstrained() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasFreeText() {
        return freeText != null;
    }

    /**
     * Stable digest of the criteria, bound into page tokens so a cursor cannot be replayed
     * against a different filter.
     */
    public String fingerprint() {
        return Hashing.sha256().hashString(toString(), StandardCharsets.UTF_8).toString();
    }

    public static final class Builder {
        private @Nullable String freeText;
        private List<String> brands = List.of();
        private List<String> models = List.of();
        private @Nullable LongRange manufactureYear;
        private @Nullable LongRange modelYear;
        private @Nullable LongRange price;
        private @Nullable LongRange mileage;
        private @Nullable LongRange doors;
        private @Nullable LongRange engineSize;
        private List<Long> doorsIn = List.of();
        private List<String> fuelTypes = List.of();
        private List<String> colors = List.of();
        private List<String> transmissions = List.of();

        private Builder() {
        }

        public Builder freeText(final @Nullable String freeText) {
            this.freeText = freeText;
            return this;
        }

        public Builder brands(final List<String> brands) {
            this.brands = brands;
            return this;
        }

        public Builder models(final List<String> models) {
            this.models = models;
            return this;
        }

        public Builder manufactureYear(final @Nullable LongRange manufactureYear) {
            this.manufactureYear = manufactureYear;
            return this;
        }

        public Builder modelYear(final @Nullable LongRange modelYear) {
            this.modelYear = modelYear;
            return this;
        }

        public Builder price(final @Nullable LongRange price) {
            this.price = price;
            return this;
        }

        public Builder mileage(final @Nullable LongRange mileage) {
            this.mileage = mileage;
            return this;
        }

        public Builder doors(final @Nullable LongRange doors) {
            this.doors = doors;
            return this;
        }

        public Builder engineSize(final @Nullable LongRange engineSize) {
            this.engineSize = engineSize;
            return this;
        }

        public Builder doorsIn(final List<Long> doorsIn) {
            this.doorsIn = doorsIn;
            return this;
        }

        public Builder fuelTypes(final List<String> fuelTypes) {
            this.fuelTypes = fuelTypes;
            return this;
        }

        public Builder colors(final List<String> colors) {
            this.colors = colors;
            return this;
        }

        public Builder transmissions(final List<String> transmissions) {
            this.transmissions = transmissions;
            return this;
        }

        public VehicleFilter build() {
            return new VehicleFilter(freeText, brands, models, manufactureYear, modelYear, price, mileage,
                    doors, engineSize, doorsIn, fuelTypes, colors, transmissions);
        }
    }
}
