package de.mirkosertic.mcp.vehiclesearch.mcp.dto;

import de.mirkosertic.mcp.vehiclesearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Input schema of the search_records tool. All criteria are optional and combined with AND.
 */
public record SearchRecordsRequest(
        @Nullable
        @Description("Free text matched against brand, model, color and fuel type (Portuguese stemming, accents ignored). All words must match. Results are then ranked by relevance.")
        String freeText,

        @Nullable
        @Description("Exact brand and/or model constraints.")
        IdentityFilters identityFilters,

        @Nullable
        @Description("Minimum manufacture year (inclusive).")
        Integer yearMin,

        @Nullable
        @Description("Maximum manufacture year (inclusive).")
        Integer yearMax,

        @Nullable
        @Description("Minimum model year (inclusive).")
        Integer modelYearMin,

        @Nullable
        @Description("Maximum model year (inclusive).")
        Integer modelYearMax,

        @Nullable
        @Description("Minimum price (inclusive).")
        Double priceMin,

        @Nullable
        @Description("Maximum price (inclusive).")
        Double priceMax,

        @Nullable
        @Description("Minimum mileage in km (inclusive).")
        Integer mileageMin,

        @Nullable
        @Description("Maximum mileage in km (inclusive).")
        Integer mileageMax,

        @Nullable
        @Description("Minimum number of doors (inclusive).")
        Integer doorsMin,

        @Nullable
        @Description("Maximum number of doors (inclusive).")
        Integer doorsMax,

        @Nullable
        @Description("Exact number(s) of doors, each one of 2, 3, 4, 5. A single number is accepted too.")
        List<Integer> doors,

        @Nullable
        @Description("Minimum engine size in litres (inclusive), e.g. 1.0.")
        Double engineSizeMin,

        @Nullable
        @Description("Maximum engine size in litres (inclusive), e.g. 2.0.")
        Double engineSizeMax,

        @Nullable
        @Description("Fuel type(s), e.g. Flex, Gasolina, Diesel. Use list_distinct to see available values.")
        List<String> fuelType,

        @Nullable
        @Description("Color(s). Use list_distinct to see available values.")
        List<String> color,

        @Nullable
        @Description("Transmission(s), e.g. Manual, Automática. Use list_distinct to see available values.")
        List<String> transmission,

        @Nullable
        @Description("Opaque token from a previous response's nextPageToken. Must be used with identical criteria.")
        String pageToken,

        @Nullable
        @Description("Number of records per page. Default is 10, larger values are truncated to 50.")
        Integer pageSize
) {
}
