package de.mirkosertic.mcp.vehiclesearch.index;

import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;

/**
 * Source text of a vehicle's search vector: brand, model, color and fuel type.
 * The text is analysed by {@link de.mirkosertic.mcp.vehiclesearch.SearchVectorAnalyzer}
 * as part of the same document write as the vehicle itself.
 */
public final class SearchVector {

    private SearchVector() {
    }

    public static String sourceText(final Vehicle vehicle) {
        return String.join(" ", vehicle.brand(), vehicle.model(), vehicle.color(), vehicle.fuelType());
    }
}
