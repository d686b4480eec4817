package com.fxscreenreader.models;

import lombok.Value;

/**
 * Treatment marker recovered from the landscape graph, with its estimated time.
 */
@Value
public class GraphTreatment {
    Double insulinUnits;
    Integer carbsGrams;
    long timestamp;

    public static GraphTreatment carbs(final int grams, final long timestamp) {
        return new GraphTreatment(null, grams, timestamp);
    }

    public boolean hasInsulin() {
        return insulinUnits != null && insulinUnits > 0;
    }

    public boolean hasCarbs() {
        return carbsGrams != null && carbsGrams > 0;
    }

    public boolean hasBoth() {
        return hasInsulin() && hasCarbs();
    }
}
