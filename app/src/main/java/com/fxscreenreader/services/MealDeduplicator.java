package com.fxscreenreader.services;

import com.fxscreenreader.models.GraphTreatment;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Constants;

/**
 * Same idea as {@link BolusDeduplicator} for meals read off the graph, with a wider window since
 * the interpolated time is only approximate. A meal is remembered only once it has been handed on.
 * Single caller only.
 */
public class MealDeduplicator {

    private static final String TAG = MealDeduplicator.class.getSimpleName();

    public static final long WINDOW_MS = 30 * Constants.MINUTE_IN_MS;

    private Integer lastGrams;
    private long lastTimestamp;

    /**
     * @return true for an empty meal or a repeat of the remembered one
     */
    public boolean isDuplicate(final GraphTreatment meal) {
        if (meal == null || !meal.hasCarbs()) return true;
        if (lastGrams != null && lastGrams.equals(meal.getCarbsGrams())
                && Math.abs(lastTimestamp - meal.getTimestamp()) < WINDOW_MS) {
            UserError.Log.d(TAG, "Duplicate meal " + meal.getCarbsGrams() + "g");
            return true;
        }
        return false;
    }

    public void remember(final GraphTreatment meal) {
        if (meal == null || !meal.hasCarbs()) return;
        lastGrams = meal.getCarbsGrams();
        lastTimestamp = meal.getTimestamp();
    }
}
