package com.fxscreenreader.services;

import com.fxscreenreader.models.JoH;
import com.fxscreenreader.utilitymodels.Constants;
import com.fxscreenreader.utilitymodels.Pref;

import lombok.Value;

/**
 * Decides whether an age observed on screen has to be pushed to the remote store.
 */
public class AgeReconciler {

    public static final double DEFAULT_TOLERANCE_HOURS = 1.5;
    public static final String PREF_TOLERANCE = "age_tolerance_hours";

    public enum Action {
        UPLOADED_NO_PREVIOUS,
        UPDATED,
        IN_SYNC
    }

    @Value
    public static class Decision {
        Action action;
        // absolute difference, 0 when there was no remote time
        double diffHours;

        public boolean needsUpload() {
            return action != Action.IN_SYNC;
        }

        public String describe() {
            switch (action) {
                case UPLOADED_NO_PREVIOUS:
                    return "uploaded (no previous)";
                case UPDATED:
                    return "updated (diff was " + JoH.qs(diffHours, 1) + "h)";
                default:
                    return "in_sync";
            }
        }
    }

    private final double toleranceHours;

    public AgeReconciler() {
        this(Pref.getDouble(PREF_TOLERANCE, DEFAULT_TOLERANCE_HOURS));
    }

    public AgeReconciler(final double toleranceHours) {
        this.toleranceHours = toleranceHours;
    }

    public double getToleranceHours() {
        return toleranceHours;
    }

    public Decision decide(final long localTime, final Long remoteTime) {
        if (remoteTime == null) {
            return new Decision(Action.UPLOADED_NO_PREVIOUS, 0);
        }
        final double diffHours = Math.abs(localTime - remoteTime) / (double) Constants.HOUR_IN_MS;
        if (diffHours > toleranceHours) {
            return new Decision(Action.UPDATED, diffHours);
        }
        return new Decision(Action.IN_SYNC, diffHours);
    }
}
