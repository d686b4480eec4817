package com.fxscreenreader.services;

import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Constants;

/**
 * Keeps the same bolus from being reported on every poll. The dialog shows a bolus as an amount and
 * an age in minutes; a bolus with the same amount whose computed time lies within two minutes of
 * the remembered one is the same event.
 * <p>
 * A bolus is only remembered through {@link #remember} once the reading carrying it has been stored,
 * so a reading that gets dropped cannot hide its bolus from later polls.
 * Not thread safe, the polling loop is the only caller.
 */
public class BolusDeduplicator {

    private static final String TAG = BolusDeduplicator.class.getSimpleName();

    public static final long WINDOW_MS = 2 * Constants.MINUTE_IN_MS;

    private Double lastAmount;
    private long lastTimestamp;

    /**
     * @return the reading, with its bolus fields removed when they repeat the remembered bolus
     */
    public GlucoseReading filter(final GlucoseReading reading, final long now) {
        if (reading == null || !reading.hasBolus()) return reading;
        if (isDuplicate(reading.getBolusAmount(), bolusTime(reading, now))) {
            UserError.Log.d(TAG, "Duplicate bolus " + reading.getBolusAmount() + "U, already seen");
            return reading.withoutBolus();
        }
        return reading;
    }

    public void remember(final GlucoseReading reading, final long now) {
        if (reading == null || !reading.hasBolus()) return;
        final long bolusTime = bolusTime(reading, now);
        if (isDuplicate(reading.getBolusAmount(), bolusTime)) return;
        UserError.Log.uel(TAG, "New bolus " + reading.getBolusAmount() + "U " + reading.getBolusMinutesAgo() + " minutes ago");
        lastAmount = reading.getBolusAmount();
        lastTimestamp = bolusTime;
    }

    public void reset() {
        lastAmount = null;
        lastTimestamp = 0;
    }

    private boolean isDuplicate(final double amount, final long bolusTime) {
        return lastAmount != null && lastAmount == amount && Math.abs(lastTimestamp - bolusTime) < WINDOW_MS;
    }

    private static long bolusTime(final GlucoseReading reading, final long now) {
        return now - reading.getBolusMinutesAgo() * Constants.MINUTE_IN_MS;
    }
}
