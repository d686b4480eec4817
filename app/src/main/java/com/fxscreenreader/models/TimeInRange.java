package com.fxscreenreader.models;

import com.fxscreenreader.utilitymodels.Pref;

import java.util.List;

import lombok.Value;

/**
 * Share of readings below, within and above the target range.
 */
@Value
public class TimeInRange {
    int count;
    double lowPercent;
    double inRangePercent;
    double highPercent;
    double averageMgdl;

    public static final String PREF_LOW = "low_threshold";
    public static final String PREF_HIGH = "high_threshold";

    /**
     * Statistics for stored readings with start <= timestamp < end, using the configured thresholds.
     */
    public static TimeInRange forPeriod(final ReadingStore store, final long start, final long end) {
        return of(store.inRange(start, end), Pref.getDouble(PREF_LOW, 70), Pref.getDouble(PREF_HIGH, 180));
    }

    public static TimeInRange of(final List<GlucoseReading> readings, final double lowMgdl, final double highMgdl) {
        if (readings == null || readings.isEmpty()) {
            return new TimeInRange(0, 0, 0, 0, 0);
        }
        int low = 0;
        int inRange = 0;
        int high = 0;
        double total = 0;
        for (final GlucoseReading reading : readings) {
            total += reading.getMgdl();
            switch (reading.rangeStatus(lowMgdl, highMgdl)) {
                case LOW:
                    low++;
                    break;
                case HIGH:
                    high++;
                    break;
                default:
                    inRange++;
                    break;
            }
        }
        final int count = readings.size();
        return new TimeInRange(count, 100.0 * low / count, 100.0 * inRange / count, 100.0 * high / count, total / count);
    }
}
