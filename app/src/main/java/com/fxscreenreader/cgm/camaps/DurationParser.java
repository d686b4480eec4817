package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Constants;

/**
 * Parses the age durations shown in the side menu, such as "5d 6h 58min", "5 Tage 6 Stunden",
 * "6 hours 58 minutes" or "58 min".
 */
public class DurationParser {

    private static final String TAG = DurationParser.class.getSimpleName();

    private static final PatternCascade<Long> DURATION = PatternCascade.<Long>builder()
            .then("(\\d+)d\\s*(?:(\\d+)h)?\\s*(?:(\\d+)min)?",
                    m -> millis(m.group(1), m.group(2), m.group(3)))
            .then("(\\d+)\\s*(?:Tage?|days?|jours?)(?:\\s+(\\d+)\\s*(?:Stunden?|hours?|heures?))?",
                    m -> millis(m.group(1), m.group(2), null))
            .then("(\\d+)\\s*(?:hours?|Stunden?|heures?|h)\\s*(?:(\\d+)\\s*(?:minutes?|Minuten?|min))?",
                    m -> millis(null, m.group(1), m.group(2)))
            .then("(\\d+)\\s*(?:minutes?|Minuten?|min)",
                    m -> millis(null, null, m.group(1)))
            .build();

    private DurationParser() {
    }

    /**
     * @return duration in milliseconds, or null for blank, "---" or unrecognised text
     */
    public static Long parse(final String text) {
        if (text == null) return null;
        final String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equals("---")) return null;
        final Long result = DURATION.match(trimmed);
        if (result == null) {
            UserError.Log.w(TAG, "Could not parse duration: '" + text + "'");
        }
        return result;
    }

    private static Long millis(final String days, final String hours, final String minutes) {
        return part(days) * Constants.DAY_IN_MS
                + part(hours) * Constants.HOUR_IN_MS
                + part(minutes) * Constants.MINUTE_IN_MS;
    }

    private static long part(final String digits) {
        final Integer value = JoH.parseIntOrNull(digits);
        return value == null ? 0 : value;
    }
}
