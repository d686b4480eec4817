package com.fxscreenreader.models;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Small shared helpers.
 */
public class JoH {

    private static final String TAG = JoH.class.getSimpleName();

    private JoH() {
    }

    public static long tsl() {
        return System.currentTimeMillis();
    }

    public static long msSince(final long when) {
        return tsl() - when;
    }

    // parse a number that may use a comma as decimal separator
    public static double tolerantParseDouble(final String str) throws NumberFormatException {
        return Double.parseDouble(str.trim().replace(",", "."));
    }

    public static Double tolerantParseDoubleOrNull(final String str) {
        if (str == null) return null;
        try {
            return tolerantParseDouble(str);
        } catch (NumberFormatException e) {
            UserError.Log.d(TAG, "Could not parse number: " + str);
            return null;
        }
    }

    public static Integer parseIntOrNull(final String str) {
        if (str == null) return null;
        try {
            return Integer.parseInt(str.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // quick string, fixed number of decimal places
    public static String qs(final double x, final int digits) {
        if (digits == 0) {
            return Long.toString(Math.round(x));
        }
        return String.format(Locale.US, "%." + digits + "f", x);
    }

    public static String dateTimeText(final long timestamp) {
        return new SimpleDateFormat("yyyy-MM-dd HH:mm:ss", Locale.US).format(new Date(timestamp));
    }

    public static String isoUtc(final long timestamp) {
        final SimpleDateFormat format = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.US);
        format.setTimeZone(TimeZone.getTimeZone("UTC"));
        return format.format(new Date(timestamp));
    }

    public static boolean emptyString(final String str) {
        return str == null || str.trim().isEmpty();
    }

    public static String niceTimeScalar(final long t) {
        final long minutes = Math.abs(t) / 60_000L;
        if (minutes < 60) return minutes + " mins";
        final long hours = minutes / 60;
        if (hours < 48) return hours + " hours " + (minutes % 60) + " mins";
        return (hours / 24) + " days " + (hours % 24) + " hours";
    }

    public static void threadSleep(final long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            UserError.Log.d(TAG, "Sleep interrupted");
        }
    }
}
