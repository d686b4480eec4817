package com.fxscreenreader.utilitymodels;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Process wide key/value state for counters, timestamps and last seen pump values.
 */
public class PersistentStore {

    private static final ConcurrentHashMap<String, Long> longs = new ConcurrentHashMap<>();
    private static final ConcurrentHashMap<String, Double> doubles = new ConcurrentHashMap<>();
    private static final ConcurrentHashMap<String, String> strings = new ConcurrentHashMap<>();

    private PersistentStore() {
    }

    public static long getLong(final String name) {
        final Long value = longs.get(name);
        return value == null ? 0 : value;
    }

    public static void setLong(final String name, final long value) {
        longs.put(name, value);
    }

    public static long incrementLong(final String name) {
        return longs.merge(name, 1L, Long::sum);
    }

    public static double getDouble(final String name) {
        final Double value = doubles.get(name);
        return value == null ? 0 : value;
    }

    public static void setDouble(final String name, final double value) {
        doubles.put(name, value);
    }

    public static String getString(final String name) {
        final String value = strings.get(name);
        return value == null ? "" : value;
    }

    public static void setString(final String name, final String value) {
        if (value == null) {
            strings.remove(name);
        } else {
            strings.put(name, value);
        }
    }

    public static void clear() {
        longs.clear();
        doubles.clear();
        strings.clear();
    }
}
