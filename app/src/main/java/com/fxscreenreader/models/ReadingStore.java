package com.fxscreenreader.models;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for validated readings, keyed by timestamp.
 */
public interface ReadingStore {

    /**
     * Insert, replacing any reading with the same timestamp. A replaced reading loses its synced mark.
     */
    void insert(GlucoseReading reading);

    GlucoseReading latest();

    /**
     * Most recent readings, newest first.
     */
    List<GlucoseReading> latest(int limit);

    /**
     * Readings with start <= timestamp < end, oldest first.
     */
    List<GlucoseReading> inRange(long start, long end);

    /**
     * Readings not yet uploaded, oldest first.
     */
    List<GlucoseReading> unsynced();

    void markSynced(Collection<Long> timestamps);

    /**
     * @return number of readings removed
     */
    int deleteOlderThan(long timestamp);

    int count();
}
