package com.fxscreenreader.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class InMemoryReadingStore implements ReadingStore {

    private static final String TAG = InMemoryReadingStore.class.getSimpleName();

    private static final class Row {
        final GlucoseReading reading;
        boolean synced;

        Row(final GlucoseReading reading) {
            this.reading = reading;
        }
    }

    private final TreeMap<Long, Row> rows = new TreeMap<>();

    @Override
    public synchronized void insert(final GlucoseReading reading) {
        if (reading == null) return;
        if (rows.put(reading.getTimestamp(), new Row(reading)) != null) {
            UserError.Log.d(TAG, "Replaced reading at " + JoH.dateTimeText(reading.getTimestamp()));
        }
    }

    @Override
    public synchronized GlucoseReading latest() {
        final Map.Entry<Long, Row> last = rows.lastEntry();
        return last == null ? null : last.getValue().reading;
    }

    @Override
    public synchronized List<GlucoseReading> latest(final int limit) {
        final List<GlucoseReading> result = new ArrayList<>();
        for (final Row row : rows.descendingMap().values()) {
            if (result.size() >= limit) break;
            result.add(row.reading);
        }
        return result;
    }

    @Override
    public synchronized List<GlucoseReading> inRange(final long start, final long end) {
        final List<GlucoseReading> result = new ArrayList<>();
        if (end <= start) return result;
        for (final Row row : rows.subMap(start, true, end, false).values()) {
            result.add(row.reading);
        }
        return result;
    }

    @Override
    public synchronized List<GlucoseReading> unsynced() {
        final List<GlucoseReading> result = new ArrayList<>();
        for (final Row row : rows.values()) {
            if (!row.synced) result.add(row.reading);
        }
        return result;
    }

    @Override
    public synchronized void markSynced(final Collection<Long> timestamps) {
        for (final Long timestamp : timestamps) {
            final Row row = rows.get(timestamp);
            if (row != null) row.synced = true;
        }
    }

    @Override
    public synchronized int deleteOlderThan(final long timestamp) {
        int removed = 0;
        final Iterator<Long> keys = rows.headMap(timestamp, false).keySet().iterator();
        while (keys.hasNext()) {
            keys.next();
            keys.remove();
            removed++;
        }
        return removed;
    }

    @Override
    public synchronized int count() {
        return rows.size();
    }
}
