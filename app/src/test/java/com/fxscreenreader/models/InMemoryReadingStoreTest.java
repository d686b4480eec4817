package com.fxscreenreader.models;

import com.fxscreenreader.utilitymodels.Pref;

import org.junit.After;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class InMemoryReadingStoreTest {

    private final InMemoryReadingStore store = new InMemoryReadingStore();

    @After
    public void tearDown() {
        Pref.resetOverrides();
    }

    private static GlucoseReading reading(final double mgdl, final long timestamp) {
        return GlucoseReading.create(mgdl, GlucoseUnit.MG_DL, GlucoseTrend.FLAT, "test", timestamp);
    }

    @Test
    public void emptyStore() {
        assertNull(store.latest());
        assertTrue(store.latest(3).isEmpty());
        assertEquals(0, store.count());
    }

    @Test
    public void sameTimestampReplaces() {
        store.insert(reading(100, 1000));
        store.insert(reading(110, 1000));
        store.insert(null);

        assertEquals(1, store.count());
        assertEquals(110.0, store.latest().getValue(), 0.0);
    }

    @Test
    public void queriesAreOrdered() {
        store.insert(reading(120, 3000));
        store.insert(reading(100, 1000));
        store.insert(reading(110, 2000));

        final List<GlucoseReading> newest = store.latest(2);
        assertEquals(3000, newest.get(0).getTimestamp());
        assertEquals(2000, newest.get(1).getTimestamp());

        final List<GlucoseReading> range = store.inRange(1000, 3000);
        assertEquals(2, range.size());
        assertEquals(1000, range.get(0).getTimestamp());
        assertEquals(2000, range.get(1).getTimestamp());
        assertTrue(store.inRange(3000, 1000).isEmpty());
    }

    @Test
    public void syncTracking() {
        store.insert(reading(100, 1000));
        store.insert(reading(110, 2000));

        store.markSynced(Arrays.asList(1000L, 5000L));

        final List<GlucoseReading> pending = store.unsynced();
        assertEquals(1, pending.size());
        assertEquals(2000, pending.get(0).getTimestamp());
    }

    @Test
    public void deleteOlderThanKeepsBoundary() {
        store.insert(reading(100, 1000));
        store.insert(reading(110, 2000));
        store.insert(reading(120, 3000));

        assertEquals(1, store.deleteOlderThan(2000));
        assertEquals(2, store.count());
        assertEquals(0, store.deleteOlderThan(500));
    }

    @Test
    public void timeInRange() {
        store.insert(reading(60, 1000));
        store.insert(reading(100, 2000));
        store.insert(reading(150, 3000));
        store.insert(reading(250, 4000));

        final TimeInRange tir = TimeInRange.of(store.inRange(0, 5000), 70, 180);

        assertEquals(4, tir.getCount());
        assertEquals(25.0, tir.getLowPercent(), 0.001);
        assertEquals(50.0, tir.getInRangePercent(), 0.001);
        assertEquals(25.0, tir.getHighPercent(), 0.001);
        assertEquals(140.0, tir.getAverageMgdl(), 0.001);

        assertEquals(0, TimeInRange.of(store.inRange(5000, 6000), 70, 180).getCount());
    }

    @Test
    public void timeInRangeUsesConfiguredThresholds() {
        store.insert(reading(60, 1000));
        store.insert(reading(100, 2000));
        store.insert(reading(150, 3000));

        assertEquals(100.0 / 3, TimeInRange.forPeriod(store, 0, 5000).getLowPercent(), 0.001);

        Pref.setDouble(TimeInRange.PREF_HIGH, 140);
        final TimeInRange strict = TimeInRange.forPeriod(store, 0, 5000);
        assertEquals(100.0 / 3, strict.getHighPercent(), 0.001);
        assertEquals(100.0 / 3, strict.getInRangePercent(), 0.001);
    }
}
