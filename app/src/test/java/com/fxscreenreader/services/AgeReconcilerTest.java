package com.fxscreenreader.services;

import com.fxscreenreader.utilitymodels.Constants;
import com.fxscreenreader.utilitymodels.Pref;

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AgeReconcilerTest {

    private static final long LOCAL = 1_710_072_000_000L;

    private final AgeReconciler reconciler = new AgeReconciler(1.5);

    @After
    public void tearDown() {
        Pref.resetOverrides();
    }

    @Test
    public void noRemoteTimeUploads() {
        final AgeReconciler.Decision decision = reconciler.decide(LOCAL, null);

        assertEquals(AgeReconciler.Action.UPLOADED_NO_PREVIOUS, decision.getAction());
        assertTrue(decision.needsUpload());
        assertEquals("uploaded (no previous)", decision.describe());
    }

    @Test
    public void withinToleranceIsInSync() {
        final AgeReconciler.Decision decision = reconciler.decide(LOCAL, LOCAL - 90 * Constants.MINUTE_IN_MS);

        assertEquals(AgeReconciler.Action.IN_SYNC, decision.getAction());
        assertFalse(decision.needsUpload());
        assertEquals("in_sync", decision.describe());
    }

    @Test
    public void beyondToleranceEitherDirectionUpdates() {
        final AgeReconciler.Decision later = reconciler.decide(LOCAL, LOCAL + 3 * Constants.HOUR_IN_MS);
        final AgeReconciler.Decision earlier = reconciler.decide(LOCAL, LOCAL - 91 * Constants.MINUTE_IN_MS);

        assertEquals(AgeReconciler.Action.UPDATED, later.getAction());
        assertEquals("updated (diff was 3.0h)", later.describe());
        assertEquals(AgeReconciler.Action.UPDATED, earlier.getAction());
    }

    @Test
    public void toleranceIsConfigurable() {
        Pref.setDouble(AgeReconciler.PREF_TOLERANCE, 4);

        final AgeReconciler configured = new AgeReconciler();

        assertEquals(4.0, configured.getToleranceHours(), 0.0);
        assertFalse(configured.decide(LOCAL, LOCAL + 3 * Constants.HOUR_IN_MS).needsUpload());
    }
}
