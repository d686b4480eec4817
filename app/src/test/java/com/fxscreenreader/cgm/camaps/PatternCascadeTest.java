package com.fxscreenreader.cgm.camaps;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class PatternCascadeTest {

    private final PatternCascade<Integer> cascade = PatternCascade.<Integer>builder()
            .then("vor (\\d+) Minuten", m -> Integer.valueOf(m.group(1)))
            .then("(\\d+) minutes ago", m -> m.group(1).length() > 3 ? null : Integer.valueOf(m.group(1)))
            .then("(\\d+)", m -> -1)
            .build();

    @Test
    public void firstMatchingStepWins() {
        assertEquals(Integer.valueOf(12), cascade.match("VOR 12 MINUTEN"));
        assertEquals(Integer.valueOf(4), cascade.match("Sensor data: 4 minutes ago"));
        assertEquals(Integer.valueOf(-1), cascade.match("42"));
        assertEquals(3, cascade.size());
    }

    @Test
    public void nullResultFallsThroughToNextStep() {
        assertEquals(Integer.valueOf(-1), cascade.match("12345 minutes ago"));
    }

    @Test
    public void noMatch() {
        assertNull(cascade.match("nothing here"));
        assertNull(cascade.match(null));
    }
}
