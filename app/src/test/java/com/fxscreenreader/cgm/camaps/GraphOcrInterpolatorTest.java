package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.GraphTreatment;
import com.fxscreenreader.models.OcrTextBlock;
import com.fxscreenreader.models.TimeLabel;
import com.fxscreenreader.utilitymodels.Constants;

import org.junit.Test;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class GraphOcrInterpolatorTest {

    // 2024-03-10T22:45:00Z
    private static final long EVENING = 1_710_110_700_000L;

    private final GraphOcrInterpolator interpolator = new GraphOcrInterpolator(ZoneOffset.UTC);

    private static OcrTextBlock at(final String text, final int centerX, final int top) {
        return new OcrTextBlock(text, centerX - 20, top, centerX + 20, top + 30);
    }

    @Test
    public void carbsBetweenLabels() {
        final List<GraphTreatment> treatments = interpolator.interpolate(Arrays.asList(
                at("21:00", 100, 900),
                at("22:00", 300, 900),
                at("45g", 200, 400)), EVENING);

        assertEquals(1, treatments.size());
        assertEquals(Integer.valueOf(45), treatments.get(0).getCarbsGrams());
        assertTrue(treatments.get(0).hasCarbs());
        // 21:30 the same day
        assertEquals(EVENING - 75 * Constants.MINUTE_IN_MS, treatments.get(0).getTimestamp());
    }

    @Test
    public void midnightWrapLandsOnPreviousDay() {
        final long justAfterMidnight = EVENING + 115 * Constants.MINUTE_IN_MS;

        final List<GraphTreatment> treatments = interpolator.interpolate(Arrays.asList(
                at("23:00", 100, 900),
                at("00:00", 300, 900),
                at("20 g", 200, 350)), justAfterMidnight);

        assertEquals(1, treatments.size());
        // 23:30 on the evening before
        assertEquals(EVENING + 45 * Constants.MINUTE_IN_MS, treatments.get(0).getTimestamp());
    }

    @Test
    public void markerRightOfLastLabelIsExtrapolated() {
        final long now = EVENING + 60 * Constants.MINUTE_IN_MS;

        final List<GraphTreatment> treatments = interpolator.interpolate(Arrays.asList(
                at("21:00", 100, 900),
                at("22:00", 300, 900),
                at("30g", 600, 300)), now);

        assertEquals(EVENING + 45 * Constants.MINUTE_IN_MS, treatments.get(0).getTimestamp());
    }

    @Test
    public void needsTwoTimeLabels() {
        assertTrue(interpolator.interpolate(Arrays.asList(at("21:00", 100, 900), at("45g", 200, 400)), EVENING).isEmpty());
        assertTrue(interpolator.interpolate(new ArrayList<>(), EVENING).isEmpty());
        assertTrue(interpolator.interpolate(null, EVENING).isEmpty());
    }

    @Test
    public void glucoseUnitsAndImplausibleAmountsAreIgnored() {
        final List<GraphTreatment> treatments = interpolator.interpolate(Arrays.asList(
                at("21:00", 100, 900),
                at("22:00", 300, 900),
                at("180 mg/dL", 150, 200),
                at("250g", 200, 400),
                at("0g", 220, 400),
                at("12g", 250, 400)), EVENING);

        assertEquals(1, treatments.size());
        assertEquals(Integer.valueOf(12), treatments.get(0).getCarbsGrams());
    }

    @Test
    public void axisThresholdFollowsMostPopulatedLabelRow() {
        assertEquals(820, GraphOcrInterpolator.axisThreshold(Arrays.asList(
                at("21:00", 100, 900),
                at("22:00", 300, 920),
                at("23:00", 500, 940),
                at("12:30", 50, 100))));
        assertEquals(GraphOcrInterpolator.DEFAULT_AXIS_THRESHOLD,
                GraphOcrInterpolator.axisThreshold(Arrays.asList(at("45g", 200, 400))));
    }

    @Test
    public void invalidClockTextIsNotALabel() {
        final List<GraphTreatment> treatments = interpolator.interpolate(Arrays.asList(
                at("21:00", 100, 900),
                at("25:99", 200, 900),
                at("22:00", 300, 900),
                at("45g", 200, 400)), EVENING);

        assertEquals(EVENING - 75 * Constants.MINUTE_IN_MS, treatments.get(0).getTimestamp());
    }

    @Test
    public void interpolateTimeUsesSurroundingPair() {
        final List<TimeLabel> labels = Arrays.asList(
                new TimeLabel(20, 0, 0), new TimeLabel(21, 0, 100), new TimeLabel(22, 0, 200));

        assertEquals(Long.valueOf(EVENING - 75 * Constants.MINUTE_IN_MS),
                interpolator.interpolateTime(150, labels, EVENING));
    }
}
