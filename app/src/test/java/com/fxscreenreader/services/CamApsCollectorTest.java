package com.fxscreenreader.services;

import com.fxscreenreader.cgm.camaps.CamApsScreens;
import com.fxscreenreader.cgm.camaps.GraphOcrInterpolator;
import com.fxscreenreader.models.AgeInfo;
import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.GraphTreatment;
import com.fxscreenreader.models.InMemoryReadingStore;
import com.fxscreenreader.models.OcrTextBlock;
import com.fxscreenreader.models.SimpleUiNode;
import com.fxscreenreader.models.UiNode;
import com.fxscreenreader.nightscout.NightscoutClient;
import com.fxscreenreader.nightscout.NightscoutUploader;
import com.fxscreenreader.utilitymodels.Constants;
import com.fxscreenreader.utilitymodels.PersistentStore;
import com.fxscreenreader.utilitymodels.Pref;
import com.fxscreenreader.utilitymodels.PumpState;
import com.fxscreenreader.utilitymodels.PumpStatus;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

import static com.fxscreenreader.cgm.camaps.CamApsScreens.closeButton;
import static com.fxscreenreader.cgm.camaps.CamApsScreens.withTexts;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class CamApsCollectorTest {

    // 2024-03-10T22:45:00Z
    private static final long NOW = 1_710_110_700_000L;

    enum Screen {
        ALERT,
        MAIN,
        DIALOG,
        MENU,
        GRAPH
    }

    /**
     * Moves between screens the way the app does when its buttons are clicked.
     */
    static class FakeHost implements UiHost {
        final SimpleUiNode info = CamApsScreens.infoButton();
        final SimpleUiNode menu = CamApsScreens.menuButton();
        final SimpleUiNode rotate = CamApsScreens.rotateButton();
        final SimpleUiNode dismiss = SimpleUiNode.button("Verstanden", null);

        UiNode main;
        UiNode dialog = withTexts(closeButton());
        UiNode sideMenu = withTexts(closeButton());
        final UiNode alert = withTexts(dismiss, "Sensor warming up");
        final UiNode graph = SimpleUiNode.group(SimpleUiNode.text("Glucose graph"), rotate);

        Screen screen = Screen.MAIN;
        boolean windowAvailable = true;
        final List<UiNode> clicks = new ArrayList<>();
        int globalBacks;

        FakeHost(final String value) {
            main = CamApsScreens.mainScreen(value, "mg/dL", "↗", info, menu, rotate);
        }

        @Override
        public UiNode getRootInActiveWindow() {
            if (!windowAvailable) return null;
            switch (screen) {
                case ALERT:
                    return alert;
                case DIALOG:
                    return dialog;
                case MENU:
                    return sideMenu;
                case GRAPH:
                    return graph;
                default:
                    return main;
            }
        }

        @Override
        public boolean click(final UiNode node) {
            clicks.add(node);
            if (node == info) {
                screen = Screen.DIALOG;
            } else if (node == menu) {
                screen = Screen.MENU;
            } else if (node == rotate) {
                screen = screen == Screen.GRAPH ? Screen.MAIN : Screen.GRAPH;
            } else {
                screen = Screen.MAIN;
            }
            return true;
        }

        @Override
        public boolean performGlobalBack() {
            globalBacks++;
            screen = Screen.MAIN;
            return true;
        }

        @Override
        public BufferedImage takeScreenshot() {
            return new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        }
    }

    private final InMemoryReadingStore store = new InMemoryReadingStore();
    private final List<OcrTextBlock> ocrBlocks = new ArrayList<>();
    private final OcrEngine ocr = image -> ocrBlocks;
    private final long[] clock = {NOW};

    private FakeHost host;
    private CamApsCollector collector;

    @Before
    public void setUp() {
        PersistentStore.clear();
        PumpStatus.reset();
        Pref.resetOverrides();
        host = new FakeHost("142");
        collector = new CamApsCollector(host, ocr, store, null, null, millis -> {
        }, new GraphOcrInterpolator(ZoneOffset.UTC));
        collector.setClock(() -> clock[0]);
    }

    @After
    public void tearDown() {
        Pref.resetOverrides();
    }

    private CamApsCollector.Outcome cycleAfter(final long ms) {
        clock[0] += ms;
        return collector.runCycle();
    }

    @Test
    public void storesReadingEnrichedFromDialog() {
        host.dialog = withTexts(closeButton(),
                "Reservoir: 120 U",
                "Pump battery: 80%",
                "Active Insulin: 1.2 U",
                "Sensor data: 2 minutes ago");

        assertEquals(CamApsCollector.Outcome.STORED, collector.runCycle());

        final GlucoseReading reading = store.latest();
        assertEquals(142.0, reading.getValue(), 0.0);
        assertEquals(NOW, reading.getTimestamp());
        assertEquals(Double.valueOf(120), reading.getReservoir());
        assertEquals(Integer.valueOf(80), reading.getPumpBattery());
        assertEquals(Integer.valueOf(2), reading.getSensorDataMinutesAgo());
        assertEquals(Screen.MAIN, host.screen);
        assertEquals(0, host.globalBacks);
        assertEquals(120.0, PumpStatus.getReservoir(), 0.0);
        assertTrue(PumpStatus.getPumpStates().contains(PumpState.AUTO_MODE));
    }

    @Test
    public void readsAreSpacedAtLeastThirtySeconds() {
        assertEquals(CamApsCollector.Outcome.STORED, collector.runCycle());
        assertEquals(CamApsCollector.Outcome.TOO_SOON, cycleAfter(10 * Constants.SECOND_IN_MS));
        assertEquals(CamApsCollector.Outcome.STORED, cycleAfter(31 * Constants.SECOND_IN_MS));
        assertEquals(2, store.count());
    }

    @Test
    public void noWindow() {
        host.windowAvailable = false;

        assertEquals(CamApsCollector.Outcome.NO_WINDOW, collector.runCycle());
        assertTrue(host.clicks.isEmpty());
    }

    @Test
    public void signalLossIsRejectedWithoutTouchingTheApp() {
        host.main = CamApsScreens.mainScreen("---", "mg/dL", null, host.info, host.menu, host.rotate);

        assertEquals(CamApsCollector.Outcome.REJECTED, collector.runCycle());
        assertTrue(host.clicks.isEmpty());
        assertEquals(0, store.count());
    }

    @Test
    public void alertCoveringMainScreenIsDismissed() {
        host.screen = Screen.ALERT;

        assertEquals(CamApsCollector.Outcome.STORED, collector.runCycle());
        assertEquals(host.dismiss, host.clicks.get(0));
        assertEquals(1, store.count());
    }

    @Test
    public void staleSensorDataIsNotStored() {
        host.dialog = withTexts(closeButton(), "Sensor data: 20 minutes ago");

        assertEquals(CamApsCollector.Outcome.STALE, collector.runCycle());
        assertEquals(0, store.count());
        assertEquals(Screen.MAIN, host.screen);
    }

    @Test
    public void bolusSeenOnStaleCycleIsKeptForNextStoredReading() {
        host.dialog = withTexts(closeButton(), "Bolus: 2.0 U 5 minutes ago", "Sensor data: 20 minutes ago");
        assertEquals(CamApsCollector.Outcome.STALE, collector.runCycle());

        host.dialog = withTexts(closeButton(), "Bolus: 2.0 U 10 minutes ago", "Sensor data: 1 minute ago");
        assertEquals(CamApsCollector.Outcome.STORED, cycleAfter(5 * Constants.MINUTE_IN_MS));

        final GlucoseReading stored = store.latest();
        assertTrue(stored.hasBolus());
        assertEquals(Double.valueOf(2.0), stored.getBolusAmount());

        host.dialog = withTexts(closeButton(), "Bolus: 2.0 U 15 minutes ago", "Sensor data: 1 minute ago");
        assertEquals(CamApsCollector.Outcome.STORED, cycleAfter(5 * Constants.MINUTE_IN_MS));
        assertFalse(store.latest().hasBolus());
    }

    @Test
    public void repeatedValueWithoutSensorAgeIsJammed() {
        for (int i = 0; i < 7; i++) {
            assertEquals(CamApsCollector.Outcome.STORED, cycleAfter(5 * Constants.MINUTE_IN_MS));
        }
        assertEquals(CamApsCollector.Outcome.JAMMED, cycleAfter(5 * Constants.MINUTE_IN_MS));
        assertEquals(7, store.count());
    }

    @Test
    public void repeatedValueWithFreshSensorAgeIsNotJammed() {
        host.dialog = withTexts(closeButton(), "Sensor data: 1 minute ago");

        for (int i = 0; i < 10; i++) {
            assertEquals(CamApsCollector.Outcome.STORED, cycleAfter(5 * Constants.MINUTE_IN_MS));
        }
    }

    @Test
    public void dialogWithoutCloseButtonFallsBackToGlobalBack() {
        host.dialog = withTexts(null, "Reservoir: 120 U");

        collector.runCycle();

        assertTrue(host.globalBacks >= 1);
        assertEquals(Screen.MAIN, host.screen);
    }

    @Test
    public void agesAreReadFromSideMenu() {
        host.sideMenu = withTexts(closeButton(),
                "Companion CGM", "FreeStyle Libre 3 Plus ABC123",
                "Anlage seit", "5d 6h 58min",
                "Füllung seit", "2 Tage 3 Stunden");

        final AgeInfo ages = collector.checkAges(NOW);

        assertNotNull(ages.getSensor());
        assertEquals("FreeStyle Libre 3 Plus ABC123", ages.getSensor().getSerialNumber());
        assertEquals(NOW - 2 * Constants.DAY_IN_MS - 3 * Constants.HOUR_IN_MS, ages.getInsulin().getFillTime());
        assertEquals(Screen.MAIN, host.screen);
    }

    @Test
    public void latestMealIsTakenFromGraphOnce() {
        ocrBlocks.addAll(Arrays.asList(
                new OcrTextBlock("21:00", 80, 900, 120, 930),
                new OcrTextBlock("22:00", 280, 900, 320, 930),
                new OcrTextBlock("30g", 130, 400, 170, 430),
                new OcrTextBlock("45g", 180, 400, 220, 430)));

        final GraphTreatment meal = collector.checkGraph(NOW);

        assertEquals(Integer.valueOf(45), meal.getCarbsGrams());
        assertEquals(NOW - 75 * Constants.MINUTE_IN_MS, meal.getTimestamp());
        assertEquals(Screen.MAIN, host.screen);
        assertEquals(2, host.clicks.size());

        assertNull(collector.checkGraph(NOW + 10 * Constants.MINUTE_IN_MS));
    }

    @Test
    public void failedMealUploadIsOfferedAgain() throws IOException {
        ocrBlocks.addAll(Arrays.asList(
                new OcrTextBlock("21:00", 80, 900, 120, 930),
                new OcrTextBlock("22:00", 280, 900, 320, 930),
                new OcrTextBlock("45g", 180, 400, 220, 430)));
        final MockWebServer server = new MockWebServer();
        server.start();
        try {
            Pref.setBoolean(NightscoutUploader.PREF_ENABLED, true);
            final NightscoutUploader uploader =
                    new NightscoutUploader(new NightscoutClient(server.url("/").toString(), "password"), store);
            collector = new CamApsCollector(host, ocr, store, uploader, null, millis -> {
            }, new GraphOcrInterpolator(ZoneOffset.UTC));
            collector.setClock(() -> clock[0]);
            server.enqueue(new MockResponse().setResponseCode(500));
            server.enqueue(new MockResponse().setBody("{}"));

            assertNull(collector.checkGraph(NOW));

            final GraphTreatment meal = collector.checkGraph(NOW + 10 * Constants.MINUTE_IN_MS);
            assertNotNull(meal);
            assertEquals(Integer.valueOf(45), meal.getCarbsGrams());
            assertEquals(2, server.getRequestCount());

            assertNull(collector.checkGraph(NOW + 20 * Constants.MINUTE_IN_MS));
            assertEquals(2, server.getRequestCount());
        } finally {
            server.shutdown();
        }
    }

    @Test
    public void graphPassRunsOnlyWhenEnabled() {
        ocrBlocks.add(new OcrTextBlock("21:00", 80, 900, 120, 930));

        collector.runCycle();
        assertFalse(host.clicks.contains(host.rotate));

        Pref.setBoolean(CamApsCollector.PREF_GRAPH_CHECK_ENABLED, true);
        cycleAfter(5 * Constants.MINUTE_IN_MS);
        assertTrue(host.clicks.contains(host.rotate));
        assertEquals(Screen.MAIN, host.screen);
    }
}
