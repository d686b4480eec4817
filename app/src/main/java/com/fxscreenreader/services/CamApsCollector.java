package com.fxscreenreader.services;

import com.fxscreenreader.cgm.camaps.AgeMenuExtractor;
import com.fxscreenreader.cgm.camaps.DetailDialogExtractor;
import com.fxscreenreader.cgm.camaps.ElementFinder;
import com.fxscreenreader.cgm.camaps.ElementType;
import com.fxscreenreader.cgm.camaps.GraphOcrInterpolator;
import com.fxscreenreader.cgm.camaps.MainScreenExtractor;
import com.fxscreenreader.cgm.camaps.MainScreenResult;
import com.fxscreenreader.models.AgeInfo;
import com.fxscreenreader.models.DetailField;
import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.GraphTreatment;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.OcrTextBlock;
import com.fxscreenreader.models.ReadingStore;
import com.fxscreenreader.models.UiNode;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.nightscout.AgeSync;
import com.fxscreenreader.nightscout.NightscoutUploader;
import com.fxscreenreader.utilitymodels.Constants;
import com.fxscreenreader.utilitymodels.PersistentStore;
import com.fxscreenreader.utilitymodels.Pref;
import com.fxscreenreader.utilitymodels.PumpStatus;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.function.LongSupplier;

import lombok.val;

/**
 * UI based collector for CamAPS FX.
 * <p>
 * One call to {@link #runCycle()} reads the main screen, opens the information dialog for pump
 * details, and on their own cadences reads sensor and reservoir ages from the side menu and meal
 * markers from the landscape graph. Every surface that gets opened is closed again, whatever happens
 * while it is open.
 */
public class CamApsCollector {

    private static final String TAG = CamApsCollector.class.getSimpleName();

    private static final String STORE_LAST_VALUE = "CAMAPS_STORE_LAST_VALUE";
    private static final String STORE_LAST_REPEAT = "CAMAPS_STORE_LAST_REPEAT";
    private static final String STORE_LAST_READ = "CAMAPS_STORE_LAST_READ";
    private static final String STORE_LAST_AGE_CHECK = "CAMAPS_STORE_LAST_AGE_CHECK";
    private static final String STORE_LAST_GRAPH_CHECK = "CAMAPS_STORE_LAST_GRAPH_CHECK";

    public static final String PREF_AGE_CHECK_INTERVAL = "age_check_interval_minutes";
    public static final String PREF_GRAPH_CHECK_ENABLED = "graph_check_enabled";
    public static final String PREF_GRAPH_CHECK_INTERVAL = "graph_check_interval_minutes";
    public static final String PREF_MAX_SENSOR_DATA_AGE = "max_sensor_data_age_minutes";

    static final long MIN_READ_SPACING_MS = 30 * Constants.SECOND_IN_MS;
    static final long DIALOG_SETTLE_MS = 1500;
    static final long MENU_SETTLE_MS = 1000;
    static final long GRAPH_SETTLE_MS = 3000;
    static final long SCREENSHOT_SETTLE_MS = 1000;
    static final long RETRY_DELAY_MS = 1000;
    static final int RETRY_ATTEMPTS = 3;
    private static final int JAM_THRESHOLD = 6;

    public enum Outcome {
        TOO_SOON,
        NO_WINDOW,
        REJECTED,
        STALE,
        JAMMED,
        STORED
    }

    private final UiHost host;
    private final OcrEngine ocr;
    private final ReadingStore store;
    private final NightscoutUploader uploader;
    private final AgeSync ageSync;
    private final Sleeper sleeper;

    private final MainScreenExtractor mainScreen = new MainScreenExtractor();
    private final DetailDialogExtractor detailDialog = new DetailDialogExtractor();
    private final AgeMenuExtractor ageMenu = new AgeMenuExtractor();
    private final GraphOcrInterpolator graph;
    private final BolusDeduplicator bolusDeduplicator = new BolusDeduplicator();
    private final MealDeduplicator mealDeduplicator = new MealDeduplicator();

    private LongSupplier clock = JoH::tsl;

    /**
     * @param ocr      may be null, the graph pass is skipped then
     * @param uploader may be null when Nightscout is not used
     * @param ageSync  may be null when Nightscout is not used
     */
    public CamApsCollector(final UiHost host, final OcrEngine ocr, final ReadingStore store,
                           final NightscoutUploader uploader, final AgeSync ageSync, final Sleeper sleeper) {
        this(host, ocr, store, uploader, ageSync, sleeper, new GraphOcrInterpolator());
    }

    CamApsCollector(final UiHost host, final OcrEngine ocr, final ReadingStore store, final NightscoutUploader uploader,
                    final AgeSync ageSync, final Sleeper sleeper, final GraphOcrInterpolator graph) {
        this.host = host;
        this.ocr = ocr;
        this.store = store;
        this.uploader = uploader;
        this.ageSync = ageSync;
        this.sleeper = sleeper;
        this.graph = graph;
    }

    void setClock(final LongSupplier clock) {
        this.clock = clock;
    }

    public Outcome runCycle() {
        final long now = clock.getAsLong();
        final long lastRead = PersistentStore.getLong(STORE_LAST_READ);
        if (lastRead > 0 && now - lastRead < MIN_READ_SPACING_MS) {
            UserError.Log.d(TAG, "Skipping read, last one was " + (now - lastRead) + "ms ago");
            return Outcome.TOO_SOON;
        }
        PersistentStore.setLong(STORE_LAST_READ, now);

        UiNode root = host.getRootInActiveWindow();
        if (root == null) {
            UserError.Log.d(TAG, "No active window");
            return Outcome.NO_WINDOW;
        }

        MainScreenResult result = mainScreen.extract(root, now);
        if (!result.isAccepted() && !result.isSafetyRejection() && dismissAlert(root)) {
            root = host.getRootInActiveWindow();
            result = mainScreen.extract(root, now);
        }
        if (!result.isAccepted()) {
            return Outcome.REJECTED;
        }
        PumpStatus.setPumpStates(result.getPumpStates());

        GlucoseReading reading = readDetails(root, result.getReading());
        reading = bolusDeduplicator.filter(reading, now);

        final Outcome outcome = handleNewValue(reading, now);
        if (outcome != Outcome.STORED) {
            return outcome;
        }

        if (isDue(STORE_LAST_AGE_CHECK, Pref.getLong(PREF_AGE_CHECK_INTERVAL, 60), now)) {
            checkAges(now);
        }
        if (ocr != null && Pref.getBooleanDefaultFalse(PREF_GRAPH_CHECK_ENABLED)
                && isDue(STORE_LAST_GRAPH_CHECK, Pref.getLong(PREF_GRAPH_CHECK_INTERVAL, 30), now)) {
            checkGraph(now);
        }
        if (uploader != null) {
            uploader.cleanup(now);
        }
        return Outcome.STORED;
    }

    Outcome handleNewValue(final GlucoseReading reading, final long now) {
        final Integer sensorAge = reading.getSensorDataMinutesAgo();
        final int maxSensorAge = Pref.getInt(PREF_MAX_SENSOR_DATA_AGE, 15);
        if (sensorAge != null && sensorAge > maxSensorAge) {
            UserError.Log.e(TAG, "Sensor data is " + sensorAge + " minutes old, not using " + reading);
            return Outcome.STALE;
        }
        // a fresh sensor data age from the dialog vouches for a repeated value
        if (sensorAge == null && isJammed((long) reading.getMgdl())) {
            UserError.Log.wtf(TAG, "Apparently value is jammed at: " + reading.getFormattedValue(reading.getUnit()));
            return Outcome.JAMMED;
        }

        UserError.Log.d(TAG, "Inserting new value " + reading);
        store.insert(reading);
        bolusDeduplicator.remember(reading, now);
        final EnumSet<PumpStatus.Change> changes = PumpStatus.update(reading);
        upload(reading, changes);
        return Outcome.STORED;
    }

    // note this method actually updates the stored value
    private boolean isJammed(final long mgdl) {
        val previousValue = PersistentStore.getLong(STORE_LAST_VALUE);
        if (previousValue == mgdl) {
            PersistentStore.incrementLong(STORE_LAST_REPEAT);
        } else {
            PersistentStore.setLong(STORE_LAST_REPEAT, 0);
        }
        PersistentStore.setLong(STORE_LAST_VALUE, mgdl);
        val lastRepeat = PersistentStore.getLong(STORE_LAST_REPEAT);
        UserError.Log.d(TAG, "Last repeat: " + lastRepeat);
        return lastRepeat > JAM_THRESHOLD;
    }

    private void upload(final GlucoseReading reading, final EnumSet<PumpStatus.Change> changes) {
        if (uploader == null || !NightscoutUploader.isEnabled()) return;
        try {
            uploader.sync(reading, changes);
        } catch (IOException e) {
            UserError.Log.e(TAG, "Nightscout upload failed, will retry next cycle: " + e.getMessage());
        }
    }

    /**
     * Open the information dialog and merge its values into the reading. Any failure leaves the
     * main screen reading as it was.
     */
    GlucoseReading readDetails(final UiNode root, final GlucoseReading reading) {
        final UiNode infoButton = ElementFinder.find(root, ElementType.INFO_BUTTON);
        if (infoButton == null || !host.click(infoButton)) {
            UserError.Log.d(TAG, "Information dialog not available");
            return reading;
        }
        try {
            sleeper.sleep(DIALOG_SETTLE_MS);
            EnumMap<DetailField, Double> details = new EnumMap<>(DetailField.class);
            for (int attempt = 1; attempt <= RETRY_ATTEMPTS; attempt++) {
                final UiNode dialog = host.getRootInActiveWindow();
                if (dialog != null) {
                    details = detailDialog.extract(dialog);
                    if (!details.isEmpty()) break;
                }
                UserError.Log.d(TAG, "Information dialog not readable yet, attempt " + attempt);
                if (attempt < RETRY_ATTEMPTS) sleeper.sleep(RETRY_DELAY_MS);
            }
            return reading.withDetails(details);
        } catch (RuntimeException e) {
            UserError.Log.e(TAG, "Exception reading information dialog: " + e);
            return reading;
        } finally {
            closeSurface();
        }
    }

    /**
     * Open the side menu and read sensor and reservoir ages. Returns null when the menu cannot be opened.
     */
    AgeInfo checkAges(final long now) {
        PersistentStore.setLong(STORE_LAST_AGE_CHECK, now);
        final UiNode root = host.getRootInActiveWindow();
        final UiNode menuButton = ElementFinder.find(root, ElementType.MENU_BUTTON);
        if (menuButton == null || !host.click(menuButton)) {
            UserError.Log.d(TAG, "Menu button not available");
            return null;
        }
        AgeInfo ages = null;
        try {
            sleeper.sleep(MENU_SETTLE_MS);
            final UiNode menu = host.getRootInActiveWindow();
            if (menu != null) {
                ages = ageMenu.extract(menu, now);
            }
        } catch (RuntimeException e) {
            UserError.Log.e(TAG, "Exception reading side menu: " + e);
        } finally {
            closeSurface();
        }
        if (ages != null && !ages.isEmpty() && ageSync != null && NightscoutUploader.isEnabled()) {
            ageSync.sync(ages);
        }
        return ages;
    }

    /**
     * Rotate to the landscape graph, read the most recent meal marker and upload it unless it was seen before.
     */
    GraphTreatment checkGraph(final long now) {
        PersistentStore.setLong(STORE_LAST_GRAPH_CHECK, now);
        final UiNode root = host.getRootInActiveWindow();
        final UiNode rotate = ElementFinder.find(root, ElementType.ROTATE_BUTTON);
        if (rotate == null || !host.click(rotate)) {
            UserError.Log.d(TAG, "Rotate button not available");
            return null;
        }
        GraphTreatment latest = null;
        try {
            sleeper.sleep(GRAPH_SETTLE_MS);
            sleeper.sleep(SCREENSHOT_SETTLE_MS);
            final BufferedImage image = host.takeScreenshot();
            if (image == null) {
                UserError.Log.e(TAG, "Screenshot failed");
                return null;
            }
            final List<OcrTextBlock> blocks = ocr.recognize(image);
            for (final GraphTreatment treatment : graph.interpolate(blocks, now)) {
                if (treatment.hasCarbs() && (latest == null || treatment.getTimestamp() > latest.getTimestamp())) {
                    latest = treatment;
                }
            }
        } catch (IOException | RuntimeException e) {
            UserError.Log.e(TAG, "Exception reading graph: " + e);
            return null;
        } finally {
            closeGraph();
        }

        if (mealDeduplicator.isDuplicate(latest)) {
            return null;
        }
        if (uploader != null && NightscoutUploader.isEnabled()) {
            try {
                uploader.uploadMeal(latest);
            } catch (IOException e) {
                // not remembered, the next graph pass offers it again
                UserError.Log.e(TAG, "Meal upload failed: " + e.getMessage());
                return null;
            }
        }
        mealDeduplicator.remember(latest);
        return latest;
    }

    private boolean dismissAlert(final UiNode root) {
        final UiNode button = ElementFinder.find(root, ElementType.ALERT_DISMISS_BUTTON);
        if (button == null) return false;
        UserError.Log.uel(TAG, "Dismissing alert covering the main screen");
        final boolean clicked = host.click(button);
        if (clicked) sleeper.sleep(MENU_SETTLE_MS);
        return clicked;
    }

    // close button, then back button, then the global back action
    private void closeSurface() {
        try {
            final UiNode current = host.getRootInActiveWindow();
            UiNode button = ElementFinder.find(current, ElementType.CLOSE_BUTTON);
            if (button == null) {
                button = ElementFinder.find(current, ElementType.BACK_BUTTON);
            }
            if (button != null && host.click(button)) {
                return;
            }
            UserError.Log.d(TAG, "No close button found, using global back");
            host.performGlobalBack();
        } catch (RuntimeException e) {
            UserError.Log.e(TAG, "Exception closing surface: " + e);
            host.performGlobalBack();
        }
    }

    private void closeGraph() {
        try {
            final UiNode rotate = ElementFinder.find(host.getRootInActiveWindow(), ElementType.ROTATE_BUTTON);
            if (rotate != null && host.click(rotate)) {
                return;
            }
            host.performGlobalBack();
        } catch (RuntimeException e) {
            UserError.Log.e(TAG, "Exception leaving graph view: " + e);
            host.performGlobalBack();
        }
    }

    private static boolean isDue(final String key, final long intervalMinutes, final long now) {
        final long last = PersistentStore.getLong(key);
        return last == 0 || now - last >= intervalMinutes * Constants.MINUTE_IN_MS;
    }
}
