package com.fxscreenreader.services;

import com.fxscreenreader.models.InMemoryReadingStore;
import com.fxscreenreader.models.ReadingStore;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.nightscout.AgeSync;
import com.fxscreenreader.nightscout.NightscoutClient;
import com.fxscreenreader.nightscout.NightscoutUploader;

/**
 * Puts the reader together from the current preferences and drives it with a {@link PollingScheduler}.
 * The automation host and the OCR engine come from the platform the reader runs on.
 */
public class CamApsReaderService {

    private static final String TAG = CamApsReaderService.class.getSimpleName();

    private final ReadingStore store;
    private final CamApsCollector collector;
    private PollingScheduler scheduler;

    public CamApsReaderService(final UiHost host, final OcrEngine ocr) {
        this(host, ocr, new InMemoryReadingStore(), NightscoutClient.fromPreferences(), Sleeper.REAL);
    }

    CamApsReaderService(final UiHost host, final OcrEngine ocr, final ReadingStore store,
                        final NightscoutClient client, final Sleeper sleeper) {
        this.store = store;
        NightscoutUploader uploader = null;
        AgeSync ageSync = null;
        if (client.isConfigured()) {
            uploader = new NightscoutUploader(client, store);
            ageSync = new AgeSync(client, new AgeReconciler());
        } else {
            UserError.Log.i(TAG, "Nightscout not configured, readings are only stored locally");
        }
        this.collector = new CamApsCollector(host, ocr, store, uploader, ageSync, sleeper);
    }

    public synchronized void start() {
        if (isRunning()) return;
        // a stopped scheduler has shut down its thread, so each start gets a fresh one
        scheduler = new PollingScheduler(collector::runCycle);
        scheduler.start();
        UserError.Log.uel(TAG, "CamAPS FX reader started");
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.stop();
        scheduler = null;
        UserError.Log.uel(TAG, "CamAPS FX reader stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null && scheduler.isRunning();
    }

    public ReadingStore getStore() {
        return store;
    }
}
