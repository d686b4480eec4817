package com.fxscreenreader.nightscout;

import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.GraphTreatment;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.ReadingStore;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Constants;
import com.fxscreenreader.utilitymodels.Pref;
import com.fxscreenreader.utilitymodels.PumpStatus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Pushes stored readings and the events derived from them to Nightscout.
 * Readings stay unsynced in the store until an upload succeeds.
 */
public class NightscoutUploader {

    private static final String TAG = NightscoutUploader.class.getSimpleName();

    public static final String PREF_ENABLED = "nightscout_enabled";
    public static final String PREF_BOLUS_MAX_AGE = "bolus_upload_max_age_minutes";
    public static final String PREF_RETENTION_DAYS = "data_retention_days";
    private static final int DEFAULT_BOLUS_MAX_AGE = 60;
    private static final int DEFAULT_RETENTION_DAYS = 90;

    private final NightscoutClient client;
    private final ReadingStore store;

    public NightscoutUploader(final NightscoutClient client, final ReadingStore store) {
        this.client = client;
        this.store = store;
    }

    public static boolean isEnabled() {
        return Pref.getBooleanDefaultFalse(PREF_ENABLED);
    }

    /**
     * Upload all unsynced readings, then device status and pump events for the newest one.
     * <p>
     * A reading carrying a bolus stays unsynced until its bolus treatment has been accepted, so a
     * failed treatment upload is retried with the next sync. Its entry is sent again then, which
     * Nightscout deduplicates by date and type.
     *
     * @return number of entries uploaded
     * @throws IOException the first upload failure, after the remaining uploads have been tried
     */
    public int sync(final GlucoseReading latest, final EnumSet<PumpStatus.Change> changes) throws IOException {
        final List<GlucoseReading> pending = store.unsynced();
        final int count = client.uploadEntries(pending);
        UserError.Log.d(TAG, "Uploaded " + count + " entries");

        IOException failure = null;
        final List<Long> synced = new ArrayList<>(pending.size());
        for (final GlucoseReading reading : pending) {
            try {
                uploadBolus(reading);
                synced.add(reading.getTimestamp());
            } catch (IOException e) {
                UserError.Log.e(TAG, "Bolus upload failed, keeping reading unsynced: " + e.getMessage());
                if (failure == null) failure = e;
            }
        }
        store.markSynced(synced);

        if (latest != null) {
            if (latest.hasPumpDetails()) {
                client.uploadDeviceStatus(NightscoutPayloads.deviceStatus(latest, PumpStatus.getPumpStateString()));
            }
            uploadChanges(latest, changes);
        }
        if (failure != null) {
            throw failure;
        }
        return count;
    }

    private void uploadChanges(final GlucoseReading reading, final EnumSet<PumpStatus.Change> changes) throws IOException {
        if (changes == null) return;
        if (changes.contains(PumpStatus.Change.BATTERY_REPLACED)) {
            client.uploadTreatment(NightscoutPayloads.pumpBatteryChange(reading.getTimestamp(),
                    "Pump battery now " + reading.getPumpBattery() + "%"));
        }
        if (changes.contains(PumpStatus.Change.RESERVOIR_REFILLED)) {
            client.uploadTreatment(NightscoutPayloads.insulinChange(reading.getTimestamp(),
                    "Reservoir now " + JoH.qs(reading.getReservoir(), 0) + "U"));
        }
    }

    private void uploadBolus(final GlucoseReading reading) throws IOException {
        if (!reading.hasBolus() || reading.getBolusAmount() <= 0) return;
        final int maxAge = Pref.getInt(PREF_BOLUS_MAX_AGE, DEFAULT_BOLUS_MAX_AGE);
        if (reading.getBolusMinutesAgo() > maxAge) {
            UserError.Log.d(TAG, "Bolus too old to upload: " + reading.getBolusMinutesAgo() + " minutes");
            return;
        }
        final long bolusTime = reading.getTimestamp() - reading.getBolusMinutesAgo() * Constants.MINUTE_IN_MS;
        client.uploadTreatment(NightscoutPayloads.bolus(bolusTime, reading.getBolusAmount()));
    }

    public void uploadMeal(final GraphTreatment meal) throws IOException {
        if (!meal.hasCarbs()) return;
        client.uploadTreatment(NightscoutPayloads.carbs(meal.getTimestamp(), meal.getCarbsGrams()));
        UserError.Log.uel(TAG, "Meal uploaded: " + meal.getCarbsGrams() + "g at " + JoH.dateTimeText(meal.getTimestamp()));
    }

    /**
     * Drop readings older than the retention period.
     */
    public int cleanup(final long now) {
        final int days = Pref.getInt(PREF_RETENTION_DAYS, DEFAULT_RETENTION_DAYS);
        final int removed = store.deleteOlderThan(now - days * Constants.DAY_IN_MS);
        if (removed > 0) {
            UserError.Log.d(TAG, "Removed " + removed + " readings older than " + days + " days");
        }
        return removed;
    }
}
