package com.fxscreenreader.nightscout;

import com.fxscreenreader.models.AgeInfo;
import com.fxscreenreader.models.InsulinInfo;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.SensorInfo;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.services.AgeReconciler;

import java.io.IOException;

/**
 * Keeps the Nightscout sensor start and insulin change treatments in line with the ages shown on screen.
 */
public class AgeSync {

    private static final String TAG = AgeSync.class.getSimpleName();

    static final String SENSOR_REGEX = "Sensor";
    static final String INSULIN_REGEX = "Insulin";

    private final NightscoutClient client;
    private final AgeReconciler reconciler;

    public AgeSync(final NightscoutClient client, final AgeReconciler reconciler) {
        this.client = client;
        this.reconciler = reconciler;
    }

    public AgeReconciler.Decision syncSensor(final SensorInfo sensor) throws IOException {
        final Long remote = client.latestTreatmentTime(SENSOR_REGEX);
        final AgeReconciler.Decision decision = reconciler.decide(sensor.getSensorStartTime(), remote);
        if (decision.needsUpload()) {
            client.uploadTreatment(NightscoutPayloads.sensorStart(sensor.getSensorStartTime(), sensor.getSerialNumber()));
        }
        UserError.Log.uel(TAG, "SAGE " + decision.describe() + " start " + JoH.dateTimeText(sensor.getSensorStartTime()));
        return decision;
    }

    public AgeReconciler.Decision syncInsulin(final InsulinInfo insulin) throws IOException {
        final Long remote = client.latestTreatmentTime(INSULIN_REGEX);
        final AgeReconciler.Decision decision = reconciler.decide(insulin.getFillTime(), remote);
        if (decision.needsUpload()) {
            client.uploadTreatment(NightscoutPayloads.insulinChange(insulin.getFillTime(), "Reservoir from CamAPS FX"));
        }
        UserError.Log.uel(TAG, "IAGE " + decision.describe() + " filled " + JoH.dateTimeText(insulin.getFillTime()));
        return decision;
    }

    /**
     * Sync both halves; a failure on one does not stop the other.
     *
     * @return true when every present half was processed without error
     */
    public boolean sync(final AgeInfo ages) {
        if (ages == null || ages.isEmpty()) return false;
        boolean ok = true;
        if (ages.getSensor() != null) {
            try {
                syncSensor(ages.getSensor());
            } catch (IOException e) {
                UserError.Log.e(TAG, "SAGE sync failed: " + e.getMessage());
                ok = false;
            }
        }
        if (ages.getInsulin() != null) {
            try {
                syncInsulin(ages.getInsulin());
            } catch (IOException e) {
                UserError.Log.e(TAG, "IAGE sync failed: " + e.getMessage());
                ok = false;
            }
        }
        return ok;
    }
}
