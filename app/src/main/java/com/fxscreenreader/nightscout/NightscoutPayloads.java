package com.fxscreenreader.nightscout;

import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.GlucoseUnit;
import com.fxscreenreader.models.JoH;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Nightscout JSON documents for entries, device status and treatments.
 */
public class NightscoutPayloads {

    public static final String DEVICE = "loop://CamAPSFX-ScreenReader";
    public static final String ENTERED_BY = "CamAPSFX-ScreenReader";
    public static final String APP = "AndroidAPS";
    public static final String ENTRY_DEVICE_PREFIX = "DiabetesScreenReader/";

    public static final String EVENT_SENSOR_START = "Sensor Start";
    public static final String EVENT_INSULIN_CHANGE = "Insulin Change";
    public static final String EVENT_PUMP_BATTERY_CHANGE = "Pump Battery Change";
    public static final String EVENT_CORRECTION_BOLUS = "Correction Bolus";
    public static final String EVENT_CARB_CORRECTION = "Carb Correction";

    private static final int TEMP_BASAL_DURATION = 30;

    private NightscoutPayloads() {
    }

    public static JSONObject entry(final GlucoseReading reading) {
        final JSONObject json = new JSONObject();
        json.put("type", "sgv");
        json.put("sgv", (int) Math.round(reading.getValueInUnit(GlucoseUnit.MG_DL)));
        json.put("direction", reading.getTrend().getDirection());
        json.put("date", reading.getTimestamp());
        json.put("dateString", JoH.isoUtc(reading.getTimestamp()));
        json.put("device", ENTRY_DEVICE_PREFIX + reading.getSource());
        return json;
    }

    public static JSONArray entries(final List<GlucoseReading> readings) {
        final JSONArray array = new JSONArray();
        for (final GlucoseReading reading : readings) {
            array.put(entry(reading));
        }
        return array;
    }

    public static JSONObject deviceStatus(final GlucoseReading reading, final String pumpStatus) {
        final String ts = JoH.isoUtc(reading.getTimestamp());
        final JSONObject json = new JSONObject();
        json.put("device", DEVICE);
        json.put("created_at", ts);
        json.put("date", reading.getTimestamp());
        json.put("uploaderBattery", 100);
        json.put("uploader", new JSONObject().put("battery", 100));

        final JSONObject pump = new JSONObject();
        pump.put("clock", ts);
        if (reading.getPumpBattery() != null) {
            pump.put("battery", new JSONObject().put("percent", reading.getPumpBattery()));
        }
        if (reading.getReservoir() != null) {
            pump.put("reservoir", reading.getReservoir());
        }
        pump.put("status", new JSONObject()
                .put("status", pumpStatus == null ? "normal" : pumpStatus)
                .put("timestamp", ts));
        json.put("pump", pump);

        final JSONObject openaps = new JSONObject();
        if (reading.getActiveInsulin() != null) {
            openaps.put("iob", new JSONObject()
                    .put("iob", reading.getActiveInsulin())
                    .put("bolusiob", reading.getActiveInsulin())
                    .put("timestamp", ts));
        }
        if (reading.getBasalRate() != null) {
            openaps.put("suggested", basal(reading, ts));
            openaps.put("enacted", basal(reading, ts));
        }
        json.put("openaps", openaps);
        return json;
    }

    private static JSONObject basal(final GlucoseReading reading, final String ts) {
        return new JSONObject()
                .put("temp", "absolute")
                .put("bg", (int) Math.round(reading.getValueInUnit(GlucoseUnit.MG_DL)))
                .put("tick", reading.getTrend().getDirection())
                .put("rate", reading.getBasalRate())
                .put("duration", TEMP_BASAL_DURATION)
                .put("timestamp", ts)
                .put("reason", "CamAPS FX current rate");
    }

    public static JSONObject treatment(final String eventType, final long timestamp, final String notes) {
        final JSONObject json = new JSONObject();
        json.put("eventType", eventType);
        json.put("created_at", JoH.isoUtc(timestamp));
        json.put("date", timestamp);
        json.put("device", DEVICE);
        json.put("app", APP);
        json.put("enteredBy", ENTERED_BY);
        json.put("isValid", true);
        if (notes != null) {
            json.put("notes", notes);
        }
        return json;
    }

    public static JSONObject bolus(final long timestamp, final double amount) {
        return treatment(EVENT_CORRECTION_BOLUS, timestamp, "Bolus from CamAPS FX")
                .put("insulin", amount)
                .put("type", "NORMAL")
                .put("isBasalInsulin", false);
    }

    public static JSONObject carbs(final long timestamp, final int grams) {
        return treatment(EVENT_CARB_CORRECTION, timestamp, "Meal from CamAPS FX graph")
                .put("carbs", grams);
    }

    public static JSONObject sensorStart(final long timestamp, final String serial) {
        return treatment(EVENT_SENSOR_START, timestamp,
                JoH.emptyString(serial) ? "Sensor from CamAPS FX" : "Sensor " + serial);
    }

    public static JSONObject insulinChange(final long timestamp, final String notes) {
        return treatment(EVENT_INSULIN_CHANGE, timestamp, notes == null ? "Reservoir from CamAPS FX" : notes);
    }

    public static JSONObject pumpBatteryChange(final long timestamp, final String notes) {
        return treatment(EVENT_PUMP_BATTERY_CHANGE, timestamp, notes);
    }
}
