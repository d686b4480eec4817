package com.fxscreenreader.utilitymodels;

import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.UserError;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.EnumSet;

/**
 * Latest pump values seen on screen. Values older than 30 minutes read as -1.
 */
public class PumpStatus {

    private static final String TAG = "PumpStatus";
    private static final String PUMP_RESERVOIR = "pump-reservoir";
    private static final String PUMP_BOLUSIOB = "pump-bolusiob";
    private static final String PUMP_BATTERY = "pump-battery";
    private static final String PUMP_BASAL = "pump-basal";
    private static final String PUMP_STATE_FLAGS = "pump-state-flags";
    private static final String TIME = "-time";

    private static final String LAST_SEEN_BATTERY = "pump-last-seen-battery";
    private static final String LAST_SEEN_RESERVOIR = "pump-last-seen-reservoir";

    public static final double BATTERY_CHANGE_THRESHOLD = 10;
    public static final double RESERVOIR_CHANGE_THRESHOLD = 50;

    public enum Change {
        BATTERY_REPLACED,
        RESERVOIR_REFILLED
    }

    private static void setValue(String name, double value) {
        if (value < 0) value = -1;
        PersistentStore.setDouble(name, value);
        PersistentStore.setLong(name + TIME, JoH.tsl());
    }

    private static double getValue(String name) {
        final long ts = PersistentStore.getLong(name + TIME);
        if ((ts > 0) && (JoH.msSince(ts) < Constants.MINUTE_IN_MS * 30)) {
            return PersistentStore.getDouble(name);
        } else {
            return -1;
        }
    }

    public static void setReservoir(double reservoir) {
        setValue(PUMP_RESERVOIR, reservoir);
    }

    public static double getReservoir() {
        return getValue(PUMP_RESERVOIR);
    }

    public static void setBolusIoB(double value) {
        setValue(PUMP_BOLUSIOB, value);
    }

    public static double getBolusIoB() {
        return getValue(PUMP_BOLUSIOB);
    }

    public static void setBattery(double value) {
        setValue(PUMP_BATTERY, value);
    }

    public static double getBattery() {
        return getValue(PUMP_BATTERY);
    }

    public static void setBasalRate(double value) {
        setValue(PUMP_BASAL, value);
    }

    public static double getBasalRate() {
        return getValue(PUMP_BASAL);
    }

    public static void setPumpStates(EnumSet<PumpState> states) {
        if (states == null) return;
        int flags = 0;
        for (PumpState state : states) {
            flags |= (1 << state.ordinal());
        }
        setValue(PUMP_STATE_FLAGS, flags);
    }

    public static EnumSet<PumpState> getPumpStates() {
        int flags = (int) getValue(PUMP_STATE_FLAGS);
        EnumSet<PumpState> states = EnumSet.noneOf(PumpState.class);
        if (flags < 0) return states;
        for (PumpState state : PumpState.values()) {
            if ((flags & (1 << state.ordinal())) != 0) {
                states.add(state);
            }
        }
        return states;
    }

    /**
     * Pump mode in priority order: Boost, Ease-off, Auto mode, otherwise Manual.
     */
    public static String getPumpStateString() {
        EnumSet<PumpState> states = getPumpStates();

        if (states.contains(PumpState.BOOST)) {
            return "Boost";
        }
        if (states.contains(PumpState.EASE_OFF)) {
            return "Ease-off";
        }
        if (states.contains(PumpState.AUTO_MODE)) {
            return "Auto mode";
        }
        return "Manual";
    }

    /**
     * Store the pump values carried by a reading and report battery or reservoir replacement.
     * A change is a rise compared with the previous value seen, by more than 10 percent of battery
     * or 50 units of insulin.
     */
    public static synchronized EnumSet<Change> update(final GlucoseReading reading) {
        final EnumSet<Change> changes = EnumSet.noneOf(Change.class);
        if (reading == null) return changes;
        if (reading.getActiveInsulin() != null) setBolusIoB(reading.getActiveInsulin());
        if (reading.getBasalRate() != null) setBasalRate(reading.getBasalRate());

        if (reading.getPumpBattery() != null) {
            final double battery = reading.getPumpBattery();
            if (rose(LAST_SEEN_BATTERY, battery, BATTERY_CHANGE_THRESHOLD)) {
                UserError.Log.uel(TAG, "Pump battery change detected: " + JoH.qs(battery, 0) + "%");
                changes.add(Change.BATTERY_REPLACED);
            }
            setBattery(battery);
        }
        if (reading.getReservoir() != null) {
            final double reservoir = reading.getReservoir();
            if (rose(LAST_SEEN_RESERVOIR, reservoir, RESERVOIR_CHANGE_THRESHOLD)) {
                UserError.Log.uel(TAG, "Reservoir refill detected: " + JoH.qs(reservoir, 1) + "U");
                changes.add(Change.RESERVOIR_REFILLED);
            }
            setReservoir(reservoir);
        }
        return changes;
    }

    // last seen values do not expire, a refill is often noticed hours later
    private static boolean rose(final String key, final double current, final double threshold) {
        final boolean known = PersistentStore.getLong(key + TIME) > 0;
        final double previous = PersistentStore.getDouble(key);
        PersistentStore.setDouble(key, current);
        PersistentStore.setLong(key + TIME, JoH.tsl());
        return known && current > previous + threshold;
    }

    public static String getReservoirString() {
        final double reservoir = getReservoir();
        if (reservoir > -1) {
            return JoH.qs(reservoir, 1) + "U ";
        } else {
            return "";
        }
    }

    public static String getBatteryString() {
        final double value = getBattery();
        if (value > -1) {
            return JoH.qs(value, 0) + "% ";
        } else {
            return "";
        }
    }

    public static String toJson() {
        final JSONObject json = new JSONObject();
        try {
            json.put("reservoir", getReservoir());
            json.put("bolusiob", getBolusIoB());
            json.put("battery", getBattery());
            json.put("basal", getBasalRate());
            json.put("status", getPumpStateString());
        } catch (JSONException e) {
            UserError.Log.e(TAG, "Got exception building PumpStatus " + e);
        }
        return json.toString();
    }

    public static void reset() {
        for (final String key : new String[]{PUMP_RESERVOIR, PUMP_BOLUSIOB, PUMP_BATTERY, PUMP_BASAL, PUMP_STATE_FLAGS,
                LAST_SEEN_BATTERY, LAST_SEEN_RESERVOIR}) {
            PersistentStore.setLong(key + TIME, 0);
            PersistentStore.setDouble(key, 0);
        }
    }
}
