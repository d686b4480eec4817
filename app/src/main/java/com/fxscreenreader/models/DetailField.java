package com.fxscreenreader.models;

/**
 * Auxiliary values read from the pump information dialog.
 */
public enum DetailField {
    ACTIVE_INSULIN,
    BASAL_RATE,
    RESERVOIR,
    PUMP_BATTERY,
    GLUCOSE_TARGET,
    INSULIN_TODAY,
    INSULIN_YESTERDAY,
    BOLUS_AMOUNT,
    BOLUS_MINUTES_AGO,
    PUMP_CONNECTION_MINUTES_AGO,
    SENSOR_DATA_MINUTES_AGO
}
