package com.fxscreenreader.models;

import lombok.Value;

/**
 * Sensor and reservoir ages read from the side menu. Either half may be missing.
 */
@Value
public class AgeInfo {
    SensorInfo sensor;
    InsulinInfo insulin;

    public boolean isEmpty() {
        return sensor == null && insulin == null;
    }
}
