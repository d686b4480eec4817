package com.fxscreenreader.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SensorInfo {
    String serialNumber;
    long sensorStartTime;
    Long sensorEndTime;
    String durationText;
}
