package com.fxscreenreader.models;

import lombok.Value;

/**
 * HH:MM tick label on the graph time axis.
 */
@Value
public class TimeLabel {
    int hour;
    int minute;
    int xPosition;

    public int minuteOfDay() {
        return hour * 60 + minute;
    }
}
