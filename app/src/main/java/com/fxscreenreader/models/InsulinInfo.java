package com.fxscreenreader.models;

import lombok.Value;

@Value
public class InsulinInfo {
    long fillTime;
    String durationText;
}
