package com.fxscreenreader.models;

public enum RangeStatus {
    LOW,
    IN_RANGE,
    HIGH
}
