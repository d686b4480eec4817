package com.fxscreenreader.utilitymodels;

public class Constants {

    public static final long SECOND_IN_MS = 1_000;
    public static final long MINUTE_IN_MS = 60_000;
    public static final long HOUR_IN_MS = 3_600_000;
    public static final long DAY_IN_MS = 86_400_000;

    public static final int MINUTES_PER_DAY = 1440;

    public static final String CAMAPS_PACKAGE = "com.camdiab.fx.camaps";

    private Constants() {
    }
}
