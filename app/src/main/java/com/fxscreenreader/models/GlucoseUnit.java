package com.fxscreenreader.models;

import java.util.Locale;

public enum GlucoseUnit {
    MG_DL("mg/dL"),
    MMOL_L("mmol/L");

    private final String display;

    GlucoseUnit(final String display) {
        this.display = display;
    }

    public String getDisplay() {
        return display;
    }

    // unit marker as it appears on screen, null when the text carries none
    public static GlucoseUnit fromMarker(final String text) {
        if (text == null) return null;
        final String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("mg/dl")) return MG_DL;
        if (lower.contains("mmol/l")) return MMOL_L;
        return null;
    }
}
