package com.fxscreenreader.utilitymodels;

import com.fxscreenreader.models.GlucoseUnit;
import com.fxscreenreader.models.JoH;

/**
 * Glucose unit conversion.
 */
public class Unitized {

    public static final double MMOLL_TO_MGDL = 18.0182;

    private Unitized() {
    }

    public static double mgdlConvert(final double mmol) {
        return mmol * MMOLL_TO_MGDL;
    }

    public static double mmolConvert(final double mgdl) {
        return mgdl / MMOLL_TO_MGDL;
    }

    public static double toMgdl(final double value, final GlucoseUnit unit) {
        return unit == GlucoseUnit.MMOL_L ? mgdlConvert(value) : value;
    }

    public static double fromMgdl(final double mgdl, final GlucoseUnit unit) {
        return unit == GlucoseUnit.MMOL_L ? mmolConvert(mgdl) : mgdl;
    }

    public static String unitized_string(final double value, final GlucoseUnit unit) {
        return unit == GlucoseUnit.MMOL_L ? JoH.qs(value, 1) : JoH.qs(value, 0);
    }
}
