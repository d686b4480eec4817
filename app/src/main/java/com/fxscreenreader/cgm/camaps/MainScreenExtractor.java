package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.GlucoseTrend;
import com.fxscreenreader.models.GlucoseUnit;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.UiNode;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Constants;
import com.fxscreenreader.utilitymodels.PersistentStore;
import com.fxscreenreader.utilitymodels.PumpState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.val;

/**
 * Reads the current glucose value from the CamAPS FX main screen.
 * <p>
 * Gates run in a fixed order and each one is final: unit marker, info button, application
 * marker, signal loss, value candidate, physiological range. Nothing is ever clamped or guessed.
 */
public class MainScreenExtractor {

    private static final String TAG = MainScreenExtractor.class.getSimpleName();
    private static final String SAFETY_REJECT_REPEAT = "CAMAPS_SAFETY_REJECT_REPEAT";
    private static final int JAM_THRESHOLD = 6;

    private static final List<String> APP_MARKERS = Arrays.asList(
            "auto mode", "auto-modus", "mode auto", "boost", "ease-off", "ease off", "mylife camaps");

    private static final List<String> SIGNAL_LOSS_INDICATORS = Arrays.asList(
            "---",
            "signalverlust", "sensor fehler", "kein signal",
            "signal loss", "no signal", "sensor error", "lost signal",
            "perte de signal", "pas de signal", "erreur capteur", "signal perdu");

    private static final Pattern MGDL_CANDIDATE = Pattern.compile("^\\s*(\\d{2,3})\\s*$");
    private static final Pattern MMOL_CANDIDATE = Pattern.compile("^\\s*(\\d{1,2}[.,]\\d)\\s*$");

    public MainScreenResult extract(final UiNode root) {
        return extract(root, JoH.tsl());
    }

    public MainScreenResult extract(final UiNode root, final long now) {
        val texts = NodeTextCollector.collect(root);
        UserError.Log.d(TAG, "Main screen texts: " + texts.size());

        final String unitText = firstUnitText(texts);
        if (unitText == null) {
            return identity(MainScreenResult.Rejection.NO_UNIT);
        }
        if (!ElementFinder.isPresent(root, ElementType.INFO_BUTTON)) {
            return identity(MainScreenResult.Rejection.NO_INFO_BUTTON);
        }
        if (!containsAny(texts, APP_MARKERS)) {
            return identity(MainScreenResult.Rejection.NO_APP_MARKER);
        }
        final String lossIndicator = firstContained(texts, SIGNAL_LOSS_INDICATORS);
        if (lossIndicator != null) {
            UserError.Log.e(TAG, "Signal loss indicator on screen: '" + lossIndicator + "' not reading a value");
            return safety(MainScreenResult.Rejection.SIGNAL_LOSS);
        }

        final GlucoseUnit unit = GlucoseUnit.fromMarker(unitText);
        val candidates = candidates(texts, unit);
        if (candidates.isEmpty()) {
            UserError.Log.e(TAG, "No glucose value candidate found");
            return safety(MainScreenResult.Rejection.NO_VALUE);
        }
        if (candidates.size() > 1) {
            UserError.Log.w(TAG, "Multiple glucose candidates " + candidates + " using first: " + candidates.get(0));
        }
        final double value = JoH.tolerantParseDouble(candidates.get(0));
        final GlucoseReading reading = GlucoseReading.create(value, unit, detectTrend(texts), Constants.CAMAPS_PACKAGE, now);
        if (reading == null) {
            UserError.Log.wtf(TAG, "Glucose value outside acceptable range: " + candidates.get(0) + " " + unit.getDisplay());
            return safety(MainScreenResult.Rejection.OUT_OF_RANGE);
        }
        PersistentStore.setLong(SAFETY_REJECT_REPEAT, 0);
        UserError.Log.d(TAG, "Main screen reading: " + reading);
        return MainScreenResult.accepted(reading, PumpState.fromTexts(texts));
    }

    static GlucoseTrend detectTrend(final List<String> texts) {
        for (final String text : texts) {
            final GlucoseTrend trend = GlucoseTrend.fromText(text);
            if (trend != null) return trend;
        }
        return GlucoseTrend.FLAT;
    }

    private static List<String> candidates(final List<String> texts, final GlucoseUnit unit) {
        final Pattern pattern = unit == GlucoseUnit.MMOL_L ? MMOL_CANDIDATE : MGDL_CANDIDATE;
        final List<String> result = new ArrayList<>();
        for (final String text : texts) {
            final Matcher matcher = pattern.matcher(text);
            if (matcher.matches()) {
                result.add(matcher.group(1));
            }
        }
        return result;
    }

    private static String firstUnitText(final List<String> texts) {
        for (final String text : texts) {
            if (GlucoseUnit.fromMarker(text) != null) return text;
        }
        return null;
    }

    private static boolean containsAny(final List<String> texts, final List<String> needles) {
        return firstContained(texts, needles) != null;
    }

    private static String firstContained(final List<String> texts, final List<String> needles) {
        for (final String text : texts) {
            final String lower = text.toLowerCase(Locale.ROOT);
            for (final String needle : needles) {
                if (lower.contains(needle)) return needle;
            }
        }
        return null;
    }

    private static MainScreenResult identity(final MainScreenResult.Rejection rejection) {
        UserError.Log.d(TAG, "Not the CamAPS FX main screen: " + rejection);
        return MainScreenResult.rejected(rejection);
    }

    // note this method updates the stored repeat counter
    private static MainScreenResult safety(final MainScreenResult.Rejection rejection) {
        final long repeats = PersistentStore.incrementLong(SAFETY_REJECT_REPEAT);
        if (repeats > JAM_THRESHOLD) {
            UserError.Log.wtf(TAG, "Main screen refused " + repeats + " times in a row, last reason: " + rejection);
        }
        return MainScreenResult.rejected(rejection);
    }

    static long consecutiveSafetyRejections() {
        return PersistentStore.getLong(SAFETY_REJECT_REPEAT);
    }
}
