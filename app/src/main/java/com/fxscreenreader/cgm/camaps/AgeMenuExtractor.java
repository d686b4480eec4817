package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.AgeInfo;
import com.fxscreenreader.models.InsulinInfo;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.SensorInfo;
import com.fxscreenreader.models.UiNode;
import com.fxscreenreader.models.UserError;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads sensor age (SAGE) and reservoir age (IAGE) from the side menu. Every label is a string of
 * its own and its value is the string that follows it.
 */
public class AgeMenuExtractor {

    private static final String TAG = AgeMenuExtractor.class.getSimpleName();

    private static final List<String> INSERTION_LABELS = Arrays.asList(
            "Anlage seit", "Inserted since", "Insertion depuis", "Sensor since", "Capteur depuis");
    private static final List<String> FILL_LABELS = Arrays.asList(
            "Füllung seit", "Filled since", "Remplissage depuis", "Reservoir since", "Réservoir depuis");
    private static final List<String> SESSION_END_LABELS = Arrays.asList(
            "Ende Sensorsitzung", "Sensor session end", "Fin session capteur");
    private static final List<String> SENSOR_BRANDS = Arrays.asList(
            "companion cgm", "freestyle libre", "dexcom", "libre");
    private static final List<String> SINCE_WORDS = Arrays.asList("seit", "since", "depuis");

    public AgeInfo extract(final UiNode root) {
        return extract(NodeTextCollector.collect(root), JoH.tsl());
    }

    public AgeInfo extract(final UiNode root, final long now) {
        return extract(NodeTextCollector.collect(root), now);
    }

    public AgeInfo extract(final List<String> texts, final long now) {
        String serial = null;
        SensorInfo sensor = null;
        InsulinInfo insulin = null;
        Long sessionEnd = null;

        for (int i = 0; i < texts.size(); i++) {
            final String text = texts.get(i).trim();
            final String next = valueAfter(texts, i);

            if (serial == null && isSensorBrand(text) && !JoH.emptyString(next) && !mentionsSince(next)) {
                serial = next.trim();
                UserError.Log.d(TAG, "Sensor '" + text + "' name/serial: " + serial);
            }

            if (isLabel(text, INSERTION_LABELS)) {
                final Long duration = DurationParser.parse(next);
                if (duration != null) {
                    sensor = SensorInfo.builder()
                            .sensorStartTime(now - duration)
                            .durationText(next)
                            .build();
                    UserError.Log.d(TAG, "Sensor inserted " + JoH.niceTimeScalar(duration) + " ago");
                }
            } else if (isLabel(text, SESSION_END_LABELS)) {
                final Long duration = DurationParser.parse(next);
                if (duration != null) {
                    sessionEnd = now + duration;
                    UserError.Log.d(TAG, "Sensor session ends in " + JoH.niceTimeScalar(duration));
                }
            } else if (isLabel(text, FILL_LABELS)) {
                final Long duration = DurationParser.parse(next);
                if (duration != null) {
                    insulin = new InsulinInfo(now - duration, next);
                    UserError.Log.d(TAG, "Reservoir filled " + JoH.niceTimeScalar(duration) + " ago");
                }
            }
        }

        if (sensor != null) {
            sensor = sensor.toBuilder().serialNumber(serial).sensorEndTime(sessionEnd).build();
        }
        if (sensor == null && insulin == null) {
            UserError.Log.w(TAG, "No sensor or reservoir age found in " + texts.size() + " menu strings");
        }
        return new AgeInfo(sensor, insulin);
    }

    static String valueAfter(final List<String> texts, final int index) {
        return index + 1 < texts.size() ? texts.get(index + 1) : "";
    }

    private static boolean isLabel(final String text, final List<String> labels) {
        for (final String label : labels) {
            if (text.equalsIgnoreCase(label)) return true;
        }
        return false;
    }

    private static boolean isSensorBrand(final String text) {
        final String lower = text.toLowerCase(Locale.ROOT);
        for (final String brand : SENSOR_BRANDS) {
            if (lower.contains(brand)) return true;
        }
        return false;
    }

    private static boolean mentionsSince(final String text) {
        final String lower = text.toLowerCase(Locale.ROOT);
        for (final String word : SINCE_WORDS) {
            if (lower.contains(word)) return true;
        }
        return false;
    }
}
