package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.DetailField;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.UiNode;
import com.fxscreenreader.models.UserError;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.val;

/**
 * Reads pump details from the CamAPS FX information dialog.
 * <p>
 * Each field is taken from the first string that yields it; later strings cannot overwrite it.
 */
public class DetailDialogExtractor {

    private static final String TAG = DetailDialogExtractor.class.getSimpleName();

    private static final String NUMBER = "([\\d,\\.]+)";
    private static final String INSULIN_UNIT = "(?:IE|UI|U)";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Map<DetailField, Pattern> SIMPLE_FIELDS = new LinkedHashMap<>();

    static {
        SIMPLE_FIELDS.put(DetailField.ACTIVE_INSULIN, Pattern.compile(
                "(?:Aktives Insulin|Active Insulin|Insuline active):\\s*" + NUMBER + "\\s*" + INSULIN_UNIT, FLAGS));
        SIMPLE_FIELDS.put(DetailField.BASAL_RATE, Pattern.compile(
                "(?:Insulinabgaberate|Insulin delivery rate|D[ée]bit d'insuline):\\s*" + NUMBER + "\\s*" + INSULIN_UNIT + "/h", FLAGS));
        SIMPLE_FIELDS.put(DetailField.RESERVOIR, Pattern.compile(
                "R[ée]servoir:\\s*" + NUMBER + "\\s*" + INSULIN_UNIT, FLAGS));
        SIMPLE_FIELDS.put(DetailField.PUMP_BATTERY, Pattern.compile(
                "(?:Pumpenbatterie|Pump battery|Batterie pompe):\\s*" + NUMBER + "\\s*%", FLAGS));
        SIMPLE_FIELDS.put(DetailField.GLUCOSE_TARGET, Pattern.compile(
                "(?:Glukosezielwert|Glucose target|Cible glyc[ée]mique):\\s*" + NUMBER + "\\s*(?:mg/dL|mmol/L)", FLAGS));
        SIMPLE_FIELDS.put(DetailField.INSULIN_TODAY, Pattern.compile(
                "(?:Insulin heute|Insulin today|Insuline aujourd'hui):\\s*" + NUMBER + "\\s*" + INSULIN_UNIT, FLAGS));
        SIMPLE_FIELDS.put(DetailField.INSULIN_YESTERDAY, Pattern.compile(
                "(?:Insulin gestern|Insulin yesterday|Insuline hier):\\s*" + NUMBER + "\\s*" + INSULIN_UNIT, FLAGS));
    }

    /**
     * Bolus amount and age. {@link #NO_BOLUS} stands for the "Bolus: ---" placeholder.
     */
    static final class Bolus {
        final Double amount;
        final Integer minutesAgo;

        Bolus(final Double amount, final Integer minutesAgo) {
            this.amount = amount;
            this.minutesAgo = minutesAgo;
        }
    }

    static final Bolus NO_BOLUS = new Bolus(null, null);

    private static final String BOLUS_PREFIX = "Bolus:\\s*" + NUMBER + "\\s*" + INSULIN_UNIT + "\\s*";

    private static final PatternCascade<Bolus> BOLUS = PatternCascade.<Bolus>builder()
            .then(BOLUS_PREFIX + "vor\\s*(\\d+)\\s*Minuten?", m -> bolus(m.group(1), minutes(m.group(2))))
            .then(BOLUS_PREFIX + "(\\d+)\\s*minutes?\\s*ago", m -> bolus(m.group(1), minutes(m.group(2))))
            .then(BOLUS_PREFIX + "il y a\\s*(\\d+)\\s*minutes?", m -> bolus(m.group(1), minutes(m.group(2))))
            .then(BOLUS_PREFIX + "(\\d+)\\s*h\\s*(\\d+)\\s*min", m -> bolus(m.group(1), hoursAndMinutes(m.group(2), m.group(3))))
            .then("Bolus:\\s*---", m -> NO_BOLUS)
            .build();

    private static final PatternCascade<Integer> PUMP_CONNECTION = minutesAgoCascade("(?:Pumpenverbindung|Pump connection|Connexion pompe)");
    private static final PatternCascade<Integer> SENSOR_DATA = minutesAgoCascade("(?:Sensordaten|Sensor data|Donn[ée]es capteur)");

    private static PatternCascade<Integer> minutesAgoCascade(final String label) {
        return PatternCascade.<Integer>builder()
                .then(label + ":\\s*vor\\s*(\\d+)\\s*Minuten?", m -> minutes(m.group(1)))
                .then(label + ":\\s*vor\\s*einer\\s*Minute", m -> 1)
                .then(label + ":\\s*(?:a|one)\\s*minute\\s*ago", m -> 1)
                .then(label + ":\\s*il y a\\s*une\\s*minute", m -> 1)
                .then(label + ":\\s*(\\d+)\\s*minutes?\\s*ago", m -> minutes(m.group(1)))
                .then(label + ":\\s*il y a\\s*(\\d+)\\s*minutes?", m -> minutes(m.group(1)))
                .build();
    }

    public EnumMap<DetailField, Double> extract(final UiNode root) {
        return extract(NodeTextCollector.collect(root));
    }

    public EnumMap<DetailField, Double> extract(final List<String> texts) {
        val data = new EnumMap<DetailField, Double>(DetailField.class);
        boolean bolusSeen = false;
        for (final String text : texts) {
            for (final Map.Entry<DetailField, Pattern> entry : SIMPLE_FIELDS.entrySet()) {
                if (data.containsKey(entry.getKey())) continue;
                final Matcher matcher = entry.getValue().matcher(text);
                if (matcher.find()) {
                    final Double value = JoH.tolerantParseDoubleOrNull(matcher.group(1));
                    if (value != null) data.put(entry.getKey(), value);
                }
            }

            if (!bolusSeen) {
                final Bolus bolus = BOLUS.match(text);
                if (bolus != null) {
                    bolusSeen = true;
                    if (bolus == NO_BOLUS) {
                        UserError.Log.d(TAG, "No recent bolus");
                    } else {
                        data.put(DetailField.BOLUS_AMOUNT, bolus.amount);
                        data.put(DetailField.BOLUS_MINUTES_AGO, bolus.minutesAgo.doubleValue());
                    }
                }
            }

            putMinutes(data, DetailField.PUMP_CONNECTION_MINUTES_AGO, PUMP_CONNECTION, text);
            putMinutes(data, DetailField.SENSOR_DATA_MINUTES_AGO, SENSOR_DATA, text);
        }
        UserError.Log.d(TAG, "Information dialog data: " + data);
        return data;
    }

    private static void putMinutes(final EnumMap<DetailField, Double> data, final DetailField field,
                                   final PatternCascade<Integer> cascade, final String text) {
        if (data.containsKey(field)) return;
        final Integer minutes = cascade.match(text);
        if (minutes != null) data.put(field, minutes.doubleValue());
    }

    private static Bolus bolus(final String amount, final Integer minutesAgo) {
        final Double value = JoH.tolerantParseDoubleOrNull(amount);
        if (value == null || minutesAgo == null) return null;
        return new Bolus(value, minutesAgo);
    }

    private static Integer minutes(final String digits) {
        return JoH.parseIntOrNull(digits);
    }

    private static Integer hoursAndMinutes(final String hours, final String minutes) {
        final Integer h = JoH.parseIntOrNull(hours);
        final Integer m = JoH.parseIntOrNull(minutes);
        if (h == null || m == null) return null;
        return h * 60 + m;
    }
}
