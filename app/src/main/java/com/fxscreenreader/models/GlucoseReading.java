package com.fxscreenreader.models;

import com.fxscreenreader.utilitymodels.Unitized;

import java.util.EnumMap;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * One validated glucose reading, optionally enriched with pump information.
 * <p>
 * The range check lives only in the constructor: a value must be positive and its mg/dL
 * equivalent must lie within {@link #MIN_MGDL}..{@link #MAX_MGDL}. Use {@link #create} where an
 * invalid value should simply be dropped.
 */
@Value
public class GlucoseReading {

    private static final String TAG = GlucoseReading.class.getSimpleName();

    public static final int MIN_MGDL = 40;
    public static final int MAX_MGDL = 400;

    double value;
    GlucoseUnit unit;
    GlucoseTrend trend;
    String source;
    long timestamp;

    Double activeInsulin;
    Double basalRate;
    Double reservoir;
    Integer pumpBattery;
    Double bolusAmount;
    Integer bolusMinutesAgo;
    Integer pumpConnectionMinutesAgo;
    Integer sensorDataMinutesAgo;
    Double glucoseTarget;
    Double insulinToday;
    Double insulinYesterday;

    @Builder(toBuilder = true)
    private GlucoseReading(final double value, final GlucoseUnit unit, final GlucoseTrend trend, final String source,
                           final long timestamp, final Double activeInsulin, final Double basalRate,
                           final Double reservoir, final Integer pumpBattery, final Double bolusAmount,
                           final Integer bolusMinutesAgo, final Integer pumpConnectionMinutesAgo,
                           final Integer sensorDataMinutesAgo, final Double glucoseTarget,
                           final Double insulinToday, final Double insulinYesterday) {
        if (unit == null) {
            throw new IllegalArgumentException("Glucose unit is required");
        }
        if (!isValidValue(value, unit)) {
            throw new IllegalArgumentException("Glucose value outside acceptable range: " + value + " " + unit.getDisplay());
        }
        this.value = value;
        this.unit = unit;
        this.trend = trend == null ? GlucoseTrend.FLAT : trend;
        this.source = source;
        this.timestamp = timestamp;
        this.activeInsulin = activeInsulin;
        this.basalRate = basalRate;
        this.reservoir = reservoir;
        this.pumpBattery = pumpBattery;
        this.bolusAmount = bolusAmount;
        this.bolusMinutesAgo = bolusMinutesAgo;
        this.pumpConnectionMinutesAgo = pumpConnectionMinutesAgo;
        this.sensorDataMinutesAgo = sensorDataMinutesAgo;
        this.glucoseTarget = glucoseTarget;
        this.insulinToday = insulinToday;
        this.insulinYesterday = insulinYesterday;
    }

    private static boolean isValidValue(final double value, final GlucoseUnit unit) {
        if (unit == null || Double.isNaN(value) || value <= 0) return false;
        final double mgdl = Unitized.toMgdl(value, unit);
        return mgdl >= MIN_MGDL && mgdl <= MAX_MGDL;
    }

    /**
     * Validating factory, returns null instead of an out of range reading.
     */
    public static GlucoseReading create(final double value, final GlucoseUnit unit, final GlucoseTrend trend,
                                        final String source, final long timestamp) {
        try {
            return GlucoseReading.builder()
                    .value(value)
                    .unit(unit)
                    .trend(trend)
                    .source(source)
                    .timestamp(timestamp)
                    .build();
        } catch (IllegalArgumentException e) {
            UserError.Log.d(TAG, "Rejecting glucose value: " + e.getMessage());
            return null;
        }
    }

    public double getMgdl() {
        return Unitized.toMgdl(value, unit);
    }

    public double getValueInUnit(final GlucoseUnit target) {
        if (target == unit) return value;
        return Unitized.fromMgdl(getMgdl(), target);
    }

    public String getFormattedValue(final GlucoseUnit target) {
        return Unitized.unitized_string(getValueInUnit(target), target);
    }

    public RangeStatus rangeStatus(final double lowMgdl, final double highMgdl) {
        final double mgdl = getMgdl();
        if (mgdl < lowMgdl) return RangeStatus.LOW;
        if (mgdl > highMgdl) return RangeStatus.HIGH;
        return RangeStatus.IN_RANGE;
    }

    public boolean hasBolus() {
        return bolusAmount != null && bolusMinutesAgo != null;
    }

    public boolean hasPumpDetails() {
        return activeInsulin != null || basalRate != null || reservoir != null || pumpBattery != null;
    }

    /**
     * Copy with the information dialog values merged in. Fields absent from the map are kept.
     */
    public GlucoseReading withDetails(final Map<DetailField, Double> details) {
        if (details == null || details.isEmpty()) return this;
        final EnumMap<DetailField, Double> d = new EnumMap<>(DetailField.class);
        d.putAll(details);
        final GlucoseReadingBuilder b = toBuilder();
        if (d.containsKey(DetailField.ACTIVE_INSULIN)) b.activeInsulin(d.get(DetailField.ACTIVE_INSULIN));
        if (d.containsKey(DetailField.BASAL_RATE)) b.basalRate(d.get(DetailField.BASAL_RATE));
        if (d.containsKey(DetailField.RESERVOIR)) b.reservoir(d.get(DetailField.RESERVOIR));
        if (d.containsKey(DetailField.PUMP_BATTERY)) b.pumpBattery(toInt(d.get(DetailField.PUMP_BATTERY)));
        if (d.containsKey(DetailField.GLUCOSE_TARGET)) b.glucoseTarget(d.get(DetailField.GLUCOSE_TARGET));
        if (d.containsKey(DetailField.INSULIN_TODAY)) b.insulinToday(d.get(DetailField.INSULIN_TODAY));
        if (d.containsKey(DetailField.INSULIN_YESTERDAY)) b.insulinYesterday(d.get(DetailField.INSULIN_YESTERDAY));
        if (d.containsKey(DetailField.BOLUS_AMOUNT)) b.bolusAmount(d.get(DetailField.BOLUS_AMOUNT));
        if (d.containsKey(DetailField.BOLUS_MINUTES_AGO)) b.bolusMinutesAgo(toInt(d.get(DetailField.BOLUS_MINUTES_AGO)));
        if (d.containsKey(DetailField.PUMP_CONNECTION_MINUTES_AGO)) {
            b.pumpConnectionMinutesAgo(toInt(d.get(DetailField.PUMP_CONNECTION_MINUTES_AGO)));
        }
        if (d.containsKey(DetailField.SENSOR_DATA_MINUTES_AGO)) {
            b.sensorDataMinutesAgo(toInt(d.get(DetailField.SENSOR_DATA_MINUTES_AGO)));
        }
        return b.build();
    }

    public GlucoseReading withoutBolus() {
        if (bolusAmount == null && bolusMinutesAgo == null) return this;
        return toBuilder().bolusAmount(null).bolusMinutesAgo(null).build();
    }

    private static Integer toInt(final Double value) {
        return value == null ? null : (int) Math.round(value);
    }

    @Override
    public String toString() {
        return getFormattedValue(unit) + " " + unit.getDisplay() + " " + trend.getSymbol() + " @ " + JoH.dateTimeText(timestamp);
    }
}
