package com.fxscreenreader.models;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Direction of glucose change, with the glyph shown on screen and the Nightscout direction name.
 */
public enum GlucoseTrend {
    DOUBLE_UP("⇈", "DoubleUp"),
    SINGLE_UP("↑", "SingleUp"),
    FORTY_FIVE_UP("↗", "FortyFiveUp"),
    FLAT("→", "Flat"),
    FORTY_FIVE_DOWN("↘", "FortyFiveDown"),
    SINGLE_DOWN("↓", "SingleDown"),
    DOUBLE_DOWN("⇊", "DoubleDown"),
    UNKNOWN("?", "NOT COMPUTABLE");

    private final String symbol;
    private final String direction;

    // double arrows and "quickly" phrases must precede their single counterparts
    private static final List<Map.Entry<String, GlucoseTrend>> RECOGNISED = Collections.unmodifiableList(Arrays.asList(
            Map.entry("↑↑", DOUBLE_UP),
            Map.entry("⇈", DOUBLE_UP),
            Map.entry("↓↓", DOUBLE_DOWN),
            Map.entry("⇊", DOUBLE_DOWN),
            Map.entry("↑", SINGLE_UP),
            Map.entry("⬆", SINGLE_UP),
            Map.entry("↗", FORTY_FIVE_UP),
            Map.entry("⬈", FORTY_FIVE_UP),
            Map.entry("→", FLAT),
            Map.entry("➡", FLAT),
            Map.entry("↘", FORTY_FIVE_DOWN),
            Map.entry("⬊", FORTY_FIVE_DOWN),
            Map.entry("↓", SINGLE_DOWN),
            Map.entry("⬇", SINGLE_DOWN),
            Map.entry("steigt schnell", DOUBLE_UP),
            Map.entry("rising quickly", DOUBLE_UP),
            Map.entry("monte rapidement", DOUBLE_UP),
            Map.entry("fällt schnell", DOUBLE_DOWN),
            Map.entry("falling quickly", DOUBLE_DOWN),
            Map.entry("baisse rapidement", DOUBLE_DOWN),
            Map.entry("steigt langsam", FORTY_FIVE_UP),
            Map.entry("rising slowly", FORTY_FIVE_UP),
            Map.entry("monte lentement", FORTY_FIVE_UP),
            Map.entry("fällt langsam", FORTY_FIVE_DOWN),
            Map.entry("falling slowly", FORTY_FIVE_DOWN),
            Map.entry("baisse lentement", FORTY_FIVE_DOWN),
            Map.entry("steigt", SINGLE_UP),
            Map.entry("rising", SINGLE_UP),
            Map.entry("monte", SINGLE_UP),
            Map.entry("fällt", SINGLE_DOWN),
            Map.entry("falling", SINGLE_DOWN),
            Map.entry("baisse", SINGLE_DOWN),
            Map.entry("stabil", FLAT),
            Map.entry("stable", FLAT),
            Map.entry("steady", FLAT)));

    GlucoseTrend(final String symbol, final String direction) {
        this.symbol = symbol;
        this.direction = direction;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDirection() {
        return direction;
    }

    /**
     * Trend named by a single on-screen string, or null when the string shows no trend.
     */
    public static GlucoseTrend fromText(final String text) {
        if (text == null) return null;
        final String lower = text.toLowerCase(Locale.ROOT);
        for (final Map.Entry<String, GlucoseTrend> entry : RECOGNISED) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static GlucoseTrend fromDirection(final String direction) {
        for (final GlucoseTrend trend : values()) {
            if (trend.direction.equalsIgnoreCase(direction)) return trend;
        }
        return UNKNOWN;
    }
}
