package com.fxscreenreader.utilitymodels;

import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.UserError;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Preference access.
 * <p>
 * Values are layered: {@code fxreader.properties} on the classpath, then the file named by the
 * {@code fxreader.config} system property, then {@code fxreader.<key>} system properties, then
 * values set at runtime.
 */
public class Pref {

    private static final String TAG = Pref.class.getSimpleName();
    private static final String RESOURCE = "fxreader.properties";
    private static final String CONFIG_PROPERTY = "fxreader.config";
    private static final String SYSTEM_PREFIX = "fxreader.";

    private static volatile Properties loaded;
    private static final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    private Pref() {
    }

    private static Properties props() {
        Properties p = loaded;
        if (p == null) {
            synchronized (Pref.class) {
                p = loaded;
                if (p == null) {
                    p = load();
                    loaded = p;
                }
            }
        }
        return p;
    }

    private static Properties load() {
        final Properties p = new Properties();
        try (InputStream in = Pref.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    p.load(reader);
                }
            }
        } catch (IOException e) {
            UserError.Log.e(TAG, "Could not read " + RESOURCE + ": " + e);
        }
        final String external = System.getProperty(CONFIG_PROPERTY);
        if (!JoH.emptyString(external)) {
            try (Reader reader = new InputStreamReader(new FileInputStream(external), StandardCharsets.UTF_8)) {
                p.load(reader);
                UserError.Log.i(TAG, "Loaded configuration from " + external);
            } catch (IOException e) {
                UserError.Log.e(TAG, "Could not read configuration file " + external + ": " + e);
            }
        }
        return p;
    }

    private static String raw(final String key) {
        final String override = overrides.get(key);
        if (override != null) return override;
        final String system = System.getProperty(SYSTEM_PREFIX + key);
        if (system != null) return system;
        return props().getProperty(key);
    }

    public static String getString(final String key, final String def) {
        final String value = raw(key);
        return value == null ? def : value.trim();
    }

    public static String getStringDefaultBlank(final String key) {
        return getString(key, "");
    }

    public static boolean getBoolean(final String key, final boolean def) {
        final String value = raw(key);
        if (value == null) return def;
        return Boolean.parseBoolean(value.trim());
    }

    public static boolean getBooleanDefaultFalse(final String key) {
        return getBoolean(key, false);
    }

    public static long getLong(final String key, final long def) {
        final String value = raw(key);
        if (value == null) return def;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            UserError.Log.w(TAG, "Invalid number for " + key + ": " + value + " using default " + def);
            return def;
        }
    }

    public static int getInt(final String key, final int def) {
        return (int) getLong(key, def);
    }

    public static double getDouble(final String key, final double def) {
        final String value = raw(key);
        if (value == null) return def;
        try {
            return JoH.tolerantParseDouble(value);
        } catch (NumberFormatException e) {
            UserError.Log.w(TAG, "Invalid number for " + key + ": " + value + " using default " + def);
            return def;
        }
    }

    public static void setString(final String key, final String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    public static void setBoolean(final String key, final boolean value) {
        setString(key, Boolean.toString(value));
    }

    public static void setLong(final String key, final long value) {
        setString(key, Long.toString(value));
    }

    public static void setDouble(final String key, final double value) {
        setString(key, Double.toString(value));
    }

    public static void resetOverrides() {
        overrides.clear();
    }
}
