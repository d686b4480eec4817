package com.fxscreenreader.nightscout;

import com.fxscreenreader.models.GlucoseReading;
import com.fxscreenreader.models.JoH;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Pref;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.logging.HttpLoggingInterceptor;

/**
 * Nightscout REST v1 access. All calls are blocking and report transport or HTTP failures as
 * {@link IOException}.
 */
public class NightscoutClient {

    private static final String TAG = NightscoutClient.class.getSimpleName();
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final List<String> TOKEN_PREFIXES = Arrays.asList("admin", "readable", "reader", "denied", "device", "food");

    public static final String PREF_URL = "nightscout_url";
    public static final String PREF_SECRET = "nightscout_api_secret";

    private final HttpUrl baseUrl;
    private final String apiSecret;
    private final OkHttpClient client;

    public NightscoutClient(final String url, final String secret) {
        final String normalized = normalizeUrl(url);
        this.baseUrl = JoH.emptyString(normalized) ? null : HttpUrl.parse(normalized);
        if (baseUrl == null && !JoH.emptyString(url)) {
            UserError.Log.e(TAG, "Invalid Nightscout URL: " + url);
        }
        this.apiSecret = prepareApiSecret(secret);
        final HttpLoggingInterceptor logging = new HttpLoggingInterceptor(message -> UserError.Log.d(TAG, message));
        logging.setLevel(HttpLoggingInterceptor.Level.BASIC);
        logging.redactHeader("api-secret");
        this.client = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .addInterceptor(logging)
                .build();
    }

    public static NightscoutClient fromPreferences() {
        return new NightscoutClient(Pref.getStringDefaultBlank(PREF_URL), Pref.getStringDefaultBlank(PREF_SECRET));
    }

    public boolean isConfigured() {
        return baseUrl != null;
    }

    static String normalizeUrl(final String url) {
        if (url == null) return "";
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.toLowerCase(Locale.ROOT).endsWith("/api/v1")) {
            normalized = normalized.substring(0, normalized.length() - "/api/v1".length());
        }
        return normalized;
    }

    /**
     * Access tokens and already hashed secrets are sent as they are, anything else as its SHA-1 hex digest.
     */
    static String prepareApiSecret(final String secret) {
        if (JoH.emptyString(secret)) return "";
        final String trimmed = secret.trim();
        final String[] parts = trimmed.split("-");
        if (parts.length == 2 && TOKEN_PREFIXES.contains(parts[0].toLowerCase(Locale.ROOT))) {
            return trimmed;
        }
        if (trimmed.matches("[0-9a-fA-F]{40}")) {
            return trimmed;
        }
        return sha1(trimmed);
    }

    static String sha1(final String value) {
        try {
            final byte[] digest = MessageDigest.getInstance("SHA-1").digest(value.getBytes(StandardCharsets.UTF_8));
            final StringBuilder hex = new StringBuilder(digest.length * 2);
            for (final byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public void testConnection() throws IOException {
        execute(request(endpoint("status")).get().build());
    }

    public int uploadEntries(final List<GlucoseReading> readings) throws IOException {
        if (readings.isEmpty()) return 0;
        post("entries", NightscoutPayloads.entries(readings).toString());
        return readings.size();
    }

    public void uploadDeviceStatus(final JSONObject status) throws IOException {
        post("devicestatus", new JSONArray().put(status).toString());
    }

    public void uploadTreatment(final JSONObject treatment) throws IOException {
        post("treatments", treatment.toString());
        UserError.Log.uel(TAG, "Uploaded treatment: " + treatment.optString("eventType"));
    }

    /**
     * Time of the newest treatment whose event type matches the regex, or null when there is none.
     */
    public Long latestTreatmentTime(final String eventTypeRegex) throws IOException {
        final HttpUrl url = endpoint("treatments").newBuilder()
                .addQueryParameter("find[eventType][$regex]", eventTypeRegex)
                .addQueryParameter("count", "1")
                .build();
        final String body = execute(request(url).get().build());
        try {
            final JSONArray treatments = new JSONArray(body);
            if (treatments.length() == 0) {
                UserError.Log.d(TAG, "No treatments matching " + eventTypeRegex);
                return null;
            }
            return treatmentTime(treatments.getJSONObject(0));
        } catch (JSONException e) {
            throw new IOException("Unexpected treatments response: " + e.getMessage(), e);
        }
    }

    static Long treatmentTime(final JSONObject treatment) {
        final Object createdAt = treatment.opt("created_at");
        final Long fromCreated = parseTime(createdAt);
        if (fromCreated != null) return fromCreated;
        return parseTime(treatment.opt("date"));
    }

    static Long parseTime(final Object value) {
        if (value == null || value == JSONObject.NULL) return null;
        if (value instanceof Number) return ((Number) value).longValue();
        final String text = value.toString().trim();
        if (text.isEmpty()) return null;
        if (text.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(text);
        }
        try {
            return OffsetDateTime.parse(text).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            UserError.Log.e(TAG, "Cannot parse date: " + text);
            return null;
        }
    }

    private HttpUrl endpoint(final String path) throws IOException {
        if (baseUrl == null) {
            throw new IOException("Nightscout URL not configured");
        }
        return baseUrl.newBuilder().addPathSegments("api/v1/" + path).build();
    }

    private Request.Builder request(final HttpUrl url) {
        final Request.Builder builder = new Request.Builder().url(url).header("Accept", "application/json");
        if (!apiSecret.isEmpty()) {
            builder.header("api-secret", apiSecret);
        }
        return builder;
    }

    private void post(final String path, final String body) throws IOException {
        execute(request(endpoint(path)).post(RequestBody.create(body, JSON)).build());
    }

    private String execute(final Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            final ResponseBody body = response.body();
            final String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("Nightscout " + request.method() + " " + request.url().encodedPath()
                        + " failed: HTTP " + response.code());
            }
            return text;
        }
    }
}
