package com.fxscreenreader.nightscout;

import com.fxscreenreader.models.AgeInfo;
import com.fxscreenreader.models.InsulinInfo;
import com.fxscreenreader.models.SensorInfo;
import com.fxscreenreader.services.AgeReconciler;
import com.fxscreenreader.utilitymodels.Constants;

import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AgeSyncTest {

    // 2024-03-10T12:00:00Z
    private static final long START = 1_710_072_000_000L;

    private MockWebServer server;
    private AgeSync ageSync;

    @Before
    public void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ageSync = new AgeSync(new NightscoutClient(server.url("/").toString(), "token-abc"), new AgeReconciler(1.5));
    }

    @After
    public void tearDown() throws IOException {
        server.shutdown();
    }

    private static SensorInfo sensor(final long start) {
        return SensorInfo.builder().sensorStartTime(start).serialNumber("ABC123").durationText("1d").build();
    }

    @Test
    public void missingRemoteSensorStartIsUploaded() throws Exception {
        server.enqueue(new MockResponse().setBody("[]"));
        server.enqueue(new MockResponse().setBody("{}"));

        final AgeReconciler.Decision decision = ageSync.syncSensor(sensor(START));

        assertEquals(AgeReconciler.Action.UPLOADED_NO_PREVIOUS, decision.getAction());
        server.takeRequest();
        final RecordedRequest upload = server.takeRequest();
        assertEquals("/api/v1/treatments", upload.getPath());
        final JSONObject treatment = new JSONObject(upload.getBody().readUtf8());
        assertEquals("Sensor Start", treatment.getString("eventType"));
        assertEquals("2024-03-10T12:00:00.000Z", treatment.getString("created_at"));
        assertEquals("Sensor ABC123", treatment.getString("notes"));
        assertEquals("CamAPSFX-ScreenReader", treatment.getString("enteredBy"));
    }

    @Test
    public void closeRemoteTimeIsLeftAlone() throws Exception {
        server.enqueue(new MockResponse().setBody("[{\"date\":" + (START + Constants.HOUR_IN_MS) + "}]"));

        final AgeReconciler.Decision decision = ageSync.syncSensor(sensor(START));

        assertEquals(AgeReconciler.Action.IN_SYNC, decision.getAction());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    public void distantRemoteFillTimeIsReplaced() throws Exception {
        server.enqueue(new MockResponse().setBody("[{\"created_at\":\"2024-03-08T12:00:00Z\"}]"));
        server.enqueue(new MockResponse().setBody("{}"));

        final AgeReconciler.Decision decision = ageSync.syncInsulin(new InsulinInfo(START, "2d"));

        assertEquals(AgeReconciler.Action.UPDATED, decision.getAction());
        assertEquals("Insulin", server.takeRequest().getRequestUrl().queryParameter("find[eventType][$regex]"));
        assertEquals("Insulin Change", new JSONObject(server.takeRequest().getBody().readUtf8()).getString("eventType"));
    }

    @Test
    public void failureOfOneHalfDoesNotStopTheOther() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setBody("[]"));
        server.enqueue(new MockResponse().setBody("{}"));

        assertFalse(ageSync.sync(new AgeInfo(sensor(START), new InsulinInfo(START, "2d"))));
        assertEquals(3, server.getRequestCount());
    }

    @Test
    public void nothingToSync() {
        assertFalse(ageSync.sync(new AgeInfo(null, null)));
        assertFalse(ageSync.sync(null));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    public void bothHalvesInSync() {
        server.enqueue(new MockResponse().setBody("[{\"date\":" + START + "}]"));
        server.enqueue(new MockResponse().setBody("[{\"date\":" + START + "}]"));

        assertTrue(ageSync.sync(new AgeInfo(sensor(START), new InsulinInfo(START, "2d"))));
    }
}
