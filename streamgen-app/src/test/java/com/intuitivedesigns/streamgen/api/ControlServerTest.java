/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.FieldSpec;
import com.intuitivedesigns.streamgen.config.FieldType;
import com.intuitivedesigns.streamgen.config.OutputKind;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.config.RateSetting;
import com.intuitivedesigns.streamgen.core.OutputSink;
import com.intuitivedesigns.streamgen.core.ProducerLifecycleManager;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ControlServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private final AtomicLong delivered = new AtomicLong();

    private ProducerLifecycleManager manager;
    private ControlServer server;
    private String base;

    @BeforeEach
    void setUp() throws Exception {
        ProducerSpec spec = new ProducerSpec("api-producer", OutputKind.CONSOLE,
                List.of(FieldSpec.range("id", FieldType.INT, 1L, 100L)), RateSetting.ofRate(50), null, null);
        OutputSink sink = record -> {
            delivered.incrementAndGet();
            return true;
        };
        manager = new ProducerLifecycleManager(AppConfig.forProducer(spec), (c, m) -> sink, MetricsRuntime.NOOP);
        server = ControlServer.start(manager, "127.0.0.1", 0,
                Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
        base = "http://127.0.0.1:" + server.port();
    }

    @AfterEach
    void tearDown() {
        server.close();
        manager.close();
    }

    @Test
    void testRootAndHealth() throws Exception {
        JsonNode root = body(get("/"));
        assertTrue(root.get("success").asBoolean());
        assertEquals(ControlServer.VERSION, root.get("data").get("version").asText());

        JsonNode health = body(get("/health"));
        assertEquals("healthy", health.get("data").get("status").asText());
        assertEquals(1_700_000_000d, health.get("data").get("timestamp").asDouble());
    }

    @Test
    void testStatusUsesSnakeCase() throws Exception {
        JsonNode status = body(get("/status"));

        assertEquals("api-producer", status.get("name").asText());
        assertEquals("stopped", status.get("status").asText());
        assertEquals(50, status.get("rate").asInt());
        assertTrue(status.has("messages_sent"));
        assertTrue(status.has("last_error"));
        assertTrue(status.has("uptime_seconds"));
    }

    @Test
    void testStartPauseResumeStop() throws Exception {
        HttpResponse<String> started = post("/start", "");
        assertEquals(200, started.statusCode());
        assertEquals("Producer started successfully", body(started).get("message").asText());
        assertTrue(manager.isRunning());

        assertEquals("Producer is already running", body(post("/start", "")).get("message").asText());

        assertEquals(200, post("/pause", "").statusCode());
        assertEquals("paused", body(get("/status")).get("status").asText());
        assertEquals(200, post("/resume", "").statusCode());

        HttpResponse<String> stopped = post("/stop", "");
        assertEquals("Producer stopped successfully", body(stopped).get("message").asText());
        assertFalse(manager.isRunning());
        assertEquals("Producer is already stopped", body(post("/stop", "")).get("message").asText());
        assertEquals(409, post("/pause", "").statusCode());
    }

    @Test
    void testRateUpdate() throws Exception {
        HttpResponse<String> ok = post("/rate", "{\"interval\": \"2s\"}");
        assertEquals(200, ok.statusCode());
        JsonNode data = body(ok).get("data");
        assertTrue(data.get("rate").isNull());
        assertEquals("2s", data.get("interval").asText());

        assertEquals(400, post("/rate", "{\"rate\": 0}").statusCode());
        assertEquals(400, post("/rate", "{}").statusCode());
        assertEquals(400, post("/rate", "{\"interval\": \"later\"}").statusCode());
        assertEquals(400, post("/rate", "not json").statusCode());
        assertEquals(400, post("/rate", "{\"rate\": \"ten\"}").statusCode());

        assertEquals(RateSetting.ofInterval("2s"), manager.spec().rateSetting());
    }

    @Test
    void testWrongMethodAndUnknownPath() throws Exception {
        assertEquals(405, post("/status", "").statusCode());
        assertEquals(405, get("/stop").statusCode());
        assertEquals(404, get("/nowhere").statusCode());
        assertFalse(body(get("/nowhere")).get("success").asBoolean());
    }

    @Test
    void testClientAgainstServer() throws Exception {
        ControlClient client = new ControlClient(base + "/");

        assertTrue(client.start().ok());
        assertTrue(client.updateRate(20, null).ok());
        assertEquals(20, client.status().body().get("rate").asInt());
        assertFalse(client.updateRate(null, "bogus").ok());
        assertEquals("Producer stopped successfully", client.stop().message());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(base + path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(base + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode body(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }
}
