/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Blocking client for a running {@link ControlServer}.
 */
public final class ControlClient {

    public static final String DEFAULT_URL = "http://" + ControlServer.DEFAULT_HOST + ":" + ControlServer.DEFAULT_PORT;

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(2);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final String baseUrl;
    private final HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public ControlClient(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.client = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
    }

    /**
     * Status code plus parsed JSON body.
     */
    public record Reply(int status, JsonNode body) {
        public boolean ok() {
            return status >= 200 && status < 300;
        }

        public String message() {
            return body.path("message").asText("HTTP " + status);
        }
    }

    public Reply status() throws IOException, InterruptedException {
        return send(HttpRequest.newBuilder(uri("/status")).GET());
    }

    public Reply updateRate(Integer rate, String interval) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        if (rate != null) body.put("rate", rate);
        if (interval != null) body.put("interval", interval);
        return post("/rate", mapper.writeValueAsString(body));
    }

    public Reply start() throws IOException, InterruptedException {
        return post("/start", "");
    }

    public Reply stop() throws IOException, InterruptedException {
        return post("/stop", "");
    }

    private Reply post(String path, String json) throws IOException, InterruptedException {
        return send(HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8)));
    }

    private Reply send(HttpRequest.Builder builder) throws IOException, InterruptedException {
        HttpResponse<String> response = client.send(
                builder.timeout(REQUEST_TIMEOUT).build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        String text = response.body();
        JsonNode body = (text == null || text.isBlank()) ? mapper.createObjectNode() : mapper.readTree(text);
        return new Reply(response.statusCode(), body);
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }
}
