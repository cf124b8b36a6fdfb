/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intuitivedesigns.streamgen.core.ProducerLifecycleManager;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * HTTP control plane for a single producer.
 *
 * <pre>
 * GET  /         service banner
 * GET  /health   liveness
 * GET  /status   producer status
 * POST /rate     {"rate": n} or {"interval": "5s"}
 * POST /start    start (or restart) the producer
 * POST /stop     stop the producer
 * POST /pause    pause emission
 * POST /resume   resume emission
 * </pre>
 */
public final class ControlServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControlServer.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8000;
    public static final String VERSION = "1.0.0";

    private static final String GET = "GET";
    private static final String POST = "POST";

    private final ProducerLifecycleManager manager;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final HttpServer server;
    private final ExecutorService executor;

    private ControlServer(ProducerLifecycleManager manager, HttpServer server, ExecutorService executor, Clock clock) {
        this.manager = manager;
        this.server = server;
        this.executor = executor;
        this.clock = clock;
        this.mapper = newMapper();
    }

    /**
     * Bind and start serving. Port 0 picks a free port; see {@link #port()}.
     *
     * @throws IOException if the address cannot be bound
     */
    public static ControlServer start(ProducerLifecycleManager manager, String host, int port) throws IOException {
        return start(manager, host, port, Clock.systemUTC());
    }

    static ControlServer start(ProducerLifecycleManager manager, String host, int port, Clock clock) throws IOException {
        Objects.requireNonNull(manager, "manager");
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }

        final HttpServer server = HttpServer.create(new InetSocketAddress(host, port), 0);
        final ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "control-http-server");
                t.setDaemon(true);
                return t;
            }
        });
        server.setExecutor(executor);

        final ControlServer control = new ControlServer(manager, server, executor, clock);
        control.register();
        server.start();

        log.info("Control API listening on http://{}:{}", host, control.port());
        return control;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    // --- Routes ---

    private void register() {
        server.createContext("/", route(GET, exchange -> reply(exchange, 200,
                ApiResponse.ok("Stream Data Producer API (Single Producer) is running", Map.of("version", VERSION)))));

        server.createContext("/health", route(GET, exchange -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status", "healthy");
            data.put("timestamp", clock.millis() / 1000.0d);
            reply(exchange, 200, ApiResponse.ok("Service is healthy", data));
        }));

        server.createContext("/status", route(GET, exchange -> reply(exchange, 200, manager.status())));

        server.createContext("/rate", route(POST, this::updateRate));

        server.createContext("/start", route(POST, exchange -> {
            if (manager.isRunning()) {
                reply(exchange, 200, ApiResponse.ok("Producer is already running"));
            } else if (manager.restart()) {
                reply(exchange, 200, ApiResponse.ok("Producer started successfully"));
            } else {
                reply(exchange, 500, ApiResponse.fail("Failed to start producer"));
            }
        }));

        server.createContext("/stop", route(POST, exchange -> {
            if (!manager.isRunning()) {
                reply(exchange, 200, ApiResponse.ok("Producer is already stopped"));
                return;
            }
            manager.stop();
            reply(exchange, 200, ApiResponse.ok("Producer stopped successfully"));
        }));

        server.createContext("/pause", route(POST, exchange -> {
            if (manager.pause()) {
                reply(exchange, 200, ApiResponse.ok("Producer paused"));
            } else {
                reply(exchange, 409, ApiResponse.fail("Producer is not running"));
            }
        }));

        server.createContext("/resume", route(POST, exchange -> {
            if (manager.resume()) {
                reply(exchange, 200, ApiResponse.ok("Producer resumed"));
            } else {
                reply(exchange, 409, ApiResponse.fail("Producer is not running"));
            }
        }));
    }

    private void updateRate(HttpExchange exchange) throws IOException {
        final JsonNode body;
        try (InputStream in = exchange.getRequestBody()) {
            body = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            reply(exchange, 400, ApiResponse.fail("Invalid JSON body: " + e.getOriginalMessage()));
            return;
        }

        Integer rate = null;
        String interval = null;
        if (body != null && body.isObject()) {
            JsonNode r = body.get("rate");
            if (r != null && !r.isNull()) {
                if (!r.isIntegralNumber() || !r.canConvertToInt()) {
                    reply(exchange, 400, ApiResponse.fail("rate must be an integer"));
                    return;
                }
                rate = r.intValue();
            }
            JsonNode i = body.get("interval");
            if (i != null && !i.isNull()) {
                interval = i.asText();
            }
        }

        if (!manager.updateRate(rate, interval)) {
            reply(exchange, 400, ApiResponse.fail("Failed to update rate"));
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("rate", manager.spec().rate());
        data.put("interval", manager.spec().interval());
        reply(exchange, 200, ApiResponse.ok("Rate updated successfully", data));
    }

    // --- Plumbing ---

    private HttpHandler route(String allowed, HttpHandler handler) {
        return exchange -> {
            try {
                if (!exchange.getRequestURI().getPath().equals(exchange.getHttpContext().getPath())) {
                    reply(exchange, 404, ApiResponse.fail("Not found"));
                } else if (method(exchange, allowed)) {
                    handler.handle(exchange);
                }
            } catch (RuntimeException e) {
                log.error("Control request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                reply(exchange, 500, ApiResponse.fail("Internal error: " + e.getMessage()));
            } finally {
                exchange.close();
            }
        };
    }

    private boolean method(HttpExchange exchange, String allowed) throws IOException {
        if (allowed.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", allowed);
        reply(exchange, 405, ApiResponse.fail("Method not allowed"));
        return false;
    }

    private void reply(HttpExchange exchange, int status, Object body) throws IOException {
        final byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        log.info("Stopping control API");
        server.stop(0);
        executor.shutdownNow();
    }
}
