/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgen.config.BrokerConfig;
import com.intuitivedesigns.streamgen.core.OutputSink;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Kafka Sink publishing each record as a JSON string value.
 *
 * Features:
 * - Async send with delivery callback
 * - Configurable message key strategy
 * - Bounded flush reporting undelivered records
 * - Rate-limited error logging
 * - Optional Micrometer counters
 */
public final class KafkaSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaSink.class);

    public static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(10);

    private static final long ERROR_LOG_INTERVAL_MS = 1_000L;

    private final Producer<String, String> producer;
    private final String topic;
    private final KeyStrategy keyStrategy;
    private final ObjectMapper mapper;
    private final Duration flushTimeout;

    // Fast counters (always on)
    private final LongAdder sentOk = new LongAdder();
    private final LongAdder sentFail = new LongAdder();
    private final LongAdder inFlight = new LongAdder();

    // Micrometer (optional)
    private final Counter okCounter;
    private final Counter failCounter;

    // Rate-limited error logging
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    // Single daemon thread; a flush that outlives its timeout keeps running here until it completes
    // or close() tears the producer down
    private final ExecutorService flushExecutor;
    private Future<?> pendingFlush;

    private volatile boolean closed;

    public KafkaSink(Producer<String, String> producer,
                     String topic,
                     KeyStrategy keyStrategy,
                     MetricsRuntime metrics,
                     String producerName,
                     Duration flushTimeout) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.keyStrategy = Objects.requireNonNull(keyStrategy, "keyStrategy");
        this.flushTimeout = Objects.requireNonNull(flushTimeout, "flushTimeout");
        this.mapper = new ObjectMapper();
        this.flushExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "kafka-flush-" + topic);
            t.setDaemon(true);
            return t;
        });

        MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;

        if (registry != null) {
            this.okCounter = registry.counter("streamgen_kafka_send_ok_total", "producer", producerName, "topic", topic);
            this.failCounter = registry.counter("streamgen_kafka_send_fail_total", "producer", producerName, "topic", topic);
        } else {
            this.okCounter = null;
            this.failCounter = null;
        }

        log.info("KafkaSink active. topic='{}'", topic);
    }

    /**
     * Build a sink backed by a real {@link KafkaProducer}.
     */
    public static KafkaSink fromConfig(BrokerConfig broker, String topic, String producerName, MetricsRuntime metrics) {
        Objects.requireNonNull(broker, "broker");
        final Properties props = buildProducerProps(broker, producerName);
        final KeyStrategy keys = KeyStrategy.fromConfig(broker.keyStrategy(), broker.keyField(), Clock.systemUTC());
        log.info("Creating Kafka producer: {}", broker);
        return new KafkaSink(new KafkaProducer<>(props), topic, keys, metrics, producerName, DEFAULT_FLUSH_TIMEOUT);
    }

    static Properties buildProducerProps(BrokerConfig broker, String producerName) {
        final Properties props = new Properties();

        // Connectivity
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, broker.bootstrapServers());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, "streamgen-" + producerName);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Timeouts
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, "30000");
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, "30000");
        props.put(CommonClientConfigs.SOCKET_CONNECTION_SETUP_TIMEOUT_MS_CONFIG, "30000");

        // Security
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, broker.securityProtocol());
        if (!"PLAINTEXT".equalsIgnoreCase(broker.securityProtocol())) {
            if (broker.saslMechanism() != null) {
                props.put(SaslConfigs.SASL_MECHANISM, broker.saslMechanism());
            }
            if (broker.saslUsername() != null && broker.saslPassword() != null) {
                props.put(SaslConfigs.SASL_JAAS_CONFIG,
                        jaasConfig(broker.saslMechanism(), broker.saslUsername(), broker.saslPassword()));
            }
        }

        // Passthrough wins over everything above
        props.putAll(broker.properties());
        return props;
    }

    static String jaasConfig(String mechanism, String username, String password) {
        final String module = (mechanism != null && mechanism.toUpperCase(Locale.ROOT).startsWith("SCRAM"))
                ? "org.apache.kafka.common.security.scram.ScramLoginModule"
                : "org.apache.kafka.common.security.plain.PlainLoginModule";
        return module + " required username=\"" + escape(username) + "\" password=\"" + escape(password) + "\";";
    }

    @Override
    public boolean send(Map<String, Object> record) {
        if (closed) return false;
        try {
            final String value = mapper.writeValueAsString(record);
            final String key = keyStrategy.keyFor(record);

            inFlight.increment();
            try {
                producer.send(new ProducerRecord<>(topic, key, value), (metadata, exception) -> {
                    inFlight.decrement();
                    if (exception == null) {
                        markOk();
                    } else {
                        markFail("Message delivery failed topic=" + topic, exception);
                    }
                });
            } catch (RuntimeException e) {
                inFlight.decrement();
                throw e;
            }
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            markFail("Kafka send failed topic=" + topic, e);
            return false;
        }
    }

    /**
     * Waits up to the flush timeout for outstanding deliveries.
     *
     * @return number of records still in flight when the wait ended
     */
    @Override
    public int flush() {
        if (closed) return 0;
        try {
            awaitFlush().get(flushTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Kafka flush timed out after {} ms, still running in background", flushTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Kafka flush failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, inFlight.sum()));
    }

    // Joins a flush still running from an earlier timeout instead of queueing another
    private synchronized Future<?> awaitFlush() {
        if (pendingFlush == null || pendingFlush.isDone()) {
            pendingFlush = flushExecutor.submit(producer::flush);
        }
        return pendingFlush;
    }

    // ---- Metrics & Logging ----

    private void markOk() {
        sentOk.increment();
        if (okCounter != null) okCounter.increment();
    }

    private void markFail(String context, Throwable exception) {
        sentFail.increment();
        if (failCounter != null) failCounter.increment();
        logRateLimited(context, exception);
    }

    private void logRateLimited(String context, Throwable ex) {
        long now = System.currentTimeMillis();
        long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.error("{} (suppressed {} similar errors): {}", context, suppressed, ex.getMessage());
            } else {
                log.error("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrorLogs.increment();
        }
    }

    // ---- Introspection ----

    public long sentOkTotal() { return sentOk.sum(); }
    public long sentFailTotal() { return sentFail.sum(); }
    public long inFlightTotal() { return inFlight.sum(); }

    public String topic() {
        return topic;
    }

    @Override
    public String id() {
        return "kafka:" + topic;
    }

    // ---- Lifecycle ----

    @Override
    public void close() {
        if (closed) return;
        log.info("Closing KafkaSink (topic={})...", topic);
        int remaining = flush();
        if (remaining > 0) {
            log.warn("{} messages unsent", remaining);
        }
        closed = true;
        try {
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("KafkaSink close failed", e);
        } finally {
            flushExecutor.shutdownNow();
        }
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
