/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.core;

import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.FieldSpec;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.config.RateSetting;
import com.intuitivedesigns.streamgen.config.RuleType;
import com.intuitivedesigns.streamgen.dictionary.DictionaryProvider;
import com.intuitivedesigns.streamgen.errors.ErrorLogger;
import com.intuitivedesigns.streamgen.generator.ValueGenerator;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.rate.AdaptiveRateController;
import com.intuitivedesigns.streamgen.rate.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one configured producer: builds its generator and sink, runs the emission loop on a
 * dedicated daemon thread and exposes the control-plane operations.
 *
 * <p>Every start or restart creates a fresh run (rate controller, stats, worker thread). Control
 * operations are serialized on this object; status reads are lock-free snapshots.</p>
 *
 * <p>The sink survives {@link #stop()} (it is only flushed) so a later restart reuses it.
 * {@link #close()} releases it.</p>
 */
public final class ProducerLifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProducerLifecycleManager.class);

    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofSeconds(1);

    public static final String METRIC_RECORDS_SENT = "streamgen_records_sent_total";
    public static final String METRIC_ERRORS = "streamgen_errors_total";
    public static final String METRIC_MEASURED_RATE = "streamgen_measured_rate";

    static final String SEND_FAILED = "Output send failed";

    private static final long SAMPLE_PERIOD_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final AppConfig config;
    private final ProducerSpec spec;
    private final SinkProvider sinkProvider;
    private final MetricsRuntime metrics;
    private final ErrorTracker errorTracker;
    private final ErrorLogger errorLogger;
    private final Clock clock;
    private final Duration stopTimeout;
    private final Duration errorBackoff;

    // Set once by initialize(), read by the worker
    private volatile ValueGenerator generator;
    private volatile OutputSink sink;

    private volatile ProducerRun current;

    public ProducerLifecycleManager(AppConfig config, SinkProvider sinkProvider, MetricsRuntime metrics) {
        this(config, sinkProvider, metrics, new ErrorTracker(), new ErrorLogger(config.errorLog()),
                Clock.systemDefaultZone(), DEFAULT_STOP_TIMEOUT, DEFAULT_ERROR_BACKOFF);
    }

    public ProducerLifecycleManager(AppConfig config,
                                    SinkProvider sinkProvider,
                                    MetricsRuntime metrics,
                                    ErrorTracker errorTracker,
                                    ErrorLogger errorLogger,
                                    Clock clock,
                                    Duration stopTimeout,
                                    Duration errorBackoff) {
        this.config = Objects.requireNonNull(config, "config");
        this.spec = config.producer();
        this.sinkProvider = Objects.requireNonNull(sinkProvider, "sinkProvider");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.errorTracker = Objects.requireNonNull(errorTracker, "errorTracker");
        this.errorLogger = Objects.requireNonNull(errorLogger, "errorLogger");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff");
    }

    /**
     * Validate the producer, load dictionaries and build the generator and sink. Idempotent once
     * it has succeeded; a failed attempt may be retried.
     *
     * @return false if any component could not be built; the error is recorded for {@link #status()}
     */
    public synchronized boolean initialize() {
        if (sink != null) return true;

        try {
            Set<String> duplicates = spec.validate();
            if (!duplicates.isEmpty()) {
                log.warn("Producer '{}' repeats field names {}; later values overwrite earlier ones", spec.name(), duplicates);
            }
            validateRateSetting(spec.rateSetting());

            DictionaryProvider dictionaries = new DictionaryProvider();
            dictionaries.loadAll(config.dictionaries());
            checkDictionaryReferences(dictionaries);

            ValueGenerator newGenerator = new ValueGenerator(dictionaries);
            OutputSink newSink = sinkProvider.create(config, metrics);
            if (newSink == null) {
                throw new ConfigurationException("No sink created for output '" + spec.output().id() + "'");
            }

            this.generator = newGenerator;
            this.sink = newSink;
            errorLogger.cleanupOldLogs();

            log.info("Initialized producer '{}': output={} sink={} {} fields={}",
                    spec.name(), spec.output().id(), newSink.id(), describeRate(spec.rateSetting()), spec.fields().size());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to initialize producer '{}': {}", spec.name(), e.getMessage(), e);
            recordError(messageOf(e), Map.of("phase", "initialize"));
            return false;
        }
    }

    /**
     * Start emitting. A no-op success when already running.
     *
     * @return true once the worker is scheduled, false if initialization failed
     */
    public synchronized boolean start() {
        if (isRunning()) {
            log.warn("Producer '{}' is already running", spec.name());
            return true;
        }
        if (!initialize()) return false;
        launch();
        log.info("Started producer '{}'", spec.name());
        return true;
    }

    /**
     * Stop the worker, waiting up to the stop timeout, then flush the sink. A no-op when not running.
     */
    public synchronized void stop() {
        final ProducerRun run = current;
        if (run == null || !run.running.get()) return;

        log.info("Stopping producer '{}'...", spec.name());
        run.running.set(false);
        run.rateController.stop();

        try {
            run.thread.join(stopTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (run.thread.isAlive()) {
            log.warn("Producer thread '{}' did not terminate within {} ms", run.thread.getName(), stopTimeout.toMillis());
        }

        flushSink();
        log.info("Producer '{}' stopped. sent={}", spec.name(), run.stats.messagesSent());
    }

    /**
     * Stop if running, zero the error count (the last error message is kept) and start a fresh run.
     */
    public synchronized boolean restart() {
        if (isRunning()) stop();
        if (!initialize()) return false;
        errorTracker.reset(spec.name());
        launch();
        log.info("Restarted producer '{}'", spec.name());
        return true;
    }

    /**
     * Change the pacing. When both are given the rate wins. The change is mirrored into the
     * producer definition so it also applies to later runs.
     *
     * @return false if neither is given or the value is rejected
     */
    public synchronized boolean updateRate(Integer rate, String interval) {
        if (rate == null && interval == null) return false;

        final RateSetting setting;
        try {
            if (rate != null) {
                if (rate < 1) {
                    log.warn("Rejected rate update for '{}': rate must be >= 1, got {}", spec.name(), rate);
                    return false;
                }
                setting = RateSetting.ofRate(rate);
            } else {
                IntervalParser.parse(interval);
                setting = RateSetting.ofInterval(interval.trim());
            }
        } catch (ConfigurationException e) {
            log.warn("Rejected rate update for '{}': {}", spec.name(), e.getMessage());
            return false;
        }

        final ProducerRun run = current;
        if (run != null) {
            if (setting.rate() != null) {
                run.rateController.setRate(setting.rate());
            } else {
                run.rateController.setInterval(setting.interval());
            }
        }
        spec.updateRateSetting(setting);
        log.info("Producer '{}' pacing updated: {}", spec.name(), describeRate(setting));
        return true;
    }

    /**
     * @return false if the producer is not running
     */
    public synchronized boolean pause() {
        if (!isRunning()) return false;
        current.rateController.pause();
        log.info("Producer '{}' paused", spec.name());
        return true;
    }

    /**
     * @return false if the producer is not running
     */
    public synchronized boolean resume() {
        if (!isRunning()) return false;
        current.rateController.resume();
        log.info("Producer '{}' resumed", spec.name());
        return true;
    }

    public boolean isRunning() {
        final ProducerRun run = current;
        return run != null && run.running.get() && run.thread.isAlive();
    }

    public ProducerStatus status() {
        final ProducerRun run = current;
        final boolean running = isRunning();
        final boolean paused = running && run.rateController.isPaused();
        final ErrorStats errors = errorTracker.stats(spec.name());
        final RateSetting setting = spec.rateSetting();

        long uptime = 0L;
        long sent = 0L;
        Instant lastMessage = null;
        double measured = 0d;
        if (run != null) {
            uptime = Math.max(0L, Duration.between(run.stats.startTime(), clock.instant()).getSeconds());
            sent = run.stats.messagesSent();
            lastMessage = run.stats.lastMessageTime();
            measured = round2(run.rateController.averageActualRate());
        }

        return new ProducerStatus(
                spec.name(),
                running,
                running ? (paused ? "paused" : "running") : "stopped",
                spec.output().id(),
                setting.rate(),
                setting.interval(),
                uptime,
                sent,
                round2(configuredRate(setting)),
                measured,
                paused,
                errors.count(),
                errors.lastError(),
                lastMessage
        );
    }

    /**
     * Stop, then close the sink. The manager can be initialized again afterwards.
     */
    @Override
    public synchronized void close() {
        stop();
        final OutputSink s = sink;
        sink = null;
        generator = null;
        if (s != null) {
            try {
                s.close();
            } catch (Exception e) {
                log.warn("Error closing sink {}", s.id(), e);
            }
        }
    }

    public ProducerSpec spec() {
        return spec;
    }

    public ErrorTracker errorTracker() {
        return errorTracker;
    }

    // --- Internals ---

    // Caller holds this
    private void launch() {
        final AdaptiveRateController rc = AdaptiveRateController.from(spec.rateSetting());
        final ProducerRun run = new ProducerRun(rc, new RuntimeStats(clock.instant()));
        current = run;
        run.thread.start();
    }

    private void emitLoop(ProducerRun run) {
        final String name = spec.name();
        final ValueGenerator gen = this.generator;
        final OutputSink out = this.sink;
        final AdaptiveRateController rc = run.rateController;

        long windowStart = System.nanoTime();
        long windowCount = 0L;

        try {
            while (run.running.get()) {
                if (!rc.waitForNext()) break;

                try {
                    final Map<String, Object> record = gen.generate(spec.fields());
                    if (out.send(record)) {
                        run.stats.recordSent(clock.instant());
                        metrics.counter(METRIC_RECORDS_SENT);
                        windowCount++;
                    } else {
                        recordError(SEND_FAILED, Map.of("sink", out.id()));
                        errorLogger.logDroppedData(name, record, SEND_FAILED);
                    }
                } catch (Exception e) {
                    log.warn("Error generating/sending record for '{}': {}", name, messageOf(e));
                    recordError(messageOf(e), Map.of("exception", e.getClass().getName()));
                    rc.sleepUnlessStopped(errorBackoff);
                }

                final long now = System.nanoTime();
                final long elapsed = now - windowStart;
                if (elapsed >= SAMPLE_PERIOD_NANOS) {
                    final double measured = windowCount * 1_000_000_000d / elapsed;
                    rc.recordActualRate(measured);
                    metrics.gauge(METRIC_MEASURED_RATE, measured);
                    windowStart = now;
                    windowCount = 0L;
                }
            }
        } catch (Throwable t) {
            log.error("Fatal error in producer loop '{}'", name, t);
            recordError("Fatal error: " + messageOf(t), Map.of("exception", t.getClass().getName()));
        } finally {
            run.running.set(false);
        }
    }

    private void recordError(String message, Map<String, ?> details) {
        errorTracker.record(spec.name(), message);
        metrics.counter(METRIC_ERRORS);
        errorLogger.logError(spec.name(), message, details);
    }

    private void flushSink() {
        final OutputSink s = sink;
        if (s == null) return;
        try {
            int pending = s.flush();
            if (pending > 0) {
                log.warn("Sink {} still had {} undelivered records after flush", s.id(), pending);
            }
        } catch (Exception e) {
            log.warn("Error flushing sink {}", s.id(), e);
        }
    }

    private void checkDictionaryReferences(DictionaryProvider dictionaries) {
        for (FieldSpec field : spec.fields()) {
            if (field.rule() == RuleType.RANDOM_FROM_DICTIONARY && !dictionaries.isLoaded(field.dictionary())) {
                throw new ConfigurationException("Field '" + field.name() + "': dictionary '" + field.dictionary() + "' is not configured");
            }
        }
    }

    private static void validateRateSetting(RateSetting setting) {
        if (setting.interval() != null) {
            IntervalParser.parse(setting.interval());
        }
    }

    private static double configuredRate(RateSetting setting) {
        if (setting.rate() != null) return setting.rate();
        if (setting.interval() != null) {
            long nanos = IntervalParser.parse(setting.interval()).toNanos();
            if (nanos > 0) return 1_000_000_000d / nanos;
        }
        return 0d;
    }

    private static String describeRate(RateSetting setting) {
        if (setting.rate() != null) return "rate=" + setting.rate() + " msg/s";
        if (setting.interval() != null) return "interval=" + setting.interval();
        return "unpaced";
    }

    private static double round2(double v) {
        return Math.round(v * 100d) / 100d;
    }

    private static String messageOf(Throwable t) {
        return (t.getMessage() != null) ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * State of one start/restart. A finished run never touches a newer one.
     */
    private final class ProducerRun {
        final AdaptiveRateController rateController;
        final RuntimeStats stats;
        final AtomicBoolean running = new AtomicBoolean(true);
        final Thread thread;

        ProducerRun(AdaptiveRateController rateController, RuntimeStats stats) {
            this.rateController = rateController;
            this.stats = stats;
            this.thread = new Thread(() -> emitLoop(this), "producer-" + spec.name());
            this.thread.setDaemon(true);
        }
    }
}
