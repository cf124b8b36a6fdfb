/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgen.api.ControlClient;
import com.intuitivedesigns.streamgen.api.ControlServer;
import com.intuitivedesigns.streamgen.cli.CliArgs;
import com.intuitivedesigns.streamgen.cli.QuickSchema;
import com.intuitivedesigns.streamgen.config.AppConfig;
import com.intuitivedesigns.streamgen.config.BrokerConfig;
import com.intuitivedesigns.streamgen.config.ConfigLoader;
import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.ErrorLogConfig;
import com.intuitivedesigns.streamgen.config.OutputKind;
import com.intuitivedesigns.streamgen.config.ProducerSpec;
import com.intuitivedesigns.streamgen.config.RateSetting;
import com.intuitivedesigns.streamgen.core.ProducerLifecycleManager;
import com.intuitivedesigns.streamgen.core.ProducerStatus;
import com.intuitivedesigns.streamgen.core.SinkFactory;
import com.intuitivedesigns.streamgen.dictionary.DictionaryException;
import com.intuitivedesigns.streamgen.dictionary.DictionaryProvider;
import com.intuitivedesigns.streamgen.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgen.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.streamgen.rate.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class StreamGenApp {

    private static final Logger log = LoggerFactory.getLogger(StreamGenApp.class);

    static final String QUICK_PRODUCER_NAME = "quick-producer";
    static final String DEFAULT_BOOTSTRAP = "localhost:9092";

    private static final int SPEEDOMETER_WINDOW_SECONDS = 10;

    private StreamGenApp() {}

    public static void main(String[] args) {
        int code = execute(args, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Dispatch a command line. Long-running commands block until shutdown.
     *
     * @return process exit code
     */
    static int execute(String[] args, PrintStream out) {
        final CliArgs cli = new CliArgs()
                .alias("c", "config")
                .alias("r", "rate")
                .alias("i", "interval")
                .alias("o", "output")
                .flag("no-api")
                .flag("help");

        try {
            cli.parse(args);
            if (cli.positionals().isEmpty() || cli.hasFlag("help")) {
                printUsage(out);
                return cli.hasFlag("help") ? 0 : 1;
            }

            final String command = cli.positionals().get(0).toLowerCase(Locale.ROOT);
            switch (command) {
                case "run":
                    return runCommand(cli);
                case "validate":
                    return validateCommand(cli, out);
                case "quick":
                    return quickCommand(cli);
                case "status":
                    return statusCommand(cli, out);
                case "update-rate":
                    return updateRateCommand(cli, out);
                case "start":
                    return remote(out, client(cli).start());
                case "stop":
                    return remote(out, client(cli).stop());
                default:
                    out.println("Unknown command: " + command);
                    printUsage(out);
                    return 1;
            }
        } catch (ConfigurationException | DictionaryException e) {
            log.error("Configuration error: {}", e.getMessage());
            out.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O failure", e);
            out.println("Error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }

    // --- Commands ---

    private static int runCommand(CliArgs cli) throws IOException {
        final Path path = ConfigLoader.resolvePath(cli.option("config"))
                .orElseThrow(() -> new ConfigurationException("No configuration given (use --config, -D"
                        + ConfigLoader.CONFIG_PATH_PROPERTY + " or " + ConfigLoader.CONFIG_PATH_ENV + ")"));
        final AppConfig config = ConfigLoader.load(path);

        final Integer port = cli.intOption("api-port");
        return runProducer(config,
                cli.option("api-host", ControlServer.DEFAULT_HOST),
                port != null ? port : ControlServer.DEFAULT_PORT,
                !cli.hasFlag("no-api"));
    }

    private static int validateCommand(CliArgs cli, PrintStream out) {
        final Path path = ConfigLoader.resolvePath(cli.option("config"))
                .orElseThrow(() -> new ConfigurationException("No configuration given (use --config)"));
        final AppConfig config = ConfigLoader.load(path);
        final ProducerSpec spec = config.producer();

        Set<String> duplicates = spec.validate();
        if (spec.interval() != null) {
            IntervalParser.parse(spec.interval());
        }

        DictionaryProvider dictionaries = new DictionaryProvider();
        dictionaries.loadAll(config.dictionaries());

        out.println("Configuration is valid: " + path);
        out.println("  Producer: " + spec.name() + " -> " + spec.output().id());
        out.println("  Fields:   " + spec.fields().size()
                + (duplicates.isEmpty() ? "" : " (duplicate names: " + duplicates + ")"));
        out.println("  Rate:     " + (spec.rate() != null ? spec.rate() + "/s"
                : spec.interval() != null ? "every " + spec.interval() : "unthrottled"));
        for (String name : dictionaries.names()) {
            out.println("  Dictionary '" + name + "': " + dictionaries.size(name) + " rows");
        }
        return 0;
    }

    private static int quickCommand(CliArgs cli) throws IOException {
        if (cli.positionals().size() < 2) {
            throw new ConfigurationException("quick requires a schema, e.g. quick id:int,name:string");
        }
        return runProducer(quickConfig(cli, cli.positionals().get(1)), null, 0, false);
    }

    static AppConfig quickConfig(CliArgs cli, String schema) {
        final OutputKind output = OutputKind.fromId(cli.option("output", OutputKind.CONSOLE.id()));
        final Integer rate = cli.intOption("rate");
        final String topic = cli.option("topic");

        final ProducerSpec spec = new ProducerSpec(
                QUICK_PRODUCER_NAME,
                output,
                QuickSchema.parse(schema),
                RateSetting.ofRate(rate != null ? rate : 1),
                topic,
                cli.option("file-path"));

        final BrokerConfig broker = (output == OutputKind.BROKER || cli.option("bootstrap") != null)
                ? BrokerConfig.of(cli.option("bootstrap", DEFAULT_BOOTSTRAP), topic)
                : null;

        return new AppConfig(Map.of(), broker, null, ErrorLogConfig.disabled(), false, spec);
    }

    private static int statusCommand(CliArgs cli, PrintStream out) throws IOException, InterruptedException {
        ControlClient.Reply reply = client(cli).status();
        if (!reply.ok()) {
            out.println("Error: " + reply.message());
            return 1;
        }
        out.println(pretty(reply));
        return 0;
    }

    private static int updateRateCommand(CliArgs cli, PrintStream out) throws IOException, InterruptedException {
        final Integer rate = cli.intOption("rate");
        final String interval = cli.option("interval");
        if (rate == null && interval == null) {
            throw new ConfigurationException("update-rate requires --rate or --interval");
        }
        return remote(out, client(cli).updateRate(rate, interval));
    }

    private static ControlClient client(CliArgs cli) {
        return new ControlClient(cli.option("api-url", ControlClient.DEFAULT_URL));
    }

    private static int remote(PrintStream out, ControlClient.Reply reply) {
        if (reply.ok()) {
            out.println(reply.message());
            if (reply.body().hasNonNull("data")) {
                out.println(reply.body().get("data"));
            }
            return 0;
        }
        out.println("Error: " + reply.message());
        return 1;
    }

    private static String pretty(ControlClient.Reply reply) {
        try {
            return new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(reply.body());
        } catch (JsonProcessingException e) {
            return reply.body().toString();
        }
    }

    // --- Producer runtime ---

    private static int runProducer(AppConfig config, String apiHost, int apiPort, boolean api) throws IOException {
        log.info("=== Booting StreamGen producer '{}' ===", config.producer().name());
        SinkFactory.logAvailablePlugins();

        final MetricsRuntime metrics = MicrometerMetricsRuntime.createIfEnabled(config.metricsEnabled(), config.producer().name());
        final ProducerLifecycleManager manager = new ProducerLifecycleManager(config, SinkFactory::create, metrics);
        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        ControlServer server = null;
        ScheduledExecutorService speedometer = null;
        try {
            if (!manager.start()) {
                log.error("Producer '{}' failed to start: {}", config.producer().name(), manager.errorTracker()
                        .stats(config.producer().name()).lastError());
                shutdown(manager, null, null, metrics);
                return 1;
            }
            if (api) {
                server = ControlServer.start(manager, apiHost, apiPort);
            }

            speedometer = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("streamgen-speedometer"));
            startSpeedometer(speedometer, manager, SPEEDOMETER_WINDOW_SECONDS);

            final ControlServer finalServer = server;
            final ScheduledExecutorService finalSpeedometer = speedometer;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }
                log.info("Shutdown signal received.");
                try {
                    shutdown(manager, finalServer, finalSpeedometer, metrics);
                } finally {
                    shutdownLatch.countDown();
                }
            }, "streamgen-shutdown"));

            shutdownLatch.await();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (IOException | RuntimeException e) {
            if (shutdownStarted.compareAndSet(false, true)) {
                shutdown(manager, server, speedometer, metrics);
            }
            throw e;
        }
    }

    private static void shutdown(ProducerLifecycleManager manager,
                                 ControlServer server,
                                 ScheduledExecutorService speedometer,
                                 MetricsRuntime metrics) {
        if (speedometer != null) {
            speedometer.shutdownNow();
        }
        closeQuietly(server);
        closeQuietly(manager);
        closeQuietly(metrics);
    }

    private static void startSpeedometer(ScheduledExecutorService scheduler, ProducerLifecycleManager manager, int windowSeconds) {
        log.info("Speedometer active ({}s window)", windowSeconds);

        final long periodNs = TimeUnit.SECONDS.toNanos(windowSeconds);

        scheduler.scheduleAtFixedRate(new Runnable() {
            private long lastTimeNs = System.nanoTime();
            private long lastSent = 0;
            private long lastErrors = 0;

            @Override
            public void run() {
                try {
                    final long nowNs = System.nanoTime();
                    final long elapsedNs = nowNs - lastTimeNs;
                    if (elapsedNs <= 0) {
                        return;
                    }
                    final double seconds = elapsedNs / 1_000_000_000.0;

                    final ProducerStatus status = manager.status();
                    final long sentNow = status.messagesSent();
                    final long errorsNow = status.errorCount();

                    // Counters restart with each run
                    final long sentDelta = sentNow >= lastSent ? sentNow - lastSent : sentNow;
                    final long errorDelta = errorsNow >= lastErrors ? errorsNow - lastErrors : errorsNow;

                    log.info(String.format(
                            Locale.US,
                            "AVG %ds | STATUS: %s | SPEED: %,.1f rps | ERRORS: %,.1f /s | TOTAL: %,d",
                            windowSeconds,
                            status.status(),
                            sentDelta / seconds,
                            errorDelta / seconds,
                            sentNow
                    ));

                    lastSent = sentNow;
                    lastErrors = errorsNow;
                    lastTimeNs = nowNs;
                } catch (Throwable t) {
                    log.warn("Speedometer error", t);
                }
            }
        }, periodNs, periodNs, TimeUnit.NANOSECONDS);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Close failed for {}", resource.getClass().getSimpleName(), e);
        }
    }

    private static void printUsage(PrintStream out) {
        List<String> lines = List.of(
                "Usage: streamgen <command> [options]",
                "",
                "Commands:",
                "  run          --config <path> [--api-host h] [--api-port p] [--no-api]",
                "  validate     --config <path>",
                "  quick        <name:type,...> [--rate n] [--output console|file|broker]",
                "               [--bootstrap servers] [--topic t] [--file-path p]",
                "  status       [--api-url u]",
                "  update-rate  (--rate n | --interval i) [--api-url u]",
                "  start        [--api-url u]",
                "  stop         [--api-url u]",
                "",
                "Field types: int, long, double, string, boolean");
        lines.forEach(out::println);
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
