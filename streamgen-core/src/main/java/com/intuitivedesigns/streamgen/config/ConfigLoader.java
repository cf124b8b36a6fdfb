/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.intuitivedesigns.streamgen.rate.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Reads the YAML configuration file into an {@link AppConfig}.
 *
 * <p>Errors name the offending path, e.g. {@code producer.fields[2].type}.</p>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_PATH_PROPERTY = "streamgen.config.path";
    public static final String CONFIG_PATH_ENV = "STREAMGEN_CONFIG_PATH";

    private static final ObjectMapper YAML = new YAMLMapper();

    private ConfigLoader() {}

    /**
     * Resolve the configuration file: the explicit argument first, then the
     * {@value #CONFIG_PATH_PROPERTY} system property, then the {@value #CONFIG_PATH_ENV} environment variable.
     */
    public static Optional<Path> resolvePath(String explicit) {
        return resolvePath(explicit, System::getProperty, System::getenv);
    }

    static Optional<Path> resolvePath(String explicit, UnaryOperator<String> sysProps, UnaryOperator<String> env) {
        String path = explicit;
        if (isBlank(path)) path = sysProps.apply(CONFIG_PATH_PROPERTY);
        if (isBlank(path)) path = env.apply(CONFIG_PATH_ENV);
        return isBlank(path) ? Optional.empty() : Optional.of(Path.of(path.trim()));
    }

    /**
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static AppConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        log.info("Loading configuration from: {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public static AppConfig parse(String yaml) {
        try {
            return read(new StringReader(yaml));
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration YAML: " + e.getMessage(), e);
        }
    }

    private static AppConfig read(Reader reader) throws IOException {
        JsonNode root = YAML.readTree(reader);
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a YAML mapping");
        }
        return fromTree(root);
    }

    static AppConfig fromTree(JsonNode root) {
        JsonNode brokerNode = root.hasNonNull("broker") ? root.get("broker") : root.get("kafka");
        BrokerConfig broker = (brokerNode != null && !brokerNode.isNull())
                ? parseBroker(brokerNode, root.has("broker") ? "broker" : "kafka")
                : null;

        return new AppConfig(
                parseDictionaries(root.get("dictionaries")),
                broker,
                parseFileOutput(root.get("file_output")),
                parseErrorLog(root.get("error_log")),
                root.path("metrics").path("enabled").asBoolean(false),
                parseProducer(root)
        );
    }

    // --- Sections ---

    private static Map<String, DictionarySpec> parseDictionaries(JsonNode node) {
        Map<String, DictionarySpec> out = new LinkedHashMap<>();
        if (node == null || node.isNull()) return out;
        requireObject(node, "dictionaries");

        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String path = "dictionaries." + e.getKey();
            JsonNode d = e.getValue();
            requireObject(d, path);

            Map<String, Object> columns = new LinkedHashMap<>();
            JsonNode cols = d.get("columns");
            if (cols == null || !cols.isObject() || cols.isEmpty()) {
                throw new ConfigurationException(path + ".columns must be a non-empty mapping");
            }
            cols.fields().forEachRemaining(c -> columns.put(c.getKey(), columnRef(c.getValue(), path + ".columns." + c.getKey())));

            String delimiter = text(d, "delimiter", String.valueOf(DictionarySpec.DEFAULT_DELIMITER));
            if (delimiter.length() != 1) {
                throw new ConfigurationException(path + ".delimiter must be a single character: '" + delimiter + "'");
            }

            out.put(e.getKey(), new DictionarySpec(
                    Path.of(requireText(d, "file", path)),
                    columns,
                    delimiter.charAt(0),
                    d.path("header").asBoolean(false)));
        }
        return out;
    }

    private static BrokerConfig parseBroker(JsonNode node, String path) {
        requireObject(node, path);
        Map<String, String> props = new LinkedHashMap<>();
        JsonNode p = node.get("properties");
        if (p != null && p.isObject()) {
            p.fields().forEachRemaining(e -> props.put(e.getKey(), e.getValue().asText()));
        }
        return new BrokerConfig(
                requireText(node, "bootstrap_servers", path),
                text(node, "default_topic", null),
                text(node, "security_protocol", null),
                text(node, "sasl_mechanism", null),
                text(node, "sasl_username", null),
                text(node, "sasl_password", null),
                text(node, "key_field", null),
                text(node, "key_strategy", null),
                props
        );
    }

    private static FileOutputConfig parseFileOutput(JsonNode node) {
        if (node == null || node.isNull()) return null;
        requireObject(node, "file_output");
        FileOutputConfig defaults = FileOutputConfig.defaults();
        return new FileOutputConfig(
                Path.of(text(node, "directory", defaults.directory().toString())),
                RollingPeriod.fromId(text(node, "rolling", defaults.rolling().name())));
    }

    private static ErrorLogConfig parseErrorLog(JsonNode node) {
        if (node == null || node.isNull()) return null;
        requireObject(node, "error_log");
        ErrorLogConfig defaults = ErrorLogConfig.defaults();
        return new ErrorLogConfig(
                node.path("enabled").asBoolean(defaults.enabled()),
                Path.of(text(node, "directory", defaults.directory().toString())),
                RollingPeriod.fromId(text(node, "rolling", defaults.rolling().name())),
                node.path("max_age_days").asInt(defaults.maxAgeDays()));
    }

    private static ProducerSpec parseProducer(JsonNode root) {
        JsonNode node = root.get("producer");
        String path = "producer";
        if (node == null || node.isNull()) {
            JsonNode list = root.get("producers");
            if (list != null && list.isArray() && !list.isEmpty()) {
                node = list.get(0);
                path = "producers[0]";
                if (list.size() > 1) {
                    log.warn("Configuration lists {} producers; only the first ('{}') is used", list.size(), node.path("name").asText());
                }
            }
        }
        if (node == null || node.isNull()) {
            throw new ConfigurationException("No producer configuration found");
        }
        requireObject(node, path);

        String name = requireText(node, "name", path);
        String outputId = requireText(node, "output", path);
        OutputKind output = wrap(path + ".output", () -> OutputKind.fromId(outputId));

        List<FieldSpec> fields = new ArrayList<>();
        JsonNode fieldNodes = node.get("fields");
        if (fieldNodes == null || !fieldNodes.isArray() || fieldNodes.isEmpty()) {
            throw new ConfigurationException(path + ".fields must be a non-empty list");
        }
        for (int i = 0; i < fieldNodes.size(); i++) {
            fields.add(parseField(fieldNodes.get(i), path + ".fields[" + i + "]"));
        }

        Integer rate = null;
        JsonNode rateNode = node.get("rate");
        if (rateNode != null && !rateNode.isNull()) {
            if (!rateNode.canConvertToInt() || !rateNode.isIntegralNumber()) {
                throw new ConfigurationException(path + ".rate must be an integer: " + rateNode.asText());
            }
            rate = rateNode.intValue();
        }
        String interval = text(node, "interval", null);
        if (interval != null) {
            wrap(path + ".interval", () -> IntervalParser.parse(interval));
        }
        final Integer rateValue = rate;
        RateSetting rateSetting = wrap(path, () -> new RateSetting(rateValue, interval));

        String topic = text(node, "topic", text(node, "kafka_topic", null));
        return new ProducerSpec(name, output, fields, rateSetting, topic, text(node, "file_path", null));
    }

    private static FieldSpec parseField(JsonNode node, String path) {
        requireObject(node, path);
        String name = requireText(node, "name", path);
        String typeId = requireText(node, "type", path);
        String ruleId = requireText(node, "rule", path);
        FieldType type = wrap(path + ".type", () -> FieldType.fromId(typeId));
        RuleType rule = wrap(path + ".rule", () -> RuleType.fromId(ruleId));

        List<Object> list = null;
        JsonNode listNode = node.get("list");
        if (listNode != null && !listNode.isNull()) {
            if (!listNode.isArray()) {
                throw new ConfigurationException(path + ".list must be a list");
            }
            list = new ArrayList<>();
            for (JsonNode v : listNode) {
                list.add(scalar(v));
            }
        }

        JsonNode column = node.get("dictionary_column");
        FieldSpec field = new FieldSpec(
                name,
                type,
                rule,
                number(node.get("min"), path + ".min"),
                number(node.get("max"), path + ".max"),
                list,
                text(node, "dictionary", null),
                (column == null || column.isNull()) ? null : columnRef(column, path + ".dictionary_column"),
                scalar(node.get("value")));
        field.validate();
        return field;
    }

    // --- Node helpers ---

    private static Object columnRef(JsonNode v, String path) {
        if (v.isIntegralNumber() && v.canConvertToInt()) return v.intValue();
        if (v.isTextual()) return v.textValue();
        throw new ConfigurationException(path + " must be a column name or index");
    }

    private static Number number(JsonNode v, String path) {
        if (v == null || v.isNull()) return null;
        if (v.isIntegralNumber()) return v.longValue();
        if (v.isNumber()) return v.doubleValue();
        throw new ConfigurationException(path + " must be a number: " + v.asText());
    }

    /**
     * @return the YAML scalar as Integer, Long, Double, Boolean or String; null for absent/null
     */
    static Object scalar(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return null;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isInt()) return v.intValue();
        if (v.isIntegralNumber()) return v.longValue();
        if (v.isNumber()) return v.doubleValue();
        if (v.isValueNode()) return v.asText();
        throw new ConfigurationException("Expected a scalar value but found: " + v);
    }

    private static String text(JsonNode node, String key, String def) {
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) return def;
        String s = v.asText();
        return s.isBlank() ? def : s.trim();
    }

    private static String requireText(JsonNode node, String key, String path) {
        String v = text(node, key, null);
        if (v == null) {
            throw new ConfigurationException(path + "." + key + " is required");
        }
        return v;
    }

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new ConfigurationException(path + " must be a mapping");
        }
    }

    private static <T> T wrap(String path, Supplier<T> parse) {
        try {
            return parse.get();
        } catch (ConfigurationException e) {
            throw new ConfigurationException(path + ": " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
