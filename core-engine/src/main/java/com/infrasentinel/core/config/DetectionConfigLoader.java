package com.infrasentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads and validates {@link DetectionConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Keys</h3>
 * <p>
 * Top level: {@code rolling_window_size}, {@code metrics}. Per metric:
 * {@code threshold}, {@code global_std_factor}, {@code rolling_std_factor},
 * {@code delta_threshold}. Unknown keys are logged and ignored; values of the
 * wrong type are errors.
 * </p>
 *
 * <p>
 * Every {@code load*} method validates the result, so the application
 * <strong>fails fast</strong> with a {@link ConfigException} on a bad file.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "DETECTION_CONFIG_PATH";

    /** Classpath fallback used by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    static final String KEY_WINDOW_SIZE = "rolling_window_size";
    static final String KEY_METRICS = "metrics";
    static final String KEY_THRESHOLD = "threshold";
    static final String KEY_GLOBAL_STD_FACTOR = "global_std_factor";
    static final String KEY_ROLLING_STD_FACTOR = "rolling_std_factor";
    static final String KEY_DELTA_THRESHOLD = "delta_threshold";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(KEY_WINDOW_SIZE, KEY_METRICS);
    private static final Set<String> RULE_KEYS = Set.of(
            KEY_THRESHOLD, KEY_GLOBAL_STD_FACTOR, KEY_ROLLING_STD_FACTOR, KEY_DELTA_THRESHOLD);

    private DetectionConfigLoader() {
        // utility class; not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution: the file named by
     * {@code DETECTION_CONFIG_PATH} when it exists, {@value #DEFAULT_RESOURCE}
     * on the classpath otherwise.
     *
     * @return parsed and validated configuration
     * @throws ConfigException if the configuration is invalid
     */
    public static DetectionConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detection config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading detection config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigException          if reading fails or the content is
     *                                  invalid
     */
    public static DetectionConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detection config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read detection config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigException          if reading fails or the content is
     *                                  invalid
     */
    public static DetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectionConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new ConfigException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param yaml YAML document; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigException if the content is invalid
     */
    public static DetectionConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "YAML content must not be null");
        try (Reader reader = new StringReader(yaml)) {
            return parse(newYaml().load(reader), "<string>");
        } catch (YAMLException e) {
            throw new ConfigException("Malformed detection config: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read YAML content", e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }

    private static DetectionConfig parseAndValidate(InputStream is, String source) {
        Object root;
        try {
            root = newYaml().load(is);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed detection config " + source + ": " + e.getMessage(), e);
        }
        return parse(root, source);
    }

    private static DetectionConfig parse(Object root, String source) {
        DetectionConfig.Builder builder = DetectionConfig.builder();
        if (root == null) {
            LOG.warn("Detection config {} is empty; no metrics will be checked", source);
            return builder.build();
        }
        if (!(root instanceof Map<?, ?> top)) {
            throw new ConfigException("Detection config " + source + " must be a mapping at the top level");
        }

        List<String> errors = new ArrayList<>();
        warnUnknownKeys(top, TOP_LEVEL_KEYS, "top level of " + source);

        Object window = top.get(KEY_WINDOW_SIZE);
        if (window != null) {
            if (window instanceof Integer i) {
                builder.rollingWindowSize(i);
            } else if (window instanceof Long || window instanceof BigInteger) {
                errors.add("'" + KEY_WINDOW_SIZE + "' is out of range: " + window);
            } else {
                errors.add("'" + KEY_WINDOW_SIZE + "' must be an integer, got: " + window);
            }
        }

        Object metrics = top.get(KEY_METRICS);
        if (metrics == null) {
            LOG.warn("No metrics defined in detection config {}", source);
        } else if (metrics instanceof Map<?, ?> byName) {
            byName.forEach((name, rule) -> parseRule(String.valueOf(name), rule, builder, errors));
        } else {
            errors.add("'" + KEY_METRICS + "' must be a mapping of metric name to rule");
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }

        DetectionConfig config = builder.build();
        LOG.info("Loaded detection config for {} metric(s), rolling window size {}",
                config.getMetrics().size(), config.getRollingWindowSize());
        return config;
    }

    private static void parseRule(String metric, Object raw, DetectionConfig.Builder builder,
            List<String> errors) {
        MetricRule.Builder rule = MetricRule.builder();
        if (raw == null) {
            builder.metric(metric, rule.build());
            return;
        }
        if (!(raw instanceof Map<?, ?> fields)) {
            errors.add("Rule for metric '" + metric + "' must be a mapping");
            return;
        }
        warnUnknownKeys(fields, RULE_KEYS, "metric '" + metric + "'");

        Double threshold = number(fields, KEY_THRESHOLD, metric, errors);
        Double globalFactor = number(fields, KEY_GLOBAL_STD_FACTOR, metric, errors);
        Double rollingFactor = number(fields, KEY_ROLLING_STD_FACTOR, metric, errors);
        Double delta = number(fields, KEY_DELTA_THRESHOLD, metric, errors);

        rule.threshold(threshold).deltaThreshold(delta);
        if (globalFactor != null) {
            rule.globalStdFactor(globalFactor);
        }
        if (rollingFactor != null) {
            rule.rollingStdFactor(rollingFactor);
        }
        builder.metric(metric, rule.build());
    }

    private static Double number(Map<?, ?> fields, String key, String metric, List<String> errors) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        errors.add("Metric '" + metric + "': '" + key + "' must be a number, got: " + value);
        return null;
    }

    private static void warnUnknownKeys(Map<?, ?> map, Set<String> known, String where) {
        for (Object key : map.keySet()) {
            if (!known.contains(String.valueOf(key))) {
                LOG.warn("Ignoring unknown key '{}' in {}", key, where);
            }
        }
    }
}
