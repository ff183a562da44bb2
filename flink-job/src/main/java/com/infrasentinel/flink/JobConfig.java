package com.infrasentinel.flink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Deployment settings of the Infra Sentinel job: where telemetry comes from,
 * where anomalies go, how the job is checkpointed, and which rules and
 * baseline it detects with.
 *
 * <p>
 * In a container every setting comes from an environment variable (the
 * {@code ENV_*} constants); unset or blank variables fall back to the
 * defaults below, except {@link #ENV_BASELINE_PATH}, which has none. Tests
 * build instances directly through {@link #builder()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_BOOTSTRAP_SERVERS = "KAFKA_BOOTSTRAP_SERVERS";
    public static final String ENV_INPUT_TOPIC = "KAFKA_INPUT_TOPIC";
    public static final String ENV_ANOMALY_TOPIC = "KAFKA_ANOMALY_TOPIC";
    public static final String ENV_GROUP_ID = "KAFKA_GROUP_ID";
    public static final String ENV_PARALLELISM = "FLINK_PARALLELISM";
    public static final String ENV_CHECKPOINT_INTERVAL_MS = "FLINK_CHECKPOINT_INTERVAL_MS";
    public static final String ENV_DETECTION_CONFIG_PATH = "DETECTION_CONFIG_PATH";
    public static final String ENV_BASELINE_PATH = "BASELINE_PATH";
    public static final String ENV_HEALTH_PORT = "HEALTH_PORT";
    public static final String ENV_SOURCE_KEY_FIELD = "SOURCE_KEY_FIELD";

    static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
    static final String DEFAULT_INPUT_TOPIC = "telemetry";
    static final String DEFAULT_ANOMALY_TOPIC = "anomalies";
    static final String DEFAULT_GROUP_ID = "infra-sentinel";
    static final int DEFAULT_PARALLELISM = 1;
    static final long DEFAULT_CHECKPOINT_INTERVAL_MS = 60_000;
    static final int DEFAULT_HEALTH_PORT = 8080;
    static final String DEFAULT_SOURCE_KEY_FIELD = "host";

    /** Upper bound Kafka brokers allow by default for a producer transaction. */
    private static final String TRANSACTION_TIMEOUT_MS = "900000";

    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAnomalyTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String detectionConfigPath;
    private final String baselinePath;
    private final int healthPort;
    private final String sourceKeyField;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAnomalyTopic = b.kafkaAnomalyTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.detectionConfigPath = b.detectionConfigPath == null ? "" : b.detectionConfigPath.trim();
        this.baselinePath = b.baselinePath;
        this.healthPort = b.healthPort;
        this.sourceKeyField = b.sourceKeyField;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException if a numeric variable does not parse,
     *                                  a value is out of range, or
     *                                  {@code BASELINE_PATH} is unset
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Resolve every setting through {@code lookup}, which returns a
     * variable's value or {@code null} when it is unset.
     */
    static JobConfig fromEnvironment(UnaryOperator<String> lookup) {
        EnvReader env = new EnvReader(lookup);
        Builder builder = new Builder()
                .kafkaBootstrapServers(env.string(ENV_BOOTSTRAP_SERVERS, DEFAULT_BOOTSTRAP_SERVERS))
                .kafkaInputTopic(env.string(ENV_INPUT_TOPIC, DEFAULT_INPUT_TOPIC))
                .kafkaAnomalyTopic(env.string(ENV_ANOMALY_TOPIC, DEFAULT_ANOMALY_TOPIC))
                .kafkaGroupId(env.string(ENV_GROUP_ID, DEFAULT_GROUP_ID))
                .parallelism(env.integer(ENV_PARALLELISM, DEFAULT_PARALLELISM))
                .checkpointIntervalMs(env.longValue(ENV_CHECKPOINT_INTERVAL_MS, DEFAULT_CHECKPOINT_INTERVAL_MS))
                .detectionConfigPath(env.string(ENV_DETECTION_CONFIG_PATH, ""))
                .baselinePath(env.string(ENV_BASELINE_PATH, null))
                .healthPort(env.integer(ENV_HEALTH_PORT, DEFAULT_HEALTH_PORT))
                .sourceKeyField(env.string(ENV_SOURCE_KEY_FIELD, DEFAULT_SOURCE_KEY_FIELD));
        env.throwIfInvalid();
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Kafka client settings
    // ---------------------------------------------------------------

    /**
     * Consumer settings. Only committed records are read, so telemetry from
     * an aborted producer transaction is never processed.
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        props.setProperty("isolation.level", "read_committed");
        return props;
    }

    /**
     * Producer settings for the transactional anomaly sink. The transaction
     * timeout must outlast the checkpoint interval.
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", TRANSACTION_TIMEOUT_MS);
        return props;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAnomalyTopic() {
        return kafkaAnomalyTopic;
    }

    /** Consumer group, also used as the sink's transactional id prefix. */
    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the detection YAML, blank to use the classpath default
     */
    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    public String getBaselinePath() {
        return baselinePath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    /** Record attribute naming the stream (host, cluster, ...) a record belongs to. */
    public String getSourceKeyField() {
        return sourceKeyField;
    }

    @Override
    public String toString() {
        return "JobConfig{kafka=" + kafkaBootstrapServers
                + ", topics=" + kafkaInputTopic + "->" + kafkaAnomalyTopic
                + ", group=" + kafkaGroupId
                + ", parallelism=" + parallelism
                + ", checkpointIntervalMs=" + checkpointIntervalMs
                + ", detectionConfig=" + (detectionConfigPath.isEmpty() ? "<classpath>" : detectionConfigPath)
                + ", baseline=" + baselinePath
                + ", healthPort=" + healthPort
                + ", keyField=" + sourceKeyField + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Starts from the same defaults as {@link #fromEnvironment()}, except
     * that the baseline path must always be set.
     */
    public static class Builder {
        private String kafkaBootstrapServers = DEFAULT_BOOTSTRAP_SERVERS;
        private String kafkaInputTopic = DEFAULT_INPUT_TOPIC;
        private String kafkaAnomalyTopic = DEFAULT_ANOMALY_TOPIC;
        private String kafkaGroupId = DEFAULT_GROUP_ID;
        private int parallelism = DEFAULT_PARALLELISM;
        private long checkpointIntervalMs = DEFAULT_CHECKPOINT_INTERVAL_MS;
        private String detectionConfigPath = "";
        private String baselinePath;
        private int healthPort = DEFAULT_HEALTH_PORT;
        private String sourceKeyField = DEFAULT_SOURCE_KEY_FIELD;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAnomalyTopic(String v) {
            this.kafkaAnomalyTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        public Builder baselinePath(String v) {
            this.baselinePath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder sourceKeyField(String v) {
            this.sourceKeyField = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException listing every invalid setting
         */
        public JobConfig build() {
            List<String> errors = new ArrayList<>();
            checkNotBlank(errors, kafkaBootstrapServers, "kafkaBootstrapServers (" + ENV_BOOTSTRAP_SERVERS + ")");
            checkNotBlank(errors, kafkaInputTopic, "kafkaInputTopic (" + ENV_INPUT_TOPIC + ")");
            checkNotBlank(errors, kafkaAnomalyTopic, "kafkaAnomalyTopic (" + ENV_ANOMALY_TOPIC + ")");
            checkNotBlank(errors, kafkaGroupId, "kafkaGroupId (" + ENV_GROUP_ID + ")");
            checkNotBlank(errors, sourceKeyField, "sourceKeyField (" + ENV_SOURCE_KEY_FIELD + ")");
            checkNotBlank(errors, baselinePath, "baselinePath (" + ENV_BASELINE_PATH + ")");

            if (parallelism < 1) {
                errors.add("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                errors.add("checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                errors.add("healthPort must be in [1, 65535], got: " + healthPort);
            }

            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid job configuration:\n  - " + String.join("\n  - ", errors));
            }
            return new JobConfig(this);
        }

        private static void checkNotBlank(List<String> errors, String value, String name) {
            if (value == null || value.isBlank()) {
                errors.add(name + " must be set");
            }
        }
    }

    /** Reads variables through a lookup and remembers the ones that do not parse. */
    private static final class EnvReader {
        private final UnaryOperator<String> lookup;
        private final List<String> errors = new ArrayList<>();

        EnvReader(UnaryOperator<String> lookup) {
            this.lookup = lookup;
        }

        String string(String name, String fallback) {
            String value = lookup.apply(name);
            return value == null || value.isBlank() ? fallback : value.trim();
        }

        int integer(String name, int fallback) {
            String value = string(name, null);
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                errors.add(name + " is not an integer: '" + value + "'");
                return fallback;
            }
        }

        long longValue(String name, long fallback) {
            String value = string(name, null);
            if (value == null) {
                return fallback;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                errors.add(name + " is not an integer: '" + value + "'");
                return fallback;
            }
        }

        void throwIfInvalid() {
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid environment:\n  - " + String.join("\n  - ", errors));
            }
        }
    }
}
