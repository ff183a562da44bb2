package com.infrasentinel.flink;

import com.infrasentinel.core.config.DetectionConfig;
import com.infrasentinel.core.config.DetectionConfigLoader;
import com.infrasentinel.core.ingest.TelemetryReader;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.TelemetryRecord;
import com.infrasentinel.core.stats.GlobalStats;
import com.infrasentinel.core.stats.GlobalStatsAccumulator;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.function.ThrowingRunnable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the Infra Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry topic)
 *     → Deserialize JSON → TelemetryRecord
 *     → Key by source attribute (e.g. host)
 *     → AnomalyProcessFunction (one detector per source)
 *     → Serialize Anomaly → JSON
 *     → Kafka (anomalies topic)
 * </pre>
 *
 * <h3>Startup</h3>
 * <p>
 * Detection rules and the baseline are loaded before anything else, so a
 * missing or empty baseline aborts the job before any thread is started.
 * The health server then runs for the lifetime of the job;
 * {@code /readiness} reports 503 until the pipeline has been built.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps the per-source rolling windows consistent
 * with the Kafka offsets across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class InfraSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(InfraSentinelJob.class);

    /** Key for records that do not carry the source attribute. */
    static final String UNKNOWN_SOURCE = "__unknown__";

    private InfraSentinelJob() {
        // entry-point class; not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load job configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Infra Sentinel with config: {}", config);

        // 2. Load detection rules and fit the shared baseline
        DetectionConfig detectionConfig = loadDetectionConfig(config);
        GlobalStats baseline = loadBaseline(config);

        // 3. Start health server (for K8s probes) with shutdown hook
        AtomicBoolean ready = new AtomicBoolean(false);
        HealthServer healthServer = new HealthServer(ready::get);
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        runServing(healthServer, config.getHealthPort(), () -> {
            // 4. Set up Flink execution environment
            StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
            env.setParallelism(config.getParallelism());
            configureCheckpointing(env, config);

            // 5. Build pipeline
            buildPipeline(env, config, detectionConfig, baseline);
            ready.set(true);

            // 6. Execute
            env.execute("Infra Sentinel: Telemetry Anomaly Detection");
        });
    }

    /**
     * Run {@code job} while the health server answers probes. The server is
     * stopped when the job returns or fails, so its non-daemon dispatcher
     * thread never outlives {@code main}.
     *
     * @param healthServer server to start; stopped on exit
     * @param port         port to bind
     * @param job          job submission, typically blocking until the job ends
     */
    static void runServing(HealthServer healthServer, int port, ThrowingRunnable<Exception> job)
            throws Exception {
        healthServer.start(port);
        try {
            job.run();
        } catch (Exception e) {
            LOG.error("Infra Sentinel job failed", e);
            throw e;
        } finally {
            healthServer.stop();
        }
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    /**
     * Build the full Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env,
            JobConfig config,
            DetectionConfig detectionConfig,
            GlobalStats baseline) {
        KafkaSource<TelemetryRecord> kafkaSource = KafkaSource.<TelemetryRecord>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaInputTopic())
                .setGroupId(config.getKafkaGroupId())
                .setProperties(config.kafkaConsumerProperties())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new TelemetryDeserializationSchema())
                .build();

        DataStream<TelemetryRecord> records = env.fromSource(
                kafkaSource,
                WatermarkStrategy.<TelemetryRecord>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                        .withTimestampAssigner((record, ts) -> record.getTimestamp().toEpochMilli())
                        .withIdleness(Duration.ofMinutes(1)),
                "kafka-telemetry-source");

        String keyField = config.getSourceKeyField();
        DataStream<Anomaly> anomalies = records
                .filter(Objects::nonNull) // drop deserialization failures
                .keyBy(record -> sourceOf(record, keyField))
                .process(new AnomalyProcessFunction(detectionConfig, baseline))
                .name("anomaly-detection");

        KafkaSink<Anomaly> kafkaSink = KafkaSink.<Anomaly>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setKafkaProducerConfig(config.kafkaProducerProperties())
                .setDeliveryGuarantee(DeliveryGuarantee.EXACTLY_ONCE)
                .setTransactionalIdPrefix(config.getKafkaGroupId())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.<Anomaly>builder()
                                .setTopic(config.getKafkaAnomalyTopic())
                                .setValueSerializationSchema(new AnomalySerializationSchema())
                                .build())
                .build();

        anomalies.sinkTo(kafkaSink).name("kafka-anomalies-sink");
    }

    static String sourceOf(TelemetryRecord record, String keyField) {
        return record.getAttribute(keyField).orElse(UNKNOWN_SOURCE);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static DetectionConfig loadDetectionConfig(JobConfig config) {
        String path = config.getDetectionConfigPath();
        if (!path.isBlank()) {
            return DetectionConfigLoader.fromFile(path);
        }
        return DetectionConfigLoader.load();
    }

    /**
     * Fit the baseline statistics from {@link JobConfig#getBaselinePath()}.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws com.infrasentinel.core.stats.BaselineEmptyException if it holds no records
     */
    static GlobalStats loadBaseline(JobConfig config) {
        GlobalStats baseline = GlobalStatsAccumulator.fit(TelemetryReader.fromFile(config.getBaselinePath()));
        LOG.info("Fitted baseline for {} metric(s) from {}", baseline.asMap().size(), config.getBaselinePath());
        return baseline;
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        // keep checkpoints on cancellation so state can be restored
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
