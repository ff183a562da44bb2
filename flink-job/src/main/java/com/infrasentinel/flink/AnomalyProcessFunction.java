package com.infrasentinel.flink;

import com.infrasentinel.core.config.DetectionConfig;
import com.infrasentinel.core.detection.AnomalyDetector;
import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.RecordFormatException;
import com.infrasentinel.core.model.TelemetryRecord;
import com.infrasentinel.core.stats.GlobalStats;
import com.infrasentinel.core.stats.RollingWindow;
import org.apache.flink.api.common.state.MapState;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs one {@link AnomalyDetector} per
 * telemetry stream.
 *
 * <p>
 * Each key (e.g. {@code host}) keeps its own rolling windows in Flink managed
 * keyed state, so windows never mix streams and are checkpointed with the
 * job. All keys share the baseline statistics fitted once at job start.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * Only the windows are stored, as a {@code MapState<String, RollingWindow>}
 * keyed by metric name. The detector is rebuilt from the operator's
 * configuration and baseline for every record, so a job restored from a
 * checkpoint with new rules or a new baseline applies them to every key.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * A record the detector rejects as malformed is logged, counted and dropped;
 * the window state is left unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyProcessFunction
        extends KeyedProcessFunction<String, TelemetryRecord, Anomaly> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyProcessFunction.class);

    private final DetectionConfig config;
    private final GlobalStats baseline;

    private transient MapState<String, RollingWindow> windowState;
    private transient DetectionMetrics metrics;

    /**
     * @param config   validated detection configuration
     * @param baseline baseline statistics shared by every key
     */
    public AnomalyProcessFunction(DetectionConfig config, GlobalStats baseline) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.baseline = Objects.requireNonNull(baseline, "GlobalStats must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        MapStateDescriptor<String, RollingWindow> descriptor = new MapStateDescriptor<>(
                "rolling-windows", Types.STRING, TypeInformation.of(RollingWindow.class));
        windowState = getRuntimeContext().getMapState(descriptor);

        metrics = new DetectionMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AnomalyProcessFunction opened: {} monitored metric(s), {} baseline metric(s), window size {}",
                config.getMetrics().size(), baseline.asMap().size(), config.getRollingWindowSize());
    }

    @Override
    public void close() {
        LOG.info("AnomalyProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(TelemetryRecord record,
            KeyedProcessFunction<String, TelemetryRecord, Anomaly>.Context ctx,
            Collector<Anomaly> out) throws Exception {
        long startNanos = System.nanoTime();
        String source = ctx.getCurrentKey();

        AnomalyDetector detector = restoreDetector(config, baseline, windowState.entries());

        List<Anomaly> anomalies;
        try {
            anomalies = detector.process(record);
        } catch (RecordFormatException e) {
            metrics.incrementRecordsRejected();
            LOG.warn("Dropping record from '{}' at {}: {}", source, record.getTimestamp(), e.getMessage());
            return;
        }
        windowState.putAll(detector.getWindows());

        for (Anomaly anomaly : anomalies) {
            anomaly.setSource(source);
            out.collect(anomaly);
            metrics.recordAnomaly(anomaly.getKind());
            LOG.info("Anomaly detected: kind={} subject={} source={}",
                    anomaly.getKind(), anomaly.getSubject(), source);
        }

        metrics.incrementRecordsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    /**
     * Rebuild a key's detector from its stored windows and the current
     * configuration and baseline.
     *
     * @param storedWindows window state of the current key; {@code null} or
     *                      empty for a key seen for the first time
     */
    static AnomalyDetector restoreDetector(DetectionConfig config,
            GlobalStats baseline,
            Iterable<Map.Entry<String, RollingWindow>> storedWindows) {
        Map<String, RollingWindow> windows = new LinkedHashMap<>();
        if (storedWindows != null) {
            for (Map.Entry<String, RollingWindow> entry : storedWindows) {
                windows.put(entry.getKey(), entry.getValue());
            }
        }
        return AnomalyDetector.fromStats(config, baseline, windows);
    }
}
