package com.infrasentinel.flink;

import com.infrasentinel.core.config.DetectionConfig;
import com.infrasentinel.core.model.TelemetryRecord;
import com.infrasentinel.core.stats.BaselineEmptyException;
import com.infrasentinel.core.stats.GlobalStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the helpers of {@link InfraSentinelJob}.
 */
class InfraSentinelJobTest {

    @Test
    @DisplayName("Should key records by the configured source attribute")
    void shouldKeyBySource() {
        TelemetryRecord record = TelemetryRecord.builder(Instant.parse("2024-05-01T10:00:00Z"))
                .attribute("host", "web-01")
                .attribute("cluster", "eu-1")
                .build();

        assertThat(InfraSentinelJob.sourceOf(record, "host")).isEqualTo("web-01");
        assertThat(InfraSentinelJob.sourceOf(record, "cluster")).isEqualTo("eu-1");
        assertThat(InfraSentinelJob.sourceOf(record, "rack")).isEqualTo(InfraSentinelJob.UNKNOWN_SOURCE);
    }

    @Test
    @DisplayName("Should load the packaged detection rules by default")
    void shouldLoadPackagedRules() {
        JobConfig config = JobConfig.builder().baselinePath("baseline.json").build();

        DetectionConfig detection = InfraSentinelJob.loadDetectionConfig(config);

        assertThat(detection.getMetrics()).containsKeys(
                "cpu_usage", "memory_usage", "disk_usage", "latency_ms", "error_rate", "temperature_celsius");
        assertThat(detection.getRule("error_rate").orElseThrow().getDeltaThreshold()).contains(0.05);
    }

    @Test
    @DisplayName("Should fit the baseline from the configured path")
    void shouldLoadBaseline(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("baseline.json");
        Files.writeString(file, "["
                + "{\"timestamp\": \"2024-05-01T10:00:00Z\", \"cpu_usage\": 40},"
                + "{\"timestamp\": \"2024-05-01T10:01:00Z\", \"cpu_usage\": 60}]");

        GlobalStats baseline = InfraSentinelJob.loadBaseline(
                JobConfig.builder().baselinePath(file.toString()).build());

        assertThat(baseline.get("cpu_usage")).isPresent();
        assertThat(baseline.get("cpu_usage").orElseThrow().getMean()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Should fail startup when the baseline file is missing")
    void shouldFailOnMissingBaseline(@TempDir Path dir) {
        JobConfig config = JobConfig.builder().baselinePath(dir.resolve("absent.json").toString()).build();

        assertThatThrownBy(() -> InfraSentinelJob.loadBaseline(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.json");
    }

    @Test
    @DisplayName("Should fail startup when the baseline holds no records")
    void shouldFailOnEmptyBaseline(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.json");
        Files.writeString(file, "[]");
        JobConfig config = JobConfig.builder().baselinePath(file.toString()).build();

        assertThatThrownBy(() -> InfraSentinelJob.loadBaseline(config))
                .isInstanceOf(BaselineEmptyException.class);
    }

    @Test
    @DisplayName("Should serve probes while the job runs and stop the server afterwards")
    void shouldServeWhileJobRuns() throws Exception {
        AtomicBoolean ready = new AtomicBoolean(true);
        HealthServer healthServer = new HealthServer(ready::get);
        AtomicInteger statusDuringJob = new AtomicInteger();

        InfraSentinelJob.runServing(healthServer, 0,
                () -> statusDuringJob.set(get(healthServer.getPort(), "/readiness").statusCode()));

        assertThat(statusDuringJob.get()).isEqualTo(200);
        assertThat(healthServer.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should stop the health server and rethrow when the job fails")
    void shouldStopServerWhenJobFails() {
        HealthServer healthServer = new HealthServer(() -> false);

        assertThatThrownBy(() -> InfraSentinelJob.runServing(healthServer, 0, () -> {
            throw new IllegalStateException("submission failed");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("submission failed");

        int port = healthServer.getPort();
        assertThat(healthServer.isRunning()).isFalse();
        assertThatThrownBy(() -> get(port, "/health")).isInstanceOf(IOException.class);
    }

    private static HttpResponse<String> get(int port, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + port + path)).GET().build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
    }
}
