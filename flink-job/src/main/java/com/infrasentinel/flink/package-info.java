/**
 * Apache Flink streaming job for Infra Sentinel.
 *
 * <p>
 * Wires the core detection engine into a Flink pipeline that consumes
 * telemetry records from Kafka, runs one detector per source, and publishes
 * anomalies back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.infrasentinel.flink.InfraSentinelJob}: main entry point</li>
 * <li>{@link com.infrasentinel.flink.AnomalyProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.infrasentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.infrasentinel.flink.HealthServer}: HTTP health and readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.infrasentinel.flink;
