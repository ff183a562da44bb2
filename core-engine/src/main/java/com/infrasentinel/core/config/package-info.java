/**
 * Detection configuration: the immutable
 * {@link com.infrasentinel.core.config.DetectionConfig} with one
 * {@link com.infrasentinel.core.config.MetricRule} per monitored metric, and
 * the YAML loader {@link com.infrasentinel.core.config.DetectionConfigLoader}.
 * Validation runs when a configuration is built so that a bad file stops the
 * application at startup.
 *
 * @since 1.0.0
 */
package com.infrasentinel.core.config;
