/**
 * Ingestion boundary: raw JSON records become typed
 * {@link com.infrasentinel.core.model.TelemetryRecord} instances here, once,
 * so the detection engine never inspects untyped maps.
 *
 * @since 1.0.0
 */
package com.infrasentinel.core.ingest;
