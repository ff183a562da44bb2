package com.infrasentinel.core.detection;

import com.infrasentinel.core.model.Anomaly;
import com.infrasentinel.core.model.AnomalyKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Categorical check on a service-status field.
 *
 * <p>
 * Fires for the statuses in {@link #PROBLEM_STATUSES}, matched exactly, and
 * does not depend on any detection configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class ServiceStatusCheck {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceStatusCheck.class);

    /** Statuses that indicate a service problem. */
    public static final Set<String> PROBLEM_STATUSES = Set.of("degraded", "offline");

    /**
     * @param service   service name
     * @param status    reported status
     * @param timestamp record timestamp
     * @return an {@link Anomaly} if the status indicates a problem, empty
     *         otherwise
     */
    public Optional<Anomaly> evaluate(String service, String status, Instant timestamp) {
        Objects.requireNonNull(service, "Service must not be null");
        if (status == null || !PROBLEM_STATUSES.contains(status)) {
            return Optional.empty();
        }

        LOG.debug("[{}] fired: service={} status={}", getKind(), service, status);
        return Optional.of(Anomaly.builder()
                .kind(getKind())
                .subject(service)
                .observedStatus(status)
                .timestamp(timestamp)
                .details(String.format(Locale.ROOT, "Service '%s' is %s",
                        service, status.toUpperCase(Locale.ROOT)))
                .build());
    }

    public AnomalyKind getKind() {
        return AnomalyKind.SERVICE_STATUS;
    }
}
