package io.cronpulse.core.worker;

import io.cronpulse.core.config.model.WorkerConfig;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

public record WorkerSettings(
    Duration reconcileInterval,
    Duration probeTimeout,
    Duration drainTimeout,
    ZoneId zone,
    boolean singleFlight,
    boolean refreshOnChange,
    int timerThreads
) {
    public WorkerSettings {
        Objects.requireNonNull(reconcileInterval, "reconcileInterval must not be null");
        Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        Objects.requireNonNull(drainTimeout, "drainTimeout must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (reconcileInterval.isZero() || reconcileInterval.isNegative()) {
            throw new IllegalArgumentException("reconcileInterval must be > 0");
        }
        if (probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be > 0");
        }
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }
        timerThreads = Math.max(1, timerThreads);
    }

    public static WorkerSettings defaults() {
        return from(WorkerConfig.defaults());
    }

    public static WorkerSettings from(WorkerConfig config) {
        return new WorkerSettings(
            Duration.ofSeconds(config.reconcileIntervalSeconds()),
            Duration.ofSeconds(config.probeTimeoutSeconds()),
            Duration.ofSeconds(config.drainTimeoutSeconds()),
            ZoneId.of(config.timezone() == null || config.timezone().isBlank() ? "UTC" : config.timezone()),
            config.singleFlight(),
            config.refreshOnChange(),
            config.timerThreads()
        );
    }

    public WorkerSettings withReconcileInterval(Duration interval) {
        return new WorkerSettings(interval, probeTimeout, drainTimeout, zone, singleFlight, refreshOnChange, timerThreads);
    }

    public WorkerSettings withSingleFlight(boolean enabled) {
        return new WorkerSettings(reconcileInterval, probeTimeout, drainTimeout, zone, enabled, refreshOnChange, timerThreads);
    }

    public WorkerSettings withDrainTimeout(Duration timeout) {
        return new WorkerSettings(reconcileInterval, probeTimeout, timeout, zone, singleFlight, refreshOnChange, timerThreads);
    }
}
