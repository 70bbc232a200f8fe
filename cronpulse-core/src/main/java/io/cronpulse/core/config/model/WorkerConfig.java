package io.cronpulse.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerConfig(
    int reconcileIntervalSeconds,
    int probeTimeoutSeconds,
    int drainTimeoutSeconds,
    String timezone,
    boolean singleFlight,
    boolean refreshOnChange,
    int timerThreads,
    String userAgent
) {

    public static WorkerConfig defaults() {
        return new WorkerConfig(
            60,
            30,
            35,
            "UTC",
            false,
            false,
            2,
            "cronpulse/0.1"
        );
    }
}
