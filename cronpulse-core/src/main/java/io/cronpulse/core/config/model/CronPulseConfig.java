package io.cronpulse.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronPulseConfig(
    WorkerConfig worker,
    StoreConfig store
) {

    public static CronPulseConfig defaults() {
        return new CronPulseConfig(
            WorkerConfig.defaults(),
            StoreConfig.defaults()
        );
    }
}
