package io.tickwork.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(long tickIntervalMs) {

    public static final long DEFAULT_TICK_INTERVAL_MS = 10_000L;

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(DEFAULT_TICK_INTERVAL_MS);
    }
}
