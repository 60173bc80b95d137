package io.tickwork.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TickworkConfig(
    SchedulerConfig scheduler,
    SnapshotConfig snapshot
) {

    public static TickworkConfig defaults() {
        return new TickworkConfig(
            SchedulerConfig.defaults(),
            SnapshotConfig.defaults()
        );
    }
}
