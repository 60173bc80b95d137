package io.tickwork.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotConfig(String path, boolean saveOnExit) {

    public static SnapshotConfig defaults() {
        return new SnapshotConfig("~/.tickwork/jobs.json", true);
    }
}
