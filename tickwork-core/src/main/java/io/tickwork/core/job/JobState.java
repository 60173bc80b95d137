package io.tickwork.core.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobState(
    int runCount,
    Long lastRunAtMs,
    JobStatus lastStatus,
    String lastError,
    Long nextRunAtMs
) {
    public JobState {
        if (runCount < 0) {
            throw new IllegalArgumentException("runCount must be >= 0");
        }
    }

    public static JobState initial(Long nextRunAtMs) {
        return new JobState(0, null, null, null, nextRunAtMs);
    }

    @JsonIgnore
    public boolean isScheduled() {
        return nextRunAtMs != null;
    }

    public JobState withNextRunAtMs(Long next) {
        return new JobState(runCount, lastRunAtMs, lastStatus, lastError, next);
    }

    JobState afterRun(long completedAtMs, JobStatus status, String error, Long next) {
        return new JobState(runCount + 1, completedAtMs, status, error, next);
    }
}
