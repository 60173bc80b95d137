package io.tickwork.core.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.tickwork.core.job.Job;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobSnapshot(Instant savedAt, List<Job> jobs) {

    public JobSnapshot {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static JobSnapshot empty() {
        return new JobSnapshot(null, List.of());
    }
}
