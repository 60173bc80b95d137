package io.tickwork.core.snapshot;

import io.tickwork.core.engine.JobScheduler;
import io.tickwork.core.job.Job;
import io.tickwork.core.job.JobInput;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SnapshotService {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotService.class);

    private final JobSnapshotStore store;
    private final Clock clock;

    public SnapshotService(JobSnapshotStore store) {
        this(store, Clock.systemUTC());
    }

    public SnapshotService(JobSnapshotStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public int save(JobScheduler scheduler) throws IOException {
        List<Job> jobs = scheduler.listJobs();
        store.save(new JobSnapshot(clock.instant(), jobs));
        LOG.debug("Saved {} job(s) to snapshot", jobs.size());
        return jobs.size();
    }

    public List<Job> restore(JobScheduler scheduler) throws IOException {
        List<Job> restored = new ArrayList<>();
        for (Job job : store.load().jobs()) {
            restored.add(scheduler.addJob(JobInput.from(job)));
        }
        LOG.debug("Restored {} job(s) from snapshot", restored.size());
        return restored;
    }
}
