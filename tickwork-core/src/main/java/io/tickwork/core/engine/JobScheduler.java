package io.tickwork.core.engine;

import io.tickwork.core.config.model.SchedulerConfig;
import io.tickwork.core.dispatch.HandlerRegistry;
import io.tickwork.core.dispatch.JobHandler;
import io.tickwork.core.dispatch.Subscription;
import io.tickwork.core.job.Job;
import io.tickwork.core.job.JobFilter;
import io.tickwork.core.job.JobInput;
import io.tickwork.core.job.JobPatch;
import io.tickwork.core.job.JobStore;
import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.schedule.ScheduleResolver;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * In-process job scheduler: holds named jobs with one-shot, interval or cron schedules, and hands due jobs to
 * the subscribed {@link JobHandler}s while running.
 *
 * <p>Each instance owns its own state, so several schedulers can coexist in one process. Operations never
 * throw for bad schedules or unknown ids; those surface as empty results, {@code false}, or a job without a
 * next run. Nothing is persisted; see {@code SnapshotService} for saving and restoring jobs.
 */
public final class JobScheduler implements AutoCloseable {
    private final ScheduleResolver resolver;
    private final JobStore store;
    private final HandlerRegistry handlers;
    private final TickEngine engine;
    private final Clock clock;

    public JobScheduler() {
        this(SchedulerConfig.defaults(), Clock.systemUTC());
    }

    public JobScheduler(SchedulerConfig config) {
        this(config, Clock.systemUTC());
    }

    public JobScheduler(SchedulerConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.resolver = new ScheduleResolver();
        this.store = new JobStore(resolver, clock);
        this.handlers = new HandlerRegistry();
        this.engine = new TickEngine(store, handlers, clock, config.tickIntervalMs());
    }

    public Job addJob(JobInput input) {
        return store.create(input);
    }

    public Optional<Job> getJob(String id) {
        return store.get(id);
    }

    public List<Job> listJobs() {
        return store.list(JobFilter.all());
    }

    public List<Job> listJobs(JobFilter filter) {
        return store.list(filter);
    }

    public Optional<Job> updateJob(String id, JobPatch patch) {
        return store.update(id, patch);
    }

    public boolean pauseJob(String id) {
        return store.pause(id);
    }

    public boolean resumeJob(String id) {
        return store.resume(id);
    }

    public boolean removeJob(String id) {
        return store.remove(id);
    }

    public Subscription onJobDue(JobHandler handler) {
        return handlers.subscribe(handler);
    }

    public void start() {
        engine.start();
    }

    public void stop() {
        engine.stop();
    }

    public boolean isRunning() {
        return engine.isRunning();
    }

    public CompletableFuture<TickSummary> tick() {
        return engine.tick();
    }

    public OptionalLong computeNextRunAtMs(Schedule schedule) {
        return computeNextRunAtMs(schedule, clock.millis());
    }

    public OptionalLong computeNextRunAtMs(Schedule schedule, long afterMs) {
        return schedule == null ? OptionalLong.empty() : resolver.resolveNext(schedule, afterMs);
    }

    public long tickIntervalMs() {
        return engine.tickIntervalMs();
    }

    @Override
    public void close() {
        engine.close();
    }
}
