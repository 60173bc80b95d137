package io.tickwork.core.engine;

import io.tickwork.core.dispatch.DispatchResult;
import io.tickwork.core.dispatch.HandlerRegistry;
import io.tickwork.core.job.Job;
import io.tickwork.core.job.JobStatus;
import io.tickwork.core.job.JobStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The scheduling loop. While running, a timer fires every {@code tickIntervalMs} (first firing immediately)
 * and each firing scans the store for due jobs, dispatches them and writes the outcomes back.
 *
 * <p>The timer thread only hands the scan to a worker thread, so a slow tick never delays the timer. A
 * firing that arrives while the previous tick is still in flight is skipped. Due jobs are dispatched in due
 * order; handlers that complete asynchronously let later jobs proceed, and each job's outcome is written as
 * soon as all of its handlers are done.
 */
public final class TickEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TickEngine.class);

    private final JobStore store;
    private final HandlerRegistry handlers;
    private final Clock clock;
    private final long tickIntervalMs;
    private final ExecutorService worker;
    private final AtomicBoolean ticking = new AtomicBoolean();
    private final AtomicLong skippedTicks = new AtomicLong();

    private ScheduledExecutorService timer;

    public TickEngine(JobStore store, HandlerRegistry handlers, Clock clock, long tickIntervalMs) {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be > 0");
        }
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.tickIntervalMs = tickIntervalMs;
        this.worker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("tickwork-tick"));
    }

    public synchronized void start() {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("tickwork-timer"));
        timer.scheduleAtFixedRate(this::onTimer, 0, tickIntervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Scheduler started with tick interval {} ms", tickIntervalMs);
    }

    public synchronized void stop() {
        if (timer == null) {
            return;
        }
        timer.shutdown();
        timer = null;
        LOG.info("Scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return timer != null;
    }

    public long tickIntervalMs() {
        return tickIntervalMs;
    }

    public long skippedTicks() {
        return skippedTicks.get();
    }

    // Never completes exceptionally.
    public CompletableFuture<TickSummary> tick() {
        if (!ticking.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            LOG.debug("Previous tick still running, skipping (skipped so far: {})", skipped);
            return CompletableFuture.completedFuture(TickSummary.SKIPPED);
        }

        CompletableFuture<TickSummary> scan;
        try {
            scan = CompletableFuture.supplyAsync(this::dispatchDue, worker).thenCompose(running -> running);
        } catch (RejectedExecutionException e) {
            ticking.set(false);
            LOG.warn("Tick rejected, engine is closed");
            return CompletableFuture.completedFuture(TickSummary.IDLE);
        }

        return scan.handle((summary, error) -> {
            ticking.set(false);
            if (error != null) {
                LOG.warn("Tick failed", error);
                return TickSummary.IDLE;
            }
            return summary;
        });
    }

    @Override
    public void close() {
        stop();
        worker.shutdown();
    }

    private void onTimer() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic task
            LOG.warn("Unexpected error while scheduling tick", e);
        }
    }

    private CompletableFuture<TickSummary> dispatchDue() {
        List<Job> due = store.dueJobs(clock.millis());
        if (due.isEmpty()) {
            return CompletableFuture.completedFuture(TickSummary.IDLE);
        }

        List<CompletableFuture<Boolean>> runs = new ArrayList<>(due.size());
        for (Job job : due) {
            runs.add(handlers.dispatch(job).thenApply(result -> recordOutcome(job, result)));
        }

        return CompletableFuture.allOf(runs.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            int failed = (int) runs.stream().filter(CompletableFuture::join).count();
            LOG.debug("Tick dispatched {} job(s), {} with handler failures", due.size(), failed);
            return new TickSummary(false, due.size(), failed);
        });
    }

    private boolean recordOutcome(Job job, DispatchResult result) {
        JobStatus status = result.anyFailed() ? JobStatus.ERROR : JobStatus.OK;
        store.recordRun(job.id(), status, result.lastErrorMessage(), clock.millis());
        if (result.anyFailed()) {
            LOG.debug("Job {} ({}) finished with error: {}", job.id(), job.name(), result.lastErrorMessage());
        }
        return result.anyFailed();
    }
}
