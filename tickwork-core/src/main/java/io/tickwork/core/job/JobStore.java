package io.tickwork.core.job;

import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.schedule.ScheduleResolver;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Owns the job collection. Every operation is serialized on the store and only ever returns immutable
 * {@link Job} values, so callers can neither observe a half-applied mutation nor alter stored state.
 * Iteration order is creation order.
 */
public final class JobStore {
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final ScheduleResolver resolver;
    private final Clock clock;

    public JobStore(ScheduleResolver resolver, Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized Job create(JobInput input) {
        Objects.requireNonNull(input, "input must not be null");
        long now = now();
        String id = newId();
        Long next = input.enabled() ? nextRun(input.schedule(), now) : null;
        Job job = new Job(
            id,
            input.name(),
            input.groupId(),
            input.description(),
            input.enabled(),
            input.schedule(),
            input.payload(),
            JobState.initial(next),
            now,
            now
        );
        jobs.put(id, job);
        return job;
    }

    public synchronized Optional<Job> get(String id) {
        return Optional.ofNullable(id == null ? null : jobs.get(id));
    }

    public synchronized List<Job> list(JobFilter filter) {
        JobFilter safe = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
            .filter(safe::matches)
            .toList();
    }

    public synchronized Optional<Job> update(String id, JobPatch patch) {
        Job current = id == null ? null : jobs.get(id);
        if (current == null) {
            return Optional.empty();
        }
        JobPatch safe = patch == null ? JobPatch.empty() : patch;
        long now = now();

        boolean enabled = safe.enabled() != null ? safe.enabled() : current.enabled();
        Schedule schedule = safe.schedule() != null ? safe.schedule() : current.schedule();
        boolean scheduleChanged = safe.schedule() != null;
        boolean becameEnabled = enabled && !current.enabled();

        JobState state = current.state();
        if (!enabled) {
            state = state.withNextRunAtMs(null);
        } else if (scheduleChanged || becameEnabled) {
            state = state.withNextRunAtMs(nextRun(schedule, now));
        }

        Job updated = current.with(
            safe.name() != null ? safe.name() : current.name(),
            safe.description() != null ? safe.description() : current.description(),
            enabled,
            schedule,
            safe.payload() != null ? safe.payload() : current.payload(),
            state,
            now
        );
        jobs.put(id, updated);
        return Optional.of(updated);
    }

    public synchronized boolean pause(String id) {
        Job current = id == null ? null : jobs.get(id);
        if (current == null) {
            return false;
        }
        jobs.put(id, current.with(current.name(), current.description(), false, current.schedule(),
            current.payload(), current.state().withNextRunAtMs(null), now()));
        return true;
    }

    public synchronized boolean resume(String id) {
        Job current = id == null ? null : jobs.get(id);
        if (current == null) {
            return false;
        }
        long now = now();
        jobs.put(id, current.with(current.name(), current.description(), true, current.schedule(),
            current.payload(), current.state().withNextRunAtMs(nextRun(current.schedule(), now)), now));
        return true;
    }

    public synchronized boolean remove(String id) {
        return id != null && jobs.remove(id) != null;
    }

    public synchronized List<Job> dueJobs(long nowMs) {
        List<Job> due = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.isDue(nowMs)) {
                due.add(job);
            }
        }
        // List.sort is stable, so equal due times keep creation order.
        due.sort(Comparator.comparingLong(job -> job.state().nextRunAtMs()));
        return due;
    }

    public synchronized Optional<Job> recordRun(String id, JobStatus status, String error, long completedAtMs) {
        Job current = id == null ? null : jobs.get(id);
        if (current == null) {
            // removed while its handlers ran
            return Optional.empty();
        }
        String lastError = status == JobStatus.ERROR ? error : null;

        Job updated;
        if (current.schedule() instanceof Schedule.At) {
            updated = current.withState(false, current.state().afterRun(completedAtMs, status, lastError, null));
        } else {
            Long next = current.enabled() ? nextRun(current.schedule(), completedAtMs) : null;
            updated = current.withState(current.enabled(),
                current.state().afterRun(completedAtMs, status, lastError, next));
        }
        jobs.put(id, updated);
        return Optional.of(updated);
    }

    public synchronized int size() {
        return jobs.size();
    }

    private Long nextRun(Schedule schedule, long afterMs) {
        OptionalLong next = resolver.resolveNext(schedule, afterMs);
        return next.isPresent() ? next.getAsLong() : null;
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString();
        } while (jobs.containsKey(id));
        return id;
    }

    private long now() {
        return clock.millis();
    }
}
