package io.tickwork.core.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tickwork.core.MutableClock;
import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.schedule.ScheduleResolver;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class JobStoreTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long MINUTE = 60_000L;

    private final MutableClock clock = MutableClock.at("2030-01-01T00:00:00Z");
    private final JobStore store = new JobStore(new ScheduleResolver(), clock);

    @Test
    void shouldAssignFreshUuidToEveryJob() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            Job job = store.create(JobInput.of("job-" + i, Schedule.every(MINUTE), null));
            assertThat(UUID.fromString(job.id()).version()).isEqualTo(4);
            ids.add(job.id());
        }

        assertThat(ids).hasSize(50);
        assertThat(store.size()).isEqualTo(50);
    }

    @Test
    void shouldCopyInputAndInitialiseState() {
        long now = clock.millis();
        Job job = store.create(JobInput.of("report", Schedule.every(MINUTE), payload("kind", "daily"))
            .withGroupId("reports")
            .withDescription("daily report"));

        assertThat(job.name()).isEqualTo("report");
        assertThat(job.groupId()).isEqualTo("reports");
        assertThat(job.description()).isEqualTo("daily report");
        assertThat(job.enabled()).isTrue();
        assertThat(job.payload()).isEqualTo(payload("kind", "daily"));
        assertThat(job.createdAtMs()).isEqualTo(now);
        assertThat(job.updatedAtMs()).isEqualTo(now);
        assertThat(job.state().runCount()).isZero();
        assertThat(job.state().lastRunAtMs()).isNull();
        assertThat(job.state().lastStatus()).isNull();
        assertThat(job.state().lastError()).isNull();
        assertThat(job.state().nextRunAtMs()).isEqualTo(now + MINUTE);
    }

    @Test
    void shouldNormaliseMissingNameAndPayload() {
        Job job = store.create(JobInput.of(null, Schedule.every(MINUTE), null));

        assertThat(job.name()).isEmpty();
        assertThat(job.payload()).isEqualTo(NullNode.getInstance());
    }

    @Test
    void shouldNotScheduleDisabledOrExhaustedJobs() {
        Job disabled = store.create(JobInput.of("off", Schedule.every(MINUTE), null).withEnabled(false));
        Job past = store.create(JobInput.of("past", Schedule.at("2000-01-01T00:00:00Z"), null));
        Job invalid = store.create(JobInput.of("bad", Schedule.cron("not a cron"), null));

        assertThat(disabled.state().nextRunAtMs()).isNull();
        assertThat(past.state().nextRunAtMs()).isNull();
        assertThat(past.enabled()).isTrue();
        assertThat(invalid.state().nextRunAtMs()).isNull();
        assertThat(store.dueJobs(Long.MAX_VALUE)).isEmpty();
    }

    @Test
    void shouldIsolateStoredPayloadFromCallers() {
        ObjectNode input = payload("count", "1");
        Job created = store.create(JobInput.of("isolated", Schedule.every(MINUTE), input));
        input.put("count", "mutated-input");

        ((ObjectNode) created.payload()).put("count", "mutated-create");
        ((ObjectNode) store.get(created.id()).orElseThrow().payload()).put("count", "mutated-get");
        ((ObjectNode) store.list(JobFilter.all()).get(0).payload()).put("count", "mutated-list");
        Job updated = store.update(created.id(), JobPatch.empty().withName("renamed")).orElseThrow();
        ((ObjectNode) updated.payload()).put("count", "mutated-update");

        assertThat(store.get(created.id()).orElseThrow().payload()).isEqualTo(payload("count", "1"));
    }

    @Test
    void shouldReturnEmptyForUnknownIds() {
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.get(null)).isEmpty();
        assertThat(store.update("missing", JobPatch.empty().withName("x"))).isEmpty();
        assertThat(store.pause("missing")).isFalse();
        assertThat(store.resume("missing")).isFalse();
        assertThat(store.remove("missing")).isFalse();
        assertThat(store.recordRun("missing", JobStatus.OK, null, clock.millis())).isEmpty();
    }

    @Test
    void shouldRemoveJobsOnce() {
        Job job = store.create(JobInput.of("gone", Schedule.every(MINUTE), null));

        assertThat(store.remove(job.id())).isTrue();
        assertThat(store.remove(job.id())).isFalse();
        assertThat(store.get(job.id())).isEmpty();
        assertThat(store.list(JobFilter.all())).isEmpty();
    }

    @Test
    void shouldFilterByGroupAndEnabledInCreationOrder() {
        Job a = store.create(JobInput.of("a", Schedule.every(MINUTE), null).withGroupId("g1"));
        Job b = store.create(JobInput.of("b", Schedule.every(MINUTE), null).withGroupId("g2"));
        Job c = store.create(JobInput.of("c", Schedule.every(MINUTE), null).withGroupId("g1").withEnabled(false));
        Job d = store.create(JobInput.of("d", Schedule.every(MINUTE), null));

        assertThat(ids(store.list(JobFilter.all()))).containsExactly(a.id(), b.id(), c.id(), d.id());
        assertThat(ids(store.list(null))).containsExactly(a.id(), b.id(), c.id(), d.id());
        assertThat(ids(store.list(JobFilter.group("g1")))).containsExactly(a.id(), c.id());
        assertThat(ids(store.list(JobFilter.enabled(true)))).containsExactly(a.id(), b.id(), d.id());
        assertThat(ids(store.list(JobFilter.enabled(false)))).containsExactly(c.id());
        assertThat(ids(store.list(JobFilter.group("g1").withEnabled(true)))).containsExactly(a.id());
        assertThat(store.list(JobFilter.group("none"))).isEmpty();
    }

    @Test
    void shouldApplyPatchAndBumpUpdatedAt() {
        Job job = store.create(JobInput.of("old", Schedule.every(MINUTE), payload("v", "1")));
        long nextBefore = job.state().nextRunAtMs();
        clock.advance(5_000L);

        Job updated = store.update(job.id(), JobPatch.empty()
            .withName("new")
            .withDescription("described")
            .withPayload(payload("v", "2"))).orElseThrow();

        assertThat(updated.name()).isEqualTo("new");
        assertThat(updated.description()).isEqualTo("described");
        assertThat(updated.payload()).isEqualTo(payload("v", "2"));
        assertThat(updated.createdAtMs()).isEqualTo(job.createdAtMs());
        assertThat(updated.updatedAtMs()).isEqualTo(job.createdAtMs() + 5_000L);
        assertThat(updated.state().nextRunAtMs()).isEqualTo(nextBefore);
    }

    @Test
    void shouldBumpUpdatedAtForEmptyPatch() {
        Job job = store.create(JobInput.of("same", Schedule.every(MINUTE), null));
        clock.advance(1_000L);

        Job updated = store.update(job.id(), JobPatch.empty()).orElseThrow();

        assertThat(updated.name()).isEqualTo("same");
        assertThat(updated.updatedAtMs()).isEqualTo(job.updatedAtMs() + 1_000L);
    }

    @Test
    void shouldRecomputeNextRunWhenScheduleChanges() {
        Job job = store.create(JobInput.of("job", Schedule.every(MINUTE), null));
        clock.advance(10_000L);

        Job updated = store.update(job.id(), JobPatch.empty().withSchedule(Schedule.every(2 * MINUTE)))
            .orElseThrow();

        assertThat(updated.schedule()).isEqualTo(Schedule.every(2 * MINUTE));
        assertThat(updated.state().nextRunAtMs()).isEqualTo(clock.millis() + 2 * MINUTE);
    }

    @Test
    void shouldClearNextRunWhenDisabledByPatchAndRestoreOnEnable() {
        Job job = store.create(JobInput.of("job", Schedule.every(MINUTE), null));

        Job disabled = store.update(job.id(), JobPatch.empty()
            .withEnabled(false)
            .withSchedule(Schedule.every(2 * MINUTE))).orElseThrow();
        assertThat(disabled.enabled()).isFalse();
        assertThat(disabled.state().nextRunAtMs()).isNull();

        clock.advance(30_000L);
        Job enabled = store.update(job.id(), JobPatch.empty().withEnabled(true)).orElseThrow();
        assertThat(enabled.enabled()).isTrue();
        assertThat(enabled.state().nextRunAtMs()).isEqualTo(clock.millis() + 2 * MINUTE);
    }

    @Test
    void shouldPauseAndResumeFromResumeTime() {
        Job job = store.create(JobInput.of("job", Schedule.every(MINUTE), null));

        assertThat(store.pause(job.id())).isTrue();
        Job paused = store.get(job.id()).orElseThrow();
        assertThat(paused.enabled()).isFalse();
        assertThat(paused.state().nextRunAtMs()).isNull();

        clock.advance(10 * MINUTE);
        assertThat(store.resume(job.id())).isTrue();
        Job resumed = store.get(job.id()).orElseThrow();
        assertThat(resumed.enabled()).isTrue();
        assertThat(resumed.state().nextRunAtMs()).isEqualTo(clock.millis() + MINUTE);
        assertThat(resumed.updatedAtMs()).isEqualTo(clock.millis());
    }

    @Test
    void shouldResumeIdempotently() {
        Job job = store.create(JobInput.of("job", Schedule.every(MINUTE), null));
        clock.advance(1_000L);

        assertThat(store.resume(job.id())).isTrue();
        assertThat(store.resume(job.id())).isTrue();

        assertThat(store.get(job.id()).orElseThrow().state().nextRunAtMs()).isEqualTo(clock.millis() + MINUTE);
    }

    @Test
    void shouldOrderDueJobsByDueTimeThenCreation() {
        Job late = store.create(JobInput.of("late", Schedule.every(3 * MINUTE), null));
        Job first = store.create(JobInput.of("first", Schedule.every(MINUTE), null));
        Job second = store.create(JobInput.of("second", Schedule.every(MINUTE), null));
        Job future = store.create(JobInput.of("future", Schedule.every(10 * MINUTE), null));
        store.create(JobInput.of("off", Schedule.every(MINUTE), null).withEnabled(false));

        List<Job> due = store.dueJobs(clock.millis() + 3 * MINUTE);

        assertThat(ids(due)).containsExactly(first.id(), second.id(), late.id());
        assertThat(ids(due)).doesNotContain(future.id());
        assertThat(store.dueJobs(clock.millis() + MINUTE - 1)).isEmpty();
    }

    @Test
    void shouldDisableOneShotJobAfterRun() {
        Job job = store.create(JobInput.of("once", Schedule.at("2030-01-01T00:01:00Z"), null));
        assertThat(job.state().nextRunAtMs()).isEqualTo(clock.millis() + MINUTE);

        long completedAt = clock.millis() + MINUTE + 250L;
        Job ran = store.recordRun(job.id(), JobStatus.OK, null, completedAt).orElseThrow();

        assertThat(ran.enabled()).isFalse();
        assertThat(ran.state().nextRunAtMs()).isNull();
        assertThat(ran.state().runCount()).isEqualTo(1);
        assertThat(ran.state().lastRunAtMs()).isEqualTo(completedAt);
        assertThat(ran.state().lastStatus()).isEqualTo(JobStatus.OK);
        assertThat(ran.state().lastError()).isNull();
    }

    @Test
    void shouldRecomputeRecurringJobFromCompletionTime() {
        Job job = store.create(JobInput.of("tick", Schedule.every(MINUTE), null));
        long completedAt = clock.millis() + MINUTE + 1_500L;

        Job ran = store.recordRun(job.id(), JobStatus.ERROR, "boom", completedAt).orElseThrow();

        assertThat(ran.enabled()).isTrue();
        assertThat(ran.state().runCount()).isEqualTo(1);
        assertThat(ran.state().lastStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(ran.state().lastError()).isEqualTo("boom");
        assertThat(ran.state().nextRunAtMs()).isEqualTo(completedAt + MINUTE);

        Job recovered = store.recordRun(job.id(), JobStatus.OK, "ignored", completedAt + MINUTE).orElseThrow();
        assertThat(recovered.state().runCount()).isEqualTo(2);
        assertThat(recovered.state().lastStatus()).isEqualTo(JobStatus.OK);
        assertThat(recovered.state().lastError()).isNull();
    }

    @Test
    void shouldKeepPausedJobUnscheduledWhenRunCompletes() {
        Job job = store.create(JobInput.of("tick", Schedule.every(MINUTE), null));
        store.pause(job.id());

        Job ran = store.recordRun(job.id(), JobStatus.OK, null, clock.millis() + MINUTE).orElseThrow();

        assertThat(ran.enabled()).isFalse();
        assertThat(ran.state().nextRunAtMs()).isNull();
        assertThat(ran.state().runCount()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreRunOfRemovedJob() {
        Job job = store.create(JobInput.of("tick", Schedule.every(MINUTE), null));
        store.remove(job.id());

        assertThat(store.recordRun(job.id(), JobStatus.OK, null, clock.millis())).isEmpty();
        assertThat(store.size()).isZero();
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).toList();
    }

    private static ObjectNode payload(String key, String value) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(key, value);
        return node;
    }
}
