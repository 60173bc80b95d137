package io.tickwork.core.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.tickwork.core.schedule.Schedule;
import java.util.Objects;

/**
 * A scheduled unit of work. Instances are immutable; {@link #payload()} hands out a fresh deep copy on every
 * call, so no caller can reach the tree held by the scheduler.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
    String id,
    String name,
    String groupId,
    String description,
    boolean enabled,
    Schedule schedule,
    JsonNode payload,
    JobState state,
    long createdAtMs,
    long updatedAtMs
) {
    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        name = name == null ? "" : name;
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        state = state == null ? JobState.initial(null) : state;
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    public boolean isDue(long nowMs) {
        return enabled && state.nextRunAtMs() != null && state.nextRunAtMs() <= nowMs;
    }

    Job with(String newName, String newDescription, boolean newEnabled, Schedule newSchedule, JsonNode newPayload,
             JobState newState, long newUpdatedAtMs) {
        return new Job(id, newName, groupId, newDescription, newEnabled, newSchedule, newPayload, newState,
            createdAtMs, newUpdatedAtMs);
    }

    Job withState(boolean newEnabled, JobState newState) {
        return new Job(id, name, groupId, description, newEnabled, schedule, payload, newState, createdAtMs,
            updatedAtMs);
    }
}
