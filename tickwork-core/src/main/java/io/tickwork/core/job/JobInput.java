package io.tickwork.core.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.tickwork.core.schedule.Schedule;
import java.util.Objects;

public record JobInput(
    String name,
    String groupId,
    String description,
    boolean enabled,
    Schedule schedule,
    JsonNode payload
) {
    public JobInput {
        Objects.requireNonNull(schedule, "schedule must not be null");
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
    }

    public static JobInput of(String name, Schedule schedule, JsonNode payload) {
        return new JobInput(name, null, null, true, schedule, payload);
    }

    public static JobInput from(Job job) {
        return new JobInput(job.name(), job.groupId(), job.description(), job.enabled(), job.schedule(),
            job.payload());
    }

    public JobInput withGroupId(String value) {
        return new JobInput(name, value, description, enabled, schedule, payload);
    }

    public JobInput withDescription(String value) {
        return new JobInput(name, groupId, value, enabled, schedule, payload);
    }

    public JobInput withEnabled(boolean value) {
        return new JobInput(name, groupId, description, value, schedule, payload);
    }
}
