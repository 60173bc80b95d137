package io.tickwork.core.job;

import com.fasterxml.jackson.databind.JsonNode;
import io.tickwork.core.schedule.Schedule;

public record JobPatch(
    String name,
    String description,
    JsonNode payload,
    Schedule schedule,
    Boolean enabled
) {
    public JobPatch {
        payload = payload == null ? null : payload.deepCopy();
    }

    public static JobPatch empty() {
        return new JobPatch(null, null, null, null, null);
    }

    public JobPatch withName(String value) {
        return new JobPatch(value, description, payload, schedule, enabled);
    }

    public JobPatch withDescription(String value) {
        return new JobPatch(name, value, payload, schedule, enabled);
    }

    public JobPatch withPayload(JsonNode value) {
        return new JobPatch(name, description, value, schedule, enabled);
    }

    public JobPatch withSchedule(Schedule value) {
        return new JobPatch(name, description, payload, value, enabled);
    }

    public JobPatch withEnabled(boolean value) {
        return new JobPatch(name, description, payload, schedule, value);
    }
}
