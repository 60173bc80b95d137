package io.tickwork.core.schedule;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Schedule.At.class, name = "at"),
    @JsonSubTypes.Type(value = Schedule.Every.class, name = "every"),
    @JsonSubTypes.Type(value = Schedule.Cron.class, name = "cron")
})
public sealed interface Schedule permits Schedule.At, Schedule.Every, Schedule.Cron {

    static At at(String timestamp) {
        return new At(timestamp);
    }

    static Every every(long intervalMs) {
        return new Every(intervalMs, null);
    }

    static Every every(long intervalMs, long anchorMs) {
        return new Every(intervalMs, anchorMs);
    }

    static Cron cron(String expression) {
        return new Cron(expression);
    }

    record At(String timestamp) implements Schedule {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Every(long intervalMs, Long anchorMs) implements Schedule {
    }

    record Cron(String expression) implements Schedule {
    }
}
