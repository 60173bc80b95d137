package io.tickwork.cli;

import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.time.NaturalTimeParser;
import picocli.CommandLine.Option;

public final class ScheduleOptions {

    @Option(names = "--cron", description = "Five-field cron expression, evaluated in UTC")
    String cron;

    @Option(names = "--every", description = "Interval in milliseconds")
    Long everyMs;

    @Option(names = "--at", description = "One-shot time: ISO-8601, 'in 10m', 'tomorrow at 9am'")
    String at;

    Schedule toSchedule(Long anchorMs, NaturalTimeParser timeParser) {
        if (cron != null) {
            return Schedule.cron(cron);
        }
        if (everyMs != null) {
            return anchorMs == null ? Schedule.every(everyMs) : Schedule.every(everyMs, anchorMs);
        }
        return Schedule.at(timeParser.parse(at).toString());
    }
}
