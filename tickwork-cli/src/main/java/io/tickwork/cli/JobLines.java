package io.tickwork.cli;

import io.tickwork.core.job.Job;
import io.tickwork.core.job.JobState;
import io.tickwork.core.schedule.Schedule;
import java.time.Instant;

final class JobLines {

    private JobLines() {
    }

    static String format(Job job) {
        JobState state = job.state();
        StringBuilder line = new StringBuilder()
            .append(job.id())
            .append(" | ").append(job.name())
            .append(" | ").append(describe(job.schedule()))
            .append(" | ").append(job.enabled() ? "enabled" : "disabled")
            .append(" | runs=").append(state.runCount());
        if (state.lastStatus() != null) {
            line.append(" | last=").append(state.lastStatus().wireName());
        }
        if (state.lastError() != null) {
            line.append(" (").append(state.lastError()).append(')');
        }
        if (state.nextRunAtMs() != null) {
            line.append(" | next=").append(Instant.ofEpochMilli(state.nextRunAtMs()));
        }
        return line.toString();
    }

    static String describe(Schedule schedule) {
        if (schedule instanceof Schedule.At at) {
            return "once at " + at.timestamp();
        }
        if (schedule instanceof Schedule.Every every) {
            String base = "every " + every.intervalMs() + "ms";
            return every.anchorMs() == null ? base : base + " from " + Instant.ofEpochMilli(every.anchorMs());
        }
        return "cron '" + ((Schedule.Cron) schedule).expression() + "'";
    }
}
