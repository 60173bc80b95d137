package io.tickwork.cli;

import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.schedule.ScheduleResolver;
import io.tickwork.core.time.NaturalTimeParser;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "next", description = "Preview upcoming occurrences of a schedule without creating a job")
public final class NextCommand implements Callable<Integer> {
    private final CliContext context;

    @ArgGroup(exclusive = true, multiplicity = "1")
    ScheduleOptions schedule;

    @Option(names = "--anchor", description = "Anchor for --every, epoch milliseconds")
    Long anchorMs;

    @Option(names = "--after", description = "Reference instant (ISO-8601), defaults to now")
    String after;

    @Option(names = {"-n", "--count"}, description = "Number of occurrences to list", defaultValue = "1")
    int count;

    public NextCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Schedule resolved = schedule.toSchedule(anchorMs, new NaturalTimeParser(context.clock(), ZoneOffset.UTC));
            ScheduleResolver resolver = new ScheduleResolver();
            long cursor = after != null ? Instant.parse(after.trim()).toEpochMilli() : context.clock().millis();

            int printed = 0;
            while (printed < Math.max(1, count)) {
                OptionalLong next = resolver.resolveNext(resolved, cursor);
                if (next.isEmpty()) {
                    break;
                }
                System.out.println(Instant.ofEpochMilli(next.getAsLong()));
                cursor = next.getAsLong();
                printed++;
            }
            if (printed == 0) {
                System.out.println("No upcoming occurrence");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Next command failed: " + e.getMessage());
            return 1;
        }
    }
}
