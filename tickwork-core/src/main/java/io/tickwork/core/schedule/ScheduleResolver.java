package io.tickwork.core.schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ScheduleResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleResolver.class);
    private static final List<Function<String, Instant>> TIMESTAMP_FORMATS = List.of(
        Instant::parse,
        text -> OffsetDateTime.parse(text).toInstant(),
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    public OptionalLong resolveNext(Schedule schedule, long afterMs) {
        if (schedule instanceof Schedule.At at) {
            return nextAt(at, afterMs);
        }
        if (schedule instanceof Schedule.Every every) {
            return nextEvery(every, afterMs);
        }
        if (schedule instanceof Schedule.Cron cron) {
            return nextCron(cron, afterMs);
        }
        return OptionalLong.empty();
    }

    private OptionalLong nextAt(Schedule.At at, long afterMs) {
        OptionalLong target = parseTimestamp(at.timestamp());
        if (target.isEmpty() || target.getAsLong() <= afterMs) {
            return OptionalLong.empty();
        }
        return target;
    }

    private OptionalLong nextEvery(Schedule.Every every, long afterMs) {
        long interval = every.intervalMs();
        if (interval <= 0) {
            return OptionalLong.empty();
        }
        try {
            Long anchor = every.anchorMs();
            if (anchor == null) {
                return OptionalLong.of(Math.addExact(afterMs, interval));
            }
            if (afterMs < anchor) {
                return OptionalLong.of(anchor);
            }
            long elapsed = Math.subtractExact(afterMs, anchor);
            long steps = Math.floorDiv(elapsed, interval) + 1;
            return OptionalLong.of(Math.addExact(anchor, Math.multiplyExact(steps, interval)));
        } catch (ArithmeticException overflow) {
            return OptionalLong.empty();
        }
    }

    private OptionalLong nextCron(Schedule.Cron cron, long afterMs) {
        if (cron.expression() == null) {
            return OptionalLong.empty();
        }
        try {
            return CronExpression.parse(cron.expression()).nextAfter(afterMs);
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException invalid) {
            LOG.debug("Cron expression '{}' has no next occurrence: {}", cron.expression(), invalid.getMessage());
            return OptionalLong.empty();
        }
    }

    static OptionalLong parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return OptionalLong.empty();
        }
        String text = value.trim();
        for (Function<String, Instant> format : TIMESTAMP_FORMATS) {
            try {
                return OptionalLong.of(format.apply(text).toEpochMilli());
            } catch (DateTimeException | ArithmeticException unparsable) {
                LOG.trace("Timestamp '{}' rejected by format: {}", text, unparsable.getMessage());
            }
        }
        return OptionalLong.empty();
    }
}
