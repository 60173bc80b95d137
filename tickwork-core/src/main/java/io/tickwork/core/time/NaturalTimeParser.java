package io.tickwork.core.time;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class NaturalTimeParser {
    private static final Pattern RELATIVE = Pattern.compile(
        "^in\\s+(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days)$"
    );
    private static final Pattern DAY_AT = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final Pattern MERIDIEM = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(am|pm)$");
    private static final Pattern CLOCK_TIME = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final DateTimeFormatter DATE_SPACE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);

    private final Clock clock;
    private final ZoneId zone;

    public NaturalTimeParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public Instant parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("time expression is required");
        }
        String raw = expression.trim();
        String normalized = raw.toLowerCase(Locale.ROOT);

        Matcher relative = RELATIVE.matcher(normalized);
        if (relative.matches()) {
            return clock.instant().plusSeconds(toSeconds(Long.parseLong(relative.group(1)), relative.group(2)));
        }

        Matcher dayAt = DAY_AT.matcher(normalized);
        if (dayAt.matches()) {
            LocalDate date = LocalDate.now(clock.withZone(zone));
            if ("tomorrow".equals(dayAt.group(1))) {
                date = date.plusDays(1);
            }
            return date.atTime(parseTime(dayAt.group(2))).atZone(zone).toInstant();
        }

        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException notInstant) {
            return parseDateTime(raw);
        }
    }

    private Instant parseDateTime(String raw) {
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(raw, DATE_SPACE_TIME).atZone(zone).toInstant();
            } catch (DateTimeParseException notSpaced) {
                try {
                    return LocalDateTime.parse(raw).atZone(zone).toInstant();
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("unable to parse time expression: " + raw, e);
                }
            }
        }
    }

    private long toSeconds(long value, String unit) {
        return switch (unit) {
            case "s", "sec", "secs", "second", "seconds" -> value;
            case "m", "min", "mins", "minute", "minutes" -> value * 60;
            case "h", "hr", "hrs", "hour", "hours" -> value * 3600;
            case "d", "day", "days" -> value * 86400;
            default -> throw new IllegalArgumentException("unsupported time unit: " + unit);
        };
    }

    private LocalTime parseTime(String token) {
        if (token == null || token.isBlank()) {
            return DEFAULT_TIME;
        }
        String value = token.trim().replace(" ", "");

        Matcher meridiem = MERIDIEM.matcher(value);
        if (meridiem.matches()) {
            int hour = Integer.parseInt(meridiem.group(1));
            if (hour < 1 || hour > 12) {
                throw new IllegalArgumentException("invalid 12-hour time: " + token);
            }
            hour = hour % 12;
            if ("pm".equals(meridiem.group(3))) {
                hour += 12;
            }
            return LocalTime.of(hour, minuteOf(meridiem.group(2), token));
        }

        Matcher clockTime = CLOCK_TIME.matcher(value);
        if (clockTime.matches()) {
            int hour = Integer.parseInt(clockTime.group(1));
            if (hour > 23) {
                throw new IllegalArgumentException("invalid time: " + token);
            }
            return LocalTime.of(hour, minuteOf(clockTime.group(2), token));
        }

        throw new IllegalArgumentException("invalid time format: " + token);
    }

    private int minuteOf(String group, String token) {
        int minute = group == null ? 0 : Integer.parseInt(group);
        if (minute > 59) {
            throw new IllegalArgumentException("invalid minute: " + token);
        }
        return minute;
    }
}
