package io.tickwork.core.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A parsed five-field cron expression ({@code minute hour day-of-month month day-of-week}) evaluated in UTC
 * at one-minute granularity.
 *
 * <p>Each field accepts {@code *}, a value {@code n}, a range {@code a-b}, a step {@code *}{@code /n} or
 * {@code a-b/n}, and comma separated lists of those. Day-of-week runs from 0 (Sunday) to 6.
 *
 * <p>Day matching follows the Vixie cron convention: when both day-of-month and day-of-week are restricted
 * (neither field starts with {@code *}), a day matches if <em>either</em> field matches. Otherwise a day must
 * satisfy both, which reduces to the restricted field alone.
 */
public final class CronExpression {
    private static final int FIELD_COUNT = 5;
    // Long enough for a Feb 29 expression to span a skipped century leap year.
    private static final int SEARCH_HORIZON_YEARS = 8;

    private final String source;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthWildcard;
    private final boolean dayOfWeekWildcard;

    private CronExpression(String source, String[] fields) {
        this.source = source;
        this.minutes = CronField.MINUTE.parse(fields[0]);
        this.hours = CronField.HOUR.parse(fields[1]);
        this.daysOfMonth = CronField.DAY_OF_MONTH.parse(fields[2]);
        this.months = CronField.MONTH.parse(fields[3]);
        this.daysOfWeek = CronField.DAY_OF_WEEK.parse(fields[4]);
        this.dayOfMonthWildcard = fields[2].startsWith("*");
        this.dayOfWeekWildcard = fields[4].startsWith("*");
    }

    public static CronExpression parse(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        String trimmed = expression.trim();
        String[] fields = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        if (fields.length == FIELD_COUNT + 1) {
            throw new IllegalArgumentException("seconds field is not supported: " + expression);
        }
        if (fields.length != FIELD_COUNT) {
            throw new IllegalArgumentException(
                "expected " + FIELD_COUNT + " fields but found " + fields.length + ": " + expression
            );
        }
        return new CronExpression(trimmed, fields);
    }

    public OptionalLong nextAfter(long afterMs) {
        LocalDateTime candidate = LocalDateTime.ofInstant(Instant.ofEpochMilli(afterMs), ZoneOffset.UTC)
            .truncatedTo(ChronoUnit.MINUTES)
            .plusMinutes(1);
        LocalDateTime limit = candidate.plusYears(SEARCH_HORIZON_YEARS);

        while (!candidate.isAfter(limit)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!matchesDay(candidate.toLocalDate())) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.get(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return OptionalLong.of(candidate.toInstant(ZoneOffset.UTC).toEpochMilli());
        }
        return OptionalLong.empty();
    }

    public boolean matches(long epochMs) {
        LocalDateTime time = LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMs), ZoneOffset.UTC);
        return minutes.get(time.getMinute())
            && hours.get(time.getHour())
            && months.get(time.getMonthValue())
            && matchesDay(time.toLocalDate());
    }

    private boolean matchesDay(LocalDate date) {
        boolean dayOfMonth = daysOfMonth.get(date.getDayOfMonth());
        boolean dayOfWeek = daysOfWeek.get(date.getDayOfWeek().getValue() % 7);
        if (!dayOfMonthWildcard && !dayOfWeekWildcard) {
            return dayOfMonth || dayOfWeek;
        }
        return dayOfMonth && dayOfWeek;
    }

    @Override
    public String toString() {
        return source;
    }
}
