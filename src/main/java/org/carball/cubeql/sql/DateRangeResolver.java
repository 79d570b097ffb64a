package org.carball.cubeql.sql;

import org.carball.cubeql.model.query.DateRange;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns date ranges into concrete UTC bounds. Relative expressions are evaluated against the
 * injected clock; an end given as a bare date covers that whole day.
 */
public class DateRangeResolver {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);
    private static final Pattern LAST_N = Pattern.compile("^last\\s+(\\d+)\\s+(day|week|month|year)s?$");

    /**
     * Inclusive bounds of a resolved range.
     */
    public record Bounds(LocalDateTime start, LocalDateTime end) {}

    private final Clock clock;

    public DateRangeResolver(Clock clock) {
        this.clock = clock;
    }

    public static DateRangeResolver systemUtc() {
        return new DateRangeResolver(Clock.systemUTC());
    }

    /**
     * @throws IllegalArgumentException when the range is neither a known expression nor parseable dates
     */
    public Bounds resolve(DateRange range) {
        if (range == null) {
            throw new IllegalArgumentException("Date range is required");
        }
        if (!range.isExpression()) {
            return new Bounds(parseStart(range.start()), parseEnd(range.end()));
        }
        String expression = range.expression().trim();
        Bounds relative = resolveRelative(expression.toLowerCase(Locale.ROOT));
        if (relative != null) {
            return relative;
        }
        return new Bounds(parseStart(expression), parseEnd(expression));
    }

    public boolean isRelative(String expression) {
        return expression != null && resolveRelative(expression.trim().toLowerCase(Locale.ROOT)) != null;
    }

    /**
     * The period of the same length ending the day before {@code current} starts.
     */
    public Bounds priorPeriod(Bounds current) {
        long days = (long) Math.ceil(ChronoUnit.MILLIS.between(current.start(), current.end()) / 86_400_000.0);
        LocalDate priorEnd = current.start().toLocalDate().minusDays(1);
        LocalDate priorStart = priorEnd.minusDays(days - 1);
        return new Bounds(priorStart.atStartOfDay(), priorEnd.atTime(END_OF_DAY));
    }

    private Bounds resolveRelative(String expression) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        switch (expression) {
            case "today":
                return days(today, today);
            case "yesterday":
                return days(today.minusDays(1), today.minusDays(1));
            case "this week": {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                return days(monday, monday.plusDays(6));
            }
            case "last week": {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
                return days(monday, monday.plusDays(6));
            }
            case "this month":
                return days(today.withDayOfMonth(1), today.with(TemporalAdjusters.lastDayOfMonth()));
            case "last month": {
                LocalDate first = today.withDayOfMonth(1).minusMonths(1);
                return days(first, first.with(TemporalAdjusters.lastDayOfMonth()));
            }
            case "this quarter": {
                LocalDate first = quarterStart(today);
                return days(first, first.plusMonths(3).minusDays(1));
            }
            case "last quarter": {
                LocalDate first = quarterStart(today).minusMonths(3);
                return days(first, first.plusMonths(3).minusDays(1));
            }
            case "this year":
                return days(today.withDayOfYear(1), today.with(TemporalAdjusters.lastDayOfYear()));
            case "last year": {
                LocalDate first = today.withDayOfYear(1).minusYears(1);
                return days(first, first.with(TemporalAdjusters.lastDayOfYear()));
            }
            default:
                break;
        }

        Matcher matcher = LAST_N.matcher(expression);
        if (!matcher.matches()) {
            return null;
        }
        int amount = Integer.parseInt(matcher.group(1));
        switch (matcher.group(2)) {
            case "day":
                return days(today.minusDays(amount - 1L), today);
            case "week":
                return days(today.minusDays(amount * 7L - 1), today);
            case "month":
                return days(today.withDayOfMonth(1).minusMonths(amount - 1L), today);
            case "year":
                return days(today.withDayOfYear(1).minusYears(amount), today);
            default:
                return null;
        }
    }

    private static LocalDate quarterStart(LocalDate date) {
        int firstMonth = ((date.getMonthValue() - 1) / 3) * 3 + 1;
        return LocalDate.of(date.getYear(), firstMonth, 1);
    }

    private static Bounds days(LocalDate start, LocalDate end) {
        return new Bounds(start.atStartOfDay(), end.atTime(END_OF_DAY));
    }

    private static LocalDateTime parseStart(String value) {
        if (isDateOnly(value)) {
            return LocalDate.parse(value).atStartOfDay();
        }
        return parseTimestamp(value);
    }

    private static LocalDateTime parseEnd(String value) {
        if (isDateOnly(value)) {
            return LocalDate.parse(value).atTime(END_OF_DAY);
        }
        return parseTimestamp(value);
    }

    private static boolean isDateOnly(String value) {
        return value != null && value.matches("\\d{4}-\\d{2}-\\d{2}");
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Date value is required");
        }
        String normalized = value.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(normalized).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(normalized);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unrecognised date or date range: " + value, e);
            }
        }
    }
}
