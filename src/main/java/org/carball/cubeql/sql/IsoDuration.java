package org.carball.cubeql.sql;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An ISO-8601 duration such as {@code P1D}, {@code P2W} or {@code PT1H30M}. Calendar parts are kept
 * separately so dialects that understand months and years can use them verbatim.
 */
public record IsoDuration(int years, int months, int weeks, int days, int hours, int minutes, BigDecimal seconds) {

    private static final Pattern ISO_DURATION = Pattern.compile(
            "^P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)W)?(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d+)?)S)?)?$");

    private static final long SECONDS_PER_DAY = 86_400L;

    public static boolean isValid(String value) {
        return parseOptional(value).isPresent();
    }

    public static IsoDuration parse(String value) {
        return parseOptional(value)
                .orElseThrow(() -> new IllegalArgumentException("Invalid ISO-8601 duration: " + value));
    }

    public static Optional<IsoDuration> parseOptional(String value) {
        if (value == null || value.equals("P") || value.endsWith("T")) {
            return Optional.empty();
        }
        Matcher matcher = ISO_DURATION.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new IsoDuration(
                group(matcher, 1), group(matcher, 2), group(matcher, 3), group(matcher, 4),
                group(matcher, 5), group(matcher, 6),
                matcher.group(7) == null ? BigDecimal.ZERO : new BigDecimal(matcher.group(7))));
    }

    /**
     * Approximate length in seconds; months count as 30 days and years as 365.
     */
    public long totalSeconds() {
        long total = (long) years * 365 * SECONDS_PER_DAY
                + (long) months * 30 * SECONDS_PER_DAY
                + ((long) weeks * 7 + days) * SECONDS_PER_DAY
                + (long) hours * 3600
                + (long) minutes * 60;
        return total + seconds.longValue();
    }

    /**
     * PostgreSQL interval literal body, e.g. {@code 1 days} or {@code 2 hours 30 minutes}.
     */
    public String toIntervalText() {
        List<String> parts = new ArrayList<>();
        if (years > 0) {
            parts.add(years + " years");
        }
        if (months > 0) {
            parts.add(months + " months");
        }
        if (weeks > 0 || days > 0) {
            parts.add((weeks * 7 + days) + " days");
        }
        if (hours > 0) {
            parts.add(hours + " hours");
        }
        if (minutes > 0) {
            parts.add(minutes + " minutes");
        }
        if (seconds.signum() > 0) {
            parts.add(seconds.stripTrailingZeros().toPlainString() + " seconds");
        }
        return parts.isEmpty() ? "0 seconds" : String.join(" ", parts);
    }

    private static int group(Matcher matcher, int index) {
        String value = matcher.group(index);
        return value == null ? 0 : Integer.parseInt(value);
    }
}
