package org.carball.cubeql.transform;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;
import org.carball.cubeql.model.query.TimeGranularity;
import org.carball.cubeql.sql.DateRangeResolver;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Adds a row for every time bucket a query's date range covers but the database returned nothing
 * for, so a time series has no holes. Buckets are generated per combination of the other
 * dimensions; added rows carry the fill value in every measure.
 */
@Slf4j
public class TimeSeriesGapFiller {

    static final int MAX_BUCKETS = 10_000;

    private static final DateTimeFormatter BUCKET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");

    /**
     * One gap-filling pass over a single time dimension.
     *
     * @param timeKey    the row key holding the bucket timestamp
     * @param start      first instant of the range, UTC
     * @param end        last instant of the range, UTC
     * @param fillValue  measure value of added rows, may be null
     * @param dimensions the other row keys that split the series
     */
    public record Request(String timeKey, TimeGranularity granularity, LocalDateTime start, LocalDateTime end,
                          Object fillValue, List<String> measures, List<String> dimensions) {}

    private final DateRangeResolver dates;

    public TimeSeriesGapFiller(DateRangeResolver dates) {
        this.dates = dates;
    }

    /**
     * Fills every time dimension of the query that has a granularity and a date range and has not
     * opted out. A range that cannot be resolved leaves the rows as they are.
     */
    public List<Map<String, Object>> apply(List<Map<String, Object>> rows, SemanticQuery query) {
        List<TimeDimension> timeDimensions = query.getTimeDimensions() == null ? List.of() : query.getTimeDimensions();
        Set<String> timeMembers = new LinkedHashSet<>();
        timeDimensions.forEach(td -> timeMembers.add(td.getDimension()));
        List<String> dimensions = new ArrayList<>();
        if (query.getDimensions() != null) {
            query.getDimensions().stream().filter(d -> !timeMembers.contains(d)).forEach(dimensions::add);
        }
        List<String> measures = query.getMeasures() == null ? List.of() : query.getMeasures();
        Object fillValue = query.getFillMissingDatesValue() == null ? 0 : query.getFillMissingDatesValue();

        List<Map<String, Object>> result = rows;
        for (TimeDimension timeDimension : timeDimensions) {
            if (!timeDimension.shouldFillMissingDates()) {
                continue;
            }
            DateRangeResolver.Bounds bounds;
            try {
                bounds = dates.resolve(timeDimension.getDateRange());
            } catch (IllegalArgumentException e) {
                log.warn("Not filling gaps for {}: {}", timeDimension.getDimension(), e.getMessage());
                continue;
            }
            result = fill(result, new Request(timeDimension.getDimension(), timeDimension.getGranularity(),
                    bounds.start(), bounds.end(), fillValue, measures, dimensions));
        }
        return result;
    }

    public List<Map<String, Object>> fill(List<Map<String, Object>> rows, Request request) {
        List<LocalDateTime> buckets = buckets(request.start(), request.end(), request.granularity());
        if (buckets.isEmpty()) {
            return rows;
        }

        Map<List<String>, Map<Object, Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<String> groupKey = new ArrayList<>();
            request.dimensions().forEach(d -> groupKey.add(Objects.toString(row.get(d), "")));
            groups.computeIfAbsent(groupKey, k -> new LinkedHashMap<>())
                    .put(bucketKey(row.get(request.timeKey())), row);
        }
        if (groups.isEmpty() && request.dimensions().isEmpty()) {
            groups.put(List.of(), new LinkedHashMap<>());
        }

        List<Map<String, Object>> filled = new ArrayList<>();
        int added = 0;
        for (Map<Object, Map<String, Object>> series : groups.values()) {
            Map<String, Object> sample = series.isEmpty() ? null : series.values().iterator().next();
            for (LocalDateTime bucket : buckets) {
                Map<String, Object> existing = series.get(bucket);
                if (existing != null) {
                    filled.add(existing);
                    continue;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(request.timeKey(), BUCKET_FORMAT.format(bucket));
                if (sample != null) {
                    request.dimensions().forEach(d -> row.put(d, sample.get(d)));
                }
                request.measures().forEach(m -> row.put(m, request.fillValue()));
                filled.add(row);
                added++;
            }
        }
        log.debug("Filled {} empty {} buckets for {} across {} series",
                added, request.granularity().value(), request.timeKey(), groups.size());
        return filled;
    }

    /**
     * Start of every bucket from the one containing {@code start} to the one containing
     * {@code end}, capped at {@value #MAX_BUCKETS}.
     */
    public static List<LocalDateTime> buckets(LocalDateTime start, LocalDateTime end, TimeGranularity granularity) {
        List<LocalDateTime> buckets = new ArrayList<>();
        LocalDateTime current = align(start, granularity);
        LocalDateTime last = align(end, granularity);
        while (!current.isAfter(last) && buckets.size() < MAX_BUCKETS) {
            buckets.add(current);
            current = next(current, granularity);
        }
        if (!current.isAfter(last)) {
            log.warn("Date range {} to {} has more than {} {} buckets; the series is truncated",
                    start, end, MAX_BUCKETS, granularity.value());
        }
        return buckets;
    }

    static LocalDateTime align(LocalDateTime time, TimeGranularity granularity) {
        switch (granularity) {
            case SECOND:
                return time.truncatedTo(ChronoUnit.SECONDS);
            case MINUTE:
                return time.truncatedTo(ChronoUnit.MINUTES);
            case HOUR:
                return time.truncatedTo(ChronoUnit.HOURS);
            case DAY:
                return time.truncatedTo(ChronoUnit.DAYS);
            case WEEK:
                return time.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay();
            case MONTH:
                return time.toLocalDate().withDayOfMonth(1).atStartOfDay();
            case QUARTER: {
                int firstMonth = ((time.getMonthValue() - 1) / 3) * 3 + 1;
                return LocalDate.of(time.getYear(), firstMonth, 1).atStartOfDay();
            }
            case YEAR:
                return time.toLocalDate().withDayOfYear(1).atStartOfDay();
            default:
                throw new IllegalArgumentException("Unsupported granularity: " + granularity);
        }
    }

    private static LocalDateTime next(LocalDateTime bucket, TimeGranularity granularity) {
        switch (granularity) {
            case SECOND:
                return bucket.plusSeconds(1);
            case MINUTE:
                return bucket.plusMinutes(1);
            case HOUR:
                return bucket.plusHours(1);
            case DAY:
                return bucket.plusDays(1);
            case WEEK:
                return bucket.plusWeeks(1);
            case MONTH:
                return bucket.plusMonths(1);
            case QUARTER:
                return bucket.plusMonths(3);
            case YEAR:
                return bucket.plusYears(1);
            default:
                throw new IllegalArgumentException("Unsupported granularity: " + granularity);
        }
    }

    /**
     * The row's bucket as a UTC timestamp, or its text when the driver returned something that
     * does not parse as one.
     */
    static Object bucketKey(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime;
        }
        if (value instanceof LocalDate localDate) {
            return localDate.atStartOfDay();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().atStartOfDay();
        }
        if (value instanceof java.util.Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        String text = value.toString().trim();
        if (text.matches("\\d{4}-\\d{2}-\\d{2}")) {
            return LocalDate.parse(text).atStartOfDay();
        }
        String normalized = text.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(normalized).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException noOffset) {
            try {
                return LocalDateTime.parse(normalized);
            } catch (DateTimeParseException e) {
                log.debug("Bucket value '{}' is not a timestamp; matching it as text", text);
                return text;
            }
        }
    }
}
