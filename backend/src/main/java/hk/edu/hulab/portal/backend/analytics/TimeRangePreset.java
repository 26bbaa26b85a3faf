package hk.edu.hulab.portal.backend.analytics;

import hk.edu.hulab.portal.backend.exception.ValidationException;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.List;

/**
 * Named time windows. Calendar presets cover whole days, weeks (Monday first), months, quarters and
 * years in the configured zone. Rolling presets end at the current instant, inclusive.
 */
public enum TimeRangePreset {
    TODAY("today"),
    YESTERDAY("yesterday"),
    WEEK("week"),
    MONTH("month"),
    QUARTER("quarter"),
    YEAR("year"),
    LAST_7_DAYS("last7days"),
    LAST_30_DAYS("last30days"),
    LAST_90_DAYS("last90days"),
    ALL("all");

    /**
     * Statement timestamps carry millisecond precision; a rolling window's exclusive bound sits one
     * millisecond after "now" so that a statement stamped at "now" is inside it.
     */
    private static final Duration ROLLING_END_PADDING = Duration.ofMillis(1);

    private final String key;

    TimeRangePreset(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static TimeRangePreset fromKey(String key) {
        if (key == null || key.isBlank()) {
            return LAST_30_DAYS;
        }
        return Arrays.stream(values())
                .filter(preset -> preset.key.equalsIgnoreCase(key.trim()))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown time range '" + key + "', expected one of "
                        + keys(true)));
    }

    public static List<String> keys(boolean includeAll) {
        return Arrays.stream(values())
                .filter(preset -> includeAll || preset != ALL)
                .map(TimeRangePreset::key)
                .toList();
    }

    public TimeRange resolve(Instant now, ZoneId zone) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        return switch (this) {
            case TODAY -> days(today, today.plusDays(1), zone);
            case YESTERDAY -> days(today.minusDays(1), today, zone);
            case WEEK -> {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                yield days(monday, monday.plusWeeks(1), zone);
            }
            case MONTH -> {
                LocalDate first = today.withDayOfMonth(1);
                yield days(first, first.plusMonths(1), zone);
            }
            case QUARTER -> {
                int firstMonth = ((today.getMonthValue() - 1) / 3) * 3 + 1;
                LocalDate first = LocalDate.of(today.getYear(), firstMonth, 1);
                yield days(first, first.plusMonths(3), zone);
            }
            case YEAR -> {
                LocalDate first = today.withDayOfYear(1);
                yield days(first, first.plusYears(1), zone);
            }
            case LAST_7_DAYS -> rolling(now, 7);
            case LAST_30_DAYS -> rolling(now, 30);
            case LAST_90_DAYS -> rolling(now, 90);
            case ALL -> TimeRange.unbounded();
        };
    }

    private TimeRange days(LocalDate from, LocalDate to, ZoneId zone) {
        return new TimeRange(key, from.atStartOfDay(zone).toInstant(), to.atStartOfDay(zone).toInstant());
    }

    private TimeRange rolling(Instant now, int days) {
        return new TimeRange(key, now.minus(Duration.ofDays(days)), now.plus(ROLLING_END_PADDING));
    }
}
