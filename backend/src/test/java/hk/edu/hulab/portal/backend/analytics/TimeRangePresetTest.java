package hk.edu.hulab.portal.backend.analytics;

import hk.edu.hulab.portal.backend.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeRangePresetTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2026-05-13T09:00:00Z");

    @Test
    void shouldResolveCalendarPresetsToWholeDays() {
        TimeRange today = TimeRangePreset.TODAY.resolve(NOW, ZoneOffset.UTC);
        TimeRange yesterday = TimeRangePreset.YESTERDAY.resolve(NOW, ZoneOffset.UTC);

        assertThat(today.since()).isEqualTo(Instant.parse("2026-05-13T00:00:00Z"));
        assertThat(today.until()).isEqualTo(Instant.parse("2026-05-14T00:00:00Z"));
        assertThat(yesterday.since()).isEqualTo(Instant.parse("2026-05-12T00:00:00Z"));
        assertThat(yesterday.until()).isEqualTo(today.since());
        assertThat(today.key()).isEqualTo("today");
    }

    @Test
    void shouldStartWeeksOnMonday() {
        TimeRange week = TimeRangePreset.WEEK.resolve(NOW, ZoneOffset.UTC);

        assertThat(week.since()).isEqualTo(Instant.parse("2026-05-11T00:00:00Z"));
        assertThat(week.until()).isEqualTo(Instant.parse("2026-05-18T00:00:00Z"));
    }

    @Test
    void shouldResolveMonthQuarterAndYear() {
        assertThat(TimeRangePreset.MONTH.resolve(NOW, ZoneOffset.UTC).since())
                .isEqualTo(Instant.parse("2026-05-01T00:00:00Z"));
        TimeRange quarter = TimeRangePreset.QUARTER.resolve(NOW, ZoneOffset.UTC);
        assertThat(quarter.since()).isEqualTo(Instant.parse("2026-04-01T00:00:00Z"));
        assertThat(quarter.until()).isEqualTo(Instant.parse("2026-07-01T00:00:00Z"));
        assertThat(TimeRangePreset.YEAR.resolve(NOW, ZoneOffset.UTC).until())
                .isEqualTo(Instant.parse("2027-01-01T00:00:00Z"));
    }

    @Test
    void shouldIncludeCurrentInstantInRollingWindows() {
        TimeRange lastWeek = TimeRangePreset.LAST_7_DAYS.resolve(NOW, ZoneOffset.UTC);

        assertThat(lastWeek.since()).isEqualTo(NOW.minus(Duration.ofDays(7)));
        assertThat(lastWeek.contains(NOW)).isTrue();
        assertThat(lastWeek.contains(NOW.minus(Duration.ofDays(7)))).isTrue();
        assertThat(lastWeek.contains(NOW.minus(Duration.ofDays(7)).minusMillis(1))).isFalse();
    }

    @Test
    void shouldResolveDaysInConfiguredZone() {
        Instant lateEvening = Instant.parse("2026-05-13T20:00:00Z");

        TimeRange today = TimeRangePreset.TODAY.resolve(lateEvening, ZoneId.of("Asia/Hong_Kong"));

        assertThat(today.since()).isEqualTo(Instant.parse("2026-05-13T16:00:00Z"));
    }

    @Test
    void shouldLeaveAllUnbounded() {
        TimeRange all = TimeRangePreset.ALL.resolve(NOW, ZoneOffset.UTC);

        assertThat(all.since()).isNull();
        assertThat(all.until()).isNull();
        assertThat(all.contains(Instant.EPOCH)).isTrue();
    }

    @Test
    void shouldParseKeys() {
        assertThat(TimeRangePreset.fromKey(null)).isEqualTo(TimeRangePreset.LAST_30_DAYS);
        assertThat(TimeRangePreset.fromKey(" LAST7DAYS ")).isEqualTo(TimeRangePreset.LAST_7_DAYS);
        assertThrows(ValidationException.class, () -> TimeRangePreset.fromKey("fortnight"));
        assertThat(TimeRangePreset.keys(false)).doesNotContain("all").contains("last90days");
    }
}
