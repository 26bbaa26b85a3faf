package hk.edu.hulab.portal.backend.analytics;

import java.time.Instant;

/**
 * Absolute half-open window {@code [since, until)}. Null bounds are open.
 *
 * @param key preset name the window was resolved from, used in cache keys and responses
 */
public record TimeRange(String key, Instant since, Instant until) {

    public static TimeRange unbounded() {
        return new TimeRange(TimeRangePreset.ALL.key(), null, null);
    }

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        return (since == null || !instant.isBefore(since)) && (until == null || instant.isBefore(until));
    }
}
