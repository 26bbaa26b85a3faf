package hk.edu.hulab.portal.backend.analytics;

import java.util.List;
import java.util.Map;

public record AnalyticsOptions(Map<String, String> metricSets, List<String> timeRanges, long cacheSize,
        long cacheTtlMs) {
}
