package hk.edu.hulab.portal.backend.analytics;

import java.time.Instant;
import java.util.Map;

public record ContributorMetric(String user, long activities, Map<String, Long> verbs,
        Instant firstActivity, Instant lastActivity) {
}
