package hk.edu.hulab.portal.backend.analytics;

import java.time.Instant;

/**
 * One line of an activity feed: who did what to which object.
 */
public record RecentActivity(String user, String action, String object, Instant timestamp) {
}
