package hk.edu.hulab.portal.backend.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Activity over the last few minutes. Never cached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeMetrics {

    private int windowMinutes;
    private Instant since;
    private Instant until;

    private long totalActivities;

    /**
     * Statements per minute over the window.
     */
    private double activityRate;
    private Map<String, Long> activityBreakdown;

    private long activeUsers;
    private List<String> activeUserList;

    /**
     * Statements whose result reports {@code success=false}.
     */
    private long errorCount;

    /**
     * Share of statements in the window that failed, 0 for an empty window.
     */
    private double errorRate;
    private Map<String, Long> errorTypes;

    private Instant generatedAt;
    private boolean partial;
}
