package hk.edu.hulab.portal.backend.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Dashboard overview over one time window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OverviewMetrics {

    /**
     * Subject e-mail, null for the platform-wide overview.
     */
    private String subject;

    private long totalActivities;
    private long uniqueUsers;
    private long activeProjects;
    private double completionRate;
    private int engagementScore;
    private CollaborationIndex collaborationIndex;
    private List<VerbCount> topActivities;
    private List<RecentActivity> recentActivities;
    private Map<Integer, Long> timeDistribution;

    /**
     * Only present for the platform-wide overview.
     */
    private List<UserRanking> userRankings;

    private String timeRange;
    private Instant since;
    private Instant until;
    private Instant generatedAt;

    /**
     * True when the scan hit the event bound and the figures cover only the newest events.
     */
    private boolean partial;
}
