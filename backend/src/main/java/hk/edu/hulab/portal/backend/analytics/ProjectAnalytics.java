package hk.edu.hulab.portal.backend.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectAnalytics {

    private String projectId;
    private String timeRange;
    private long totalActivities;
    private long uniqueContributors;

    /**
     * Statements per RIDE-I phase, taken from the ride-i-phase extension.
     */
    private Map<String, Long> phaseBreakdown;

    private List<PhaseTransition> phaseTransitions;
    private List<ContributorMetric> contributorMetrics;
    private CollaborationNetwork collaborationNetwork;

    /**
     * Statements per day (ISO date), oldest first.
     */
    private Map<String, Long> activityTimeline;

    private Instant generatedAt;
    private boolean partial;
}
