package hk.edu.hulab.portal.backend.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAnalytics {

    private String user;
    private String timeRange;
    private long totalActivities;
    private Map<String, Long> activityBreakdown;
    private UserCollaborationMetrics collaborationMetrics;
    private AssessmentPerformance assessmentPerformance;
    private AiInteractionMetrics aiInteractionMetrics;
    private ActivityPatterns activityPatterns;
    private double completionRate;
    private int engagementScore;
    private Instant generatedAt;
    private boolean partial;
}
