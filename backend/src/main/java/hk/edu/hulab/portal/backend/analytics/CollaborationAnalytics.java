package hk.edu.hulab.portal.backend.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CollaborationAnalytics {

    private String projectId;
    private String timeRange;
    private long totalCollaborations;
    private long uniqueCollaborators;
    private long activeProjects;
    private Map<String, Long> collaborationFrequency;
    private CollaborationNetwork network;
    private List<Integer> peakCollaborationHours;
    private Instant generatedAt;
    private boolean partial;
}
