package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A set of agents seen together on collaboration statements. Teams have no stored identity; the id is
 * derived from the member set, so the same members always yield the same team.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Team derived from collaboration statements")
public class Team {

    @Schema(description = "Name-based UUID of the sorted member mbox list")
    private String id;

    @Schema(description = "Sorted, comma-joined member mboxes")
    private String memberKey;

    @Builder.Default
    private List<String> members = new ArrayList<>();

    @Builder.Default
    private List<String> projects = new ArrayList<>();

    private long interactionCount;

    private Instant lastActivity;

    @Schema(description = "Up to five most recent activities, newest first")
    @Builder.Default
    private List<TeamActivity> recentActivities = new ArrayList<>();
}
