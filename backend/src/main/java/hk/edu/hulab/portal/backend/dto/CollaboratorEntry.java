package hk.edu.hulab.portal.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Project member, from the project document or from collaboration statements")
public class CollaboratorEntry {

    private String email;
    private String name;

    @Schema(description = "owner, viewer, editor or manager; null for agents only seen on statements")
    private String role;

    @Schema(description = "Whether the agent is listed on the project document")
    private boolean listed;

    private long interactions;
    private Instant lastActivity;
}
