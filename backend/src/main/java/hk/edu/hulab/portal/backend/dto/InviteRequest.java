package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Invite one or more agents to a project")
public class InviteRequest {

    @NotBlank(message = "Project ID is required")
    private String projectId;

    @NotEmpty(message = "At least one invitee email is required")
    @Builder.Default
    private List<String> inviteeEmails = new ArrayList<>();

    @Schema(description = "viewer, editor or manager", example = "editor")
    private String role;

    private String message;

    @Builder.Default
    private List<String> permissions = new ArrayList<>();
}
