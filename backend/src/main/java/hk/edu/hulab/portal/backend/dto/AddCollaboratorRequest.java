package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
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
@Schema(description = "Request to add a collaborator to a project")
public class AddCollaboratorRequest {

    @NotBlank(message = "Collaborator email is required")
    @Email(message = "Valid collaborator email is required")
    private String collaboratorEmail;

    @Schema(description = "viewer, editor or manager", example = "viewer")
    private String role;

    @Builder.Default
    private List<String> permissions = new ArrayList<>();
}
