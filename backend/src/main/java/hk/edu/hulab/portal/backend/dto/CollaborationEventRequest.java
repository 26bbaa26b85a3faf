package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
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
@Schema(description = "A collaboration that happened on a project")
public class CollaborationEventRequest {

    @NotBlank
    private String projectId;

    @NotBlank
    @Schema(description = "Free-form action name", example = "co_edited")
    private String action;

    @Schema(description = "Other agents involved")
    @Builder.Default
    private List<String> teamEmails = new ArrayList<>();
}
