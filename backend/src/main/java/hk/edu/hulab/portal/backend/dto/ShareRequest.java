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
@Schema(description = "Share a resource with other agents")
public class ShareRequest {

    @NotBlank
    @Schema(description = "file, project, note or link", example = "file")
    private String resourceType;

    @NotBlank
    private String resourceId;

    @NotEmpty
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private String message;

    @Schema(description = "Defaults to view")
    @Builder.Default
    private List<String> permissions = new ArrayList<>();
}
