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
@Schema(description = "Comment on a project, file or activity")
public class CommentRequest {

    @NotBlank
    @Schema(description = "project, file or activity", example = "project")
    private String targetType;

    @NotBlank
    private String targetId;

    @NotBlank(message = "Comment content is required")
    private String content;

    @Schema(description = "Id of the comment this one replies to")
    private String parentCommentId;

    @Builder.Default
    private List<String> mentions = new ArrayList<>();
}
