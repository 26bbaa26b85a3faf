package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to create a research project")
public class CreateProjectRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    @Schema(description = "Project title", example = "Peer feedback in design studios")
    private String title;

    @NotBlank(message = "Description is required")
    @Schema(description = "Project description")
    private String description;

    @Builder.Default
    private List<String> researchQuestions = new ArrayList<>();

    private String methodology;

    @Builder.Default
    private List<String> expectedOutcomes = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> timeline = new LinkedHashMap<>();

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String fundingSource;
    private String ethicsApproval;

    @Schema(description = "private or public", example = "private")
    private String visibility;
}
