package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
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
@Schema(description = "Closing notes for the current phase")
public class AdvancePhaseRequest {

    private String completionNotes;

    @Builder.Default
    private List<String> outputs = new ArrayList<>();
}
