package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Research project following the RIDE-I framework. Stored under the owner's agent as {@code project-data}.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResearchProject extends StateDocument {

    private String title;
    private String description;

    @Builder.Default
    private List<String> researchQuestions = new ArrayList<>();

    private String methodology;

    @Builder.Default
    private List<String> expectedOutcomes = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> timeline = new LinkedHashMap<>();

    @Builder.Default
    private List<Collaborator> collaborators = new ArrayList<>();

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String fundingSource;
    private String ethicsApproval;

    @Builder.Default
    private String visibility = "private";

    private ProjectPhase currentPhase;

    /**
     * Progress per phase, keyed by {@link ProjectPhase#key()}.
     */
    @Builder.Default
    private Map<String, PhaseProgress> phases = new LinkedHashMap<>();

    @Override
    public String displayName() {
        return title;
    }

    public Optional<Collaborator> collaborator(String email) {
        if (email == null || collaborators == null) {
            return Optional.empty();
        }
        return collaborators.stream()
                .filter(c -> email.equalsIgnoreCase(c.getEmail()))
                .findFirst();
    }
}
