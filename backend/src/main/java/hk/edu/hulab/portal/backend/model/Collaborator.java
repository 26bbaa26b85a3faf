package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Project member entry. Roles are viewer, editor and manager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Collaborator {

    public static final String VIEWER = "viewer";
    public static final String EDITOR = "editor";
    public static final String MANAGER = "manager";

    private String email;
    private String name;

    @Builder.Default
    private String role = VIEWER;

    @Builder.Default
    private List<String> permissions = new ArrayList<>();

    private String addedBy;
    private Instant addedAt;

    /**
     * Set when the collaborator joined by accepting an invitation.
     */
    private String invitedBy;

    public boolean hasRole(String... roles) {
        for (String candidate : roles) {
            if (candidate.equalsIgnoreCase(role)) {
                return true;
            }
        }
        return false;
    }
}
