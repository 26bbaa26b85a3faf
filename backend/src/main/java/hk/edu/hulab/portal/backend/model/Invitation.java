package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Invitation to join a project. Stored under the invitee's agent so that it can be listed
 * and answered without knowing the inviter.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Invitation extends StateDocument {

    public static final String PENDING = "pending";
    public static final String ACCEPTED = "accepted";
    public static final String DECLINED = "declined";

    private String invitationBatchId;
    private String projectId;
    private String projectTitle;
    private String projectOwner;
    private String inviterEmail;
    private String inviteeEmail;
    private String role;

    @Builder.Default
    private List<String> permissions = new ArrayList<>();

    private String message;

    @Builder.Default
    private String response = PENDING;

    private String responseMessage;
    private Instant respondedAt;
    private Instant expiresAt;
}
