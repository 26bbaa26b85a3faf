package hk.edu.hulab.portal.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome for one invitee of a batch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvitationResult(String inviteeEmail, boolean success, String invitationId, String error) {

    public static InvitationResult sent(String inviteeEmail, String invitationId) {
        return new InvitationResult(inviteeEmail, true, invitationId, null);
    }

    public static InvitationResult failed(String inviteeEmail, String error) {
        return new InvitationResult(inviteeEmail, false, null, error);
    }
}
