package hk.edu.hulab.portal.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Result of sending a batch of invitations")
public record InvitationBatch(String invitationBatchId, int sent, List<InvitationResult> results) {

    public boolean success() {
        return sent > 0;
    }
}
