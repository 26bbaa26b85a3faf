package hk.edu.hulab.portal.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.ExtensionKey;
import hk.edu.hulab.portal.backend.model.Statement;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a collaboration feed, flattened from its statement.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Collaboration feed entry")
public record CollaborationActivity(
        @Schema(description = "Statement id") String id,
        String actor,
        String actorName,
        @Schema(description = "Verb display text") String verb,
        @Schema(description = "Collaboration action, when the statement records one") String action,
        String objectId,
        String objectName,
        String objectType,
        @Schema(description = "Other agents named on the statement") List<String> team,
        Instant timestamp) {

    public static CollaborationActivity of(Statement statement) {
        List<String> team = statement.getContext() != null && statement.getContext().getTeam() != null
                ? statement.getContext().getTeam().stream().map(Actor::email).filter(Objects::nonNull).toList()
                : List.of();
        return new CollaborationActivity(
                statement.getId(),
                statement.actorEmail(),
                statement.getActor() != null ? statement.getActor().getName() : null,
                statement.verbDisplay(),
                statement.contextExtensions().getString(ExtensionKey.COLLABORATION_ACTION),
                statement.getObject() != null ? statement.getObject().getId() : null,
                statement.getObject() != null ? statement.getObject().displayName() : null,
                statement.getObject() != null ? statement.getObject().type() : null,
                team,
                statement.getTimestamp());
    }
}
