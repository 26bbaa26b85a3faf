package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * An immutable record of an actor performing a verb on an object.
 * Statements are the ledger of "what happened" and are never updated or removed once stored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Statement {

    private String id;

    private Actor actor;

    private Verb verb;

    private Activity object;

    private StatementResult result;

    private StatementContext context;

    private Instant timestamp;

    /**
     * Extensions on the statement context, never null.
     */
    public Extensions contextExtensions() {
        return context != null && context.getExtensions() != null ? context.getExtensions() : Extensions.empty();
    }

    /**
     * First "other" context activity, which carries the back-reference to the state document
     * a comment, share or invitation statement was written for.
     */
    public Optional<Activity> backReference() {
        if (context == null || context.getContextActivities() == null) {
            return Optional.empty();
        }
        List<Activity> other = context.getContextActivities().getOther();
        return other == null ? Optional.empty() : other.stream().findFirst();
    }

    public String actorEmail() {
        return actor != null ? actor.email() : null;
    }

    public String verbDisplay() {
        return verb != null ? verb.displayText() : "unknown";
    }
}
