package hk.edu.hulab.portal.backend.lrs;

import hk.edu.hulab.portal.backend.model.Verb;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Statement filter. Only single-field filters are available on the store; anything composite is a
 * client-side predicate applied by the caller.
 */
@Data
@Builder(toBuilder = true)
public class StatementQuery {

    public static final int DEFAULT_LIMIT = 100;

    /**
     * Agent e-mail.
     */
    private String agent;

    private String verb;

    /**
     * Object (activity) IRI.
     */
    private String activity;

    /**
     * Inclusive lower bound.
     */
    private Instant since;

    /**
     * Exclusive upper bound.
     */
    private Instant until;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    @Builder.Default
    private boolean ascending = false;

    private boolean relatedActivities;

    private boolean relatedAgents;

    public static class StatementQueryBuilder {
        public StatementQueryBuilder verb(Verb verb) {
            this.verb = verb != null ? verb.getId() : null;
            return this;
        }

        public StatementQueryBuilder verb(String verbId) {
            this.verb = verbId;
            return this;
        }
    }
}
