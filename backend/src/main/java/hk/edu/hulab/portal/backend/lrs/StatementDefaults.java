package hk.edu.hulab.portal.backend.lrs;

import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.model.Statement;

import java.time.Clock;
import java.util.UUID;

final class StatementDefaults {

    private StatementDefaults() {
    }

    /**
     * Copy of the statement with id and timestamp filled in.
     */
    static Statement complete(Statement statement, Clock clock) {
        if (statement == null || statement.getActor() == null || statement.getVerb() == null
                || statement.getObject() == null) {
            throw new ValidationException("Statement requires actor, verb and object");
        }
        Statement.StatementBuilder builder = statement.toBuilder();
        if (statement.getId() == null || statement.getId().isBlank()) {
            builder.id(UUID.randomUUID().toString());
        }
        if (statement.getTimestamp() == null) {
            builder.timestamp(clock.instant());
        }
        return builder.build();
    }
}
