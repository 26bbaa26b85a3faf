package hk.edu.hulab.portal.backend.lrs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import hk.edu.hulab.portal.backend.exception.ConflictException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Process-local store used for development and tests. Statements are kept in their JSON form so that
 * callers never share mutable instances with the store, the same as going through the HTTP client.
 */
@Component
@ConditionalOnProperty(name = "portal.lrs.mode", havingValue = "memory")
public class InMemoryEventLogClient implements EventLogClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLogClient.class);

    static final int PAGE_SIZE = 50;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final List<StoredStatement> statements = new CopyOnWriteArrayList<>();
    private final Map<String, String> statementsById = new ConcurrentHashMap<>();
    private final Map<BlobKey, StoredBlob> blobs = new ConcurrentHashMap<>();
    private final AtomicLong etagSequence = new AtomicLong();
    private final AtomicLong statementSequence = new AtomicLong();

    public InMemoryEventLogClient(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        log.info("Using in-memory learning record store");
    }

    @Override
    public String append(Statement statement) {
        Statement complete = StatementDefaults.complete(statement, clock);
        store(List.of(complete));
        log.debug("Appended statement {} ({} {})", complete.getId(),
                complete.getVerb().getId(), complete.getObject().getId());
        return complete.getId();
    }

    @Override
    public List<String> appendAll(List<Statement> batch) {
        if (batch == null || batch.isEmpty()) {
            return List.of();
        }
        List<Statement> complete = batch.stream().map(s -> StatementDefaults.complete(s, clock)).toList();
        store(complete);
        return complete.stream().map(Statement::getId).toList();
    }

    @Override
    public Stream<Statement> query(StatementQuery query) {
        Comparator<Sequenced> order = Comparator.comparing((Sequenced s) -> s.statement().getTimestamp())
                .thenComparingLong(Sequenced::sequence);
        List<Statement> matching = statements.stream()
                .map(stored -> new Sequenced(stored.sequence(), fromJson(stored.json())))
                .filter(s -> matches(s.statement(), query))
                .sorted(query.isAscending() ? order : order.reversed())
                .map(Sequenced::statement)
                .toList();

        PagedStatementSpliterator spliterator = new PagedStatementSpliterator(more -> {
            int from = more == null ? 0 : Integer.parseInt(more);
            int to = Math.min(from + PAGE_SIZE, matching.size());
            String next = to < matching.size() ? String.valueOf(to) : null;
            return new PagedStatementSpliterator.StatementPage(new ArrayList<>(matching.subList(from, to)), next);
        }, query.getLimit(), query.getUntil());
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public Optional<Blob> getBlob(BlobKey key) {
        StoredBlob stored = blobs.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(new Blob(stored.content().clone(), stored.etag()));
    }

    @Override
    public void putBlob(BlobKey key, byte[] content) {
        blobs.put(key, new StoredBlob(content.clone(), nextEtag()));
    }

    @Override
    public void putBlob(BlobKey key, byte[] content, String expectedEtag) {
        blobs.compute(key, (k, current) -> {
            if (expectedEtag == null && current != null) {
                throw new ConflictException("Blob already exists: " + k.key() + " of " + k.agent());
            }
            if (expectedEtag != null && (current == null || !expectedEtag.equals(current.etag()))) {
                throw new ConflictException("Blob changed since it was read: " + k.key() + " of " + k.agent());
            }
            return new StoredBlob(content.clone(), nextEtag());
        });
    }

    @Override
    public void ping() {
        // always reachable
    }

    /**
     * Drop every statement and blob.
     */
    public void reset() {
        statements.clear();
        statementsById.clear();
        blobs.clear();
    }

    public int statementCount() {
        return statements.size();
    }

    /**
     * Adds the batch as a whole or not at all. A statement whose id is already stored is skipped when its
     * content matches the stored one apart from the timestamp, and rejected otherwise.
     */
    private synchronized void store(List<Statement> batch) {
        Map<String, String> fresh = new LinkedHashMap<>();
        for (Statement statement : batch) {
            String json = toJson(statement);
            String existing = statementsById.containsKey(statement.getId())
                    ? statementsById.get(statement.getId())
                    : fresh.get(statement.getId());
            if (existing == null) {
                fresh.put(statement.getId(), json);
            } else if (sameContent(existing, json)) {
                log.debug("Statement {} is already stored, ignoring the repeat", statement.getId());
            } else {
                throw new ConflictException("Statement " + statement.getId() + " already exists with different content");
            }
        }
        fresh.forEach((id, json) -> {
            statements.add(new StoredStatement(statementSequence.incrementAndGet(), json));
            statementsById.put(id, json);
        });
    }

    private boolean sameContent(String storedJson, String incomingJson) {
        try {
            JsonNode stored = objectMapper.readTree(storedJson);
            JsonNode incoming = objectMapper.readTree(incomingJson);
            if (stored.isObject() && incoming.isObject()) {
                ((ObjectNode) stored).remove("timestamp");
                ((ObjectNode) incoming).remove("timestamp");
            }
            return stored.equals(incoming);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt statement in memory store", e);
        }
    }

    private boolean matches(Statement statement, StatementQuery query) {
        if (query.getAgent() != null && !involvesAgent(statement, query.getAgent(), query.isRelatedAgents())) {
            return false;
        }
        if (query.getVerb() != null && (statement.getVerb() == null
                || !query.getVerb().equals(statement.getVerb().getId()))) {
            return false;
        }
        if (query.getActivity() != null
                && !involvesActivity(statement, query.getActivity(), query.isRelatedActivities())) {
            return false;
        }
        if (query.getSince() != null && statement.getTimestamp().isBefore(query.getSince())) {
            return false;
        }
        return query.getUntil() == null || statement.getTimestamp().isBefore(query.getUntil());
    }

    private static boolean involvesAgent(Statement statement, String agent, boolean related) {
        String mbox = Actor.ofEmail(agent).getMbox();
        if (statement.getActor() != null && mbox.equals(statement.getActor().getMbox())) {
            return true;
        }
        if (!related || statement.getContext() == null || statement.getContext().getTeam() == null) {
            return false;
        }
        return statement.getContext().getTeam().stream().anyMatch(member -> mbox.equals(member.getMbox()));
    }

    private static boolean involvesActivity(Statement statement, String activityId, boolean related) {
        if (statement.getObject() != null && activityId.equals(statement.getObject().getId())) {
            return true;
        }
        if (!related || statement.getContext() == null || statement.getContext().getContextActivities() == null) {
            return false;
        }
        StatementContext.ContextActivities activities = statement.getContext().getContextActivities();
        return Stream.of(activities.getParent(), activities.getGrouping(), activities.getOther())
                .filter(list -> list != null)
                .flatMap(List::stream)
                .map(Activity::getId)
                .anyMatch(activityId::equals);
    }

    private String nextEtag() {
        return "\"" + etagSequence.incrementAndGet() + "\"";
    }

    private String toJson(Statement statement) {
        try {
            return objectMapper.writeValueAsString(statement);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot serialize statement: " + e.getOriginalMessage());
        }
    }

    private Statement fromJson(String json) {
        try {
            return objectMapper.readValue(json, Statement.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt statement in memory store", e);
        }
    }

    private record StoredBlob(byte[] content, String etag) {
    }

    private record StoredStatement(long sequence, String json) {
    }

    private record Sequenced(long sequence, Statement statement) {
    }
}
