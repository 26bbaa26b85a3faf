package hk.edu.hulab.portal.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import hk.edu.hulab.portal.backend.exception.ConflictException;
import hk.edu.hulab.portal.backend.exception.NotFoundException;
import hk.edu.hulab.portal.backend.exception.UpstreamException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.lrs.Blob;
import hk.edu.hulab.portal.backend.lrs.BlobKey;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.DocumentKey;
import hk.edu.hulab.portal.backend.model.DocumentStatus;
import hk.edu.hulab.portal.backend.model.DocumentType;
import hk.edu.hulab.portal.backend.model.ExtensionKey;
import hk.edu.hulab.portal.backend.model.Extensions;
import hk.edu.hulab.portal.backend.model.StateDocument;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import hk.edu.hulab.portal.backend.model.Verb;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Create/read/update/soft-delete for documents kept in activity-state blobs. Every write is
 * followed by a statement announcing it, which is what makes the document discoverable later.
 * <p>
 * Updates are read-modify-write without a lock: two unconditional writers racing on the same document
 * both succeed and the later write wins. Callers that cannot accept that pass an expected version
 * (or use {@link #modifyIfUnchanged}) and get a {@link ConflictException} instead.
 * <p>
 * No authorization happens here; services check ownership and roles before calling in.
 */
@Service
public class DocumentMapper {

    private static final Logger log = LoggerFactory.getLogger(DocumentMapper.class);

    private static final Set<String> COMMON_IMMUTABLE_FIELDS = Set.of("id", "createdBy", "createdAt");
    private static final Set<String> MAPPER_OWNED_FIELDS = Set.of("version", "updatedAt", "deletedAt", "deletedBy");
    private static final String STATUS_FIELD = "status";

    private final EventLogClient eventLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DocumentMapper(EventLogClient eventLog, ObjectMapper objectMapper, Clock clock) {
        this.eventLog = eventLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Store a new document under {@code ownerAgent} and announce it with a {@code created} statement.
     * If the blob is written but the statement fails, the error propagates and the blob stays behind
     * unannounced.
     */
    public <T extends StateDocument> T create(String actingAgent, String ownerAgent, DocumentType<T> type, T entity) {
        if (entity == null) {
            throw new ValidationException("Cannot create an empty " + type.name());
        }
        requireAgent(actingAgent, "actingAgent");
        requireAgent(ownerAgent, "ownerAgent");

        Instant now = clock.instant();
        if (entity.getId() == null || entity.getId().isBlank()) {
            entity.setId(UUID.randomUUID().toString());
        }
        if (entity.getCreatedBy() == null || entity.getCreatedBy().isBlank()) {
            entity.setCreatedBy(Actor.ofEmail(actingAgent).email());
        }
        entity.setVersion(1);
        entity.setStatus(DocumentStatus.ACTIVE);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        entity.setDeletedAt(null);
        entity.setDeletedBy(null);

        DocumentKey<T> key = DocumentKey.of(type, ownerAgent, entity.getId());
        // create-only: a preset id that already exists is a conflict, not an overwrite
        eventLog.putBlob(blobKey(key), serialize(entity), null);
        announce(Vocabulary.CREATED, actingAgent, key, entity);

        log.info("Created {} {} for {}", type.name(), entity.getId(), key.ownerAgent());
        return entity;
    }

    public <T extends StateDocument> Optional<T> find(DocumentKey<T> key) {
        return load(key).map(Loaded::document);
    }

    public <T extends StateDocument> T read(DocumentKey<T> key) {
        return find(key).orElseThrow(() -> NotFoundException.of(key.type().name(), key.id()));
    }

    /**
     * Shallow-merge {@code patch} into the stored document. Last writer wins.
     */
    public <T extends StateDocument> T update(DocumentKey<T> key, String actingAgent, Map<String, Object> patch) {
        return update(key, actingAgent, patch, null);
    }

    /**
     * Shallow-merge {@code patch} into the stored document, provided it is still at
     * {@code expectedVersion}. A null expected version behaves like {@link #update(DocumentKey, String, Map)}.
     *
     * @throws ConflictException if the stored version differs, or another writer got in between read and write
     */
    public <T extends StateDocument> T update(DocumentKey<T> key, String actingAgent, Map<String, Object> patch,
            Integer expectedVersion) {
        requireAgent(actingAgent, "actingAgent");
        Loaded<T> current = loadLive(key);
        if (expectedVersion != null && !expectedVersion.equals(current.document().getVersion())) {
            throw new ConflictException(key.type().name() + " " + key.id() + " is at version "
                    + current.document().getVersion() + ", expected " + expectedVersion);
        }
        T merged = merge(key.type(), current.document(), patch == null ? Map.of() : patch);
        return write(key, current, merged, actingAgent, Vocabulary.UPDATED, expectedVersion != null);
    }

    /**
     * Typed read-modify-write. The mutator works on a copy; bookkeeping fields it changes are reset.
     * Last writer wins.
     */
    public <T extends StateDocument> T modify(DocumentKey<T> key, String actingAgent, UnaryOperator<T> mutator) {
        return modify(key, actingAgent, mutator, false);
    }

    /**
     * As {@link #modify}, but the write only succeeds if nobody else wrote the blob since it was read.
     */
    public <T extends StateDocument> T modifyIfUnchanged(DocumentKey<T> key, String actingAgent,
            UnaryOperator<T> mutator) {
        return modify(key, actingAgent, mutator, true);
    }

    /**
     * Mark the document deleted. Repeating the call keeps it deleted but still bumps the version.
     * The blob itself is never removed.
     */
    public <T extends StateDocument> T softDelete(DocumentKey<T> key, String actingAgent) {
        requireAgent(actingAgent, "actingAgent");
        Loaded<T> current = load(key).orElseThrow(() -> NotFoundException.of(key.type().name(), key.id()));
        T next = copy(key.type(), current.document());
        if (!next.isDeleted()) {
            next.setStatus(DocumentStatus.DELETED);
            next.setDeletedAt(clock.instant());
            next.setDeletedBy(Actor.ofEmail(actingAgent).email());
        }
        T deleted = bumpAndWrite(key, current, next, false);
        announce(Vocabulary.DELETED, actingAgent, key, deleted);
        log.info("Deleted {} {} of {} (version {})", key.type().name(), key.id(), key.ownerAgent(),
                deleted.getVersion());
        return deleted;
    }

    private <T extends StateDocument> T modify(DocumentKey<T> key, String actingAgent, UnaryOperator<T> mutator,
            boolean conditional) {
        requireAgent(actingAgent, "actingAgent");
        Loaded<T> current = loadLive(key);
        T changed = mutator.apply(copy(key.type(), current.document()));
        if (changed == null) {
            throw new ValidationException("Modification of " + key.type().name() + " produced no document");
        }
        JsonNode before = objectMapper.valueToTree(current.document());
        JsonNode after = objectMapper.valueToTree(changed);
        for (String field : immutableFields(key.type())) {
            if (!sameValue(before.get(field), after.get(field))) {
                throw new ValidationException("Field '" + field + "' of " + key.type().name() + " cannot be changed");
            }
        }
        if (changed.isDeleted()) {
            throw new ValidationException("Use delete to remove a " + key.type().name());
        }
        return write(key, current, changed, actingAgent, Vocabulary.UPDATED, conditional);
    }

    private <T extends StateDocument> T write(DocumentKey<T> key, Loaded<T> current, T next, String actingAgent,
            Verb verb, boolean conditional) {
        T written = bumpAndWrite(key, current, next, conditional);
        announce(verb, actingAgent, key, written);
        log.info("Updated {} {} of {} to version {}", key.type().name(), key.id(), key.ownerAgent(),
                written.getVersion());
        return written;
    }

    private <T extends StateDocument> T bumpAndWrite(DocumentKey<T> key, Loaded<T> current, T next,
            boolean conditional) {
        T stored = current.document();
        next.setId(stored.getId());
        next.setCreatedBy(stored.getCreatedBy());
        next.setCreatedAt(stored.getCreatedAt());
        if (!next.isDeleted()) {
            next.setDeletedAt(stored.getDeletedAt());
            next.setDeletedBy(stored.getDeletedBy());
        }
        next.setVersion(stored.getVersion() == null ? 1 : stored.getVersion() + 1);
        next.setUpdatedAt(clock.instant());

        if (conditional) {
            eventLog.putBlob(blobKey(key), serialize(next), current.etag());
        } else {
            eventLog.putBlob(blobKey(key), serialize(next));
        }
        return next;
    }

    private <T extends StateDocument> T merge(DocumentType<T> type, T current, Map<String, Object> patch) {
        ObjectNode node = objectMapper.valueToTree(current);
        Set<String> immutable = immutableFields(type);
        patch.forEach((field, value) -> {
            if (MAPPER_OWNED_FIELDS.contains(field)) {
                log.debug("Ignoring mapper-owned field '{}' in {} patch", field, type.name());
                return;
            }
            JsonNode patchValue = value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
            if (immutable.contains(field)) {
                if (!sameValue(node.get(field), patchValue)) {
                    throw new ValidationException("Field '" + field + "' of " + type.name() + " cannot be changed");
                }
                return;
            }
            if (STATUS_FIELD.equals(field)) {
                DocumentStatus status = patchStatus(type, patchValue);
                if (status == DocumentStatus.DELETED) {
                    throw new ValidationException("Use delete to remove a " + type.name());
                }
                patchValue = TextNode.valueOf(status.wireValue());
            }
            node.set(field, patchValue);
        });
        try {
            return objectMapper.treeToValue(node, type.documentClass());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid " + type.name() + " patch: " + e.getOriginalMessage());
        }
    }

    private static DocumentStatus patchStatus(DocumentType<?> type, JsonNode value) {
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ValidationException("Status of " + type.name() + " must be one of: active, completed, archived");
        }
        try {
            return DocumentStatus.fromWire(value.asText());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + type.name() + " status '" + value.asText() + "'");
        }
    }

    private <T extends StateDocument> Loaded<T> loadLive(DocumentKey<T> key) {
        Loaded<T> loaded = load(key).orElseThrow(() -> NotFoundException.of(key.type().name(), key.id()));
        if (loaded.document().isDeleted()) {
            throw NotFoundException.of(key.type().name(), key.id());
        }
        return loaded;
    }

    private <T extends StateDocument> Optional<Loaded<T>> load(DocumentKey<T> key) {
        Optional<Blob> blob = eventLog.getBlob(blobKey(key));
        if (blob.isEmpty()) {
            return Optional.empty();
        }
        try {
            T document = objectMapper.readValue(blob.get().content(), key.type().documentClass());
            return Optional.of(new Loaded<>(document, blob.get().etag()));
        } catch (IOException e) {
            log.error("Unreadable {} blob {} of {}: {}", key.type().name(), key.id(), key.ownerAgent(),
                    e.getMessage());
            throw new UpstreamException("Stored " + key.type().name() + " " + key.id() + " is unreadable", 200, false);
        }
    }

    private void announce(Verb verb, String actingAgent, DocumentKey<?> key, StateDocument document) {
        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(actingAgent))
                .verb(verb)
                .object(key.type().activity(key.id(), document.displayName()))
                .context(StatementContext.builder()
                        .platform(Vocabulary.PLATFORM)
                        .language(Vocabulary.LANGUAGE)
                        .extensions(Extensions.builder()
                                .put(ExtensionKey.OWNER, key.ownerAgent())
                                .build())
                        .build())
                .build());
    }

    private <T extends StateDocument> T copy(DocumentType<T> type, T document) {
        return objectMapper.convertValue(objectMapper.valueToTree(document), type.documentClass());
    }

    private byte[] serialize(StateDocument document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot serialize document " + document.getId() + ": "
                    + e.getOriginalMessage());
        }
    }

    private static Set<String> immutableFields(DocumentType<?> type) {
        if (type.immutableFields().isEmpty()) {
            return COMMON_IMMUTABLE_FIELDS;
        }
        Set<String> all = new HashSet<>(COMMON_IMMUTABLE_FIELDS);
        all.addAll(type.immutableFields());
        return all;
    }

    private static boolean sameValue(JsonNode stored, JsonNode candidate) {
        boolean storedEmpty = stored == null || stored.isNull();
        boolean candidateEmpty = candidate == null || candidate.isNull();
        if (storedEmpty || candidateEmpty) {
            return storedEmpty == candidateEmpty;
        }
        return Objects.equals(stored, candidate);
    }

    private static void requireAgent(String agent, String name) {
        if (agent == null || agent.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }

    static <T extends StateDocument> BlobKey blobKey(DocumentKey<T> key) {
        return BlobKey.state(key.ownerAgent(), key.address(), key.type().stateId());
    }

    private record Loaded<T>(T document, String etag) {
    }
}
