package hk.edu.hulab.portal.backend.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Full address of a state document: which kind, whose agent the blob lives under, and its id.
 * The same id under a different owner is a different (usually absent) document.
 */
public record DocumentKey<T extends StateDocument>(DocumentType<T> type, String ownerAgent, String id) {

    public DocumentKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(ownerAgent, "ownerAgent");
        Objects.requireNonNull(id, "id");
        ownerAgent = ownerAgent.trim().toLowerCase(Locale.ROOT);
    }

    public static <T extends StateDocument> DocumentKey<T> of(DocumentType<T> type, String ownerAgent, String id) {
        return new DocumentKey<>(type, ownerAgent, id);
    }

    public String address() {
        return type.address(id);
    }
}
