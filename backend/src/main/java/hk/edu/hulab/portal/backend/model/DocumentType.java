package hk.edu.hulab.portal.backend.model;

import java.util.Objects;
import java.util.Set;

/**
 * Describes how one kind of document is addressed in the store.
 *
 * @param name           path segment of the entity address, e.g. {@code project}
 * @param stateId        state id of the activity-state blob holding the document
 * @param activityType   activity type IRI used on statements about the document
 * @param documentClass  Java type the blob is read into
 * @param immutableFields fields, beyond the common ones, that may not change after creation
 */
public record DocumentType<T extends StateDocument>(String name, String stateId, String activityType,
        Class<T> documentClass, Set<String> immutableFields) {

    public static final DocumentType<ResearchProject> PROJECT = new DocumentType<>("project", "project-data",
            Vocabulary.TYPE_RESEARCH_PROJECT, ResearchProject.class, Set.of());

    public static final DocumentType<Invitation> INVITATION = new DocumentType<>("invitation", "invitation-data",
            Vocabulary.TYPE_INVITATION, Invitation.class,
            Set.of("invitationBatchId", "projectId", "projectOwner", "inviterEmail", "inviteeEmail", "expiresAt"));

    public static final DocumentType<Comment> COMMENT = new DocumentType<>("comment", "comment-data",
            Vocabulary.TYPE_COMMENT, Comment.class, Set.of("targetType", "targetId", "author"));

    public static final DocumentType<ShareRecord> SHARE = new DocumentType<>("share", "share-data",
            Vocabulary.TYPE_SHARE, ShareRecord.class, Set.of("resourceType", "resourceId", "sharedBy"));

    public DocumentType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(stateId, "stateId");
        Objects.requireNonNull(documentClass, "documentClass");
        immutableFields = immutableFields == null ? Set.of() : Set.copyOf(immutableFields);
    }

    public String address(String id) {
        return Vocabulary.address(name, id);
    }

    /**
     * Prefix shared by the addresses of every document of this type.
     */
    public String addressPrefix() {
        return Vocabulary.BASE + "/" + name + "/";
    }

    public Activity activity(String id, String displayName) {
        return Activity.of(address(id), activityType, displayName != null ? displayName : name + " " + id);
    }
}
