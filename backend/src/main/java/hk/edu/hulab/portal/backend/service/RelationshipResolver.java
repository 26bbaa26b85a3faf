package hk.edu.hulab.portal.backend.service;

import hk.edu.hulab.portal.backend.analytics.TimeRange;
import hk.edu.hulab.portal.backend.dto.CollaborationActivity;
import hk.edu.hulab.portal.backend.dto.CollaboratorEntry;
import hk.edu.hulab.portal.backend.dto.PagedResult;
import hk.edu.hulab.portal.backend.dto.SharedResource;
import hk.edu.hulab.portal.backend.dto.Team;
import hk.edu.hulab.portal.backend.dto.TeamActivity;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import hk.edu.hulab.portal.backend.lrs.StatementQuery;
import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Collaborator;
import hk.edu.hulab.portal.backend.model.Comment;
import hk.edu.hulab.portal.backend.model.DocumentKey;
import hk.edu.hulab.portal.backend.model.DocumentStatus;
import hk.edu.hulab.portal.backend.model.DocumentType;
import hk.edu.hulab.portal.backend.model.ExtensionKey;
import hk.edu.hulab.portal.backend.model.Invitation;
import hk.edu.hulab.portal.backend.model.ResearchProject;
import hk.edu.hulab.portal.backend.model.ShareRecord;
import hk.edu.hulab.portal.backend.model.StateDocument;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Rebuilds relational views (ownership, teams, shares, threads, invitations) that the store cannot
 * answer directly. Every view is a scan over statements followed by blob dereferences, so results are
 * only as fresh as the statements announcing them.
 * <p>
 * A statement whose document cannot be read is logged and left out; the rest of the view is still
 * returned.
 */
@Service
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    private static final String PROJECT_SEGMENT = "/project/";
    private static final int RECENT_TEAM_ACTIVITIES = 5;

    private final EventLogClient eventLog;
    private final DocumentMapper documentMapper;
    private final int scanLimit;

    public RelationshipResolver(EventLogClient eventLog,
                                DocumentMapper documentMapper,
                                @Value("${portal.resolver.scan-limit:1000}") int scanLimit) {
        this.eventLog = eventLog;
        this.documentMapper = documentMapper;
        this.scanLimit = scanLimit;
    }

    /**
     * Find whose agent a document lives under, from the statement that announced its creation.
     */
    public <T extends StateDocument> Optional<DocumentKey<T>> locate(DocumentType<T> type, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        StatementQuery query = StatementQuery.builder()
                .verb(Vocabulary.CREATED)
                .activity(type.address(id))
                .ascending(true)
                .limit(1)
                .build();
        try (Stream<Statement> statements = eventLog.query(query)) {
            return statements.findFirst()
                    .map(RelationshipResolver::ownerOf)
                    .filter(Objects::nonNull)
                    .map(owner -> DocumentKey.of(type, owner, id));
        }
    }

    /**
     * Live documents of {@code type} that {@code agent} created for itself, most recently active first.
     * Activity is the newest statement about the document, its own writes as well as comments and
     * collaborations on it.
     *
     * @param statusFilter only documents in this status, null for any live status
     */
    public <T extends StateDocument> PagedResult<T> listOwned(String agent, DocumentType<T> type,
            DocumentStatus statusFilter, int offset, int limit) {
        String owner = email(agent);
        StatementQuery query = StatementQuery.builder()
                .agent(owner)
                .verb(Vocabulary.CREATED)
                .limit(scanLimit + 1)
                .build();

        Set<String> ids = new LinkedHashSet<>();
        scan(query, "listOwned " + type.name() + " of " + owner).stream()
                .filter(s -> owner.equals(s.actorEmail()))
                .filter(s -> s.getObject() != null && s.getObject().getId() != null
                        && s.getObject().getId().startsWith(type.addressPrefix()))
                .filter(s -> owner.equals(ownerOf(s)))
                .forEach(s -> ids.add(s.getObject().tail()));

        List<T> documents = new ArrayList<>();
        Map<String, Instant> lastActivity = new HashMap<>();
        for (String id : ids) {
            dereference(DocumentKey.of(type, owner, id))
                    .filter(d -> !d.isDeleted())
                    .filter(d -> statusFilter == null || statusFilter == d.getStatus())
                    .ifPresent(d -> {
                        documents.add(d);
                        lastActivity.put(id, latestActivity(type.address(id)).orElse(d.getUpdatedAt()));
                    });
        }
        documents.sort(Comparator.comparing((T d) -> lastActivity.get(d.getId()),
                Comparator.nullsLast(Comparator.reverseOrder())));
        log.debug("listOwned {} {}: {} candidates, {} live", type.name(), owner, ids.size(), documents.size());
        return PagedResult.slice(documents, offset, limit);
    }

    /**
     * Teams the agent worked in during {@code range}, grouped by the member set of each collaboration.
     */
    public List<Team> resolveTeams(String agent, TimeRange range) {
        StatementQuery query = StatementQuery.builder()
                .agent(email(agent))
                .verb(Vocabulary.COLLABORATED)
                .relatedAgents(true)
                .since(range != null ? range.since() : null)
                .until(range != null ? range.until() : null)
                .limit(scanLimit + 1)
                .build();

        Map<String, Team> teams = new LinkedHashMap<>();
        for (Statement statement : scan(query, "teams of " + email(agent))) {
            List<Actor> members = statement.getContext() != null ? statement.getContext().getTeam() : null;
            if (members == null || members.isEmpty()) {
                continue;
            }
            Set<String> mboxes = new TreeSet<>();
            members.stream().map(Actor::getMbox).filter(Objects::nonNull).forEach(mboxes::add);
            if (mboxes.isEmpty()) {
                continue;
            }
            String memberKey = String.join(",", mboxes);
            Team team = teams.computeIfAbsent(memberKey, key -> Team.builder()
                    .id(teamId(key))
                    .memberKey(key)
                    .members(mboxes.stream().map(m -> Actor.builder().mbox(m).build().email()).toList())
                    .build());
            accumulate(team, statement);
        }

        List<Team> result = new ArrayList<>(teams.values());
        result.sort(Comparator.comparing(Team::getLastActivity, Comparator.nullsLast(Comparator.reverseOrder())));
        return result;
    }

    /**
     * Resources other agents shared with {@code agent}, newest first.
     *
     * @param resourceTypeFilter e.g. {@code file} or {@code project}; null for every type
     */
    public List<SharedResource> resolveSharedWith(String agent, String resourceTypeFilter) {
        String recipient = email(agent);
        StatementQuery query = StatementQuery.builder()
                .verb(Vocabulary.SHARED)
                .limit(scanLimit + 1)
                .build();
        List<Statement> matching = scan(query, "shares with " + recipient).stream()
                .filter(s -> s.contextExtensions().getStringList(ExtensionKey.RECIPIENTS).stream()
                        .anyMatch(r -> r.equalsIgnoreCase(recipient)))
                .toList();
        return toSharedResources(matching, resourceTypeFilter);
    }

    /**
     * Resources {@code agent} shared with others, newest first.
     */
    public List<SharedResource> resolveSharedBy(String agent, String resourceTypeFilter) {
        String sharer = email(agent);
        StatementQuery query = StatementQuery.builder()
                .agent(sharer)
                .verb(Vocabulary.SHARED)
                .limit(scanLimit + 1)
                .build();
        List<Statement> matching = scan(query, "shares by " + sharer).stream()
                .filter(s -> sharer.equals(s.actorEmail()))
                .toList();
        return toSharedResources(matching, resourceTypeFilter);
    }

    /**
     * Live comments on a target, oldest first.
     */
    public PagedResult<Comment> resolveCommentThread(String targetType, String targetId, int offset, int limit) {
        StatementQuery query = StatementQuery.builder()
                .verb(Vocabulary.COMMENTED)
                .activity(Vocabulary.address(targetType, targetId))
                .limit(scanLimit + 1)
                .build();

        Map<String, Comment> comments = new LinkedHashMap<>();
        for (Statement statement : scan(query, "comments on " + targetType + " " + targetId)) {
            String commentId = backReferenceId(statement, DocumentType.COMMENT);
            if (commentId == null || comments.containsKey(commentId) || statement.actorEmail() == null) {
                continue;
            }
            dereference(DocumentKey.of(DocumentType.COMMENT, statement.actorEmail(), commentId))
                    .filter(c -> !c.isDeleted())
                    .ifPresent(c -> comments.put(commentId, c));
        }

        List<Comment> thread = new ArrayList<>(comments.values());
        thread.sort(Comparator.comparing(Comment::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return PagedResult.slice(thread, offset, limit);
    }

    /**
     * Invitations addressed to or sent by {@code agent}, newest first.
     *
     * @param responseFilter {@code pending}, {@code accepted} or {@code declined}; null or {@code all} for any
     */
    public List<Invitation> resolveInvitations(String agent, InvitationDirection direction, String responseFilter) {
        String me = email(agent);
        InvitationDirection effective = direction != null ? direction : InvitationDirection.RECEIVED;
        Map<String, Invitation> found = new LinkedHashMap<>();

        if (effective.includesReceived()) {
            StatementQuery query = StatementQuery.builder()
                    .verb(Vocabulary.INVITED)
                    .limit(scanLimit + 1)
                    .build();
            scan(query, "invitations to " + me).stream()
                    .filter(s -> me.equalsIgnoreCase(s.contextExtensions().getString(ExtensionKey.INVITEE)))
                    .forEach(s -> collectInvitation(found, s, me));
        }
        if (effective.includesSent()) {
            StatementQuery query = StatementQuery.builder()
                    .agent(me)
                    .verb(Vocabulary.INVITED)
                    .limit(scanLimit + 1)
                    .build();
            scan(query, "invitations from " + me).stream()
                    .filter(s -> me.equals(s.actorEmail()))
                    .forEach(s -> {
                        String invitee = s.contextExtensions().getString(ExtensionKey.INVITEE);
                        if (invitee != null) {
                            collectInvitation(found, s, invitee);
                        }
                    });
        }

        boolean anyResponse = responseFilter == null || responseFilter.isBlank() || "all".equalsIgnoreCase(responseFilter);
        List<Invitation> result = new ArrayList<>(found.values().stream()
                .filter(i -> anyResponse || responseFilter.equalsIgnoreCase(i.getResponse()))
                .toList());
        result.sort(Comparator.comparing(Invitation::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return result;
    }

    /**
     * Newest statements about a project and its sub-activities, or, without a project, the collaboration
     * statements the agent made or was named in.
     *
     * @param since only statements at or after this instant; null for no lower bound
     */
    public List<CollaborationActivity> resolveActivityFeed(String agent, String projectId, Instant since, int limit) {
        StatementQuery.StatementQueryBuilder query = StatementQuery.builder()
                .since(since)
                .limit(limit);
        if (projectId != null && !projectId.isBlank()) {
            query.activity(DocumentType.PROJECT.address(projectId)).relatedActivities(true);
        } else {
            query.agent(email(agent)).relatedAgents(true).verb(Vocabulary.COLLABORATED);
        }
        try (Stream<Statement> statements = eventLog.query(query.build())) {
            return statements.map(CollaborationActivity::of).toList();
        }
    }

    /**
     * The owner and listed collaborators of a project, followed by agents only seen on its collaboration
     * statements. Interaction counts come from those statements.
     */
    public List<CollaboratorEntry> resolveCollaborators(DocumentKey<ResearchProject> projectKey) {
        ResearchProject project = documentMapper.read(projectKey);
        Map<String, CollaboratorEntry> entries = new LinkedHashMap<>();

        String owner = project.getCreatedBy() != null ? email(project.getCreatedBy()) : projectKey.ownerAgent();
        entries.put(owner, CollaboratorEntry.builder()
                .email(owner)
                .role("owner")
                .listed(true)
                .build());
        if (project.getCollaborators() != null) {
            for (Collaborator collaborator : project.getCollaborators()) {
                if (collaborator.getEmail() == null) {
                    continue;
                }
                String email = email(collaborator.getEmail());
                entries.putIfAbsent(email, CollaboratorEntry.builder()
                        .email(email)
                        .name(collaborator.getName())
                        .role(collaborator.getRole())
                        .listed(true)
                        .build());
            }
        }

        StatementQuery query = StatementQuery.builder()
                .verb(Vocabulary.COLLABORATED)
                .activity(projectKey.address())
                .limit(scanLimit + 1)
                .build();
        for (Statement statement : scan(query, "collaborators of project " + projectKey.id())) {
            Set<Actor> involved = new LinkedHashSet<>();
            if (statement.getActor() != null) {
                involved.add(statement.getActor());
            }
            if (statement.getContext() != null && statement.getContext().getTeam() != null) {
                involved.addAll(statement.getContext().getTeam());
            }
            Set<String> counted = new LinkedHashSet<>();
            for (Actor actor : involved) {
                String email = actor.email();
                if (email == null || !counted.add(email)) {
                    continue;
                }
                CollaboratorEntry entry = entries.computeIfAbsent(email, e -> CollaboratorEntry.builder()
                        .email(e)
                        .name(actor.getName())
                        .listed(false)
                        .build());
                entry.setInteractions(entry.getInteractions() + 1);
                Instant at = statement.getTimestamp();
                if (at != null && (entry.getLastActivity() == null || at.isAfter(entry.getLastActivity()))) {
                    entry.setLastActivity(at);
                }
            }
        }

        List<CollaboratorEntry> listed = entries.values().stream().filter(CollaboratorEntry::isListed).toList();
        List<CollaboratorEntry> seen = entries.values().stream()
                .filter(e -> !e.isListed())
                .sorted(Comparator.comparingLong(CollaboratorEntry::getInteractions).reversed())
                .toList();
        List<CollaboratorEntry> result = new ArrayList<>(listed);
        result.addAll(seen);
        return result;
    }

    private Optional<Instant> latestActivity(String address) {
        StatementQuery query = StatementQuery.builder()
                .activity(address)
                .relatedActivities(true)
                .limit(1)
                .build();
        try (Stream<Statement> statements = eventLog.query(query)) {
            return statements.findFirst().map(Statement::getTimestamp);
        }
    }

    /**
     * The newest {@code scanLimit} statements matching the query. Older statements beyond the cap are left
     * out of the view with a warning.
     */
    private List<Statement> scan(StatementQuery query, String view) {
        List<Statement> scanned;
        try (Stream<Statement> statements = eventLog.query(query)) {
            scanned = statements.limit(scanLimit + 1L).toList();
        }
        if (scanned.size() > scanLimit) {
            log.warn("Scan for {} hit the limit of {} statements, older statements are left out", view, scanLimit);
            return scanned.subList(0, scanLimit);
        }
        return scanned;
    }

    private List<SharedResource> toSharedResources(List<Statement> statements, String resourceTypeFilter) {
        List<SharedResource> resources = new ArrayList<>();
        for (Statement statement : statements) {
            String resourceType = resourceType(statement.getObject());
            if (resourceTypeFilter != null && !resourceTypeFilter.isBlank()
                    && !resourceTypeFilter.equalsIgnoreCase(resourceType)) {
                continue;
            }
            SharedResource.SharedResourceBuilder summary = SharedResource.builder()
                    .resourceType(resourceType)
                    .resourceId(statement.getObject() != null ? statement.getObject().tail() : null)
                    .resourceName(statement.getObject() != null ? statement.getObject().displayName() : null)
                    .sharedBy(statement.actorEmail())
                    .recipients(statement.contextExtensions().getStringList(ExtensionKey.RECIPIENTS))
                    .permissions(permissionsOf(statement))
                    .sharedAt(statement.getTimestamp());

            String shareId = backReferenceId(statement, DocumentType.SHARE);
            if (shareId == null || statement.actorEmail() == null) {
                resources.add(summary.build());
                continue;
            }
            Optional<ShareRecord> record;
            try {
                record = documentMapper.find(DocumentKey.of(DocumentType.SHARE, statement.actorEmail(), shareId));
            } catch (RuntimeException e) {
                log.warn("Skipping share {} of {}: {}", shareId, statement.actorEmail(), e.getMessage());
                continue;
            }
            if (record.isPresent() && record.get().isDeleted()) {
                continue;
            }
            summary.shareId(shareId);
            record.ifPresent(r -> summary
                    .shareRecord(r)
                    .message(r.getMessage())
                    .recipients(r.getRecipients())
                    .permissions(r.getPermissions()));
            resources.add(summary.build());
        }
        resources.sort(Comparator.comparing(SharedResource::getSharedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return resources;
    }

    private void collectInvitation(Map<String, Invitation> found, Statement statement, String inviteeAgent) {
        String invitationId = backReferenceId(statement, DocumentType.INVITATION);
        if (invitationId == null || found.containsKey(invitationId)) {
            return;
        }
        dereference(DocumentKey.of(DocumentType.INVITATION, inviteeAgent, invitationId))
                .filter(i -> !i.isDeleted())
                .ifPresent(i -> found.put(invitationId, i));
    }

    private <T extends StateDocument> Optional<T> dereference(DocumentKey<T> key) {
        try {
            return documentMapper.find(key);
        } catch (RuntimeException e) {
            log.warn("Skipping {} {} of {}: {}", key.type().name(), key.id(), key.ownerAgent(), e.getMessage());
            return Optional.empty();
        }
    }

    private static void accumulate(Team team, Statement statement) {
        team.setInteractionCount(team.getInteractionCount() + 1);
        String objectId = statement.getObject() != null ? statement.getObject().getId() : null;
        if (objectId != null && objectId.contains(PROJECT_SEGMENT)) {
            String projectId = objectId.substring(objectId.indexOf(PROJECT_SEGMENT) + PROJECT_SEGMENT.length());
            if (!projectId.isEmpty() && !team.getProjects().contains(projectId)) {
                team.getProjects().add(projectId);
            }
        }
        Instant at = statement.getTimestamp();
        if (at != null && (team.getLastActivity() == null || at.isAfter(team.getLastActivity()))) {
            team.setLastActivity(at);
        }
        String action = statement.contextExtensions().getString(ExtensionKey.COLLABORATION_ACTION);
        team.getRecentActivities().add(new TeamActivity(
                statement.actorEmail(),
                action != null ? action : statement.verbDisplay(),
                statement.getObject() != null ? statement.getObject().displayName() : null,
                at));
        team.getRecentActivities().sort(Comparator.comparing(TeamActivity::timestamp,
                Comparator.nullsLast(Comparator.reverseOrder())));
        if (team.getRecentActivities().size() > RECENT_TEAM_ACTIVITIES) {
            team.getRecentActivities().subList(RECENT_TEAM_ACTIVITIES, team.getRecentActivities().size()).clear();
        }
    }

    /**
     * Same member key, same id.
     */
    static String teamId(String memberKey) {
        return UUID.nameUUIDFromBytes(memberKey.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String backReferenceId(Statement statement, DocumentType<?> type) {
        return statement.backReference()
                .map(Activity::getId)
                .filter(id -> id.startsWith(type.addressPrefix()))
                .map(id -> id.substring(type.addressPrefix().length()))
                .filter(id -> !id.isEmpty())
                .orElse(null);
    }

    private static String ownerOf(Statement statement) {
        String owner = statement.contextExtensions().getString(ExtensionKey.OWNER);
        return owner != null ? email(owner) : statement.actorEmail();
    }

    private static String resourceType(Activity object) {
        if (object == null) {
            return null;
        }
        String type = object.type();
        if (type != null) {
            return type.substring(type.lastIndexOf('/') + 1);
        }
        String id = object.getId();
        if (id == null || !id.startsWith(Vocabulary.BASE + "/")) {
            return null;
        }
        String path = id.substring(Vocabulary.BASE.length() + 1);
        int slash = path.indexOf('/');
        return slash > 0 ? path.substring(0, slash) : null;
    }

    private static List<String> permissionsOf(Statement statement) {
        List<String> permissions = statement.contextExtensions().getStringList(ExtensionKey.PERMISSIONS);
        return permissions.isEmpty() ? List.of("view") : permissions;
    }

    private static String email(String agent) {
        if (agent == null || agent.isBlank()) {
            throw new ValidationException("agent is required");
        }
        return agent.trim().toLowerCase(Locale.ROOT);
    }
}
