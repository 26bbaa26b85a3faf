package hk.edu.hulab.portal.backend.service;

import hk.edu.hulab.portal.backend.analytics.TimeRange;
import hk.edu.hulab.portal.backend.analytics.TimeRangePreset;
import hk.edu.hulab.portal.backend.config.PortalPrincipal;
import hk.edu.hulab.portal.backend.dto.CollaborationActivity;
import hk.edu.hulab.portal.backend.dto.InvitationBatch;
import hk.edu.hulab.portal.backend.dto.InvitationResult;
import hk.edu.hulab.portal.backend.dto.PagedResult;
import hk.edu.hulab.portal.backend.dto.SharedResource;
import hk.edu.hulab.portal.backend.dto.Team;
import hk.edu.hulab.portal.backend.exception.NotFoundException;
import hk.edu.hulab.portal.backend.exception.PermissionDeniedException;
import hk.edu.hulab.portal.backend.exception.PortalException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Collaborator;
import hk.edu.hulab.portal.backend.model.Comment;
import hk.edu.hulab.portal.backend.model.DocumentKey;
import hk.edu.hulab.portal.backend.model.DocumentType;
import hk.edu.hulab.portal.backend.model.ExtensionKey;
import hk.edu.hulab.portal.backend.model.Extensions;
import hk.edu.hulab.portal.backend.model.Invitation;
import hk.edu.hulab.portal.backend.model.ResearchProject;
import hk.edu.hulab.portal.backend.model.ShareRecord;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import hk.edu.hulab.portal.backend.model.StatementResult;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Invitations, shares, comments and collaboration events between agents.
 */
@Service
public class CollaborationService {

    private static final Logger log = LoggerFactory.getLogger(CollaborationService.class);

    static final Duration INVITATION_TTL = Duration.ofDays(7);

    static final int DEFAULT_FEED_LIMIT = 50;
    static final int MAX_FEED_LIMIT = 500;

    private static final String ACCEPT = "accept";
    private static final String DECLINE = "decline";

    private final DocumentMapper documentMapper;
    private final RelationshipResolver relationshipResolver;
    private final ResearchProjectService projectService;
    private final EventLogClient eventLog;
    private final Clock clock;
    private final ZoneId zone;

    public CollaborationService(DocumentMapper documentMapper,
                                RelationshipResolver relationshipResolver,
                                ResearchProjectService projectService,
                                EventLogClient eventLog,
                                Clock clock,
                                @Value("${portal.analytics.zone:UTC}") String zone) {
        this.documentMapper = documentMapper;
        this.relationshipResolver = relationshipResolver;
        this.projectService = projectService;
        this.eventLog = eventLog;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Invite agents to a project. Each invitee gets its own invitation document; a failure for one
     * invitee is reported in the batch and does not stop the others.
     */
    public InvitationBatch invite(PortalPrincipal caller, String projectId, List<String> inviteeEmails, String role,
            String message, List<String> permissions) {
        if (isBlank(projectId) || inviteeEmails == null || inviteeEmails.isEmpty()) {
            throw new ValidationException("Project ID and invitee emails are required");
        }
        String effectiveRole = ResearchProjectService.validRole(role);
        DocumentKey<ResearchProject> projectKey = projectService.keyOf(projectId);
        ResearchProject project = documentMapper.read(projectKey);
        if (project.isDeleted()) {
            throw NotFoundException.of("project", projectId);
        }
        boolean canInvite = ResearchProjectService.isOwner(caller, project)
                || ResearchProjectService.hasCollaboratorRole(caller, project, Collaborator.MANAGER, Collaborator.EDITOR)
                || caller.isAdmin();
        if (!canInvite) {
            throw new PermissionDeniedException("You do not have permission to send invitations for this project");
        }

        String batchId = UUID.randomUUID().toString();
        Instant expiresAt = clock.instant().plus(INVITATION_TTL);
        List<InvitationResult> results = new ArrayList<>();
        for (String raw : inviteeEmails) {
            if (isBlank(raw) || !raw.contains("@")) {
                results.add(InvitationResult.failed(raw, "Invalid email"));
                continue;
            }
            String invitee = raw.trim().toLowerCase(Locale.ROOT);
            try {
                Invitation invitation = documentMapper.create(caller.email(), invitee, DocumentType.INVITATION,
                        Invitation.builder()
                                .invitationBatchId(batchId)
                                .projectId(projectId)
                                .projectTitle(project.getTitle())
                                .projectOwner(projectKey.ownerAgent())
                                .inviterEmail(caller.email())
                                .inviteeEmail(invitee)
                                .role(effectiveRole)
                                .permissions(permissions != null ? new ArrayList<>(permissions) : new ArrayList<>())
                                .message(message != null ? message : "")
                                .response(Invitation.PENDING)
                                .expiresAt(expiresAt)
                                .build());

                eventLog.append(Statement.builder()
                        .actor(Actor.ofEmail(caller.email()))
                        .verb(Vocabulary.INVITED)
                        .object(DocumentType.PROJECT.activity(projectId, project.getTitle()))
                        .context(StatementContext.withBackReference(
                                DocumentType.INVITATION.activity(invitation.getId(), "Collaboration Invitation"),
                                Extensions.builder()
                                        .put(ExtensionKey.INVITEE, invitee)
                                        .put(ExtensionKey.ROLE, effectiveRole)
                                        .build()))
                        .build());

                results.add(InvitationResult.sent(invitee, invitation.getId()));
                log.info("Invitation {} to project {} sent by {} to {} as {}", invitation.getId(), projectId,
                        caller.email(), invitee, effectiveRole);
            } catch (PortalException e) {
                log.error("Error sending invitation for project {} to {}: {}", projectId, invitee, e.getMessage());
                results.add(InvitationResult.failed(invitee, e.getMessage()));
            }
        }

        int sent = (int) results.stream().filter(InvitationResult::success).count();
        return new InvitationBatch(batchId, sent, results);
    }

    /**
     * Accept or decline an invitation addressed to the caller. Accepting adds the caller to the project.
     */
    public Invitation respondToInvitation(PortalPrincipal caller, String invitationId, String response,
            String message) {
        String answer = response == null ? "" : response.trim().toLowerCase(Locale.ROOT);
        if (!ACCEPT.equals(answer) && !DECLINE.equals(answer)) {
            throw new ValidationException("Response must be either \"accept\" or \"decline\"");
        }
        DocumentKey<Invitation> key = DocumentKey.of(DocumentType.INVITATION, caller.email(), invitationId);
        Invitation invitation = documentMapper.find(key)
                .filter(i -> !i.isDeleted())
                .orElseThrow(() -> NotFoundException.of("invitation", invitationId));
        if (!caller.email().equalsIgnoreCase(invitation.getInviteeEmail())) {
            throw new PermissionDeniedException("This invitation is not for you");
        }
        if (!Invitation.PENDING.equals(invitation.getResponse())) {
            throw new ValidationException("This invitation has already been responded to");
        }
        Instant now = clock.instant();
        if (invitation.getExpiresAt() != null && now.isAfter(invitation.getExpiresAt())) {
            throw new ValidationException("This invitation has expired");
        }

        boolean accepted = ACCEPT.equals(answer);
        Invitation answered = documentMapper.modify(key, caller.email(), i -> {
            i.setResponse(accepted ? Invitation.ACCEPTED : Invitation.DECLINED);
            i.setResponseMessage(message != null ? message : "");
            i.setRespondedAt(now);
            return i;
        });

        if (accepted) {
            joinProject(caller, answered, now);
        }

        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(caller.email()))
                .verb(accepted ? Vocabulary.ACCEPTED : Vocabulary.DECLINED)
                .object(DocumentType.INVITATION.activity(invitationId, "Collaboration Invitation"))
                .context(StatementContext.withParent(
                        DocumentType.PROJECT.activity(answered.getProjectId(), answered.getProjectTitle())))
                .build());
        log.info("Invitation {} {} by {}", invitationId, answered.getResponse(), caller.email());
        return answered;
    }

    /**
     * Share a resource with other agents. The share document is stored under the sharer.
     */
    public ShareRecord share(PortalPrincipal caller, String resourceType, String resourceId, List<String> recipients,
            String message, List<String> permissions) {
        if (isBlank(resourceType) || isBlank(resourceId) || recipients == null || recipients.isEmpty()) {
            throw new ValidationException("Resource type, ID, and recipients are required");
        }
        List<String> normalizedRecipients = recipients.stream()
                .filter(r -> !isBlank(r))
                .map(r -> r.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        if (normalizedRecipients.isEmpty()) {
            throw new ValidationException("At least one recipient is required");
        }
        List<String> effectivePermissions = permissions == null || permissions.isEmpty()
                ? List.of("view") : List.copyOf(permissions);
        String type = resourceType.trim().toLowerCase(Locale.ROOT);

        ShareRecord share = documentMapper.create(caller.email(), caller.email(), DocumentType.SHARE,
                ShareRecord.builder()
                        .resourceType(type)
                        .resourceId(resourceId)
                        .sharedBy(caller.email())
                        .recipients(new ArrayList<>(normalizedRecipients))
                        .message(message != null ? message : "")
                        .permissions(new ArrayList<>(effectivePermissions))
                        .build());

        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(caller.email()))
                .verb(Vocabulary.SHARED)
                .object(Activity.of(Vocabulary.address(type, resourceId), Vocabulary.activityType(type),
                        "Shared " + type))
                .context(StatementContext.withBackReference(
                        DocumentType.SHARE.activity(share.getId(), "Share"),
                        Extensions.builder()
                                .put(ExtensionKey.RECIPIENTS, normalizedRecipients)
                                .put(ExtensionKey.PERMISSIONS, effectivePermissions)
                                .build()))
                .build());
        log.info("Share {} of {} {} by {} to {} recipient(s)", share.getId(), type, resourceId, caller.email(),
                normalizedRecipients.size());
        return share;
    }

    /**
     * @param direction {@code received}, {@code sent} or {@code all}
     */
    public List<SharedResource> shared(PortalPrincipal caller, String direction, String resourceType) {
        InvitationDirection which = InvitationDirection.fromKey(direction == null ? "all" : direction);
        List<SharedResource> resources = new ArrayList<>();
        if (which != InvitationDirection.SENT) {
            resources.addAll(relationshipResolver.resolveSharedWith(caller.email(), resourceType));
        }
        if (which != InvitationDirection.RECEIVED) {
            resources.addAll(relationshipResolver.resolveSharedBy(caller.email(), resourceType));
        }
        resources.sort(Comparator.comparing(SharedResource::getSharedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return resources;
    }

    public Comment addComment(PortalPrincipal caller, String targetType, String targetId, String content,
            String parentCommentId, List<String> mentions) {
        if (isBlank(targetType) || isBlank(targetId) || isBlank(content)) {
            throw new ValidationException("Target type, ID, and content are required");
        }
        String type = targetType.trim().toLowerCase(Locale.ROOT);
        List<String> mentioned = mentions != null ? mentions : List.of();
        Comment comment = documentMapper.create(caller.email(), caller.email(), DocumentType.COMMENT,
                Comment.builder()
                        .targetType(type)
                        .targetId(targetId)
                        .content(content.trim())
                        .author(caller.email())
                        .authorName(Actor.ofEmail(caller.email()).getName())
                        .parentCommentId(parentCommentId)
                        .mentions(new ArrayList<>(mentioned))
                        .build());

        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(caller.email()))
                .verb(Vocabulary.COMMENTED)
                .object(Activity.of(Vocabulary.address(type, targetId), Vocabulary.activityType(type),
                        type + " " + targetId))
                .result(StatementResult.builder().response(content).build())
                .context(StatementContext.withBackReference(
                        DocumentType.COMMENT.activity(comment.getId(), "Comment"),
                        Extensions.builder()
                                .put(ExtensionKey.MENTIONS, mentioned)
                                .put(ExtensionKey.PARENT_COMMENT, parentCommentId)
                                .build()))
                .build());
        log.info("Comment {} on {} {} by {} ({} mention(s))", comment.getId(), type, targetId, caller.email(),
                mentioned.size());
        return comment;
    }

    public Comment deleteComment(PortalPrincipal caller, String commentId) {
        DocumentKey<Comment> key = relationshipResolver.locate(DocumentType.COMMENT, commentId)
                .orElseThrow(() -> NotFoundException.of("comment", commentId));
        Comment comment = documentMapper.read(key);
        if (!caller.email().equalsIgnoreCase(comment.getAuthor()) && !caller.isAdmin()) {
            throw new PermissionDeniedException("Only the author can delete this comment");
        }
        return documentMapper.softDelete(key, caller.email());
    }

    public PagedResult<Comment> comments(String targetType, String targetId, int offset, int limit) {
        return relationshipResolver.resolveCommentThread(targetType.trim().toLowerCase(Locale.ROOT), targetId,
                offset, limit);
    }

    public List<Invitation> invitations(PortalPrincipal caller, String direction, String response) {
        return relationshipResolver.resolveInvitations(caller.email(), InvitationDirection.fromKey(direction),
                response);
    }

    /**
     * Teams the caller worked in, over {@code preset} or all time when absent.
     */
    public List<Team> teams(PortalPrincipal caller, String preset) {
        TimeRange range = isBlank(preset)
                ? TimeRange.unbounded()
                : TimeRangePreset.fromKey(preset).resolve(clock.instant(), zone);
        return relationshipResolver.resolveTeams(caller.email(), range);
    }

    /**
     * Record a collaboration on a project the caller has access to.
     */
    public String recordCollaboration(PortalPrincipal caller, String projectId, String action,
            List<String> teamEmails) {
        if (isBlank(action)) {
            throw new ValidationException("Collaboration action is required");
        }
        ResearchProject project = projectService.get(caller, projectId);
        return projectService.recordCollaboration(caller.email(), projectId, project.getTitle(), action, teamEmails);
    }

    /**
     * Collaboration feed for a project the caller can see, or for the caller when no project is given.
     *
     * @param limit 1 to {@value #MAX_FEED_LIMIT}, null for {@value #DEFAULT_FEED_LIMIT}
     * @param since ISO-8601 instant, null for no lower bound
     */
    public List<CollaborationActivity> activities(PortalPrincipal caller, String projectId, Integer limit,
            String since) {
        int effectiveLimit = limit == null ? DEFAULT_FEED_LIMIT : limit;
        if (effectiveLimit < 1 || effectiveLimit > MAX_FEED_LIMIT) {
            throw new ValidationException("Limit must be between 1 and " + MAX_FEED_LIMIT);
        }
        Instant from = null;
        if (!isBlank(since)) {
            try {
                from = Instant.parse(since.trim());
            } catch (DateTimeParseException e) {
                throw new ValidationException("since must be an ISO-8601 instant, got '" + since + "'");
            }
        }
        if (!isBlank(projectId)) {
            projectService.get(caller, projectId);
        }
        return relationshipResolver.resolveActivityFeed(caller.email(), isBlank(projectId) ? null : projectId,
                from, effectiveLimit);
    }

    private void joinProject(PortalPrincipal caller, Invitation invitation, Instant now) {
        String owner = invitation.getProjectOwner() != null ? invitation.getProjectOwner() : invitation.getInviterEmail();
        DocumentKey<ResearchProject> projectKey = DocumentKey.of(DocumentType.PROJECT, owner, invitation.getProjectId());
        try {
            documentMapper.modify(projectKey, caller.email(), p -> {
                if (p.collaborator(caller.email()).isEmpty()) {
                    List<Collaborator> collaborators = p.getCollaborators() != null
                            ? new ArrayList<>(p.getCollaborators()) : new ArrayList<>();
                    collaborators.add(Collaborator.builder()
                            .email(caller.email())
                            .name(Actor.ofEmail(caller.email()).getName())
                            .role(invitation.getRole())
                            .permissions(invitation.getPermissions() != null
                                    ? new ArrayList<>(invitation.getPermissions()) : new ArrayList<>())
                            .addedBy(invitation.getInviterEmail())
                            .addedAt(now)
                            .invitedBy(invitation.getInviterEmail())
                            .build());
                    p.setCollaborators(collaborators);
                }
                return p;
            });
            log.info("{} joined project {} as {}", caller.email(), invitation.getProjectId(), invitation.getRole());
        } catch (NotFoundException e) {
            log.warn("Project {} of accepted invitation {} no longer exists", invitation.getProjectId(),
                    invitation.getId());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
