package hk.edu.hulab.portal.backend.service;

import hk.edu.hulab.portal.backend.config.PortalPrincipal;
import hk.edu.hulab.portal.backend.dto.CollaboratorEntry;
import hk.edu.hulab.portal.backend.dto.CreateProjectRequest;
import hk.edu.hulab.portal.backend.dto.PagedResult;
import hk.edu.hulab.portal.backend.exception.NotFoundException;
import hk.edu.hulab.portal.backend.exception.PermissionDeniedException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Collaborator;
import hk.edu.hulab.portal.backend.model.DocumentKey;
import hk.edu.hulab.portal.backend.model.DocumentStatus;
import hk.edu.hulab.portal.backend.model.DocumentType;
import hk.edu.hulab.portal.backend.model.ExtensionKey;
import hk.edu.hulab.portal.backend.model.Extensions;
import hk.edu.hulab.portal.backend.model.PhaseProgress;
import hk.edu.hulab.portal.backend.model.ProjectPhase;
import hk.edu.hulab.portal.backend.model.ResearchProject;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Research projects and their RIDE-I phase progress. Projects live under the creator's agent;
 * collaborators reach them through {@link RelationshipResolver#locate}.
 */
@Service
public class ResearchProjectService {

    private static final Logger log = LoggerFactory.getLogger(ResearchProjectService.class);

    private static final Set<String> COLLABORATOR_ROLES =
            Set.of(Collaborator.VIEWER, Collaborator.EDITOR, Collaborator.MANAGER);

    private final DocumentMapper documentMapper;
    private final RelationshipResolver relationshipResolver;
    private final UserProfileService userProfileService;
    private final EventLogClient eventLog;
    private final Clock clock;

    public ResearchProjectService(DocumentMapper documentMapper,
                                  RelationshipResolver relationshipResolver,
                                  UserProfileService userProfileService,
                                  EventLogClient eventLog,
                                  Clock clock) {
        this.documentMapper = documentMapper;
        this.relationshipResolver = relationshipResolver;
        this.userProfileService = userProfileService;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    public ResearchProject create(PortalPrincipal caller, CreateProjectRequest request) {
        if (request == null || isBlank(request.getTitle()) || isBlank(request.getDescription())) {
            throw new ValidationException("Title and description are required");
        }
        if (!userProfileService.canCreateProjects(caller.email())) {
            throw new PermissionDeniedException("You do not have permission to create projects");
        }

        Instant now = clock.instant();
        Map<String, PhaseProgress> phases = new LinkedHashMap<>();
        for (ProjectPhase phase : ProjectPhase.values()) {
            phases.put(phase.key(), PhaseProgress.builder().build());
        }
        PhaseProgress first = phases.get(ProjectPhase.RESOURCE.key());
        first.setStatus(PhaseProgress.IN_PROGRESS);
        first.setStartedAt(now);

        ResearchProject project = ResearchProject.builder()
                .title(request.getTitle().trim())
                .description(request.getDescription().trim())
                .researchQuestions(orEmpty(request.getResearchQuestions()))
                .methodology(request.getMethodology() != null ? request.getMethodology().trim() : "")
                .expectedOutcomes(orEmpty(request.getExpectedOutcomes()))
                .timeline(request.getTimeline() != null ? request.getTimeline() : new LinkedHashMap<>())
                .keywords(orEmpty(request.getKeywords()))
                .fundingSource(request.getFundingSource())
                .ethicsApproval(request.getEthicsApproval())
                .visibility(request.getVisibility() != null ? request.getVisibility() : "private")
                .currentPhase(ProjectPhase.RESOURCE)
                .phases(phases)
                .build();

        ResearchProject created = documentMapper.create(caller.email(), caller.email(), DocumentType.PROJECT, project);
        log.info("Research project {} '{}' created by {}", created.getId(), created.getTitle(), caller.email());
        return created;
    }

    /**
     * The project, if the caller owns it, collaborates on it or is an admin.
     */
    public ResearchProject get(PortalPrincipal caller, String projectId) {
        ResearchProject project = documentMapper.read(keyOf(projectId));
        if (project.isDeleted()) {
            throw NotFoundException.of("project", projectId);
        }
        if (!isOwner(caller, project) && project.collaborator(caller.email()).isEmpty() && !caller.isAdmin()) {
            throw new PermissionDeniedException("You do not have access to this project");
        }
        return project;
    }

    public PagedResult<ResearchProject> list(PortalPrincipal caller, String status, int offset, int limit) {
        DocumentStatus filter = null;
        if (!isBlank(status) && !"all".equalsIgnoreCase(status)) {
            try {
                filter = DocumentStatus.fromWire(status);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown project status: " + status);
            }
        }
        return relationshipResolver.listOwned(caller.email(), DocumentType.PROJECT, filter, offset, limit);
    }

    public ResearchProject update(PortalPrincipal caller, String projectId, Map<String, Object> patch,
            Integer expectedVersion) {
        DocumentKey<ResearchProject> key = keyOf(projectId);
        ResearchProject project = live(key);
        if (!isOwner(caller, project) && !hasCollaboratorRole(caller, project, Collaborator.EDITOR) && !caller.isAdmin()) {
            throw new PermissionDeniedException("You do not have permission to edit this project");
        }
        return documentMapper.update(key, caller.email(), patch, expectedVersion);
    }

    public ResearchProject delete(PortalPrincipal caller, String projectId) {
        DocumentKey<ResearchProject> key = keyOf(projectId);
        ResearchProject project = live(key);
        if (!isOwner(caller, project) && !caller.isAdmin()) {
            throw new PermissionDeniedException("Only the project creator can delete this project");
        }
        return documentMapper.softDelete(key, caller.email());
    }

    /**
     * Close the current phase and start {@code phaseKey}.
     */
    public ResearchProject advancePhase(PortalPrincipal caller, String projectId, String phaseKey,
            String completionNotes, List<String> outputs) {
        ProjectPhase target = ProjectPhase.fromKey(phaseKey);
        DocumentKey<ResearchProject> key = keyOf(projectId);
        ResearchProject project = live(key);
        if (!isOwner(caller, project)
                && !hasCollaboratorRole(caller, project, Collaborator.EDITOR, Collaborator.MANAGER)
                && !caller.isAdmin()) {
            throw new PermissionDeniedException("You do not have permission to advance project phases");
        }

        ProjectPhase previous = project.getCurrentPhase();
        Instant now = clock.instant();
        ResearchProject advanced = documentMapper.modify(key, caller.email(), p -> {
            Map<String, PhaseProgress> phases = p.getPhases() != null ? p.getPhases() : new LinkedHashMap<>();
            if (p.getCurrentPhase() != null) {
                PhaseProgress closing = phases.computeIfAbsent(p.getCurrentPhase().key(),
                        k -> PhaseProgress.builder().build());
                closing.setStatus(PhaseProgress.COMPLETED);
                closing.setCompletedAt(now);
                closing.setCompletionNotes(completionNotes != null ? completionNotes : "");
                if (outputs != null && !outputs.isEmpty()) {
                    closing.setOutputs(new ArrayList<>(outputs));
                }
            }
            PhaseProgress opening = phases.computeIfAbsent(target.key(), k -> PhaseProgress.builder().build());
            opening.setStatus(PhaseProgress.IN_PROGRESS);
            opening.setStartedAt(now);
            p.setPhases(phases);
            p.setCurrentPhase(target);
            return p;
        });

        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(caller.email()))
                .verb(Vocabulary.ADVANCED)
                .object(DocumentType.PROJECT.activity(projectId, advanced.getTitle()))
                .context(StatementContext.builder()
                        .extensions(Extensions.builder()
                                .put(ExtensionKey.RIDE_I_PHASE, target.key())
                                .put(ExtensionKey.PREVIOUS_PHASE, previous != null ? previous.key() : null)
                                .build())
                        .build())
                .build());
        log.info("Project {} advanced from {} to {} by {}", projectId,
                previous != null ? previous.key() : "none", target.key(), caller.email());
        return advanced;
    }

    public Collaborator addCollaborator(PortalPrincipal caller, String projectId, String collaboratorEmail,
            String role, List<String> permissions) {
        if (isBlank(collaboratorEmail) || !collaboratorEmail.contains("@")) {
            throw new ValidationException("Valid collaborator email is required");
        }
        String email = collaboratorEmail.trim().toLowerCase(Locale.ROOT);
        String effectiveRole = validRole(role);

        DocumentKey<ResearchProject> key = keyOf(projectId);
        ResearchProject project = live(key);
        if (!isOwner(caller, project) && !hasCollaboratorRole(caller, project, Collaborator.MANAGER)
                && !caller.isAdmin()) {
            throw new PermissionDeniedException("You do not have permission to add collaborators");
        }
        if (project.collaborator(email).isPresent()) {
            throw new ValidationException("This user is already a collaborator on this project");
        }

        Collaborator collaborator = Collaborator.builder()
                .email(email)
                .name(Actor.ofEmail(email).getName())
                .role(effectiveRole)
                .permissions(permissions != null ? new ArrayList<>(permissions) : new ArrayList<>())
                .addedBy(caller.email())
                .addedAt(clock.instant())
                .build();
        ResearchProject updated = documentMapper.modify(key, caller.email(), p -> {
            if (p.collaborator(email).isPresent()) {
                throw new ValidationException("This user is already a collaborator on this project");
            }
            List<Collaborator> collaborators = p.getCollaborators() != null
                    ? new ArrayList<>(p.getCollaborators()) : new ArrayList<>();
            collaborators.add(collaborator);
            p.setCollaborators(collaborators);
            return p;
        });

        recordCollaboration(caller.email(), projectId, updated.getTitle(), "invited_collaborator", List.of(email));
        log.info("Collaborator {} added to project {} as {} by {}", email, projectId, effectiveRole, caller.email());
        return collaborator;
    }

    public List<CollaboratorEntry> collaborators(PortalPrincipal caller, String projectId) {
        get(caller, projectId);
        return relationshipResolver.resolveCollaborators(keyOf(projectId));
    }

    /**
     * Append a {@code collaborated} statement naming the other agents as the team.
     */
    public String recordCollaboration(String actorEmail, String projectId, String projectTitle, String action,
            List<String> teamEmails) {
        List<Actor> team = teamEmails == null ? List.of() : teamEmails.stream()
                .filter(e -> !isBlank(e))
                .map(Actor::ofEmail)
                .toList();
        return eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(actorEmail))
                .verb(Vocabulary.COLLABORATED)
                .object(DocumentType.PROJECT.activity(projectId, projectTitle))
                .context(StatementContext.builder()
                        .team(team)
                        .extensions(Extensions.builder()
                                .put(ExtensionKey.COLLABORATION_ACTION, action)
                                .build())
                        .build())
                .build());
    }

    /**
     * Owner key of the project, from its creation statement.
     */
    public DocumentKey<ResearchProject> keyOf(String projectId) {
        return relationshipResolver.locate(DocumentType.PROJECT, projectId)
                .orElseThrow(() -> NotFoundException.of("project", projectId));
    }

    static boolean isOwner(PortalPrincipal caller, ResearchProject project) {
        return caller.email().equalsIgnoreCase(project.getCreatedBy());
    }

    static boolean hasCollaboratorRole(PortalPrincipal caller, ResearchProject project, String... roles) {
        return project.collaborator(caller.email()).map(c -> c.hasRole(roles)).orElse(false);
    }

    static String validRole(String role) {
        if (isBlank(role)) {
            return Collaborator.VIEWER;
        }
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        if (!COLLABORATOR_ROLES.contains(normalized)) {
            throw new ValidationException("Role must be one of viewer, editor or manager");
        }
        return normalized;
    }

    private ResearchProject live(DocumentKey<ResearchProject> key) {
        ResearchProject project = documentMapper.read(key);
        if (project.isDeleted()) {
            throw NotFoundException.of("project", key.id());
        }
        return project;
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
