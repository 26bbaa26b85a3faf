package hk.edu.hulab.portal.backend.controller;

import hk.edu.hulab.portal.backend.analytics.AnalyticsAggregator;
import hk.edu.hulab.portal.backend.analytics.ProjectAnalytics;
import hk.edu.hulab.portal.backend.config.PortalPrincipal;
import hk.edu.hulab.portal.backend.dto.AddCollaboratorRequest;
import hk.edu.hulab.portal.backend.dto.AdvancePhaseRequest;
import hk.edu.hulab.portal.backend.dto.CollaboratorEntry;
import hk.edu.hulab.portal.backend.dto.CreateProjectRequest;
import hk.edu.hulab.portal.backend.dto.PagedResult;
import hk.edu.hulab.portal.backend.model.Collaborator;
import hk.edu.hulab.portal.backend.model.ResearchProject;
import hk.edu.hulab.portal.backend.service.ResearchProjectService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/research/projects")
@Tag(name = "Research Projects", description = "RIDE-I research project management")
public class ProjectController {

    private final ResearchProjectService projectService;
    private final AnalyticsAggregator analyticsAggregator;

    public ProjectController(ResearchProjectService projectService, AnalyticsAggregator analyticsAggregator) {
        this.projectService = projectService;
        this.analyticsAggregator = analyticsAggregator;
    }

    @PostMapping
    @Operation(summary = "Create project", description = "Create a research project owned by the caller")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Project created"),
            @ApiResponse(responseCode = "400", description = "Title or description missing"),
            @ApiResponse(responseCode = "403", description = "Profile does not allow creating projects")
    })
    public ResponseEntity<ResearchProject> createProject(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Valid @RequestBody CreateProjectRequest request) {

        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.create(principal, request));
    }

    @GetMapping
    @Operation(summary = "List own projects", description = "Live projects created by the caller, most recently updated first")
    public ResponseEntity<PagedResult<ResearchProject>> listProjects(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Parameter(description = "active, completed, archived or all") @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "20") int limit) {

        return ResponseEntity.ok(projectService.list(principal, status, offset, limit));
    }

    @GetMapping("/{projectId}")
    @Operation(summary = "Get project")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project found"),
            @ApiResponse(responseCode = "403", description = "Caller is neither owner, collaborator nor admin"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    public ResponseEntity<ResearchProject> getProject(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Parameter(description = "Project ID") @PathVariable String projectId) {

        return ResponseEntity.ok(projectService.get(principal, projectId));
    }

    @PutMapping("/{projectId}")
    @Operation(summary = "Update project", description = "Shallow-merge fields into the project")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project updated"),
            @ApiResponse(responseCode = "400", description = "Attempt to change an immutable field"),
            @ApiResponse(responseCode = "409", description = "Project changed since expectedVersion")
    })
    public ResponseEntity<ResearchProject> updateProject(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String projectId,
            @Parameter(description = "Fail unless the stored version matches") @RequestParam(required = false) Integer expectedVersion,
            @RequestBody Map<String, Object> updates) {

        return ResponseEntity.ok(projectService.update(principal, projectId, updates, expectedVersion));
    }

    @DeleteMapping("/{projectId}")
    @Operation(summary = "Delete project", description = "Soft delete; only the creator or an admin")
    public ResponseEntity<ResearchProject> deleteProject(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String projectId) {

        return ResponseEntity.ok(projectService.delete(principal, projectId));
    }

    @PostMapping("/{projectId}/phase/{phase}")
    @Operation(summary = "Advance phase", description = "Complete the current RIDE-I phase and start another")
    public ResponseEntity<ResearchProject> advancePhase(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String projectId,
            @Parameter(description = "resource, information, decisions, experience or implementation") @PathVariable String phase,
            @RequestBody(required = false) AdvancePhaseRequest request) {

        AdvancePhaseRequest body = request != null ? request : new AdvancePhaseRequest();
        return ResponseEntity.ok(projectService.advancePhase(principal, projectId, phase,
                body.getCompletionNotes(), body.getOutputs()));
    }

    @PostMapping("/{projectId}/collaborate")
    @Operation(summary = "Add collaborator")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Collaborator added"),
            @ApiResponse(responseCode = "400", description = "Invalid email or already a collaborator"),
            @ApiResponse(responseCode = "403", description = "Caller is not owner, manager or admin")
    })
    public ResponseEntity<Collaborator> addCollaborator(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String projectId,
            @Valid @RequestBody AddCollaboratorRequest request) {

        return ResponseEntity.ok(projectService.addCollaborator(principal, projectId,
                request.getCollaboratorEmail(), request.getRole(), request.getPermissions()));
    }

    @GetMapping("/{projectId}/collaborators")
    @Operation(summary = "List collaborators", description = "Listed members plus agents seen collaborating on the project")
    public ResponseEntity<List<CollaboratorEntry>> collaborators(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String projectId) {

        return ResponseEntity.ok(projectService.collaborators(principal, projectId));
    }

    @GetMapping("/{projectId}/analytics")
    @Operation(summary = "Project analytics")
    public ResponseEntity<ProjectAnalytics> analytics(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String projectId,
            @RequestParam(required = false) String timeRange) {

        projectService.get(principal, projectId);
        return ResponseEntity.ok(analyticsAggregator.projectAnalytics(projectId, timeRange));
    }
}
