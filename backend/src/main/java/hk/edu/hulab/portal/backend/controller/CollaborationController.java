package hk.edu.hulab.portal.backend.controller;

import hk.edu.hulab.portal.backend.config.PortalPrincipal;
import hk.edu.hulab.portal.backend.dto.CollaborationActivity;
import hk.edu.hulab.portal.backend.dto.CollaborationEventRequest;
import hk.edu.hulab.portal.backend.dto.CommentRequest;
import hk.edu.hulab.portal.backend.dto.InvitationBatch;
import hk.edu.hulab.portal.backend.dto.InvitationResponseRequest;
import hk.edu.hulab.portal.backend.dto.InviteRequest;
import hk.edu.hulab.portal.backend.dto.PagedResult;
import hk.edu.hulab.portal.backend.dto.ShareRequest;
import hk.edu.hulab.portal.backend.dto.SharedResource;
import hk.edu.hulab.portal.backend.dto.Team;
import hk.edu.hulab.portal.backend.model.Comment;
import hk.edu.hulab.portal.backend.model.Invitation;
import hk.edu.hulab.portal.backend.model.ShareRecord;
import hk.edu.hulab.portal.backend.service.CollaborationService;
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
@RequestMapping("/api/collaboration")
@Tag(name = "Collaboration", description = "Teams, invitations, shares and comments")
public class CollaborationController {

    private final CollaborationService collaborationService;

    public CollaborationController(CollaborationService collaborationService) {
        this.collaborationService = collaborationService;
    }

    @GetMapping("/teams")
    @Operation(summary = "List teams", description = "Teams derived from the caller's collaboration statements")
    public ResponseEntity<List<Team>> teams(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Parameter(description = "Time range preset, all time when absent") @RequestParam(required = false) String timeRange) {

        return ResponseEntity.ok(collaborationService.teams(principal, timeRange));
    }

    @PostMapping("/invite")
    @Operation(summary = "Invite collaborators", description = "Send one invitation per invitee")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch processed, see per-invitee results"),
            @ApiResponse(responseCode = "403", description = "Caller may not invite to this project"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    public ResponseEntity<InvitationBatch> invite(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Valid @RequestBody InviteRequest request) {

        return ResponseEntity.ok(collaborationService.invite(principal, request.getProjectId(),
                request.getInviteeEmails(), request.getRole(), request.getMessage(), request.getPermissions()));
    }

    @GetMapping("/invitations")
    @Operation(summary = "List invitations")
    public ResponseEntity<List<Invitation>> invitations(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Parameter(description = "received, sent or all") @RequestParam(defaultValue = "received") String type,
            @Parameter(description = "pending, accepted, declined or all") @RequestParam(defaultValue = "all") String status) {

        return ResponseEntity.ok(collaborationService.invitations(principal, type, status));
    }

    @PostMapping("/invitations/{invitationId}/respond")
    @Operation(summary = "Respond to invitation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Response recorded"),
            @ApiResponse(responseCode = "400", description = "Invalid response, already answered or expired"),
            @ApiResponse(responseCode = "404", description = "Invitation not found")
    })
    public ResponseEntity<Invitation> respond(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String invitationId,
            @Valid @RequestBody InvitationResponseRequest request) {

        return ResponseEntity.ok(collaborationService.respondToInvitation(principal, invitationId,
                request.getResponse(), request.getMessage()));
    }

    @PostMapping("/share")
    @Operation(summary = "Share resource")
    public ResponseEntity<ShareRecord> share(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Valid @RequestBody ShareRequest request) {

        return ResponseEntity.ok(collaborationService.share(principal, request.getResourceType(),
                request.getResourceId(), request.getRecipients(), request.getMessage(), request.getPermissions()));
    }

    @GetMapping("/shared")
    @Operation(summary = "List shared resources")
    public ResponseEntity<List<SharedResource>> shared(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Parameter(description = "received, sent or all") @RequestParam(defaultValue = "all") String type,
            @RequestParam(required = false) String resourceType) {

        return ResponseEntity.ok(collaborationService.shared(principal, type, resourceType));
    }

    @PostMapping("/comment")
    @Operation(summary = "Add comment")
    public ResponseEntity<Comment> comment(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Valid @RequestBody CommentRequest request) {

        Comment comment = collaborationService.addComment(principal, request.getTargetType(), request.getTargetId(),
                request.getContent(), request.getParentCommentId(), request.getMentions());
        return ResponseEntity.status(HttpStatus.CREATED).body(comment);
    }

    @GetMapping("/comments/{targetType}/{targetId}")
    @Operation(summary = "Comment thread", description = "Live comments on a target, oldest first")
    public ResponseEntity<PagedResult<Comment>> comments(
            @PathVariable String targetType,
            @PathVariable String targetId,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "50") int limit) {

        return ResponseEntity.ok(collaborationService.comments(targetType, targetId, offset, limit));
    }

    @DeleteMapping("/comments/{commentId}")
    @Operation(summary = "Delete comment", description = "Soft delete; only the author or an admin")
    public ResponseEntity<Comment> deleteComment(
            @AuthenticationPrincipal PortalPrincipal principal,
            @PathVariable String commentId) {

        return ResponseEntity.ok(collaborationService.deleteComment(principal, commentId));
    }

    @GetMapping("/activities")
    @Operation(summary = "Collaboration feed", description = "Newest statements on a project, or the caller's collaborations")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Feed returned, newest first"),
            @ApiResponse(responseCode = "400", description = "Bad limit or since"),
            @ApiResponse(responseCode = "403", description = "Caller may not view the project"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    public ResponseEntity<Map<String, Object>> activities(
            @AuthenticationPrincipal PortalPrincipal principal,
            @RequestParam(required = false) String projectId,
            @Parameter(description = "Maximum entries, default 50") @RequestParam(required = false) Integer limit,
            @Parameter(description = "ISO-8601 lower bound") @RequestParam(required = false) String since) {

        List<CollaborationActivity> activities = collaborationService.activities(principal, projectId, limit, since);
        return ResponseEntity.ok(Map.of("activities", activities, "count", activities.size()));
    }

    @PostMapping("/activities")
    @Operation(summary = "Record collaboration", description = "Record that the caller collaborated with others on a project")
    public ResponseEntity<Map<String, String>> recordCollaboration(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Valid @RequestBody CollaborationEventRequest request) {

        String statementId = collaborationService.recordCollaboration(principal, request.getProjectId(),
                request.getAction(), request.getTeamEmails());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("statementId", statementId));
    }
}
