package hk.edu.hulab.portal.backend.service;

import hk.edu.hulab.portal.backend.BaseE2ETest;
import hk.edu.hulab.portal.backend.analytics.TimeRange;
import hk.edu.hulab.portal.backend.dto.CollaboratorEntry;
import hk.edu.hulab.portal.backend.dto.CreateProjectRequest;
import hk.edu.hulab.portal.backend.dto.PagedResult;
import hk.edu.hulab.portal.backend.dto.SharedResource;
import hk.edu.hulab.portal.backend.dto.Team;
import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Comment;
import hk.edu.hulab.portal.backend.model.DocumentKey;
import hk.edu.hulab.portal.backend.model.DocumentStatus;
import hk.edu.hulab.portal.backend.model.DocumentType;
import hk.edu.hulab.portal.backend.model.Invitation;
import hk.edu.hulab.portal.backend.model.ResearchProject;
import hk.edu.hulab.portal.backend.model.ExtensionKey;
import hk.edu.hulab.portal.backend.model.Extensions;
import hk.edu.hulab.portal.backend.model.ShareRecord;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RelationshipResolverE2ETest extends BaseE2ETest {

    @Autowired
    private RelationshipResolver relationshipResolver;

    @Autowired
    private DocumentMapper documentMapper;

    @Autowired
    private ResearchProjectService projectService;

    @Autowired
    private CollaborationService collaborationService;

    private ResearchProject project(String title) {
        ResearchProject created = projectService.create(ALICE, CreateProjectRequest.builder()
                .title(title)
                .description("Study of " + title)
                .build());
        tick();
        return created;
    }

    @Test
    void shouldLocateDocumentOwner() {
        ResearchProject created = project("Located");

        Optional<DocumentKey<ResearchProject>> key = relationshipResolver.locate(DocumentType.PROJECT,
                created.getId());

        assertTrue(key.isPresent());
        assertEquals(ALICE.email(), key.get().ownerAgent());
        assertTrue(relationshipResolver.locate(DocumentType.PROJECT, "unknown").isEmpty());
        assertTrue(relationshipResolver.locate(DocumentType.PROJECT, " ").isEmpty());
    }

    @Test
    void shouldListOwnedDocumentsExcludingDeleted() {
        // Given
        ResearchProject first = project("First");
        ResearchProject second = project("Second");
        ResearchProject third = project("Third");
        projectService.create(BOB, CreateProjectRequest.builder().title("Bob's").description("Other owner").build());
        collaborationService.addComment(ALICE, "project", first.getId(), "Not a project", null, null);
        projectService.delete(ALICE, second.getId());

        // When
        PagedResult<ResearchProject> owned = relationshipResolver.listOwned(ALICE.email(), DocumentType.PROJECT,
                null, 0, 10);

        // Then: the comment makes the first project the most recently active
        assertEquals(2, owned.totalCount());
        assertThat(owned.items()).extracting(ResearchProject::getId).containsExactly(first.getId(), third.getId());
        assertFalse(owned.hasMore());
    }

    @Test
    void shouldOrderOwnedDocumentsByLatestRelatedStatement() {
        ResearchProject older = project("Older");
        ResearchProject newer = project("Newer");
        assertThat(relationshipResolver.listOwned(ALICE.email(), DocumentType.PROJECT, null, 0, 10).items())
                .extracting(ResearchProject::getId)
                .containsExactly(newer.getId(), older.getId());

        collaborationService.recordCollaboration(ALICE, older.getId(), "discussed", List.of(BOB.email()));
        tick();
        assertThat(relationshipResolver.listOwned(ALICE.email(), DocumentType.PROJECT, null, 0, 10).items())
                .extracting(ResearchProject::getId)
                .containsExactly(older.getId(), newer.getId());

        projectService.update(ALICE, newer.getId(), Map.of("methodology", "Interviews"), null);
        tick();
        assertThat(relationshipResolver.listOwned(ALICE.email(), DocumentType.PROJECT, null, 0, 10).items())
                .extracting(ResearchProject::getId)
                .containsExactly(newer.getId(), older.getId());

        collaborationService.addComment(BOB, "project", older.getId(), "Still relevant", null, null);
        assertThat(relationshipResolver.listOwned(ALICE.email(), DocumentType.PROJECT, null, 0, 10).items())
                .extracting(ResearchProject::getId)
                .containsExactly(older.getId(), newer.getId());
    }

    @Test
    void shouldFilterOwnedDocumentsByStatusAndPage() {
        project("One");
        project("Two");
        project("Three");

        PagedResult<ResearchProject> page = relationshipResolver.listOwned(ALICE.email(), DocumentType.PROJECT,
                DocumentStatus.ACTIVE, 0, 2);
        PagedResult<ResearchProject> completed = relationshipResolver.listOwned(ALICE.email(),
                DocumentType.PROJECT, DocumentStatus.COMPLETED, 0, 10);

        assertEquals(3, page.totalCount());
        assertThat(page.items()).hasSize(2);
        assertTrue(page.hasMore());
        assertEquals(0, completed.totalCount());
    }

    @Test
    void shouldReturnSingleShareRecordPerRecipient() {
        // Given
        ShareRecord share = collaborationService.share(ALICE, "file", "f-1",
                List.of("bob@polyu.edu.hk", "carol@polyu.edu.hk"), "Have a look", null);

        // When
        List<SharedResource> forBob = relationshipResolver.resolveSharedWith(BOB.email(), null);
        List<SharedResource> forCarol = relationshipResolver.resolveSharedWith(CAROL.email(), null);
        List<SharedResource> byAlice = relationshipResolver.resolveSharedBy(ALICE.email(), null);

        // Then
        assertThat(forBob).hasSize(1);
        SharedResource resource = forBob.get(0);
        assertEquals(share.getId(), resource.getShareId());
        assertEquals("file", resource.getResourceType());
        assertEquals("f-1", resource.getResourceId());
        assertEquals(ALICE.email(), resource.getSharedBy());
        assertEquals("Have a look", resource.getMessage());
        assertThat(resource.getRecipients()).containsExactly("bob@polyu.edu.hk", "carol@polyu.edu.hk");
        assertThat(resource.getPermissions()).containsExactly("view");
        assertNotNull(resource.getShareRecord());

        assertThat(forCarol).hasSize(1);
        assertThat(byAlice).hasSize(1);
        assertThat(relationshipResolver.resolveSharedWith("dave@polyu.edu.hk", null)).isEmpty();
    }

    @Test
    void shouldFilterSharesByResourceTypeNewestFirst() {
        collaborationService.share(ALICE, "file", "f-1", List.of("bob@polyu.edu.hk"), null, null);
        tick();
        collaborationService.share(ALICE, "dataset", "d-1", List.of("bob@polyu.edu.hk"), null, List.of("edit"));
        tick();
        collaborationService.share(CAROL, "file", "f-2", List.of("bob@polyu.edu.hk"), null, null);

        List<SharedResource> all = relationshipResolver.resolveSharedWith(BOB.email(), null);
        List<SharedResource> files = relationshipResolver.resolveSharedWith(BOB.email(), "file");

        assertThat(all).extracting(SharedResource::getResourceId).containsExactly("f-2", "d-1", "f-1");
        assertThat(files).extracting(SharedResource::getResourceId).containsExactly("f-2", "f-1");
        assertThat(all.get(1).getPermissions()).containsExactly("edit");
    }

    @Test
    void shouldSkipDeletedShares() {
        ShareRecord share = collaborationService.share(ALICE, "file", "f-1", List.of("bob@polyu.edu.hk"), null, null);
        documentMapper.softDelete(DocumentKey.of(DocumentType.SHARE, ALICE.email(), share.getId()), ALICE.email());

        assertThat(relationshipResolver.resolveSharedWith(BOB.email(), null)).isEmpty();
        assertThat(relationshipResolver.resolveSharedBy(ALICE.email(), null)).isEmpty();
    }

    @Test
    void shouldSkipUnreadableDocumentAndReturnTheRest() {
        ResearchProject readable = project("Readable");
        ResearchProject broken = project("Broken");
        eventLog.putBlob(DocumentMapper.blobKey(DocumentKey.of(DocumentType.PROJECT, ALICE.email(), broken.getId())),
                "{not json".getBytes(StandardCharsets.UTF_8));

        PagedResult<ResearchProject> owned = relationshipResolver.listOwned(ALICE.email(), DocumentType.PROJECT,
                null, 0, 10);

        assertThat(owned.items()).extracting(ResearchProject::getId).containsExactly(readable.getId());
    }

    @Test
    void shouldSkipUnreadableShareAndReturnTheRest() {
        collaborationService.share(ALICE, "file", "f-1", List.of(BOB.email()), null, null);
        tick();
        ShareRecord broken = collaborationService.share(CAROL, "file", "f-2", List.of(BOB.email()), null, null);
        eventLog.putBlob(DocumentMapper.blobKey(DocumentKey.of(DocumentType.SHARE, CAROL.email(), broken.getId())),
                "{not json".getBytes(StandardCharsets.UTF_8));

        assertThat(relationshipResolver.resolveSharedWith(BOB.email(), null))
                .extracting(SharedResource::getResourceId)
                .containsExactly("f-1");
    }

    @Test
    void shouldFallBackToStatementWhenShareRecordIsMissing() {
        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(ALICE.email()))
                .verb(Vocabulary.SHARED)
                .object(Activity.of(Vocabulary.address("dataset", "d-9"), Vocabulary.activityType("dataset"),
                        "Shared dataset"))
                .context(StatementContext.withBackReference(
                        DocumentType.SHARE.activity("missing-share", "Share"),
                        Extensions.builder()
                                .put(ExtensionKey.RECIPIENTS, List.of(BOB.email()))
                                .put(ExtensionKey.PERMISSIONS, List.of("view", "comment"))
                                .build()))
                .build());

        List<SharedResource> forBob = relationshipResolver.resolveSharedWith(BOB.email(), null);

        assertThat(forBob).hasSize(1);
        SharedResource resource = forBob.get(0);
        assertEquals("missing-share", resource.getShareId());
        assertEquals("dataset", resource.getResourceType());
        assertEquals("d-9", resource.getResourceId());
        assertEquals(ALICE.email(), resource.getSharedBy());
        assertEquals(START, resource.getSharedAt());
        assertThat(resource.getRecipients()).containsExactly(BOB.email());
        assertThat(resource.getPermissions()).containsExactly("view", "comment");
        assertNull(resource.getShareRecord());
        assertNull(resource.getMessage());
    }

    @Test
    void shouldReturnCommentThreadOldestFirstWithoutDeleted() {
        // Given
        Comment first = collaborationService.addComment(ALICE, "project", "p-1", "First", null, null);
        tick();
        Comment second = collaborationService.addComment(BOB, "project", "p-1", "Second", null, null);
        tick();
        Comment third = collaborationService.addComment(CAROL, "project", "p-1", "Third", first.getId(),
                List.of("alice@polyu.edu.hk"));
        tick();
        collaborationService.addComment(ALICE, "project", "p-2", "Elsewhere", null, null);
        collaborationService.deleteComment(BOB, second.getId());

        // When
        PagedResult<Comment> thread = relationshipResolver.resolveCommentThread("project", "p-1", 0, 10);

        // Then
        assertThat(thread.items()).extracting(Comment::getId).containsExactly(first.getId(), third.getId());
        assertEquals(first.getId(), thread.items().get(1).getParentCommentId());
        assertThat(thread.items().get(1).getMentions()).containsExactly("alice@polyu.edu.hk");
    }

    @Test
    void shouldPageCommentThread() {
        for (int i = 0; i < 3; i++) {
            collaborationService.addComment(ALICE, "file", "f-1", "Comment " + i, null, null);
            tick();
        }

        PagedResult<Comment> page = relationshipResolver.resolveCommentThread("file", "f-1", 1, 1);

        assertEquals(3, page.totalCount());
        assertEquals("Comment 1", page.items().get(0).getContent());
        assertTrue(page.hasMore());
    }

    @Test
    void shouldGroupTeamsByMemberSet() {
        // Given
        ResearchProject study = project("Team study");
        projectService.recordCollaboration(ALICE.email(), study.getId(), study.getTitle(), "edited",
                List.of(BOB.email()));
        tick();
        projectService.recordCollaboration(ALICE.email(), study.getId(), study.getTitle(), "reviewed",
                List.of(BOB.email()));
        tick();
        projectService.recordCollaboration(ALICE.email(), study.getId(), study.getTitle(), "planned",
                List.of(CAROL.email(), BOB.email()));

        // When
        List<Team> teams = relationshipResolver.resolveTeams(ALICE.email(), TimeRange.unbounded());

        // Then
        assertThat(teams).hasSize(2);
        Team latest = teams.get(0);
        assertThat(latest.getMembers()).containsExactly(BOB.email(), CAROL.email());
        assertEquals(1, latest.getInteractionCount());

        Team pair = teams.get(1);
        assertEquals(2, pair.getInteractionCount());
        assertThat(pair.getProjects()).containsExactly(study.getId());
        assertEquals("reviewed", pair.getRecentActivities().get(0).action());
        assertEquals(RelationshipResolver.teamId(pair.getMemberKey()), pair.getId());
    }

    @Test
    void shouldShowTeamsToMembersAndRespectTimeRange() {
        ResearchProject study = project("Shared study");
        projectService.recordCollaboration(ALICE.email(), study.getId(), study.getTitle(), "edited",
                List.of(BOB.email()));
        clock.advance(Duration.ofDays(3));

        List<Team> forAlice = relationshipResolver.resolveTeams(ALICE.email(), TimeRange.unbounded());
        List<Team> forBob = relationshipResolver.resolveTeams(BOB.email(), TimeRange.unbounded());
        List<Team> lastDay = relationshipResolver.resolveTeams(ALICE.email(),
                new TimeRange("custom", clock.instant().minus(Duration.ofDays(1)), null));

        assertThat(forBob).extracting(Team::getId).containsExactlyElementsOf(
                forAlice.stream().map(Team::getId).toList());
        assertThat(lastDay).isEmpty();
    }

    @Test
    void shouldKeepFiveMostRecentTeamActivities() {
        ResearchProject study = project("Busy study");
        for (int i = 0; i < 7; i++) {
            projectService.recordCollaboration(ALICE.email(), study.getId(), study.getTitle(), "step-" + i,
                    List.of(BOB.email()));
            tick();
        }

        Team team = relationshipResolver.resolveTeams(ALICE.email(), TimeRange.unbounded()).get(0);

        assertEquals(7, team.getInteractionCount());
        assertThat(team.getRecentActivities()).hasSize(5);
        assertEquals("step-6", team.getRecentActivities().get(0).action());
    }

    @Test
    void shouldResolveInvitationsByDirectionAndResponse() {
        // Given
        ResearchProject study = project("Invite study");
        collaborationService.invite(ALICE, study.getId(), List.of(BOB.email(), CAROL.email()), "editor",
                "Join us", null);

        // When
        List<Invitation> bobReceived = relationshipResolver.resolveInvitations(BOB.email(),
                InvitationDirection.RECEIVED, null);
        List<Invitation> aliceSent = relationshipResolver.resolveInvitations(ALICE.email(),
                InvitationDirection.SENT, "all");
        List<Invitation> aliceReceived = relationshipResolver.resolveInvitations(ALICE.email(),
                InvitationDirection.RECEIVED, null);

        // Then
        assertThat(bobReceived).hasSize(1);
        assertEquals(study.getId(), bobReceived.get(0).getProjectId());
        assertEquals("editor", bobReceived.get(0).getRole());
        assertEquals(Invitation.PENDING, bobReceived.get(0).getResponse());
        assertThat(aliceSent).extracting(Invitation::getInviteeEmail)
                .containsExactlyInAnyOrder(BOB.email(), CAROL.email());
        assertThat(aliceReceived).isEmpty();

        // When bob accepts
        collaborationService.respondToInvitation(BOB, bobReceived.get(0).getId(), "accept", null);

        // Then
        assertThat(relationshipResolver.resolveInvitations(BOB.email(), InvitationDirection.RECEIVED, "accepted"))
                .hasSize(1);
        assertThat(relationshipResolver.resolveInvitations(BOB.email(), InvitationDirection.RECEIVED, "pending"))
                .isEmpty();
        assertThat(relationshipResolver.resolveInvitations(ALICE.email(), InvitationDirection.SENT, "pending"))
                .extracting(Invitation::getInviteeEmail)
                .containsExactly(CAROL.email());
    }

    @Test
    void shouldListListedCollaboratorsBeforeAgentsOnlySeenOnStatements() {
        // Given
        ResearchProject study = project("People study");
        projectService.addCollaborator(ALICE, study.getId(), BOB.email(), "editor", null);
        tick();
        projectService.recordCollaboration("dave@polyu.edu.hk", study.getId(), study.getTitle(), "visited",
                List.of());
        tick();
        projectService.recordCollaboration("erin@polyu.edu.hk", study.getId(), study.getTitle(), "visited",
                List.of("dave@polyu.edu.hk"));

        // When
        List<CollaboratorEntry> entries = relationshipResolver.resolveCollaborators(
                projectService.keyOf(study.getId()));

        // Then
        assertThat(entries).extracting(CollaboratorEntry::getEmail)
                .containsExactly(ALICE.email(), BOB.email(), "dave@polyu.edu.hk", "erin@polyu.edu.hk");
        assertEquals("owner", entries.get(0).getRole());
        assertEquals("editor", entries.get(1).getRole());
        assertTrue(entries.get(1).isListed());
        assertEquals(1, entries.get(1).getInteractions());
        assertFalse(entries.get(2).isListed());
        assertEquals(2, entries.get(2).getInteractions());
        assertEquals(1, entries.get(3).getInteractions());
    }
}
