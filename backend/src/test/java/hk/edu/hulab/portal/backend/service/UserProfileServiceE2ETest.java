package hk.edu.hulab.portal.backend.service;

import hk.edu.hulab.portal.backend.BaseE2ETest;
import hk.edu.hulab.portal.backend.dto.LoginRequest;
import hk.edu.hulab.portal.backend.exception.NotFoundException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.lrs.StatementQuery;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.UserProfile;
import hk.edu.hulab.portal.backend.model.UserRole;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class UserProfileServiceE2ETest extends BaseE2ETest {

    @Autowired
    private UserProfileService userProfileService;

    private List<Statement> statements(String verbId) {
        return eventLog.query(StatementQuery.builder().verb(verbId).build()).toList();
    }

    @Test
    void shouldCreateProfileOnFirstLogin() {
        // When
        UserProfile profile = userProfileService.recordLogin("Research.Lead@PolyU.edu.hk", LoginRequest.builder()
                .name("Lead Researcher")
                .provider("google")
                .build());

        // Then
        assertEquals("research.lead@polyu.edu.hk", profile.getEmail());
        assertEquals(UserRole.RESEARCHER, profile.getRole());
        assertEquals(1, profile.getLoginCount());
        assertEquals(1, profile.getVersion());
        assertEquals(START, profile.getCreatedAt());
        assertTrue(profile.getPermissions().isCanCreateProjects());

        List<Statement> registered = statements(Vocabulary.REGISTERED.getId());
        assertThat(registered).hasSize(1);
        assertEquals(Vocabulary.PORTAL_ACTIVITY, registered.get(0).getObject().getId());
        assertEquals("Lead Researcher", registered.get(0).getActor().getName());
    }

    @Test
    void shouldCountRepeatedLogins() {
        userProfileService.recordLogin(ALICE.email(), LoginRequest.builder().name("Alice").build());
        clock.advance(Duration.ofHours(1));

        UserProfile profile = userProfileService.recordLogin(ALICE.email(), LoginRequest.builder()
                .avatar("https://example.com/alice.png")
                .build());

        assertEquals(2, profile.getLoginCount());
        assertEquals(2, profile.getVersion());
        assertEquals("Alice", profile.getName());
        assertEquals("https://example.com/alice.png", profile.getAvatar());
        assertEquals(START, profile.getCreatedAt());
        assertEquals(START.plus(Duration.ofHours(1)), profile.getLastLogin());
        assertThat(statements(Vocabulary.REGISTERED.getId())).hasSize(1);
    }

    @Test
    void shouldIgnoreProtectedFieldsOnUpdate() {
        userProfileService.recordLogin(ALICE.email(), LoginRequest.builder().name("Alice").provider("google").build());

        UserProfile updated = userProfileService.updateProfile(ALICE.email(), Map.of(
                "email", "mallory@example.com",
                "provider", "github",
                "loginCount", 99,
                "role", "admin",
                "name", "Alice Chan"));

        assertEquals(ALICE.email(), updated.getEmail());
        assertEquals("google", updated.getProvider());
        assertEquals(1, updated.getLoginCount());
        assertEquals(UserRole.STUDENT, updated.getRole());
        assertEquals("Alice Chan", updated.getName());
        assertEquals(2, updated.getVersion());
        assertEquals("Alice Chan", userProfileService.getProfile(ALICE.email()).getName());
        assertThat(statements(Vocabulary.UPDATED.getId())).singleElement()
                .satisfies(s -> assertEquals(Vocabulary.address("profile", ALICE.email()), s.getObject().getId()));
    }

    @Test
    void shouldRejectUnreadablePatchValue() {
        userProfileService.recordLogin(ALICE.email(), null);

        assertThrows(ValidationException.class,
                () -> userProfileService.updateProfile(ALICE.email(), Map.of("preferences", List.of(1, 2))));
    }

    @Test
    void shouldRaiseNotFoundForMissingProfile() {
        assertThrows(NotFoundException.class, () -> userProfileService.getProfile("nobody@polyu.edu.hk"));
        assertThrows(NotFoundException.class,
                () -> userProfileService.updateProfile("nobody@polyu.edu.hk", Map.of("name", "x")));
        assertTrue(userProfileService.findProfile("nobody@polyu.edu.hk").isEmpty());
        assertThrows(ValidationException.class, () -> userProfileService.findProfile(" "));
    }

    @Test
    void shouldDeriveRoleFromInstitutionalAddress() {
        assertEquals(UserRole.ADMIN, UserProfileService.determineRole("it.admin@polyu.edu.hk"));
        assertEquals(UserRole.EDUCATOR, UserProfileService.determineRole("faculty.chan@polyu.edu.hk"));
        assertEquals(UserRole.EDUCATOR, UserProfileService.determineRole("prof.lee@polyu.edu.hk"));
        assertEquals(UserRole.RESEARCHER, UserProfileService.determineRole("research.team@polyu.edu.hk"));
        assertEquals(UserRole.STUDENT, UserProfileService.determineRole("admin@gmail.com"));
        assertEquals(UserRole.STUDENT, UserProfileService.determineRole("alice@polyu.edu.hk"));
    }

    @Test
    void shouldCheckPermissionsAgainstStoredRole() {
        userProfileService.recordLogin("research.team@polyu.edu.hk", null);

        assertTrue(userProfileService.hasPermission("research.team@polyu.edu.hk", "create_project"));
        assertFalse(userProfileService.hasPermission("research.team@polyu.edu.hk", "manage_students"));
        assertFalse(userProfileService.hasPermission("stranger@polyu.edu.hk", "create_project"));
        assertTrue(userProfileService.hasPermission("stranger@polyu.edu.hk", "view_content"));
        assertTrue(userProfileService.hasPermission(UserRole.ADMIN, "anything"));
        assertTrue(userProfileService.canCreateProjects("stranger@polyu.edu.hk"));
    }
}
