package hk.edu.hulab.portal.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import hk.edu.hulab.portal.backend.dto.LoginRequest;
import hk.edu.hulab.portal.backend.exception.NotFoundException;
import hk.edu.hulab.portal.backend.exception.UpstreamException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.lrs.Blob;
import hk.edu.hulab.portal.backend.lrs.BlobKey;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import hk.edu.hulab.portal.backend.model.UserProfile;
import hk.edu.hulab.portal.backend.model.UserRole;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * User profiles, kept in the {@code user-profile} agent blob of each user.
 */
@Service
public class UserProfileService {

    private static final Logger log = LoggerFactory.getLogger(UserProfileService.class);

    private static final String INSTITUTION_DOMAIN = "@polyu.edu.hk";
    private static final Set<String> PROTECTED_FIELDS = Set.of("id", "email", "provider", "createdAt", "role", "permissions");
    private static final Set<String> BOOKKEEPING_FIELDS = Set.of("updatedAt", "version", "loginCount", "lastLogin");

    private final EventLogClient eventLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UserProfileService(EventLogClient eventLog, ObjectMapper objectMapper, Clock clock) {
        this.eventLog = eventLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Create the profile on first sign-in, otherwise refresh identity fields and count the login.
     */
    public UserProfile recordLogin(String email, LoginRequest identity) {
        String agent = normalize(email);
        LoginRequest attributes = identity != null ? identity : new LoginRequest();
        Instant now = clock.instant();

        Optional<UserProfile> existing = findProfile(agent);
        if (existing.isPresent()) {
            UserProfile profile = existing.get();
            if (attributes.getName() != null) {
                profile.setName(attributes.getName());
            }
            if (attributes.getFirstName() != null) {
                profile.setFirstName(attributes.getFirstName());
            }
            if (attributes.getLastName() != null) {
                profile.setLastName(attributes.getLastName());
            }
            if (attributes.getAvatar() != null) {
                profile.setAvatar(attributes.getAvatar());
            }
            if (profile.getRole() == null) {
                profile.setRole(determineRole(agent));
            }
            profile.setLoginCount(profile.getLoginCount() + 1);
            profile.setLastLogin(now);
            profile.setUpdatedAt(now);
            profile.setVersion(profile.getVersion() + 1);
            save(agent, profile);
            log.info("Recorded login #{} for {}", profile.getLoginCount(), agent);
            return profile;
        }

        UserProfile profile = UserProfile.builder()
                .id(attributes.getId() != null ? attributes.getId() : agent)
                .email(agent)
                .name(attributes.getName() != null ? attributes.getName() : agent.split("@")[0])
                .firstName(attributes.getFirstName())
                .lastName(attributes.getLastName())
                .avatar(attributes.getAvatar())
                .provider(attributes.getProvider())
                .role(determineRole(agent))
                .permissions(UserProfile.Permissions.builder()
                        .canCreateProjects(true)
                        .canUploadFiles(true)
                        .canCollaborate(true)
                        .canUseAI(true)
                        .build())
                .preferences(UserProfile.Preferences.builder().build())
                .loginCount(1)
                .lastLogin(now)
                .createdAt(now)
                .updatedAt(now)
                .version(1)
                .build();
        save(agent, profile);

        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(agent, profile.getName()))
                .verb(Vocabulary.REGISTERED)
                .object(Activity.of(Vocabulary.PORTAL_ACTIVITY, Vocabulary.TYPE_APPLICATION, Vocabulary.PLATFORM))
                .context(StatementContext.builder()
                        .platform(Vocabulary.PLATFORM)
                        .language(Vocabulary.LANGUAGE)
                        .build())
                .build());
        log.info("Created profile for {} with role {}", agent, profile.getRole().key());
        return profile;
    }

    public Optional<UserProfile> findProfile(String email) {
        String agent = normalize(email);
        Optional<Blob> blob = eventLog.getBlob(BlobKey.userProfile(agent));
        if (blob.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(blob.get().content(), UserProfile.class));
        } catch (IOException e) {
            log.error("Unreadable profile of {}: {}", agent, e.getMessage());
            throw new UpstreamException("Stored profile of " + agent + " is unreadable", 200, false);
        }
    }

    public UserProfile getProfile(String email) {
        return findProfile(email).orElseThrow(() -> NotFoundException.of("profile", normalize(email)));
    }

    /**
     * Merge {@code patch} into the profile. Identity fields and bookkeeping are kept as stored.
     */
    public UserProfile updateProfile(String email, Map<String, Object> patch) {
        String agent = normalize(email);
        UserProfile current = getProfile(agent);
        ObjectNode node = objectMapper.valueToTree(current);
        if (patch != null) {
            patch.forEach((field, value) -> {
                if (PROTECTED_FIELDS.contains(field) || BOOKKEEPING_FIELDS.contains(field)) {
                    log.debug("Ignoring protected profile field '{}' for {}", field, agent);
                    return;
                }
                JsonNode patchValue = value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
                node.set(field, patchValue);
            });
        }

        UserProfile updated;
        try {
            updated = objectMapper.treeToValue(node, UserProfile.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid profile update: " + e.getOriginalMessage());
        }
        updated.setUpdatedAt(clock.instant());
        updated.setVersion(current.getVersion() + 1);
        save(agent, updated);

        eventLog.append(Statement.builder()
                .actor(Actor.ofEmail(agent, updated.getName()))
                .verb(Vocabulary.UPDATED)
                .object(Activity.of(Vocabulary.address("profile", agent), Vocabulary.TYPE_PROFILE, "User Profile"))
                .build());
        log.info("Updated profile of {} ({})", agent, patch != null ? patch.keySet() : Set.of());
        return updated;
    }

    public boolean hasPermission(UserRole role, String permission) {
        return (role != null ? role : UserRole.STUDENT).allows(permission);
    }

    /**
     * Permission check against the stored role; agents without a profile are students.
     */
    public boolean hasPermission(String email, String permission) {
        return hasPermission(findProfile(email).map(UserProfile::getRole).orElse(UserRole.STUDENT), permission);
    }

    /**
     * Whether the profile allows creating projects. Agents without a profile get the default permissions.
     */
    public boolean canCreateProjects(String email) {
        return findProfile(email)
                .map(UserProfile::getPermissions)
                .map(UserProfile.Permissions::isCanCreateProjects)
                .orElse(true);
    }

    static UserRole determineRole(String email) {
        String agent = email.toLowerCase(Locale.ROOT);
        if (agent.endsWith(INSTITUTION_DOMAIN)) {
            if (agent.contains("admin")) {
                return UserRole.ADMIN;
            }
            if (agent.contains("faculty") || agent.contains("prof")) {
                return UserRole.EDUCATOR;
            }
            if (agent.contains("research")) {
                return UserRole.RESEARCHER;
            }
        }
        return UserRole.STUDENT;
    }

    private void save(String agent, UserProfile profile) {
        try {
            eventLog.putBlob(BlobKey.userProfile(agent), objectMapper.writeValueAsBytes(profile));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot serialize profile of " + agent + ": " + e.getOriginalMessage());
        }
    }

    private static String normalize(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationException("email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
