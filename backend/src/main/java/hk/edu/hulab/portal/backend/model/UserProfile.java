package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Profile document kept in the {@code user-profile} agent blob.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserProfile {

    private String id;
    private String email;
    private String name;
    private String firstName;
    private String lastName;
    private String avatar;
    private String provider;
    private UserRole role;
    private Permissions permissions;
    private Preferences preferences;
    private int loginCount;
    private Instant lastLogin;
    private Instant createdAt;
    private Instant updatedAt;
    private int version;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Permissions {
        private boolean canCreateProjects;
        private boolean canUploadFiles;
        private boolean canCollaborate;
        private boolean canUseAI;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Preferences {
        @Builder.Default
        private String theme = "light";
        @Builder.Default
        private String language = "en";
        @Builder.Default
        private boolean notifications = true;
        @Builder.Default
        private boolean emailNotifications = true;
    }
}
