package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

public enum UserRole {
    STUDENT(Set.of("view_own_analytics", "submit_assessment", "collaborate", "use_ai", "view_content")),
    EDUCATOR(Set.of("view_analytics", "create_assessment", "manage_students", "create_content",
            "view_all_projects", "export_data")),
    RESEARCHER(Set.of("create_project", "view_analytics", "collaborate", "use_ai", "export_data")),
    ADMIN(Set.of("all"));

    private final Set<String> permissions;

    UserRole(Set<String> permissions) {
        this.permissions = permissions;
    }

    public boolean allows(String permission) {
        return permissions.contains("all") || permissions.contains(permission);
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UserRole fromKey(String key) {
        if (key == null || key.isBlank()) {
            return STUDENT;
        }
        for (UserRole role : values()) {
            if (role.key().equalsIgnoreCase(key.trim())) {
                return role;
            }
        }
        return STUDENT;
    }
}
