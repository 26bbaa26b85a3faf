package hk.edu.hulab.portal.backend.config;

import java.util.Locale;

/**
 * Caller identity established by {@link IdentityHeaderAuthFilter}.
 */
public record PortalPrincipal(String email, String role) {

    public static final String ADMIN = "admin";

    public PortalPrincipal {
        email = email.trim().toLowerCase(Locale.ROOT);
        role = role == null || role.isBlank() ? "student" : role.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isAdmin() {
        return ADMIN.equals(role);
    }
}
