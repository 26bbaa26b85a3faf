package hk.edu.hulab.portal.backend.controller;

import hk.edu.hulab.portal.backend.config.IdentityHeaderAuthFilter;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

/**
 * Identity headers as the authentication gateway would set them.
 */
final class GatewayHeaders {

    private GatewayHeaders() {
    }

    static RequestPostProcessor as(String email, String role) {
        return request -> {
            request.addHeader(IdentityHeaderAuthFilter.EMAIL_HEADER, email);
            request.addHeader(IdentityHeaderAuthFilter.ROLE_HEADER, role);
            return request;
        };
    }

    static RequestPostProcessor student(String email) {
        return as(email, "student");
    }

    static RequestPostProcessor admin(String email) {
        return as(email, "admin");
    }
}
