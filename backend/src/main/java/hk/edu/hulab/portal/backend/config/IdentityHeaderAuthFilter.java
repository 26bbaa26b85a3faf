package hk.edu.hulab.portal.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Turns the identity headers set by the upstream authentication gateway into a Spring Security
 * authentication. When a gateway key is configured, requests without the matching
 * X-Gateway-Key header are rejected before any identity is accepted.
 */
@Component
public class IdentityHeaderAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(IdentityHeaderAuthFilter.class);

    public static final String EMAIL_HEADER = "X-Authenticated-Email";
    public static final String ROLE_HEADER = "X-Authenticated-Role";
    public static final String GATEWAY_KEY_HEADER = "X-Gateway-Key";

    @Value("${portal.auth.gateway-key:}")
    private String gatewayKey;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String email = request.getHeader(EMAIL_HEADER);

        // Anonymous request, let the authorization rules decide
        if (email == null || email.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        if (gatewayKey != null && !gatewayKey.isBlank() && !gatewayKey.equals(request.getHeader(GATEWAY_KEY_HEADER))) {
            log.warn("Rejected identity header for {} without a valid gateway key", email);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write("{\"error\":\"Invalid or missing X-Gateway-Key header\"}");
            return;
        }

        PortalPrincipal principal = new PortalPrincipal(email, request.getHeader(ROLE_HEADER));
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal, null,
                List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().toUpperCase(Locale.ROOT))));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }
}
