package hk.edu.hulab.portal.backend.config;

import hk.edu.hulab.portal.backend.BaseE2ETest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
@TestPropertySource(properties = "portal.auth.gateway-key=test-gateway-key")
class GatewayKeyE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldRejectIdentityWithoutGatewayKey() throws Exception {
        mockMvc.perform(get("/api/analytics/options")
                        .header(IdentityHeaderAuthFilter.EMAIL_HEADER, "alice@polyu.edu.hk"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid or missing X-Gateway-Key header"));
    }

    @Test
    void shouldRejectWrongGatewayKey() throws Exception {
        mockMvc.perform(get("/api/analytics/options")
                        .header(IdentityHeaderAuthFilter.EMAIL_HEADER, "alice@polyu.edu.hk")
                        .header(IdentityHeaderAuthFilter.GATEWAY_KEY_HEADER, "guess"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldAcceptIdentityWithGatewayKey() throws Exception {
        mockMvc.perform(get("/api/analytics/options")
                        .header(IdentityHeaderAuthFilter.EMAIL_HEADER, "alice@polyu.edu.hk")
                        .header(IdentityHeaderAuthFilter.GATEWAY_KEY_HEADER, "test-gateway-key"))
                .andExpect(status().isOk());
    }

    @Test
    void shouldLeavePublicEndpointsOpen() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk());
    }
}
