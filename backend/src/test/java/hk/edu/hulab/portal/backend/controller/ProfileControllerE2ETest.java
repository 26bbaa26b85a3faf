package hk.edu.hulab.portal.backend.controller;

import hk.edu.hulab.portal.backend.BaseE2ETest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static hk.edu.hulab.portal.backend.controller.GatewayHeaders.student;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class ProfileControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldReturnNotFoundBeforeFirstLogin() throws Exception {
        mockMvc.perform(get("/api/profile").with(student("alice@polyu.edu.hk")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void shouldCreateProfileOnLogin() throws Exception {
        mockMvc.perform(post("/api/profile/login")
                        .with(student("Alice@PolyU.edu.hk"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Alice Chan\",\"provider\":\"google\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("alice@polyu.edu.hk"))
                .andExpect(jsonPath("$.name").value("Alice Chan"))
                .andExpect(jsonPath("$.role").value("student"))
                .andExpect(jsonPath("$.loginCount").value(1));

        mockMvc.perform(get("/api/profile").with(student("alice@polyu.edu.hk")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.provider").value("google"));
    }

    @Test
    void shouldKeepRoleOnProfileUpdate() throws Exception {
        mockMvc.perform(post("/api/profile/login").with(student("alice@polyu.edu.hk")))
                .andExpect(status().isOk());
        tick();

        mockMvc.perform(put("/api/profile")
                        .with(student("alice@polyu.edu.hk"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Alice C.\",\"role\":\"admin\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Alice C."))
                .andExpect(jsonPath("$.role").value("student"));
    }

    @Test
    void shouldCheckPermissionsAgainstStoredRole() throws Exception {
        mockMvc.perform(get("/api/profile/permissions")
                        .with(student("alice@polyu.edu.hk"))
                        .param("permission", "collaborate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.granted").value(true));

        mockMvc.perform(get("/api/profile/permissions")
                        .with(student("alice@polyu.edu.hk"))
                        .param("permission", "create_project"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.granted").value(false));
    }
}
