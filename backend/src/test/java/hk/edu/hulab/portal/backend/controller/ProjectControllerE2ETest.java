package hk.edu.hulab.portal.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import hk.edu.hulab.portal.backend.BaseE2ETest;
import hk.edu.hulab.portal.backend.dto.CreateProjectRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static hk.edu.hulab.portal.backend.controller.GatewayHeaders.student;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class ProjectControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createProject(String title) throws Exception {
        CreateProjectRequest request = CreateProjectRequest.builder()
                .title(title)
                .description("Studio feedback study")
                .build();
        String body = mockMvc.perform(post("/api/research/projects")
                        .with(student("alice@polyu.edu.hk"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode created = objectMapper.readTree(body);
        return created.get("id").asText();
    }

    @Test
    void shouldReturnUnauthorizedWithoutIdentity() throws Exception {
        mockMvc.perform(get("/api/research/projects"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldAccessHealthEndpointWithoutAuth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.store").value("connected"));
    }

    @Test
    void shouldAccessSwaggerWithoutAuth() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void shouldCreateAndFetchProject() throws Exception {
        String projectId = createProject("Alpha");

        mockMvc.perform(get("/api/research/projects/" + projectId)
                        .with(student("alice@polyu.edu.hk")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Alpha"))
                .andExpect(jsonPath("$.createdBy").value("alice@polyu.edu.hk"))
                .andExpect(jsonPath("$.currentPhase").value("resource"))
                .andExpect(jsonPath("$.version").value(1));
    }

    @Test
    void shouldReportValidationErrorsInErrorBody() throws Exception {
        mockMvc.perform(post("/api/research/projects")
                        .with(student("alice@polyu.edu.hk"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Alpha\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("description: Description is required"))
                .andExpect(jsonPath("$.timestamp").value(START.toString()))
                .andExpect(jsonPath("$.path").value("/api/research/projects"));
    }

    @Test
    void shouldForbidStrangers() throws Exception {
        String projectId = createProject("Alpha");

        mockMvc.perform(get("/api/research/projects/" + projectId)
                        .with(student("bob@polyu.edu.hk")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void shouldReturnNotFoundForUnknownProject() throws Exception {
        mockMvc.perform(get("/api/research/projects/missing")
                        .with(student("alice@polyu.edu.hk")))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectStaleUpdate() throws Exception {
        String projectId = createProject("Alpha");
        tick();

        mockMvc.perform(put("/api/research/projects/" + projectId)
                        .with(student("alice@polyu.edu.hk"))
                        .param("expectedVersion", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("title", "Beta"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2));

        mockMvc.perform(put("/api/research/projects/" + projectId)
                        .with(student("alice@polyu.edu.hk"))
                        .param("expectedVersion", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("title", "Gamma"))))
                .andExpect(status().isConflict());
    }

    @Test
    void shouldAdvancePhaseAndListCollaborators() throws Exception {
        String projectId = createProject("Alpha");
        tick();

        mockMvc.perform(post("/api/research/projects/" + projectId + "/collaborate")
                        .with(student("alice@polyu.edu.hk"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"collaboratorEmail\":\"Bob@PolyU.edu.hk\",\"role\":\"editor\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("bob@polyu.edu.hk"));
        tick();

        mockMvc.perform(post("/api/research/projects/" + projectId + "/phase/information")
                        .with(student("bob@polyu.edu.hk")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentPhase").value("information"));

        mockMvc.perform(get("/api/research/projects/" + projectId + "/collaborators")
                        .with(student("alice@polyu.edu.hk")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].email").value("alice@polyu.edu.hk"))
                .andExpect(jsonPath("$[1].email").value("bob@polyu.edu.hk"));
    }

    @Test
    void shouldOnlyLetCreatorDelete() throws Exception {
        String projectId = createProject("Alpha");
        tick();

        mockMvc.perform(delete("/api/research/projects/" + projectId)
                        .with(student("bob@polyu.edu.hk")))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/api/research/projects/" + projectId)
                        .with(student("alice@polyu.edu.hk")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"));

        mockMvc.perform(get("/api/research/projects")
                        .with(student("alice@polyu.edu.hk")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(0));
    }

    @Test
    void shouldListWithMaximumLimit() throws Exception {
        createProject("Alpha");
        tick();
        createProject("Beta");

        mockMvc.perform(get("/api/research/projects")
                        .param("offset", "1")
                        .param("limit", String.valueOf(Integer.MAX_VALUE))
                        .with(student("alice@polyu.edu.hk")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(2))
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.hasMore").value(false));
    }
}
