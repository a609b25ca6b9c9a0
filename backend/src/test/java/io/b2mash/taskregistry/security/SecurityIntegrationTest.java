package io.b2mash.taskregistry.security;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SecurityIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void unauthenticatedRequest_toApi_returns401() throws Exception {
    mockMvc.perform(get("/api/tasks/count")).andExpect(status().isUnauthorized());
  }

  @Test
  void unauthenticatedMutation_returns401() throws Exception {
    mockMvc
        .perform(
            post("/api/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"description": "anonymous", "dueDate": 1, "priority": "LOW"}
                    """))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void authenticatedRequest_withValidJwt_isServed() throws Exception {
    mockMvc
        .perform(get("/api/tasks/count").with(jwt().jwt(j -> j.subject("user_sec_reader"))))
        .andExpect(status().isOk());
  }

  @Test
  void actuatorHealth_isPublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }

  @Test
  void unknownPath_returns403() throws Exception {
    // anyRequest().denyAll() returns 403 for paths outside /api
    mockMvc
        .perform(get("/unknown").with(jwt().jwt(j -> j.subject("user_sec_reader"))))
        .andExpect(status().isForbidden());
  }
}
