package com.yamdb.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamdb.backend.modules.auth.application.ConfirmationCodeSender;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.policy.domain.Role;
import com.yamdb.backend.support.AbstractPostgresIntegrationTest;
import com.yamdb.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private YamdbUserRepository userRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @MockBean
    private ConfirmationCodeSender confirmationCodeSender;

    @Test
    void signupThenTokenThenProfile() throws Exception {
        String username = "reader-" + UUID.randomUUID().toString().substring(0, 8);
        String email = username + "@example.com";

        signup(email, username)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.username").value(username));
        String code = captureCode(email, username, 1);

        String token = exchange(username, code)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andReturn()
                .getResponse()
                .getContentAsString();
        String accessToken = objectMapper.readTree(token).path("token").asText();

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value(username))
                .andExpect(jsonPath("$.role").value("user"));

        // the code is single use
        exchange(username, code)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_confirmation_code"));
    }

    @Test
    void repeatedSignupReissuesCodeAndInvalidatesOldOne() throws Exception {
        String username = "repeat-" + UUID.randomUUID().toString().substring(0, 8);
        String email = username + "@example.com";

        signup(email, username).andExpect(status().isOk());
        String first = captureCode(email, username, 1);
        signup(email.toUpperCase(), username).andExpect(status().isOk());
        String second = captureCode(email, username, 2);

        assertThat(userRepository.findByUsername(username)).isPresent();
        if (!first.equals(second)) {
            exchange(username, first).andExpect(status().isUnauthorized());
        }
        exchange(username, second).andExpect(status().isOk());
    }

    @Test
    void signupRejectsMismatchedPairAndReservedName() throws Exception {
        YamdbUser existing = testUserFactory.createUser("owner", Role.USER);

        signup("someone-else-" + UUID.randomUUID() + "@example.com", existing.getUsername())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("auth.username_taken"));
        signup(existing.getEmail(), "fresh-" + UUID.randomUUID().toString().substring(0, 8))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("auth.email_taken"));
        signup("me-" + UUID.randomUUID() + "@example.com", "me")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("auth.username_reserved"));
    }

    @Test
    void invalidBearerTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/users/me").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("invalid_access_token"));
    }

    @Test
    void adminManagesUsersAndRoles() throws Exception {
        YamdbUser admin = testUserFactory.createUser("admin", Role.ADMIN);
        YamdbUser target = testUserFactory.createUser("target", Role.USER);
        String adminToken = testUserFactory.bearer(admin);

        mockMvc.perform(patch("/users/" + target.getUsername())
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role": "moderator", "bio": "Keeps threads civil"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("moderator"))
                .andExpect(jsonPath("$.bio").value("Keeps threads civil"));

        mockMvc.perform(get("/users/" + target.getUsername()).header("Authorization", testUserFactory.bearer(target)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/users").param("search", "target").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isArray());

        mockMvc.perform(delete("/users/" + target.getUsername()).header("Authorization", adminToken))
                .andExpect(status().isNoContent());
        assertThat(userRepository.findByUsername(target.getUsername())).isEmpty();
    }

    @Test
    void profileUpdateCannotChangeRole() throws Exception {
        YamdbUser user = testUserFactory.createUser("climber", Role.USER);

        mockMvc.perform(patch("/users/me")
                        .header("Authorization", testUserFactory.bearer(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role": "admin", "firstName": "Ann"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("user"))
                .andExpect(jsonPath("$.firstName").value("Ann"));
    }

    private ResultActions signup(String email, String username) throws Exception {
        return mockMvc.perform(post("/auth/signup")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"email": "%s", "username": "%s"}
                        """.formatted(email, username)));
    }

    private ResultActions exchange(String username, String code) throws Exception {
        return mockMvc.perform(post("/auth/token")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"username": "%s", "confirmation_code": "%s"}
                        """.formatted(username, code)));
    }

    private String captureCode(String email, String username, int expectedCalls) {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(confirmationCodeSender, timeout(5000).times(expectedCalls)).send(eq(email), eq(username), code.capture());
        return code.getValue();
    }
}
