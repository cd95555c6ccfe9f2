package com.flagship.stock_orders.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.stock_orders.security.dto.LoginRequest;
import com.flagship.stock_orders.support.IntegrationTestSupport;
import com.flagship.stock_orders.user.UserEntity;
import com.flagship.stock_orders.user.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AuthControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String loginJson(String username, String password) throws Exception {
        return objectMapper.writeValueAsString(LoginRequest.builder().username(username).password(password).build());
    }

    @Test
    @DisplayName("Valid credentials return a bearer token that authenticates later requests")
    void loginIssuesUsableToken() throws Exception {
        UserEntity keeper = createUser(UserRole.STORE_KEEPER);

        MvcResult result = mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginJson(keeper.getUsername(), "password")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tokenType").value("Bearer"))
            .andExpect(jsonPath("$.user.username").value(keeper.getUsername()))
            .andExpect(jsonPath("$.user.role").value("STORE_KEEPER"))
            .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        String token = body.get("token").asText();

        Optional<UserPrincipal> principal = jwtTokenProvider.parse(token);
        assertTrue(principal.isPresent());
        assertEquals(keeper.getId(), principal.get().getUserId());
        assertEquals(UserRole.STORE_KEEPER, principal.get().getRole());

        mockMvc.perform(get("/api/orders").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Wrong password, unknown user and inactive account all get 401")
    void loginFailures() throws Exception {
        UserEntity rep = createUser(UserRole.SALES_REPRESENTATIVE);

        mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginJson(rep.getUsername(), "wrong-password")))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("unauthorized"));

        mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginJson("nobody", "password")))
            .andExpect(status().isUnauthorized());

        userService.updateStatus(rep.getId(), false);
        mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginJson(rep.getUsername(), "password")))
            .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Blank credentials fail request validation")
    void blankCredentials() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"\",\"password\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_failed"));
    }

    @Test
    @DisplayName("Health endpoint is public")
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk());
    }
}
