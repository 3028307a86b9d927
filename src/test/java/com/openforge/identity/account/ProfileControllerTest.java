package com.openforge.identity.account;

import com.openforge.identity.auth.AuthService;
import com.openforge.identity.auth.JwtUtil;
import com.openforge.identity.domain.Account;
import com.openforge.identity.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class ProfileControllerTest extends BaseSpringTest {

    @Autowired MockMvc     mvc;
    @Autowired AuthService authService;
    @Autowired JwtUtil     jwtUtil;

    private String token;

    @BeforeEach
    void signIn() {
        Account alice = authService.register("alice", "alice@example.com", "secret1");
        token = "Bearer " + jwtUtil.generateAccess(alice);
    }

    @Test
    void profile_shows_own_view() throws Exception {
        mvc.perform(get("/api/user/profile").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("alice@example.com"))
                .andExpect(jsonPath("$.user.is_active").value(true))
                .andExpect(jsonPath("$.user.created_at").isNotEmpty());
    }

    @Test
    void profile_update_changes_only_given_fields() throws Exception {
        mvc.perform(put("/api/user/profile").header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"avatar_url\":\"https://img/a.png\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.username").value("alice"))
                .andExpect(jsonPath("$.user.avatar_url").value("https://img/a.png"));
    }

    @Test
    void taken_username_is_a_conflict() throws Exception {
        authService.register("bob", "bob@example.com", "secret1");

        mvc.perform(put("/api/user/profile").header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("USERNAME_TAKEN"));
    }

    @Test
    void change_password_then_login_with_new_one() throws Exception {
        mvc.perform(put("/api/user/password").header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"old_password\":\"wrong-one\",\"new_password\":\"brandnew\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("WRONG_PASSWORD"));

        mvc.perform(put("/api/user/password").header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"old_password\":\"secret1\",\"new_password\":\"brandnew\"}"))
                .andExpect(status().isOk());

        mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"brandnew\"}"))
                .andExpect(status().isOk());
    }
}
