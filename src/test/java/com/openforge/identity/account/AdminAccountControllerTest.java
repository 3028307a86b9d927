package com.openforge.identity.account;

import com.openforge.identity.auth.AuthService;
import com.openforge.identity.auth.JwtUtil;
import com.openforge.identity.domain.Account;
import com.openforge.identity.domain.Role;
import com.openforge.identity.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class AdminAccountControllerTest extends BaseSpringTest {

    @Autowired MockMvc     mvc;
    @Autowired AuthService authService;
    @Autowired JwtUtil     jwtUtil;

    private Account user;
    private String  userToken;
    private String  adminToken;

    @BeforeEach
    void accounts() {
        user = authService.register("alice", "alice@example.com", "secret1");
        userToken = "Bearer " + jwtUtil.generateAccess(user);

        Account admin = authService.register("root", "root@example.com", "secret1");
        admin.setRole(Role.ADMIN);
        admin = accountRepository.save(admin);
        adminToken = "Bearer " + jwtUtil.generateAccess(admin);
    }

    @Test
    void plain_users_cannot_reach_admin_endpoints() throws Exception {
        mvc.perform(put("/api/admin/accounts/{id}/active", user.getId())
                        .header("Authorization", userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":false}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        assertThat(accountRepository.findById(user.getId()).orElseThrow().isActive()).isTrue();
    }

    @Test
    void disabling_an_account_locks_out_its_existing_tokens() throws Exception {
        mvc.perform(put("/api/admin/accounts/{id}/active", user.getId())
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_active").value(false));

        mvc.perform(get("/api/user/profile").header("Authorization", userToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCOUNT_DISABLED"));
    }

    @Test
    void role_change_accepts_only_known_roles() throws Exception {
        mvc.perform(put("/api/admin/accounts/{id}/role", user.getId())
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"Admin\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("admin"));

        mvc.perform(put("/api/admin/accounts/{id}/role", user.getId())
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"superuser\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ROLE"));
    }

    @Test
    void delete_removes_account_and_unknown_id_is_404() throws Exception {
        mvc.perform(delete("/api/admin/accounts/{id}", user.getId()).header("Authorization", adminToken))
                .andExpect(status().isNoContent());
        assertThat(accountRepository.findById(user.getId())).isEmpty();

        mvc.perform(delete("/api/admin/accounts/{id}", user.getId()).header("Authorization", adminToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
