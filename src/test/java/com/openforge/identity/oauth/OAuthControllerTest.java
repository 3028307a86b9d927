package com.openforge.identity.oauth;

import com.openforge.identity.auth.JwtUtil;
import com.openforge.identity.domain.Account;
import com.openforge.identity.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class OAuthControllerTest extends BaseSpringTest {

    private static final String CALLBACK_URI = "http://api.test/api/auth/google/callback";

    @Autowired MockMvc mvc;
    @Autowired JwtUtil jwtUtil;

    @MockBean GoogleOAuthClient google;

    @BeforeEach
    void stubProvider() {
        when(google.name()).thenReturn("google");
        when(google.isEnabled()).thenReturn(true);
    }

    @Test
    void authorize_redirects_with_provider_bound_state() throws Exception {
        when(google.authorizationUrl(anyString(), eq(CALLBACK_URI))).thenReturn("https://accounts.test/auth?x=1");

        mvc.perform(get("/api/auth/google"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://accounts.test/auth?x=1"));

        ArgumentCaptor<String> state = ArgumentCaptor.forClass(String.class);
        verify(google).authorizationUrl(state.capture(), eq(CALLBACK_URI));
        assertThat(jwtUtil.parse(state.getValue(), JwtUtil.TYPE_STATE).get("provider", String.class))
                .isEqualTo("google");
    }

    @Test
    void callback_signs_in_and_hands_tokens_to_frontend() throws Exception {
        when(google.fetchProfile("auth-code", CALLBACK_URI)).thenReturn(
                new OAuthProfile("google", "g-1", "bob@example.com", "Bob", "https://img/b.png"));

        String location = mvc.perform(get("/api/auth/google/callback")
                        .param("code", "auth-code")
                        .param("state", jwtUtil.generateState("google")))
                .andExpect(status().isFound())
                .andReturn().getResponse().getHeader("Location");

        assertThat(location).startsWith("http://app.test/auth/callback?access_token=").contains("&refresh_token=");
        Account bob = accountRepository.findByEmail("bob@example.com").orElseThrow();
        assertThat(bob.getOauthProvider()).isEqualTo("google");
    }

    @Test
    void callback_with_state_for_another_provider_is_refused() throws Exception {
        mvc.perform(get("/api/auth/google/callback")
                        .param("code", "auth-code")
                        .param("state", jwtUtil.generateState("github")))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "http://app.test/login?error=Invalid+state"));

        verify(google, never()).fetchProfile(anyString(), anyString());
    }

    @Test
    void callback_with_forged_state_fails_without_calling_provider() throws Exception {
        mvc.perform(get("/api/auth/google/callback")
                        .param("code", "auth-code")
                        .param("state", "forged"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "http://app.test/login?error=OAuth+failed"));

        verify(google, never()).fetchProfile(anyString(), anyString());
    }

    @Test
    void provider_error_is_sent_back_to_login() throws Exception {
        mvc.perform(get("/api/auth/google/callback").param("error", "access_denied"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "http://app.test/login?error=Authorization+cancelled"));
    }

    @Test
    void provider_failure_is_sent_back_to_login() throws Exception {
        when(google.fetchProfile("auth-code", CALLBACK_URI))
                .thenThrow(new AbstractOAuthClient.OAuthException("google returned HTTP 500"));

        mvc.perform(get("/api/auth/google/callback")
                        .param("code", "auth-code")
                        .param("state", jwtUtil.generateState("google")))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "http://app.test/login?error=OAuth+failed"));
        assertThat(accountRepository.count()).isZero();
    }

    @Test
    void disabled_account_is_not_signed_in() throws Exception {
        Account existing = new Account();
        existing.setUsername("bob");
        existing.setEmail("bob@example.com");
        existing.setActive(false);
        accountRepository.save(existing);
        when(google.fetchProfile("auth-code", CALLBACK_URI)).thenReturn(
                new OAuthProfile("google", "g-1", "bob@example.com", "Bob", null));

        mvc.perform(get("/api/auth/google/callback")
                        .param("code", "auth-code")
                        .param("state", jwtUtil.generateState("google")))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "http://app.test/login?error=Account+is+disabled"));
    }

    @Test
    void unconfigured_provider_answers_501() throws Exception {
        mvc.perform(get("/api/auth/github"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.code").value("OAUTH_NOT_CONFIGURED"));
    }
}
