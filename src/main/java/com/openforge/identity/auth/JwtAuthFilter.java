package com.openforge.identity.auth;

import com.openforge.identity.common.AuthException;
import com.openforge.identity.domain.Account;
import com.openforge.identity.repository.AccountRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Reads the access token from the Authorization header on every request.
 *
 * A missing or bad token leaves the request anonymous and lets the chain decide.
 * A valid token for a disabled account also stays anonymous, but the request is
 * marked with {@link #DISABLED_ACCOUNT} so protected routes answer 403, not 401.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    /** Request attribute set when the bearer token belongs to a disabled account. */
    public static final String DISABLED_ACCOUNT = JwtAuthFilter.class.getName() + ".DISABLED_ACCOUNT";

    private final JwtUtil           jwtUtil;
    private final AccountRepository accountRepository;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         chain) throws ServletException, IOException {

        String header = request.getHeader("Authorization");

        if (header != null && header.startsWith("Bearer ")
                && SecurityContextHolder.getContext().getAuthentication() == null) {

            Optional<Account> account = resolve(header.substring(7));

            if (account.isPresent()) {
                Account a = account.get();
                if (!a.isActive()) {
                    request.setAttribute(DISABLED_ACCOUNT, Boolean.TRUE);
                    log.debug("[JWT] Token of disabled accountId={} left anonymous", a.getId());
                    chain.doFilter(request, response);
                    return;
                }
                var principal = new AuthenticatedAccount(a.getId(), a.getUsername(), a.getRole());
                var auth = new UsernamePasswordAuthenticationToken(
                        principal,
                        null,
                        List.of(new SimpleGrantedAuthority(a.getRole().authority()))
                );
                auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("[JWT] Authenticated accountId={} path={}", a.getId(), request.getRequestURI());
            }
        }

        chain.doFilter(request, response);
    }

    private Optional<Account> resolve(String token) {
        try {
            Long id = jwtUtil.accountId(token, JwtUtil.TYPE_ACCESS);
            return accountRepository.findById(id);
        } catch (AuthException e) {
            return Optional.empty();
        }
    }
}
