package com.agrinova.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.agrinova.backend.modules.auth.application.AuthenticatedSession;
import com.agrinova.backend.modules.auth.application.SessionOrchestrator;
import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.global.web.RequestIdFilter;
import com.agrinova.backend.modules.auth.domain.TokenClaims;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer access tokens. A rejected token leaves the request anonymous and records the failure
 * kind so {@link RestAuthenticationEntryPoint} can report it.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".failure";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String ROLE_PREFIX = "ROLE_";

    private final SessionOrchestrator sessionOrchestrator;

    public JwtAuthenticationFilter(SessionOrchestrator sessionOrchestrator) {
        this.sessionOrchestrator = sessionOrchestrator;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Optional<String> token = BearerTokens.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isPresent()) {
            try {
                AuthenticatedSession session = sessionOrchestrator.authenticate(token.get());
                authenticate(request, session, token.get());
            } catch (AuthException ex) {
                SecurityContextHolder.clearContext();
                RequestIdFilter.unbindSession();
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ex.getKind());
            } catch (DataAccessException | TransactionException ex) {
                log.error("Auth store unavailable while authenticating {}", request.getRequestURI(), ex);
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, AuthFailureKind.STORE_UNAVAILABLE);
            }
        }
        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, AuthenticatedSession session, String token) {
        TokenClaims claims = session.claims();
        Set<String> permissions = session.permissions().names();
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        permissions.forEach(permission -> authorities.add(new SimpleGrantedAuthority(permission)));
        if (claims.role() != null) {
            authorities.add(new SimpleGrantedAuthority(ROLE_PREFIX + claims.role()));
        }

        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(
                claims.userId(),
                claims.role(),
                claims.companyId(),
                claims.deviceId(),
                claims.lineageId(),
                permissions
        );
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        RequestIdFilter.bindSession(claims.userId(), claims.lineageId());
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return path.equals("/auth/login")
                || path.equals("/auth/refresh")
                || path.equals("/auth/logout")
                || path.equals("/auth/authorize")
                || path.startsWith("/auth/offline/")
                || path.equals("/health")
                || path.equals("/readyz")
                || path.startsWith("/actuator/health")
                || path.startsWith("/v3/api-docs")
                || path.startsWith("/swagger-ui");
    }
}
