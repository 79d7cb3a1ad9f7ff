package com.agrinova.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.global.security.AuthenticatedPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the acting user id for JPA auditing.
 * Returns {@code Optional.empty()} for login and refresh calls, which run without a principal.
 */
public class AgrinovaAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof AuthenticatedPrincipal principal) {
            return Optional.ofNullable(principal.userId());
        }
        return Optional.empty();
    }
}
