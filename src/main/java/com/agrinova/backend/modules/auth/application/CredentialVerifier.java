package com.agrinova.backend.modules.auth.application;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.modules.auth.domain.HashingSaturatedException;
import com.agrinova.backend.modules.auth.domain.VerifiedIdentity;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.security.application.SecurityEventCommand;
import com.agrinova.backend.modules.security.application.SecurityEventLogger;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Checks an identifier (username or email) and secret against the stored Argon2id hash.
 * <p>
 * Unknown identifiers are verified against a dummy hash, and unknown, wrong and deactivated all fail with
 * the same {@link AuthFailureKind#INVALID_CREDENTIALS}. Hashing runs on {@code credentialHashingExecutor}
 * and never inside a transaction, so a slow hash holds no database connection. A saturated pool fails fast
 * with {@link HashingSaturatedException}.
 */
@Service
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);
    private static final long SATURATED_RETRY_AFTER_SECONDS = 1;

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final Executor hashingExecutor;
    private final SecurityEventLogger securityEventLogger;
    private final Duration hashingTimeout;
    private final String dummyHash;

    public CredentialVerifier(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            @Qualifier("credentialHashingExecutor") Executor hashingExecutor,
            SecurityEventLogger securityEventLogger,
            @Value("${agrinova.credentials.hashing-timeout:PT5S}") Duration hashingTimeout
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.hashingExecutor = hashingExecutor;
        this.securityEventLogger = securityEventLogger;
        this.hashingTimeout = hashingTimeout;
        this.dummyHash = passwordEncoder.encode("dummy-" + UUID.randomUUID());
    }

    public VerifiedIdentity verify(String identifier, String secret) {
        String normalized = identifier == null ? "" : identifier.trim();
        Optional<AppUser> user = normalized.isEmpty()
                ? Optional.empty()
                : appUserRepository.findByIdentifier(normalized);

        String storedHash = user.map(AppUser::getPasswordHash).orElse(dummyHash);
        String presented = secret == null ? "" : secret;
        boolean matches = onHashingPool(() -> passwordEncoder.matches(presented, storedHash));

        if (user.isEmpty() || !matches || !user.get().isActive()) {
            throw new AuthException(AuthFailureKind.INVALID_CREDENTIALS);
        }
        return VerifiedIdentity.from(user.get());
    }

    public boolean matches(String secret, String storedHash) {
        return onHashingPool(() -> passwordEncoder.matches(secret, storedHash));
    }

    public String hash(String secret) {
        return onHashingPool(() -> passwordEncoder.encode(secret));
    }

    private <T> T onHashingPool(Supplier<T> task) {
        FutureTask<T> future = new FutureTask<>(task::get);
        try {
            hashingExecutor.execute(future);
        } catch (RejectedExecutionException ex) {
            reportSaturation("queue_full");
            throw new HashingSaturatedException(SATURATED_RETRY_AFTER_SECONDS, ex);
        }
        try {
            return future.get(hashingTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            // interrupts the worker, or drops the task if it is still queued
            future.cancel(true);
            reportSaturation("timeout");
            throw new HashingSaturatedException(SATURATED_RETRY_AFTER_SECONDS, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while hashing credentials", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Credential hashing failed", cause);
        }
    }

    private void reportSaturation(String reason) {
        log.warn("Credential hashing pool saturated ({})", reason);
        securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.CREDENTIAL_HASHING_SATURATED,
                        SecurityOutcome.FAILURE)
                .withDetail(Map.of("reason", reason)));
    }
}
