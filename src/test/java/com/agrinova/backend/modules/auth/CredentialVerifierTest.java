package com.agrinova.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import com.agrinova.backend.modules.auth.application.CredentialVerifier;
import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.domain.AppUserStatus;
import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.modules.auth.domain.HashingSaturatedException;
import com.agrinova.backend.modules.auth.domain.VerifiedIdentity;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.security.application.SecurityEventCommand;
import com.agrinova.backend.modules.security.application.SecurityEventLogger;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;

@ExtendWith(MockitoExtension.class)
class CredentialVerifierTest {

    private static final String DUMMY_HASH = "dummy-hash";

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private SecurityEventLogger securityEventLogger;

    private CredentialVerifier credentialVerifier;
    private AppUser user;

    @BeforeEach
    void setUp() {
        when(passwordEncoder.encode(startsWith("dummy-"))).thenReturn(DUMMY_HASH);
        credentialVerifier = verifierOn(Runnable::run);
        user = TestEntities.user(UUID.randomUUID(), "asisten1", TestEntities.role("ASISTEN"));
    }

    private CredentialVerifier verifierOn(Executor executor) {
        return verifierOn(executor, Duration.ofSeconds(5));
    }

    private CredentialVerifier verifierOn(Executor executor, Duration timeout) {
        return new CredentialVerifier(appUserRepository, passwordEncoder, executor, securityEventLogger, timeout);
    }

    @Test
    void validCredentialsYieldIdentity() {
        when(appUserRepository.findByIdentifier("asisten1")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("Tanjung#Rimba47Q", user.getPasswordHash())).thenReturn(true);

        VerifiedIdentity identity = credentialVerifier.verify("  asisten1 ", "Tanjung#Rimba47Q");

        assertThat(identity.userId()).isEqualTo(user.getId());
        assertThat(identity.role()).isEqualTo("ASISTEN");
    }

    @Test
    void wrongPasswordIsInvalidCredentials() {
        when(appUserRepository.findByIdentifier("asisten1")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", user.getPasswordHash())).thenReturn(false);

        assertThatThrownBy(() -> credentialVerifier.verify("asisten1", "wrong"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(AuthFailureKind.INVALID_CREDENTIALS));
    }

    @Test
    void unknownIdentifierStillPaysForAHashComparison() {
        when(appUserRepository.findByIdentifier("ghost@agrinova.local")).thenReturn(Optional.empty());
        when(passwordEncoder.matches("anything", DUMMY_HASH)).thenReturn(false);

        assertThatThrownBy(() -> credentialVerifier.verify("ghost@agrinova.local", "anything"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(AuthFailureKind.INVALID_CREDENTIALS));
        verify(passwordEncoder).matches("anything", DUMMY_HASH);
    }

    @Test
    void deactivatedAccountIsIndistinguishableFromWrongPassword() {
        user.setStatus(AppUserStatus.INACTIVE);
        when(appUserRepository.findByIdentifier("asisten1")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("Tanjung#Rimba47Q", user.getPasswordHash())).thenReturn(true);

        assertThatThrownBy(() -> credentialVerifier.verify("asisten1", "Tanjung#Rimba47Q"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(AuthFailureKind.INVALID_CREDENTIALS));
    }

    @Test
    void blankIdentifierSkipsLookup() {
        when(passwordEncoder.matches("secret", DUMMY_HASH)).thenReturn(false);

        assertThatThrownBy(() -> credentialVerifier.verify("   ", "secret"))
                .isInstanceOf(AuthException.class);
        verify(appUserRepository, never()).findByIdentifier(anyString());
    }

    @Test
    void saturatedHashingPoolFailsFastAsRateLimited() {
        CredentialVerifier saturated = verifierOn(command -> {
            throw new RejectedExecutionException("queue full");
        });
        when(appUserRepository.findByIdentifier("asisten1")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> saturated.verify("asisten1", "Tanjung#Rimba47Q"))
                .isInstanceOfSatisfying(HashingSaturatedException.class,
                        ex -> assertThat(ex.getRetryAfterSeconds()).isEqualTo(1));

        ArgumentCaptor<SecurityEventCommand> captor = ArgumentCaptor.forClass(SecurityEventCommand.class);
        verify(securityEventLogger).record(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(SecurityEventType.CREDENTIAL_HASHING_SATURATED);
        verify(passwordEncoder, never()).matches(any(), any());
    }

    @Test
    void timedOutHashInterruptsItsWorker() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch interrupted = new CountDownLatch(1);
        try {
            CredentialVerifier slow = verifierOn(pool, Duration.ofMillis(100));
            when(appUserRepository.findByIdentifier("asisten1")).thenReturn(Optional.of(user));
            when(passwordEncoder.matches(any(), any())).thenAnswer(invocation -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException ex) {
                    interrupted.countDown();
                }
                return false;
            });

            assertThatThrownBy(() -> slow.verify("asisten1", "Tanjung#Rimba47Q"))
                    .isInstanceOf(HashingSaturatedException.class);
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void hashingRunsOutsideAnyTransaction() throws Exception {
        assertThat(CredentialVerifier.class.isAnnotationPresent(Transactional.class)).isFalse();
        assertThat(CredentialVerifier.class.getMethod("verify", String.class, String.class)
                .isAnnotationPresent(Transactional.class)).isFalse();
    }
}
