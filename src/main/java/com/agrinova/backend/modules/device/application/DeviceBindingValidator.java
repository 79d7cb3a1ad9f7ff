package com.agrinova.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.modules.auth.domain.ClientPlatform;
import com.agrinova.backend.modules.device.domain.DeviceBinding;
import com.agrinova.backend.modules.device.domain.DeviceBindingState;
import com.agrinova.backend.modules.device.domain.DeviceValidationResult;
import com.agrinova.backend.modules.device.infrastructure.persistence.DeviceBindingRepository;
import com.agrinova.backend.modules.security.application.SecurityEventCommand;
import com.agrinova.backend.modules.security.application.SecurityEventLogger;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trust-on-first-use device binding for mobile logins.
 * <ul>
 *     <li>no binding: register and accept</li>
 *     <li>bound, same fingerprint: accept and touch last-seen</li>
 *     <li>bound, different fingerprint: {@link AuthFailureKind#DEVICE_MISMATCH}</li>
 *     <li>revoked: {@link AuthFailureKind#DEVICE_REVOKED}</li>
 * </ul>
 * Registration relies on the (user_id, device_id) unique constraint; the loser of a concurrent first login
 * re-reads the winner's row and is judged by the same rules.
 */
@Service
@Transactional(noRollbackFor = AuthException.class)
public class DeviceBindingValidator {

    public static final int DEVICE_ID_MAX_LENGTH = 100;

    private final DeviceBindingRepository deviceBindingRepository;
    private final DeviceFingerprintHasher fingerprintHasher;
    private final SecurityEventLogger securityEventLogger;
    private final Clock clock;

    public DeviceBindingValidator(
            DeviceBindingRepository deviceBindingRepository,
            DeviceFingerprintHasher fingerprintHasher,
            SecurityEventLogger securityEventLogger,
            Clock clock
    ) {
        this.deviceBindingRepository = deviceBindingRepository;
        this.fingerprintHasher = fingerprintHasher;
        this.securityEventLogger = securityEventLogger;
        this.clock = clock;
    }

    public DeviceValidationResult validate(UUID userId, String rawDeviceId, String fingerprint, ClientPlatform platform) {
        String deviceId = normalizeDeviceId(rawDeviceId);
        if (deviceId == null || fingerprint == null || fingerprint.isBlank()) {
            throw new AuthException(AuthFailureKind.DEVICE_MISMATCH);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<DeviceBinding> existing = deviceBindingRepository.findByUserIdAndDeviceId(userId, deviceId);
        if (existing.isEmpty()) {
            int inserted = deviceBindingRepository.insertIfAbsent(UUID.randomUUID(), userId, deviceId,
                    fingerprintHasher.hash(fingerprint), platform.name(), now);
            DeviceBinding binding = deviceBindingRepository.findByUserIdAndDeviceId(userId, deviceId)
                    .orElseThrow(() -> new IllegalStateException("Device binding missing after registration"));
            if (inserted == 1) {
                securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.DEVICE_BOUND, SecurityOutcome.SUCCESS)
                        .withUser(userId)
                        .withDevice(deviceId)
                        .withDetail(Map.of("platform", platform.name())));
                return new DeviceValidationResult(binding.getId(), deviceId, true);
            }
            return evaluateExisting(binding, fingerprint, now);
        }
        return evaluateExisting(existing.get(), fingerprint, now);
    }

    @Transactional(readOnly = true)
    public DeviceBindingState stateOf(UUID userId, String rawDeviceId) {
        String deviceId = normalizeDeviceId(rawDeviceId);
        if (deviceId == null) {
            return DeviceBindingState.UNREGISTERED;
        }
        return deviceBindingRepository.findByUserIdAndDeviceId(userId, deviceId)
                .map(DeviceBinding::getState)
                .orElse(DeviceBindingState.UNREGISTERED);
    }

    /**
     * Read-through check for device-bound tokens. A revoked or removed binding fails with
     * {@link AuthFailureKind#DEVICE_REVOKED}.
     */
    @Transactional(readOnly = true)
    public void requireActive(UUID userId, String deviceId) {
        if (stateOf(userId, deviceId) != DeviceBindingState.BOUND) {
            throw new AuthException(AuthFailureKind.DEVICE_REVOKED);
        }
    }

    private DeviceValidationResult evaluateExisting(DeviceBinding binding, String fingerprint, OffsetDateTime now) {
        if (binding.getState() == DeviceBindingState.REVOKED) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.DEVICE_REVOKED_ACCESS, SecurityOutcome.DENIED)
                    .withUser(binding.getUserId())
                    .withDevice(binding.getDeviceId()));
            throw new AuthException(AuthFailureKind.DEVICE_REVOKED);
        }
        if (!fingerprintHasher.matches(fingerprint, binding.getFingerprintHash())) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.DEVICE_MISMATCH, SecurityOutcome.DENIED)
                    .withUser(binding.getUserId())
                    .withDevice(binding.getDeviceId()));
            throw new AuthException(AuthFailureKind.DEVICE_MISMATCH);
        }
        deviceBindingRepository.touchLastSeen(binding.getId(), now);
        return new DeviceValidationResult(binding.getId(), binding.getDeviceId(), false);
    }

    /**
     * @return the trimmed id, or {@code null} when blank or longer than {@value #DEVICE_ID_MAX_LENGTH}
     *         characters; an over-long id is never shortened onto another device's binding
     */
    public static String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty() || trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return null;
        }
        return trimmed;
    }
}
