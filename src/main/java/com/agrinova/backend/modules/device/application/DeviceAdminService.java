package com.agrinova.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.agrinova.backend.global.error.ProblemException;
import com.agrinova.backend.modules.auth.application.JwtTokenService;
import com.agrinova.backend.modules.device.domain.DeviceBinding;
import com.agrinova.backend.modules.device.domain.DeviceBindingState;
import com.agrinova.backend.modules.device.infrastructure.persistence.DeviceBindingRepository;
import com.agrinova.backend.modules.rbac.application.AdministrationScope;
import com.agrinova.backend.modules.security.application.AuthRateLimiter;
import com.agrinova.backend.modules.security.application.SecurityEventCommand;
import com.agrinova.backend.modules.security.application.SecurityEventLogger;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative device operations.
 * <p>
 * Revoking keeps the binding row so the device stays blocked and its tokens fail with
 * {@code DEVICE_REVOKED}. Unbinding deletes the row, which allows the device to register again; the
 * device's session lineages are revoked first so old tokens cannot come back to life.
 * Every operation is limited to users the actor may manage.
 */
@Service
@Transactional
public class DeviceAdminService {

    static final String OPERATION = "device";

    private final DeviceBindingRepository deviceBindingRepository;
    private final JwtTokenService jwtTokenService;
    private final AdministrationScope administrationScope;
    private final AuthRateLimiter rateLimiter;
    private final SecurityEventLogger securityEventLogger;
    private final Clock clock;

    public DeviceAdminService(
            DeviceBindingRepository deviceBindingRepository,
            JwtTokenService jwtTokenService,
            AdministrationScope administrationScope,
            AuthRateLimiter rateLimiter,
            SecurityEventLogger securityEventLogger,
            Clock clock
    ) {
        this.deviceBindingRepository = deviceBindingRepository;
        this.jwtTokenService = jwtTokenService;
        this.administrationScope = administrationScope;
        this.rateLimiter = rateLimiter;
        this.securityEventLogger = securityEventLogger;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<DeviceBinding> listActive(UUID userId, UUID actorId) {
        administrationScope.requireManageableUser(administrationScope.requireActor(actorId), userId);
        return deviceBindingRepository.findActiveByUserId(userId);
    }

    public DeviceBinding revoke(UUID userId, String rawDeviceId, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        administrationScope.requireManageableUser(administrationScope.requireActor(actorId), userId);
        String deviceId = requireDeviceId(rawDeviceId);
        DeviceBinding binding = deviceBindingRepository.findByUserIdAndDeviceId(userId, deviceId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DEVICE_NOT_FOUND"));
        if (binding.getState() == DeviceBindingState.REVOKED) {
            return binding;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        binding.setRevokedAt(now);
        binding.setRevokedBy(actorId);
        securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.DEVICE_REVOKED, SecurityOutcome.SUCCESS)
                .withUser(userId)
                .withDevice(deviceId)
                .withDetail(Map.of("actorId", String.valueOf(actorId))));
        return binding;
    }

    public void unbind(UUID userId, String rawDeviceId, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        administrationScope.requireManageableUser(administrationScope.requireActor(actorId), userId);
        String deviceId = requireDeviceId(rawDeviceId);
        int revokedLineages = jwtTokenService.revokeAllForDevice(userId, deviceId, JwtTokenService.REASON_DEVICE_UNBOUND);
        int deleted = deviceBindingRepository.deleteBinding(userId, deviceId);
        if (deleted == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "DEVICE_NOT_FOUND");
        }
        securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.DEVICE_UNBOUND, SecurityOutcome.SUCCESS)
                .withUser(userId)
                .withDevice(deviceId)
                .withDetail(Map.of(
                        "actorId", String.valueOf(actorId),
                        "revokedLineages", revokedLineages)));
    }

    private String requireDeviceId(String rawDeviceId) {
        String deviceId = DeviceBindingValidator.normalizeDeviceId(rawDeviceId);
        if (deviceId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "DEVICE_NOT_FOUND");
        }
        return deviceId;
    }
}
