package com.agrinova.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.agrinova.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Chain of tokens descending from one login. Stores no token material, only the id of the refresh token
 * currently allowed to rotate.
 */
@Entity
@Table(name = "session_lineage")
public class SessionLineage extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "device_id", length = 100)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 16)
    private ClientPlatform platform;

    @Column(name = "current_refresh_id", nullable = false, columnDefinition = "uuid")
    private UUID currentRefreshId;

    @Column(name = "refresh_expires_at", nullable = false)
    private OffsetDateTime refreshExpiresAt;

    @Column(name = "offline_expires_at")
    private OffsetDateTime offlineExpiresAt;

    @Column(name = "rotated_at")
    private OffsetDateTime rotatedAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_reason", length = 100)
    private String revokedReason;

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public ClientPlatform getPlatform() {
        return platform;
    }

    public void setPlatform(ClientPlatform platform) {
        this.platform = platform;
    }

    public UUID getCurrentRefreshId() {
        return currentRefreshId;
    }

    public void setCurrentRefreshId(UUID currentRefreshId) {
        this.currentRefreshId = currentRefreshId;
    }

    public OffsetDateTime getRefreshExpiresAt() {
        return refreshExpiresAt;
    }

    public void setRefreshExpiresAt(OffsetDateTime refreshExpiresAt) {
        this.refreshExpiresAt = refreshExpiresAt;
    }

    public OffsetDateTime getOfflineExpiresAt() {
        return offlineExpiresAt;
    }

    public void setOfflineExpiresAt(OffsetDateTime offlineExpiresAt) {
        this.offlineExpiresAt = offlineExpiresAt;
    }

    public OffsetDateTime getRotatedAt() {
        return rotatedAt;
    }

    public void setRotatedAt(OffsetDateTime rotatedAt) {
        this.rotatedAt = rotatedAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public void setRevokedAt(OffsetDateTime revokedAt) {
        this.revokedAt = revokedAt;
    }

    public String getRevokedReason() {
        return revokedReason;
    }

    public void setRevokedReason(String revokedReason) {
        this.revokedReason = revokedReason;
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    /**
     * Latest instant at which any token of this lineage can still be presented.
     */
    public OffsetDateTime latestTokenExpiry(OffsetDateTime accessHorizon) {
        OffsetDateTime latest = refreshExpiresAt;
        if (offlineExpiresAt != null && offlineExpiresAt.isAfter(latest)) {
            latest = offlineExpiresAt;
        }
        if (accessHorizon != null && accessHorizon.isAfter(latest)) {
            latest = accessHorizon;
        }
        return latest;
    }
}
