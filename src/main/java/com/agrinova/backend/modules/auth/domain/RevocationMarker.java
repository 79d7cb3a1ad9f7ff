package com.agrinova.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Append-only record that every token of a lineage is revoked. Purged once {@code expiresAt} has passed.
 */
@Entity
@Table(name = "revocation_marker")
public class RevocationMarker {

    @Id
    @Column(name = "lineage_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID lineageId;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "reason", nullable = false, updatable = false, length = 100)
    private String reason;

    @Column(name = "revoked_at", nullable = false, updatable = false)
    private OffsetDateTime revokedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    protected RevocationMarker() {
    }

    public UUID getLineageId() {
        return lineageId;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }
}
