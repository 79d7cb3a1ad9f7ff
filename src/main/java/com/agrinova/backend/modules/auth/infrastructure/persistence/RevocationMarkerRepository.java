package com.agrinova.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.RevocationMarker;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RevocationMarkerRepository extends JpaRepository<RevocationMarker, UUID> {

    /**
     * Appends a marker. An existing marker for the lineage is left untouched.
     */
    @Modifying
    @Query(value = """
            insert into revocation_marker (lineage_id, user_id, reason, revoked_at, expires_at)
            values (:lineageId, :userId, :reason, :revokedAt, :expiresAt)
            on conflict (lineage_id) do nothing
            """, nativeQuery = true)
    int append(@Param("lineageId") UUID lineageId,
               @Param("userId") UUID userId,
               @Param("reason") String reason,
               @Param("revokedAt") OffsetDateTime revokedAt,
               @Param("expiresAt") OffsetDateTime expiresAt);

    @Modifying
    @Query("delete from RevocationMarker m where m.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
