package com.agrinova.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.SessionLineage;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SessionLineageRepository extends JpaRepository<SessionLineage, UUID> {

    /**
     * Compare-and-swap rotation: succeeds only while {@code expected} is still the current refresh id.
     *
     * @return 1 for the single winner, 0 for a reused or revoked refresh token
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            update SessionLineage l
               set l.currentRefreshId = :next,
                   l.rotatedAt = :now,
                   l.refreshExpiresAt = :refreshExpiresAt
             where l.id = :id
               and l.currentRefreshId = :expected
               and l.revokedAt is null
            """)
    int rotate(@Param("id") UUID id,
               @Param("expected") UUID expected,
               @Param("next") UUID next,
               @Param("now") OffsetDateTime now,
               @Param("refreshExpiresAt") OffsetDateTime refreshExpiresAt);

    @Modifying(clearAutomatically = true)
    @Query("""
            update SessionLineage l
               set l.revokedAt = :now,
                   l.revokedReason = :reason
             where l.id = :id
               and l.revokedAt is null
            """)
    int markRevoked(@Param("id") UUID id, @Param("now") OffsetDateTime now, @Param("reason") String reason);

    @Query("select l from SessionLineage l where l.userId = :userId and l.revokedAt is null")
    List<SessionLineage> findActiveByUserId(@Param("userId") UUID userId);

    @Query("""
            select l
              from SessionLineage l
             where l.userId = :userId
               and l.deviceId = :deviceId
               and l.revokedAt is null
            """)
    List<SessionLineage> findActiveByUserIdAndDeviceId(@Param("userId") UUID userId,
                                                        @Param("deviceId") String deviceId);

    @Modifying
    @Query("""
            delete from SessionLineage l
             where l.refreshExpiresAt < :now
               and (l.offlineExpiresAt is null or l.offlineExpiresAt < :now)
            """)
    int deleteExpired(@Param("now") OffsetDateTime now);
}
