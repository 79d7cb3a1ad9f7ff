package com.agrinova.backend.modules.device.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.modules.device.domain.DeviceBinding;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceBindingRepository extends JpaRepository<DeviceBinding, UUID> {

    Optional<DeviceBinding> findByUserIdAndDeviceId(UUID userId, String deviceId);

    @Query("""
            select db
              from DeviceBinding db
             where db.userId = :userId
               and db.revokedAt is null
             order by db.registeredAt
            """)
    List<DeviceBinding> findActiveByUserId(@Param("userId") UUID userId);

    /**
     * Registers a binding unless one already exists for (user, device id).
     *
     * @return 1 when this call created the row, 0 when another row won
     */
    @Modifying
    @Query(value = """
            insert into device_binding (id, user_id, device_id, fingerprint_hash, platform,
                                        registered_at, last_seen_at, created_at, updated_at)
            values (:id, :userId, :deviceId, :fingerprintHash, :platform, :now, :now, :now, :now)
            on conflict (user_id, device_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("userId") UUID userId,
                       @Param("deviceId") String deviceId,
                       @Param("fingerprintHash") String fingerprintHash,
                       @Param("platform") String platform,
                       @Param("now") OffsetDateTime now);

    @Modifying
    @Query("update DeviceBinding db set db.lastSeenAt = :now where db.id = :id")
    int touchLastSeen(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from DeviceBinding db where db.userId = :userId and db.deviceId = :deviceId")
    int deleteBinding(@Param("userId") UUID userId, @Param("deviceId") String deviceId);
}
