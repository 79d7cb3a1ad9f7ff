package com.agrinova.backend.modules.rbac.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.modules.rbac.domain.UserPermissionOverride;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserPermissionOverrideRepository extends JpaRepository<UserPermissionOverride, UUID> {

    @Query("""
            select o
              from UserPermissionOverride o
              join fetch o.permission p
             where o.userId = :userId
               and p.active = true
               and (o.expiresAt is null or o.expiresAt > :now)
            """)
    List<UserPermissionOverride> findActiveOverrides(@Param("userId") UUID userId,
                                                     @Param("now") OffsetDateTime now);

    @Query("""
            select o
              from UserPermissionOverride o
              join fetch o.permission
             where o.userId = :userId
             order by o.createdAt
            """)
    List<UserPermissionOverride> findAllByUserId(@Param("userId") UUID userId);

    @Query("""
            select o
              from UserPermissionOverride o
             where o.userId = :userId
               and o.permission.id = :permissionId
               and o.granted = :granted
            """)
    Optional<UserPermissionOverride> findOverride(@Param("userId") UUID userId,
                                                  @Param("permissionId") UUID permissionId,
                                                  @Param("granted") boolean granted);

    @Modifying
    @Query("delete from UserPermissionOverride o where o.userId = :userId and o.permission.id = :permissionId")
    int deleteOverrides(@Param("userId") UUID userId, @Param("permissionId") UUID permissionId);

    @Query("select count(o) from UserPermissionOverride o where o.expiresAt is null or o.expiresAt > :now")
    long countActive(@Param("now") OffsetDateTime now);

    @Query("select count(o) from UserPermissionOverride o where o.expiresAt is not null and o.expiresAt <= :now")
    long countExpired(@Param("now") OffsetDateTime now);
}
