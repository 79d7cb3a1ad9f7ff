package com.agrinova.backend.modules.rbac.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.rbac.domain.RolePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

    @Query("""
            select p.name
              from RolePermission rp
              join rp.role r
              join rp.permission p
             where r.id = :roleId
               and r.active = true
               and p.active = true
            """)
    List<String> findActivePermissionNames(@Param("roleId") UUID roleId);

    @Query("select p.name from RolePermission rp join rp.permission p where rp.role.id = :roleId")
    List<String> findPermissionNames(@Param("roleId") UUID roleId);

    long countByRoleId(UUID roleId);

    @Modifying
    @Query("delete from RolePermission rp where rp.role.id = :roleId and rp.permission.id in :permissionIds")
    int deleteByRoleIdAndPermissionIds(@Param("roleId") UUID roleId,
                                       @Param("permissionIds") Collection<UUID> permissionIds);
}
