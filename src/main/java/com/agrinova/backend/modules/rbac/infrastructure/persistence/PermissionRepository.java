package com.agrinova.backend.modules.rbac.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByName(String name);

    List<Permission> findByNameIn(Collection<String> names);

    boolean existsByName(String name);

    long countByActiveTrue();
}
