package com.agrinova.backend.modules.rbac.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.modules.rbac.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    @Query("select r from Role r where upper(r.name) = upper(:name)")
    Optional<Role> findByNameIgnoreCase(@Param("name") String name);

    long countByActiveTrue();

    long countBySystemTrue();

    long countBySystemFalse();
}
