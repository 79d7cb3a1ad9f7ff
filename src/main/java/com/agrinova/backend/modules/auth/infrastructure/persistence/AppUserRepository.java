package com.agrinova.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("""
            select u
              from AppUser u
              join fetch u.role
             where lower(u.username) = lower(:identifier)
                or lower(u.email) = lower(:identifier)
            """)
    Optional<AppUser> findByIdentifier(@Param("identifier") String identifier);

    @Query("select u from AppUser u join fetch u.role where u.id = :id")
    Optional<AppUser> findWithRoleById(@Param("id") UUID id);

    @Query("select case when count(u) > 0 then true else false end from AppUser u where lower(u.username) = lower(:username)")
    boolean existsByUsernameIgnoreCase(@Param("username") String username);
}
