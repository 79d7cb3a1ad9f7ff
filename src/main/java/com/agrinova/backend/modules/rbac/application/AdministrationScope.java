package com.agrinova.backend.modules.rbac.application;

import java.util.Collection;
import java.util.UUID;

import com.agrinova.backend.global.error.ProblemException;
import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;
import com.agrinova.backend.modules.rbac.domain.Role;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Tenant and hierarchy boundaries for administrative operations.
 * <ul>
 *     <li>Only a super admin reaches users outside its own company.</li>
 *     <li>An actor manages users and custom roles strictly below its role level.</li>
 *     <li>The permission catalog and system role baselines belong to super admins.</li>
 *     <li>Outside super admins, an actor can only hand out permissions it holds itself.</li>
 * </ul>
 */
@Component
public class AdministrationScope {

    private final AppUserRepository appUserRepository;
    private final PermissionResolver permissionResolver;

    public AdministrationScope(AppUserRepository appUserRepository, PermissionResolver permissionResolver) {
        this.appUserRepository = appUserRepository;
        this.permissionResolver = permissionResolver;
    }

    public AppUser requireActor(UUID actorId) {
        if (actorId == null) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ADMIN_ACTOR_REQUIRED");
        }
        return appUserRepository.findWithRoleById(actorId)
                .filter(AppUser::isActive)
                .orElseThrow(() -> new ProblemException(HttpStatus.FORBIDDEN, "ADMIN_ACTOR_REQUIRED"));
    }

    /**
     * @return the target user, loaded with its role
     */
    public AppUser requireManageableUser(AppUser actor, UUID targetUserId) {
        if (targetUserId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND");
        }
        AppUser target = appUserRepository.findWithRoleById(targetUserId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        if (!isSuperAdmin(actor) && !sameCompany(actor, target)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "COMPANY_SCOPE_VIOLATION");
        }
        if (!outranks(actor, target.getRole().getLevel())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROLE_HIERARCHY_VIOLATION");
        }
        return target;
    }

    public void requireSuperAdmin(AppUser actor) {
        if (!isSuperAdmin(actor)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "SUPER_ADMIN_ONLY");
        }
    }

    public void requireManageableRole(AppUser actor, Role role) {
        if (role.isSystem()) {
            requireSuperAdmin(actor);
            return;
        }
        if (!outranks(actor, role.getLevel())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROLE_HIERARCHY_VIOLATION");
        }
    }

    /**
     * Checks the level requested for a new custom role. Level {@value Role#HIGHEST_LEVEL} is reserved.
     */
    public void requireAssignableLevel(AppUser actor, int level) {
        if (level <= Role.HIGHEST_LEVEL || level > Role.LOWEST_LEVEL) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ROLE_LEVEL",
                    "level must be between " + (Role.HIGHEST_LEVEL + 1) + " and " + Role.LOWEST_LEVEL);
        }
        if (!outranks(actor, level)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROLE_HIERARCHY_VIOLATION");
        }
    }

    public void requireHeldPermissions(AppUser actor, Collection<String> permissionNames) {
        if (isSuperAdmin(actor) || permissionNames.isEmpty()) {
            return;
        }
        EffectivePermissions held = permissionResolver.resolve(actor.getId());
        if (!held.hasAll(permissionNames)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "PERMISSION_NOT_HELD",
                    "Only permissions held by the acting administrator can be handed out");
        }
    }

    private static boolean isSuperAdmin(AppUser actor) {
        return actor.getRole() != null && actor.getRole().isActive() && actor.getRole().isSuperAdmin();
    }

    private static boolean sameCompany(AppUser actor, AppUser target) {
        return actor.getCompanyId() != null && actor.getCompanyId().equals(target.getCompanyId());
    }

    private static boolean outranks(AppUser actor, int targetLevel) {
        Role role = actor.getRole();
        return role != null && role.isActive() && role.getLevel() < targetLevel;
    }
}
