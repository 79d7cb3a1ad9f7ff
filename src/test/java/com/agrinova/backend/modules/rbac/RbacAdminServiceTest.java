package com.agrinova.backend.modules.rbac;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.agrinova.backend.global.error.ProblemException;
import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.domain.AppUserStatus;
import com.agrinova.backend.modules.auth.domain.RateLimitedException;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.rbac.application.AdministrationScope;
import com.agrinova.backend.modules.rbac.application.PermissionResolver;
import com.agrinova.backend.modules.rbac.application.RbacAdminService;
import com.agrinova.backend.modules.rbac.application.RbacAdminService.CreateRoleCommand;
import com.agrinova.backend.modules.rbac.application.RbacAdminService.OverrideCommand;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;
import com.agrinova.backend.modules.rbac.domain.Permission;
import com.agrinova.backend.modules.rbac.domain.Role;
import com.agrinova.backend.modules.rbac.domain.RolePermission;
import com.agrinova.backend.modules.rbac.domain.UserPermissionOverride;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.UserPermissionOverrideRepository;
import com.agrinova.backend.modules.security.application.AuthRateLimiter;
import com.agrinova.backend.modules.security.application.SecurityEventLogger;
import com.agrinova.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class RbacAdminServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T06:00:00Z");
    private static final UUID ESTATE_A = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID ESTATE_B = UUID.fromString("00000000-0000-0000-0000-00000000000b");

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    @Mock
    private UserPermissionOverrideRepository overrideRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private PermissionResolver permissionResolver;

    @Mock
    private AuthRateLimiter rateLimiter;

    @Mock
    private SecurityEventLogger securityEventLogger;

    private RbacAdminService service;
    private UUID adminId;
    private UUID companyAdminId;
    private UUID targetUserId;
    private Permission harvestApprove;

    @BeforeEach
    void setUp() {
        service = new RbacAdminService(roleRepository, permissionRepository, rolePermissionRepository,
                overrideRepository, new AdministrationScope(appUserRepository, permissionResolver), rateLimiter,
                securityEventLogger, Clock.fixed(NOW, ZoneOffset.UTC));
        adminId = UUID.randomUUID();
        companyAdminId = UUID.randomUUID();
        targetUserId = UUID.randomUUID();
        harvestApprove = TestEntities.permission("harvest:approve");
        stubUser(adminId, "SUPER_ADMIN", ESTATE_A);
        stubUser(companyAdminId, "COMPANY_ADMIN", ESTATE_A);
        stubUser(targetUserId, "MANDOR", ESTATE_A);
        lenient().when(permissionRepository.findByName("harvest:approve")).thenReturn(Optional.of(harvestApprove));
    }

    private AppUser stubUser(UUID id, String role, UUID companyId) {
        AppUser user = TestEntities.user(id, role.toLowerCase() + "-" + id, TestEntities.role(role), companyId);
        lenient().when(appUserRepository.findWithRoleById(id)).thenReturn(Optional.of(user));
        return user;
    }

    @Test
    void grantOverrideWithFutureExpiryIsStored() {
        OffsetDateTime expiresAt = OffsetDateTime.ofInstant(NOW.plusSeconds(3_600), ZoneOffset.UTC);
        when(overrideRepository.findOverride(targetUserId, harvestApprove.getId(), true)).thenReturn(Optional.empty());

        UserPermissionOverride override = service.grantOverride(
                new OverrideCommand(targetUserId, "harvest:approve", expiresAt, "cover for leave"), adminId);

        assertThat(override.isGranted()).isTrue();
        assertThat(override.getExpiresAt()).isEqualTo(expiresAt);
        assertThat(override.getAssignedBy()).isEqualTo(adminId);
        verify(overrideRepository).save(override);
        verify(rateLimiter).checkMutation(adminId, "rbac");
    }

    @Test
    void denyOverrideUpdatesExistingRow() {
        UserPermissionOverride existing = TestEntities.override(targetUserId, "harvest:approve", false, null);
        when(overrideRepository.findOverride(targetUserId, harvestApprove.getId(), false))
                .thenReturn(Optional.of(existing));

        UserPermissionOverride override = service.denyOverride(
                new OverrideCommand(targetUserId, "harvest:approve", null, "audit hold"), adminId);

        assertThat(override).isSameAs(existing);
        assertThat(override.getReason()).isEqualTo("audit hold");
        assertThat(override.isGranted()).isFalse();
    }

    @Test
    void overrideExpiringNowOrEarlierIsRejected() {
        OffsetDateTime expiresAt = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

        assertThatThrownBy(() -> service.grantOverride(
                new OverrideCommand(targetUserId, "harvest:approve", expiresAt, null), adminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("OVERRIDE_EXPIRY_IN_PAST"));
        verify(overrideRepository, never()).save(any());
    }

    @Test
    void overrideForUnknownUserOrPermissionIsNotFound() {
        UUID ghost = UUID.randomUUID();
        when(appUserRepository.findWithRoleById(ghost)).thenReturn(Optional.empty());
        when(permissionRepository.findByName("harvest:delete")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.grantOverride(new OverrideCommand(ghost, "harvest:approve", null, null), adminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND"));
        assertThatThrownBy(() -> service.grantOverride(
                new OverrideCommand(targetUserId, "harvest:delete", null, null), adminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("PERMISSION_NOT_FOUND"));
    }

    @Test
    void mutationsAreRateLimitedBeforeTouchingTheStore() {
        doThrow(new RateLimitedException(30)).when(rateLimiter).checkMutation(adminId, "rbac");

        assertThatThrownBy(() -> service.removeOverride(targetUserId, "harvest:approve", adminId))
                .isInstanceOf(RateLimitedException.class);
        verify(overrideRepository, never()).deleteOverrides(any(), any());
    }

    @Test
    void removingLastPermissionOfARoleIsRefused() {
        Role mandor = TestEntities.role("MANDOR");
        when(roleRepository.findByNameIgnoreCase("MANDOR")).thenReturn(Optional.of(mandor));
        when(permissionRepository.findByNameIn(Set.of("harvest:approve"))).thenReturn(List.of(harvestApprove));
        when(rolePermissionRepository.findPermissionNames(mandor.getId())).thenReturn(List.of("harvest:approve"));

        assertThatThrownBy(() -> service.removeRolePermissions("MANDOR", List.of("harvest:approve"), adminId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("ROLE_BASELINE_EMPTY");
                });
        verify(rolePermissionRepository, never()).deleteByRoleIdAndPermissionIds(any(), any());
    }

    @Test
    void assigningPermissionsSkipsOnesAlreadyHeld() {
        Role asisten = TestEntities.role("ASISTEN");
        Permission reportRead = TestEntities.permission("report:read");
        when(roleRepository.findByNameIgnoreCase("ASISTEN")).thenReturn(Optional.of(asisten));
        when(permissionRepository.findByNameIn(Set.of("harvest:approve", "report:read")))
                .thenReturn(List.of(harvestApprove, reportRead));
        when(rolePermissionRepository.findPermissionNames(asisten.getId())).thenReturn(List.of("report:read"));

        Set<String> result = service.assignRolePermissions("ASISTEN", List.of("harvest:approve", " report:read "),
                adminId);

        assertThat(result).containsExactlyInAnyOrder("harvest:approve", "report:read");
        verify(rolePermissionRepository).save(any(RolePermission.class));
    }

    @Test
    void customRoleWithoutPermissionsMustBeFlaggedNoAccess() {
        assertThatThrownBy(() -> service.createRole(
                new CreateRoleCommand("auditor", "Auditor", null, false, null, List.of()), adminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_BASELINE_EMPTY"));

        when(roleRepository.findByNameIgnoreCase("VISITOR")).thenReturn(Optional.empty());
        Role visitor = service.createRole(new CreateRoleCommand("visitor", null, "Site visitor", true, null, null), adminId);

        assertThat(visitor.getName()).isEqualTo("VISITOR");
        assertThat(visitor.getDisplayName()).isEqualTo("VISITOR");
        assertThat(visitor.isNoAccess()).isTrue();
        assertThat(visitor.isSystem()).isFalse();
        assertThat(visitor.getLevel()).isEqualTo(Role.DEFAULT_LEVEL);
        verify(roleRepository).save(visitor);
    }

    @Test
    void systemRolesCannotBeDeactivated() {
        when(roleRepository.findByNameIgnoreCase("SATPAM")).thenReturn(Optional.of(TestEntities.role("SATPAM")));

        assertThatThrownBy(() -> service.setRoleActive("SATPAM", false, adminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("SYSTEM_ROLE_IMMUTABLE"));
    }

    @Test
    void createdPermissionIsNormalizedToResourceAction() {
        when(permissionRepository.existsByName("gatecheck:approve")).thenReturn(false);

        Permission permission = service.createPermission(" GateCheck ", "Approve", "Approve gate checks", adminId);

        assertThat(permission.getName()).isEqualTo("gatecheck:approve");
        verify(permissionRepository).save(permission);
    }

    @Test
    void invalidPermissionSegmentsAreRejected() {
        assertThatThrownBy(() -> service.createPermission("harvest", "approve:all", null, adminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_PERMISSION_NAME"));
    }

    @Test
    void companyAdminCannotStripTheSuperAdminBaseline() {
        Role superAdmin = TestEntities.role("SUPER_ADMIN");
        when(roleRepository.findByNameIgnoreCase("SUPER_ADMIN")).thenReturn(Optional.of(superAdmin));

        assertThatThrownBy(() -> service.removeRolePermissions("SUPER_ADMIN", List.of("rbac:manage"), companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("SUPER_ADMIN_ONLY");
                });
        verify(rolePermissionRepository, never()).deleteByRoleIdAndPermissionIds(any(), any());
    }

    @Test
    void companyAdminCannotGrantToAUserOfAnotherCompany() {
        UUID outsider = UUID.randomUUID();
        stubUser(outsider, "MANDOR", ESTATE_B);

        assertThatThrownBy(() -> service.grantOverride(
                new OverrideCommand(outsider, "harvest:approve", null, null), companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("COMPANY_SCOPE_VIOLATION"));
        verify(overrideRepository, never()).save(any());
    }

    @Test
    void companyAdminCannotManageAUserAtOrAboveItsLevel() {
        UUID areaManager = UUID.randomUUID();
        stubUser(areaManager, "AREA_MANAGER", ESTATE_A);

        assertThatThrownBy(() -> service.denyOverride(
                new OverrideCommand(areaManager, "harvest:approve", null, null), companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
        assertThatThrownBy(() -> service.listOverrides(areaManager, companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
    }

    @Test
    void companyAdminCanOnlyGrantPermissionsItHolds() {
        when(permissionResolver.resolve(companyAdminId)).thenReturn(EffectivePermissions.of(List.of("user:manage")));

        assertThatThrownBy(() -> service.grantOverride(
                new OverrideCommand(targetUserId, "harvest:approve", null, null), companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("PERMISSION_NOT_HELD"));
        verify(overrideRepository, never()).save(any());
    }

    @Test
    void companyAdminManagesUsersBelowItInItsOwnCompany() {
        when(permissionResolver.resolve(companyAdminId))
                .thenReturn(EffectivePermissions.of(List.of("harvest:approve", "user:manage")));
        when(overrideRepository.findOverride(targetUserId, harvestApprove.getId(), true)).thenReturn(Optional.empty());

        UserPermissionOverride override = service.grantOverride(
                new OverrideCommand(targetUserId, "harvest:approve", null, "harvest peak"), companyAdminId);

        assertThat(override.getAssignedBy()).isEqualTo(companyAdminId);
        verify(overrideRepository).save(override);
    }

    @Test
    void permissionCatalogBelongsToSuperAdmins() {
        assertThatThrownBy(() -> service.setPermissionActive("harvest:approve", false, companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("SUPER_ADMIN_ONLY"));
        assertThatThrownBy(() -> service.createPermission("gatecheck", "approve", null, companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("SUPER_ADMIN_ONLY"));
        assertThat(harvestApprove.isActive()).isTrue();
        verify(permissionRepository, never()).save(any());
    }

    @Test
    void customRoleLevelMustSitBelowTheActor() {
        assertThatThrownBy(() -> service.createRole(
                new CreateRoleCommand("regional", null, null, true, 2, null), companyAdminId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
        assertThatThrownBy(() -> service.createRole(
                new CreateRoleCommand("root", null, null, true, 1, null), adminId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("INVALID_ROLE_LEVEL");
                });
        verify(roleRepository, never()).save(any());
    }

    @Test
    void companyAdminEditsCustomRolesBelowIt() {
        Role clerk = TestEntities.role("WEIGHBRIDGE_CLERK");
        clerk.setLevel(8);
        when(roleRepository.findByNameIgnoreCase("WEIGHBRIDGE_CLERK")).thenReturn(Optional.of(clerk));

        Role result = service.setRoleActive("WEIGHBRIDGE_CLERK", false, companyAdminId);

        assertThat(result.isActive()).isFalse();
    }

    @Test
    void deactivatedActorIsRefused() {
        UUID formerAdmin = UUID.randomUUID();
        AppUser former = stubUser(formerAdmin, "SUPER_ADMIN", ESTATE_A);
        former.setStatus(AppUserStatus.INACTIVE);

        assertThatThrownBy(() -> service.removeOverride(targetUserId, "harvest:approve", formerAdmin))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ADMIN_ACTOR_REQUIRED"));
        verify(overrideRepository, never()).deleteOverrides(any(), any());
    }
}
