package com.agrinova.backend.modules.rbac;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.agrinova.backend.global.error.ProblemException;
import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.rbac.application.AdministrationScope;
import com.agrinova.backend.modules.rbac.application.PermissionResolver;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;
import com.agrinova.backend.modules.rbac.domain.Role;
import com.agrinova.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AdministrationScopeTest {

    private static final UUID ESTATE_A = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID ESTATE_B = UUID.fromString("00000000-0000-0000-0000-00000000000b");

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private PermissionResolver permissionResolver;

    private AdministrationScope scope;
    private AppUser superAdmin;
    private AppUser companyAdmin;

    @BeforeEach
    void setUp() {
        scope = new AdministrationScope(appUserRepository, permissionResolver);
        superAdmin = user("SUPER_ADMIN", ESTATE_A);
        companyAdmin = user("COMPANY_ADMIN", ESTATE_A);
    }

    private static AppUser user(String role, UUID companyId) {
        UUID id = UUID.randomUUID();
        return TestEntities.user(id, role.toLowerCase() + "-" + id, TestEntities.role(role), companyId);
    }

    private AppUser stored(String role, UUID companyId) {
        AppUser user = user(role, companyId);
        when(appUserRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));
        return user;
    }

    @Test
    void missingActorIsRefused() {
        assertThatThrownBy(() -> scope.requireActor(null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("ADMIN_ACTOR_REQUIRED");
                });
        UUID unknown = UUID.randomUUID();
        when(appUserRepository.findWithRoleById(unknown)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> scope.requireActor(unknown))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ADMIN_ACTOR_REQUIRED"));
    }

    @Test
    void targetInAnotherCompanyIsOutOfScope() {
        AppUser mandorOfB = stored("MANDOR", ESTATE_B);

        assertThatThrownBy(() -> scope.requireManageableUser(companyAdmin, mandorOfB.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("COMPANY_SCOPE_VIOLATION"));
    }

    @Test
    void actorWithoutCompanyReachesNoOne() {
        AppUser detached = user("COMPANY_ADMIN", null);
        AppUser mandor = stored("MANDOR", ESTATE_A);

        assertThatThrownBy(() -> scope.requireManageableUser(detached, mandor.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("COMPANY_SCOPE_VIOLATION"));
    }

    @Test
    void peersAndSuperiorsAreOutOfReach() {
        AppUser peer = stored("COMPANY_ADMIN", ESTATE_A);
        AppUser owner = stored("SUPER_ADMIN", ESTATE_A);

        assertThatThrownBy(() -> scope.requireManageableUser(companyAdmin, peer.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
        assertThatThrownBy(() -> scope.requireManageableUser(companyAdmin, owner.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
    }

    @Test
    void superAdminCrossesCompaniesButNotOtherSuperAdmins() {
        AppUser mandorOfB = stored("MANDOR", ESTATE_B);
        AppUser otherOwner = stored("SUPER_ADMIN", ESTATE_B);

        assertThat(scope.requireManageableUser(superAdmin, mandorOfB.getId())).isSameAs(mandorOfB);
        assertThatThrownBy(() -> scope.requireManageableUser(superAdmin, otherOwner.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
    }

    @Test
    void deactivatedRoleLosesItsRank() {
        AppUser demoted = user("COMPANY_ADMIN", ESTATE_A);
        demoted.getRole().setActive(false);
        AppUser mandor = stored("MANDOR", ESTATE_A);

        assertThatThrownBy(() -> scope.requireManageableUser(demoted, mandor.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
    }

    @Test
    void systemRoleBaselinesBelongToSuperAdmins() {
        Role satpam = TestEntities.role("SATPAM");

        assertThatThrownBy(() -> scope.requireManageableRole(companyAdmin, satpam))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("SUPER_ADMIN_ONLY"));
        assertThatCode(() -> scope.requireManageableRole(superAdmin, satpam)).doesNotThrowAnyException();
    }

    @Test
    void customRoleAtTheActorsLevelIsRefused() {
        Role sameLevel = TestEntities.role("ESTATE_AUDITOR");
        sameLevel.setLevel(3);

        assertThatThrownBy(() -> scope.requireManageableRole(companyAdmin, sameLevel))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
    }

    @Test
    void assignableLevelIsBoundedAndBelowTheActor() {
        assertThatThrownBy(() -> scope.requireAssignableLevel(superAdmin, Role.HIGHEST_LEVEL))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_ROLE_LEVEL"));
        assertThatThrownBy(() -> scope.requireAssignableLevel(superAdmin, Role.LOWEST_LEVEL + 1))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_ROLE_LEVEL"));
        assertThatThrownBy(() -> scope.requireAssignableLevel(companyAdmin, 3))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ROLE_HIERARCHY_VIOLATION"));
        assertThatCode(() -> scope.requireAssignableLevel(companyAdmin, 4)).doesNotThrowAnyException();
    }

    @Test
    void onlyHeldPermissionsCanBeHandedOut() {
        when(permissionResolver.resolve(companyAdmin.getId()))
                .thenReturn(EffectivePermissions.of(List.of("user:manage", "harvest:read")));

        assertThatCode(() -> scope.requireHeldPermissions(companyAdmin, List.of("harvest:read")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> scope.requireHeldPermissions(companyAdmin, List.of("harvest:read", "rbac:manage")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("PERMISSION_NOT_HELD"));
    }

    @Test
    void superAdminHandsOutWithoutResolvingItsOwnSet() {
        scope.requireHeldPermissions(superAdmin, List.of("rbac:manage"));

        verify(permissionResolver, never()).resolve(any());
    }
}
