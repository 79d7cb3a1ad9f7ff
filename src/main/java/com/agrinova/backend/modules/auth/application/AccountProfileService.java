package com.agrinova.backend.modules.auth.application;

import java.util.UUID;

import com.agrinova.backend.global.error.ProblemException;
import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.agrinova.backend.modules.rbac.application.PermissionResolver;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountProfileService {

    private final AppUserRepository appUserRepository;
    private final PermissionResolver permissionResolver;

    public AccountProfileService(AppUserRepository appUserRepository, PermissionResolver permissionResolver) {
        this.appUserRepository = appUserRepository;
        this.permissionResolver = permissionResolver;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = appUserRepository.findWithRoleById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        EffectivePermissions permissions = permissionResolver.resolve(userId);
        return UserProfileResponse.from(user, permissions);
    }
}
