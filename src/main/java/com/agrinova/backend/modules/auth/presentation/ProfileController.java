package com.agrinova.backend.modules.auth.presentation;

import com.agrinova.backend.global.security.AuthenticatedPrincipal;
import com.agrinova.backend.modules.auth.application.AccountProfileService;
import com.agrinova.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AccountProfileService accountProfileService;

    public ProfileController(AccountProfileService accountProfileService) {
        this.accountProfileService = accountProfileService;
    }

    @GetMapping("/profile/me")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(accountProfileService.loadProfile(principal.userId()));
    }
}
