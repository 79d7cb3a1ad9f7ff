package com.agrinova.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.domain.PasswordPolicy;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.rbac.domain.Role;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the demo field accounts on startup. Passwords are hashed with the live encoder so the seed never
 * carries a precomputed hash. Existing usernames are left untouched.
 */
@Component
@ConditionalOnProperty(prefix = "agrinova.demo-seed", name = "enabled", havingValue = "true")
public class DemoAccountSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoAccountSeeder.class);

    static final UUID DEMO_COMPANY_ID = UUID.fromString("6f1c2a9e-4b7d-4e21-9c3a-1d2e3f405a6b");

    private static final List<DemoAccount> ACCOUNTS = List.of(
            new DemoAccount("superadmin", "superadmin@agrinova.local", "Super Admin", "SUPER_ADMIN"),
            new DemoAccount("asisten1", "asisten1@agrinova.local", "Asisten Afdeling 1", "ASISTEN"),
            new DemoAccount("mandor1", "mandor1@agrinova.local", "Mandor Panen 1", "MANDOR"),
            new DemoAccount("satpam1", "satpam1@agrinova.local", "Satpam Pos 1", "SATPAM")
    );

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final CredentialVerifier credentialVerifier;
    private final String demoPassword;

    public DemoAccountSeeder(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            CredentialVerifier credentialVerifier,
            @Value("${agrinova.demo-seed.password}") String demoPassword
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.credentialVerifier = credentialVerifier;
        this.demoPassword = demoPassword;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        List<String> violations = PasswordPolicy.violations(demoPassword);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("agrinova.demo-seed.password is not acceptable: " + violations);
        }
        int created = 0;
        for (DemoAccount account : ACCOUNTS) {
            if (appUserRepository.existsByUsernameIgnoreCase(account.username())) {
                continue;
            }
            Role role = roleRepository.findByNameIgnoreCase(account.roleName())
                    .orElseThrow(() -> new IllegalStateException("Seed role missing: " + account.roleName()));
            AppUser user = new AppUser();
            user.setUsername(account.username());
            user.setEmail(account.email());
            user.setFullName(account.fullName());
            user.setRole(role);
            user.setCompanyId(DEMO_COMPANY_ID);
            user.setPasswordHash(credentialVerifier.hash(demoPassword));
            appUserRepository.save(user);
            created++;
        }
        if (created > 0) {
            log.info("Seeded {} demo accounts", created);
        }
    }

    private record DemoAccount(String username, String email, String fullName, String roleName) {
    }
}
