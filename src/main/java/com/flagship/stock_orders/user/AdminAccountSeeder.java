package com.flagship.stock_orders.user;

import com.flagship.stock_orders.config.SeedProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the configured ADMIN account at startup if it does not exist yet.
 * Existing accounts are left untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAccountSeeder implements ApplicationRunner {

    private final SeedProperties seedProperties;
    private final UserRepository userRepository;
    private final UserService userService;

    @Override
    public void run(ApplicationArguments args) {
        if (!seedProperties.isAdminConfigured()) {
            log.info("Admin seeding skipped: app.seed.admin-username/admin-password not set");
            return;
        }
        String username = seedProperties.getAdminUsername();
        if (userRepository.existsByUsername(username)) {
            log.debug("Admin account already present: username={}", username);
            return;
        }
        userService.register(username, seedProperties.getAdminPassword(), UserRole.ADMIN, null);
        log.info("Admin account seeded: username={}", username);
    }
}
