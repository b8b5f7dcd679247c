package com.farmket.marketplace.config;

import com.farmket.marketplace.dto.AccountRequest;
import com.farmket.marketplace.repository.UserRepository;
import com.farmket.marketplace.service.SettingsService;
import com.farmket.marketplace.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    @Bean
    CommandLineRunner init(UserRepository userRepo,
            UserService userService,
            SettingsService settingsService,
            @Value("${farmket.bootstrap.admin-email:}") String adminEmail,
            @Value("${farmket.bootstrap.admin-password:}") String adminPassword) {
        return args -> {
            settingsService.seedDefaults();

            // First superuser, only on an empty users table
            if (userRepo.count() == 0 && !adminEmail.isBlank()) {
                userService.createSuperuser(AccountRequest.builder()
                        .email(adminEmail)
                        .password(adminPassword.isBlank() ? null : adminPassword)
                        .firstName("System")
                        .lastName("Admin")
                        .build());
                log.info("Bootstrapped superuser {}", adminEmail);
            }
        };
    }
}
