package com.ewale.ewale.config;

import com.ewale.ewale.entity.AdminUser;
import com.ewale.ewale.entity.Role;
import com.ewale.ewale.repository.AdminUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Seeds the back-office admin account on first start.
 */
@Component
public class DataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${admin.default.username:admin}")
    private String defaultUsername;

    @Value("${admin.default.email:admin@ewale.com}")
    private String defaultEmail;

    @Value("${admin.default.password:admin123}")
    private String defaultPassword;

    public DataInitializer(AdminUserRepository adminUserRepository, PasswordEncoder passwordEncoder) {
        this.adminUserRepository = adminUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void run(String... args) {
        if (adminUserRepository.existsByUsernameIgnoreCaseOrEmailIgnoreCase(defaultUsername, defaultEmail)) {
            logger.info("Admin account '{}' already present, nothing to seed", defaultUsername);
            return;
        }

        AdminUser admin = new AdminUser();
        admin.setUsername(defaultUsername);
        admin.setEmail(defaultEmail);
        admin.setPasswordHash(passwordEncoder.encode(defaultPassword));
        admin.setRole(Role.ADMIN);
        adminUserRepository.save(admin);

        logger.info("Seeded admin account '{}'", defaultUsername);
        if ("admin123".equals(defaultPassword)) {
            logger.warn("Admin account '{}' uses the built-in password; set ADMIN_PASSWORD", defaultUsername);
        }
    }
}
