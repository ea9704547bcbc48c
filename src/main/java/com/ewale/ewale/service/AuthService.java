package com.ewale.ewale.service;

import com.ewale.ewale.dto.AdminLoginResponse;
import com.ewale.ewale.dto.LoginRequest;
import com.ewale.ewale.entity.AdminUser;
import com.ewale.ewale.repository.AdminUserRepository;
import com.ewale.ewale.util.JwtUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;

/**
 * Back-office login. Unknown user, wrong password and disabled account all fail with the same message.
 */
@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtil jwtUtil;

    public AuthService(AdminUserRepository adminUserRepository, PasswordEncoder passwordEncoder, JwtUtil jwtUtil) {
        this.adminUserRepository = adminUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtUtil = jwtUtil;
    }

    @Transactional
    public AdminLoginResponse login(LoginRequest request) {
        AdminUser admin = adminUserRepository.findByUsernameIgnoreCase(request.getUsername().trim())
                .filter(a -> Boolean.TRUE.equals(a.getActive()))
                .filter(a -> passwordEncoder.matches(request.getPassword(), a.getPasswordHash()))
                .orElseThrow(() -> {
                    logger.warn("Failed admin login for '{}'", request.getUsername());
                    return new BadCredentialsException(INVALID_CREDENTIALS);
                });

        Date issuedAt = new Date();
        String token = jwtUtil.issueToken(admin, issuedAt);
        admin.setLastLoginAt(LocalDateTime.now());
        adminUserRepository.save(admin);
        logger.info("Admin '{}' logged in", admin.getUsername());

        LocalDateTime expiresAt = LocalDateTime.ofInstant(jwtUtil.expiryFor(issuedAt).toInstant(), ZoneId.systemDefault());
        return new AdminLoginResponse(token, "Bearer", expiresAt, admin.getUsername(), admin.getRole());
    }
}
