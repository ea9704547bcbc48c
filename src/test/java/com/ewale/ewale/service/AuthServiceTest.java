package com.ewale.ewale.service;

import com.ewale.ewale.dto.AdminLoginResponse;
import com.ewale.ewale.dto.LoginRequest;
import com.ewale.ewale.entity.AdminUser;
import com.ewale.ewale.entity.Role;
import com.ewale.ewale.repository.AdminUserRepository;
import com.ewale.ewale.util.JwtUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Date;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService Unit Tests")
class AuthServiceTest {

    @Mock
    private AdminUserRepository adminUserRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private JwtUtil jwtUtil;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        jwtUtil = new JwtUtil();
        ReflectionTestUtils.setField(jwtUtil, "secretKey", "test-signing-secret-that-is-at-least-256-bits-long-0123456789");
        ReflectionTestUtils.setField(jwtUtil, "expirationMs", 3_600_000L);
        authService = new AuthService(adminUserRepository, passwordEncoder, jwtUtil);
    }

    private AdminUser admin(boolean active) {
        AdminUser admin = new AdminUser();
        admin.setUsername("ops");
        admin.setEmail("ops@ewale.com");
        admin.setPasswordHash(passwordEncoder.encode("s3cret!"));
        admin.setRole(Role.SUPPORT);
        admin.setActive(active);
        return admin;
    }

    private static LoginRequest login(String username, String password) {
        LoginRequest request = new LoginRequest();
        request.setUsername(username);
        request.setPassword(password);
        return request;
    }

    @Test
    @DisplayName("Valid credentials return a verifiable token carrying the role")
    void validLogin() {
        // Given
        AdminUser admin = admin(true);
        when(adminUserRepository.findByUsernameIgnoreCase("ops")).thenReturn(Optional.of(admin));

        // When
        AdminLoginResponse response = authService.login(login(" ops ", "s3cret!"));

        // Then
        assertThat(response.getTokenType()).isEqualTo("Bearer");
        assertThat(response.getRole()).isEqualTo(Role.SUPPORT);
        assertThat(jwtUtil.verify(response.getToken()))
                .hasValueSatisfying(claims -> {
                    assertThat(claims.getSubject()).isEqualTo("ops");
                    assertThat(JwtUtil.roleOf(claims)).isEqualTo(Role.SUPPORT);
                });
        assertThat(admin.getLastLoginAt()).isNotNull();
        verify(adminUserRepository).save(admin);
    }

    @Test
    @DisplayName("Wrong password is rejected")
    void wrongPassword() {
        when(adminUserRepository.findByUsernameIgnoreCase("ops")).thenReturn(Optional.of(admin(true)));

        assertThatThrownBy(() -> authService.login(login("ops", "guess")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Invalid username or password");
        verify(adminUserRepository, never()).save(any(AdminUser.class));
    }

    @Test
    @DisplayName("Disabled account is rejected like a bad password")
    void disabledAccount() {
        when(adminUserRepository.findByUsernameIgnoreCase("ops")).thenReturn(Optional.of(admin(false)));

        assertThatThrownBy(() -> authService.login(login("ops", "s3cret!")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Invalid username or password");
    }

    @Test
    @DisplayName("Tampered token fails verification")
    void tamperedToken() {
        String token = jwtUtil.issueToken(admin(true), new Date());

        String[] parts = token.split("\\.");
        String signature = parts[2];
        String forged = parts[0] + "." + parts[1] + "."
                + (signature.charAt(0) == 'A' ? 'B' : 'A') + signature.substring(1);

        assertThat(jwtUtil.verify(forged)).isEmpty();
        assertThat(jwtUtil.verify("not-a-token")).isEmpty();
    }
}
