package com.ewale.ewale.dto;

import com.ewale.ewale.entity.Role;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdminLoginResponse {
    private String token;
    private String tokenType;
    private LocalDateTime expiresAt;
    private String username;
    private Role role;
}
