package com.ewale.ewale.util;

import com.ewale.ewale.entity.AdminUser;
import com.ewale.ewale.entity.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * Signs and verifies back-office tokens. Tokens carry the admin username as subject and the role claim.
 */
@Component
public class JwtUtil {

    private static final Logger logger = LoggerFactory.getLogger(JwtUtil.class);

    static final String ISSUER = "ewale-ussd";
    static final String ROLE_CLAIM = "role";

    @Value("${jwt.secret}")
    private String secretKey;

    @Value("${jwt.expiration:86400000}")
    private long expirationMs;

    private SecretKey signingKey() {
        return Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    public String issueToken(AdminUser admin, Date issuedAt) {
        return Jwts.builder()
                .issuer(ISSUER)
                .subject(admin.getUsername())
                .claim(ROLE_CLAIM, admin.getRole().name())
                .issuedAt(issuedAt)
                .expiration(expiryFor(issuedAt))
                .signWith(signingKey())
                .compact();
    }

    public Date expiryFor(Date issuedAt) {
        return new Date(issuedAt.getTime() + expirationMs);
    }

    /**
     * @return the verified claims, or empty when the token is malformed, expired, foreign or badly signed
     */
    public Optional<Claims> verify(String token) {
        try {
            return Optional.of(Jwts.parser()
                    .verifyWith(signingKey())
                    .requireIssuer(ISSUER)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload());
        } catch (JwtException | IllegalArgumentException e) {
            logger.debug("Rejected admin token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public static Role roleOf(Claims claims) {
        return Role.valueOf(claims.get(ROLE_CLAIM, String.class));
    }
}
