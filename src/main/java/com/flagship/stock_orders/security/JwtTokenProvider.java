package com.flagship.stock_orders.security;

import com.flagship.stock_orders.user.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies HS256 access tokens.
 *
 * Claims: subject = username, {@code userId}, {@code role}.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String USER_ID_CLAIM = "userId";
    static final String ROLE_CLAIM = "role";
    private static final int MIN_SECRET_LENGTH = 32;

    @Value("${jwt.secret:}")
    private String jwtSecret;

    @Value("${jwt.expiration:86400000}")
    private long jwtExpirationMs;

    private SecretKey signingKey;

    @PostConstruct
    void initSigningKey() {
        if (jwtSecret == null || jwtSecret.length() < MIN_SECRET_LENGTH) {
            log.error("jwt.secret missing or shorter than {} characters; using an ephemeral key. "
                    + "Issued tokens will not survive a restart.", MIN_SECRET_LENGTH);
            jwtSecret = UUID.randomUUID() + UUID.randomUUID().toString();
        }
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(UUID userId, String username, UserRole role) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        return Jwts.builder()
                .subject(username)
                .claim(USER_ID_CLAIM, userId.toString())
                .claim(ROLE_CLAIM, role.name())
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    public long getExpirationMs() {
        return jwtExpirationMs;
    }

    /**
     * Verifies the token and resolves the caller it was issued to.
     *
     * @return empty if the token is malformed, expired, badly signed or carries unknown claims
     */
    public Optional<UserPrincipal> parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String userId = claims.get(USER_ID_CLAIM, String.class);
            String role = claims.get(ROLE_CLAIM, String.class);
            if (userId == null || role == null) {
                log.debug("JWT rejected: missing userId or role claim");
                return Optional.empty();
            }

            return Optional.of(new UserPrincipal(UUID.fromString(userId), claims.getSubject(), UserRole.valueOf(role)));
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("JWT rejected: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
