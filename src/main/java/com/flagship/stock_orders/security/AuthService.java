package com.flagship.stock_orders.security;

import com.flagship.stock_orders.security.dto.LoginResponse;
import com.flagship.stock_orders.user.UserEntity;
import com.flagship.stock_orders.user.UserRepository;
import com.flagship.stock_orders.user.dto.UserResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Exchanges username/password for an access token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private static final String TOKEN_TYPE = "Bearer";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    /**
     * Unknown users, wrong passwords and deactivated accounts all fail the
     * same way so the response does not reveal which one it was.
     *
     * @throws BadCredentialsException if the credentials are not accepted
     */
    @Transactional(readOnly = true)
    public LoginResponse login(String username, String password) {
        UserEntity user = userRepository.findByUsername(username)
            .filter(UserEntity::isActive)
            .filter(candidate -> passwordEncoder.matches(password, candidate.getPasswordHash()))
            .orElseThrow(() -> {
                log.warn("Login rejected: username={}", username);
                return new BadCredentialsException("Invalid credentials");
            });

        String token = jwtTokenProvider.generateToken(user.getId(), user.getUsername(), user.getRole());
        log.info("Login succeeded: username={}, role={}", user.getUsername(), user.getRole());

        return LoginResponse.builder()
            .token(token)
            .tokenType(TOKEN_TYPE)
            .expiresInMs(jwtTokenProvider.getExpirationMs())
            .user(UserResponse.from(user))
            .build();
    }
}
