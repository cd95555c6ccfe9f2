package com.flagship.stock_orders.user;

import com.flagship.stock_orders.exception.NotFoundException;
import com.flagship.stock_orders.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Account administration: listing, creating and (de)activating users.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional(readOnly = true)
    public List<UserEntity> listManagedUsers() {
        return userRepository.findByRoleNotOrderByCreatedAtDesc(UserRole.ADMIN);
    }

    /**
     * Creates a non-admin account on behalf of an administrator.
     *
     * @throws ValidationException if the role is unknown or not assignable, or the username is taken
     */
    @Transactional
    public UserEntity createUser(String username, String rawPassword, String role, UUID createdBy) {
        UserRole userRole = parseAssignableRole(role);
        UserEntity saved = register(username, rawPassword, userRole, createdBy);
        log.info("User created: username={}, role={}, createdBy={}", username, userRole, createdBy);
        return saved;
    }

    /**
     * Creates an account with any role. Used by the admin seeder as well.
     */
    @Transactional
    public UserEntity register(String username, String rawPassword, UserRole role, UUID createdBy) {
        if (userRepository.existsByUsername(username)) {
            throw new ValidationException(ValidationException.DUPLICATE_USERNAME, "Username already exists");
        }
        UserEntity entity = UserEntity.create(username, passwordEncoder.encode(rawPassword), role, createdBy);
        return userRepository.save(entity);
    }

    @Transactional
    public UserEntity updateStatus(UUID userId, boolean active) {
        UserEntity entity = userRepository.findById(userId)
            .orElseThrow(() -> NotFoundException.user(userId));
        entity.changeActive(active);
        UserEntity saved = userRepository.save(entity);
        log.info("User status changed: userId={}, active={}", userId, active);
        return saved;
    }

    private UserRole parseAssignableRole(String role) {
        UserRole parsed;
        try {
            parsed = UserRole.valueOf(role);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ValidationException.INVALID_ROLE, "Invalid role: " + role);
        }
        if (!parsed.isAssignable()) {
            throw new ValidationException(ValidationException.INVALID_ROLE, "Invalid role: " + role);
        }
        return parsed;
    }
}
