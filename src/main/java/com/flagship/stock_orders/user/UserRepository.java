package com.flagship.stock_orders.user;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    Optional<UserEntity> findByUsername(String username);

    boolean existsByUsername(String username);

    /**
     * Accounts an administrator manages; ADMIN accounts are hidden.
     */
    List<UserEntity> findByRoleNotOrderByCreatedAtDesc(UserRole role);

    long countByRoleNotAndActiveTrue(UserRole role);
}
