package com.flagship.stock_orders.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stock_orders.user.UserEntity;
import com.flagship.stock_orders.user.UserRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Public view of an account; never carries the password hash.
 */
@Value
@Builder
public class UserResponse {
    UUID id;
    String username;
    UserRole role;
    @JsonProperty("isActive")
    boolean active;
    Instant createdAt;

    public static UserResponse from(UserEntity entity) {
        return UserResponse.builder()
            .id(entity.getId())
            .username(entity.getUsername())
            .role(entity.getRole())
            .active(entity.isActive())
            .createdAt(entity.getCreatedAt())
            .build();
    }
}
