package com.flagship.stock_orders.security;

import com.flagship.stock_orders.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Authenticated caller, resolved from the bearer token of a request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPrincipal {
    private UUID userId;
    private String username;
    private UserRole role;

    public boolean hasRole(UserRole candidate) {
        return role == candidate;
    }
}
