package com.flagship.stock_orders.security;

import com.flagship.stock_orders.user.UserRole;

import java.util.EnumSet;
import java.util.Set;

/**
 * Permission table: which roles may perform each guarded operation.
 * The security filter chain is built from this table.
 */
public enum Permission {
    CREATE_ORDER(EnumSet.of(UserRole.SALES_REPRESENTATIVE)),
    DECIDE_ORDER(EnumSet.of(UserRole.STORE_KEEPER)),
    VIEW_ORDERS(EnumSet.allOf(UserRole.class)),
    VIEW_STOCK(EnumSet.allOf(UserRole.class)),
    MANAGE_STOCK(EnumSet.of(UserRole.MANAGER)),
    MANAGE_USERS(EnumSet.of(UserRole.ADMIN)),
    VIEW_DASHBOARD(EnumSet.allOf(UserRole.class)),
    VIEW_SALES_SUMMARY(EnumSet.of(UserRole.ADMIN));

    private final Set<UserRole> allowedRoles;

    Permission(Set<UserRole> allowedRoles) {
        this.allowedRoles = allowedRoles;
    }

    public boolean isGrantedTo(UserRole role) {
        return role != null && allowedRoles.contains(role);
    }

    /**
     * Role names without the {@code ROLE_} prefix, for {@code hasAnyRole(...)}.
     */
    public String[] roleNames() {
        return allowedRoles.stream().map(Enum::name).toArray(String[]::new);
    }
}
