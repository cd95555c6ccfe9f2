package com.flagship.stock_orders.user;

/**
 * Closed set of roles a caller can hold.
 */
public enum UserRole {
    ADMIN,
    MANAGER,
    STORE_KEEPER,
    SALES_REPRESENTATIVE;

    /**
     * Roles an administrator may hand out. ADMIN accounts are only seeded.
     */
    public boolean isAssignable() {
        return this != ADMIN;
    }
}
