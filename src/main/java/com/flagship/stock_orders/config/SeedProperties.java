package com.flagship.stock_orders.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials of the administrator account created on first start.
 * Seeding is skipped unless both values are set.
 */
@Value
@ConfigurationProperties(prefix = "app.seed")
public class SeedProperties {
    String adminUsername;
    String adminPassword;

    public boolean isAdminConfigured() {
        return adminUsername != null && !adminUsername.isBlank()
            && adminPassword != null && !adminPassword.isBlank();
    }
}
