package com.flagship.stock_orders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Stock inventory and purchase order approval service.
 *
 * Users authenticate with a JWT issued by {@code /api/auth/login}; there is no
 * in-memory user store, so Spring Boot's default one is excluded.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class StockOrdersApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockOrdersApplication.class, args);
    }
}
