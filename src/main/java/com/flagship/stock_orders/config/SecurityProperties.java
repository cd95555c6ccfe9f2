package com.flagship.stock_orders.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * HTTP-layer security settings, bound once at startup and handed to
 * {@link SecurityConfig}. Immutable after binding.
 */
@ConfigurationProperties(prefix = "app.security")
@Value
public class SecurityProperties {

    Cors cors;

    public SecurityProperties(@DefaultValue Cors cors) {
        this.cors = cors;
    }

    @Value
    public static class Cors {
        List<String> allowedOrigins;
        List<String> allowedMethods;

        public Cors(@DefaultValue List<String> allowedOrigins,
                    @DefaultValue({"GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"}) List<String> allowedMethods) {
            this.allowedOrigins = List.copyOf(allowedOrigins);
            this.allowedMethods = List.copyOf(allowedMethods);
        }
    }
}
