package com.flagship.stock_orders.config;

import com.flagship.stock_orders.security.JwtAuthenticationFilter;
import com.flagship.stock_orders.security.Permission;
import com.flagship.stock_orders.security.RestAccessDeniedHandler;
import com.flagship.stock_orders.security.RestAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Stateless JWT security. Endpoint access follows the {@link Permission} table.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private static final int BCRYPT_STRENGTH = 10;

    private final JwtAuthenticationFilter jwtAuthFilter;
    private final SecurityProperties securityProperties;
    private final RestAuthenticationEntryPoint restAuthenticationEntryPoint;
    private final RestAccessDeniedHandler restAccessDeniedHandler;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }

    /**
     * The JWT filter runs inside the security chain only, not as a plain servlet filter.
     */
    @Bean
    public FilterRegistrationBean<JwtAuthenticationFilter> jwtAuthFilterRegistration() {
        FilterRegistrationBean<JwtAuthenticationFilter> registration = new FilterRegistrationBean<>(jwtAuthFilter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(restAuthenticationEntryPoint)
                .accessDeniedHandler(restAccessDeniedHandler)
            )
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/auth/login").permitAll()
                .requestMatchers("/health", "/actuator/health/**", "/actuator/info", "/actuator/prometheus").permitAll()
                .requestMatchers("/error").permitAll()

                .requestMatchers(HttpMethod.POST, "/api/orders")
                    .hasAnyRole(Permission.CREATE_ORDER.roleNames())
                .requestMatchers(HttpMethod.PATCH, "/api/orders/*/approve", "/api/orders/*/reject")
                    .hasAnyRole(Permission.DECIDE_ORDER.roleNames())
                .requestMatchers(HttpMethod.GET, "/api/orders", "/api/orders/*")
                    .hasAnyRole(Permission.VIEW_ORDERS.roleNames())

                .requestMatchers(HttpMethod.GET, "/api/stock")
                    .hasAnyRole(Permission.VIEW_STOCK.roleNames())
                .requestMatchers("/api/stock", "/api/stock/*")
                    .hasAnyRole(Permission.MANAGE_STOCK.roleNames())

                .requestMatchers("/api/users", "/api/users/**")
                    .hasAnyRole(Permission.MANAGE_USERS.roleNames())

                .requestMatchers(HttpMethod.GET, "/api/dashboard/stats")
                    .hasAnyRole(Permission.VIEW_DASHBOARD.roleNames())
                .requestMatchers(HttpMethod.GET, "/api/dashboard/sales-summary")
                    .hasAnyRole(Permission.VIEW_SALES_SUMMARY.roleNames())

                .anyRequest().authenticated()
            )
            .addFilterBefore(jwtAuthFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration cfg = new CorsConfiguration();
        cfg.setAllowedOrigins(securityProperties.getCors().getAllowedOrigins());
        cfg.setAllowedMethods(securityProperties.getCors().getAllowedMethods());
        cfg.setAllowedHeaders(List.of("Content-Type", "Authorization", "X-Requested-With", "X-Correlation-ID"));
        cfg.setExposedHeaders(List.of("X-Correlation-ID"));
        cfg.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cfg);
        return source;
    }
}
