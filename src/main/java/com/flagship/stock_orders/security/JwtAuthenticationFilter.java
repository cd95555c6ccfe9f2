package com.flagship.stock_orders.security;

import com.flagship.stock_orders.observability.CorrelationContext;
import com.flagship.stock_orders.user.UserEntity;
import com.flagship.stock_orders.user.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the caller from an {@code Authorization: Bearer} header.
 *
 * Requests without a valid token pass through unauthenticated; the
 * authorization rules then decide whether that is acceptable.
 * A token is only honoured while its user still exists and is active, and
 * the role is taken from the stored account rather than from the token.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider jwtTokenProvider;
    private final UserRepository userRepository;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader("Authorization");

        if (header != null && header.startsWith(BEARER_PREFIX)) {
            jwtTokenProvider.parse(header.substring(BEARER_PREFIX.length()))
                    .flatMap(this::resolveActiveUser)
                    .ifPresent(principal -> authenticate(principal, request));
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(UserPrincipal principal, HttpServletRequest request) {
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + principal.getRole().name())));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        MDC.put(CorrelationContext.USER_MDC_KEY, principal.getUsername());

        log.debug("Authenticated user: {} with role: {}", principal.getUsername(), principal.getRole());
    }

    private Optional<UserPrincipal> resolveActiveUser(UserPrincipal fromToken) {
        Optional<UserEntity> user = userRepository.findById(fromToken.getUserId())
                .filter(UserEntity::isActive);
        if (user.isEmpty()) {
            log.debug("JWT rejected: user {} is missing or deactivated", fromToken.getUsername());
            return Optional.empty();
        }
        return Optional.of(new UserPrincipal(user.get().getId(), user.get().getUsername(), user.get().getRole()));
    }
}
