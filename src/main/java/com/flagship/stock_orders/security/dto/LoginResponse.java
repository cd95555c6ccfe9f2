package com.flagship.stock_orders.security.dto;

import com.flagship.stock_orders.user.dto.UserResponse;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LoginResponse {
    String token;
    String tokenType;
    long expiresInMs;
    UserResponse user;
}
