package com.flagship.stock_orders.user.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class UpdateUserStatusRequest {

    @NotNull(message = "isActive is required")
    Boolean isActive;
}
