package com.flagship.stock_orders.user;

import com.flagship.stock_orders.security.UserPrincipal;
import com.flagship.stock_orders.user.dto.CreateUserRequest;
import com.flagship.stock_orders.user.dto.UpdateUserStatusRequest;
import com.flagship.stock_orders.user.dto.UserResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Account administration endpoints. Access is restricted to ADMIN in the security configuration.
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping
    public List<UserResponse> listUsers() {
        return userService.listManagedUsers().stream()
            .map(UserResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request,
                                                   @AuthenticationPrincipal UserPrincipal principal) {
        UserEntity created = userService.createUser(
            request.getUsername(), request.getPassword(), request.getRole(), principal.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(created));
    }

    @PatchMapping("/{id}/status")
    public UserResponse updateStatus(@PathVariable("id") UUID id,
                                     @Valid @RequestBody UpdateUserStatusRequest request) {
        return UserResponse.from(userService.updateStatus(id, request.getIsActive()));
    }
}
