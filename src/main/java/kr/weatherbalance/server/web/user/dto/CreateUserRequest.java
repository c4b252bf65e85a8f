package kr.weatherbalance.server.web.user.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "username is required")
        @Size(max = 50, message = "username must not exceed 50 characters")
        String username,

        @PositiveOrZero(message = "balance must be zero or greater")
        Double balance  // 생략 시 0
) {
    public double balanceOrZero() {
        return balance == null ? 0.0 : balance;
    }
}
