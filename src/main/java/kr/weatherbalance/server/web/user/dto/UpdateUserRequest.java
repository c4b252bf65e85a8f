package kr.weatherbalance.server.web.user.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * 알 수 없는 필드는 무시, 지정된 필드만 변경
 */
public record UpdateUserRequest(
        @Size(min = 1, max = 50, message = "username must be 1 to 50 characters")
        String username,

        @PositiveOrZero(message = "balance must be zero or greater")
        Double balance
) {}
