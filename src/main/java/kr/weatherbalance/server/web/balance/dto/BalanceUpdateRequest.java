package kr.weatherbalance.server.web.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record BalanceUpdateRequest(
        @JsonProperty("user_id")
        @NotNull(message = "user_id is required")
        Long userId,

        String operation,  // 서비스에서 검증

        @NotBlank(message = "city is required")
        String city
) {}
