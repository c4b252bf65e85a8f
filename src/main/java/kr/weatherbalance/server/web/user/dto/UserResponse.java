package kr.weatherbalance.server.web.user.dto;

import kr.weatherbalance.server.domain.user.model.User;

public record UserResponse(Long id, String username, double balance) {
    public static UserResponse from(User user) {
        return new UserResponse(user.id(), user.username(), user.balance());
    }
}
