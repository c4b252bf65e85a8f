package kr.weatherbalance.server.web.user.dto;

public record UserUpdatedResponse(String message, Long id) {}
