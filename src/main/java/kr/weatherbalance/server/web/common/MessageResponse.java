package kr.weatherbalance.server.web.common;

public record MessageResponse(String message) {}
