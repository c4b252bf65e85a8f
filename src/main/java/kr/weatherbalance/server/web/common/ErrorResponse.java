package kr.weatherbalance.server.web.common;

public record ErrorResponse(String code, String error) {}
