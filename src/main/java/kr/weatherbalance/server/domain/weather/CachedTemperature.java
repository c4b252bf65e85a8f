package kr.weatherbalance.server.domain.weather;

import java.time.Instant;

/**
 * 도시별 캐시 항목. 불변 값이므로 교체만 가능.
 */
public record CachedTemperature(double temperature, Instant expiresAt) {

    public CachedTemperature {
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt cannot be null");
        }
    }

    // 만료 시각과 같은 순간까지는 유효
    public boolean isValidAt(Instant now) {
        return !now.isAfter(expiresAt);
    }
}
