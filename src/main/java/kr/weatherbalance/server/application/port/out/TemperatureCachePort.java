package kr.weatherbalance.server.application.port.out;

import java.time.Instant;
import java.util.Optional;

/**
 * 도시별 온도 캐시 포트
 */
public interface TemperatureCachePort {

    /**
     * 만료되지 않은 항목이 있으면 온도를 반환. 만료 항목은 없는 것으로 취급.
     */
    Optional<Double> get(String city);

    /**
     * expiresAt = now + TTL 로 덮어쓴다 (last write wins)
     */
    void put(String city, double temperature, Instant now);

    int size();
}
