package kr.weatherbalance.server.infrastructure.cache;

import kr.weatherbalance.server.application.port.out.TemperatureCachePort;
import kr.weatherbalance.server.domain.weather.CachedTemperature;
import kr.weatherbalance.server.infrastructure.config.WeatherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 단위 온도 캐시
 * - 도시명(대소문자 구분)당 항목 1개, 마지막 쓰기 우선
 * - 만료 항목은 삭제하지 않고 조회 시 무시만 함
 * - 별도 eviction 없음: 조회된 도시 수만큼 메모리 사용
 */
@Slf4j
@Component
public class InMemoryTemperatureCache implements TemperatureCachePort {

    private final Map<String, CachedTemperature> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public InMemoryTemperatureCache(Clock clock, WeatherProperties properties) {
        this(clock, properties.getCache().getTtl());
    }

    public InMemoryTemperatureCache(Clock clock, Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("cache ttl must be zero or positive");
        }
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Optional<Double> get(String city) {
        CachedTemperature entry = entries.get(city);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (!entry.isValidAt(now)) {
            log.debug("캐시 만료 - city: {}, expiresAt: {}", city, entry.expiresAt());
            return Optional.empty();
        }
        return Optional.of(entry.temperature());
    }

    @Override
    public void put(String city, double temperature, Instant now) {
        entries.put(city, new CachedTemperature(temperature, now.plus(ttl)));
    }

    @Override
    public int size() {
        return entries.size();
    }
}
