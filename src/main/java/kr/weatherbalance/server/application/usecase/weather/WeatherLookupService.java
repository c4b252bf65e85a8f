package kr.weatherbalance.server.application.usecase.weather;

import kr.weatherbalance.server.application.port.out.TemperatureCachePort;
import kr.weatherbalance.server.application.port.out.WeatherPort;
import kr.weatherbalance.server.domain.weather.WeatherFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 캐시 우선 온도 조회
 * - 캐시 히트: 외부 호출 0회
 * - 캐시 미스: 외부 호출 1회, 성공 시 캐시 1회 기록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeatherLookupService {

    private final TemperatureCachePort temperatureCache;
    private final WeatherPort weatherPort;
    private final Clock clock;

    public TemperatureLookup fetch(String city) {
        Optional<Double> cached = temperatureCache.get(city);
        if (cached.isPresent()) {
            log.debug("캐시 히트 - city: {}", city);
            return TemperatureLookup.found(cached.get(), true);
        }

        // 만료 기준 시각은 호출 직전 시각
        Instant requestedAt = clock.instant();
        log.info("캐시 미스 - 날씨 API 호출: {}", city);
        try {
            double temperature = weatherPort.currentTemperature(city);
            temperatureCache.put(city, temperature, requestedAt);
            return TemperatureLookup.found(temperature, false);
        } catch (WeatherFetchException e) {
            log.warn("날씨 조회 실패 - city: {}, reason: {}", e.getCity(), e.getMessage());
            return TemperatureLookup.unavailable(city, e.getMessage());
        }
    }
}
