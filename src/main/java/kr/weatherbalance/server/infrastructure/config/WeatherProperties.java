package kr.weatherbalance.server.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "weather")
public class WeatherProperties {
    private Api api = new Api();
    private Cache cache = new Cache();

    // true 면 POST 경로에서 0.0도를 조회 실패로 간주 (기존 동작)
    private boolean zeroTemperatureAsFailure = false;

    @Getter
    @Setter
    public static class Api {
        private String url = "http://api.openweathermap.org/data/2.5/weather";
        private String key = "test";
        private String units = "metric";
    }

    @Getter
    @Setter
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(600);
    }
}
