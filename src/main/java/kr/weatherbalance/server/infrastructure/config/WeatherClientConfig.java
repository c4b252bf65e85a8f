package kr.weatherbalance.server.infrastructure.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class WeatherClientConfig {

    @Bean
    public RestTemplate weatherRestTemplate(RestTemplateBuilder builder) {
        return builder.build();
    }

    /**
     * 캐시 만료 판단용 시계. 테스트에서는 고정/가변 Clock 으로 교체.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
