package kr.weatherbalance.server.infrastructure.weather;

import kr.weatherbalance.server.application.port.out.WeatherPort;
import kr.weatherbalance.server.domain.weather.WeatherFetchException;
import kr.weatherbalance.server.infrastructure.config.WeatherProperties;
import kr.weatherbalance.server.infrastructure.weather.dto.OpenWeatherResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * OpenWeatherMap 호출 어댑터
 * - 재시도 없음, 200 이외의 응답은 모두 실패
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenWeatherAdapter implements WeatherPort {

    private final RestTemplate weatherRestTemplate;
    private final WeatherProperties properties;

    @Override
    public double currentTemperature(String city) {
        WeatherProperties.Api api = properties.getApi();
        URI uri = UriComponentsBuilder.fromHttpUrl(api.getUrl())
                .queryParam("q", city)
                .queryParam("appid", api.getKey())
                .queryParam("units", api.getUnits())
                .encode()
                .build()
                .toUri();

        ResponseEntity<OpenWeatherResponse> response;
        try {
            response = weatherRestTemplate.getForEntity(uri, OpenWeatherResponse.class);
        } catch (RestClientException e) {
            // 4xx/5xx, 통신 오류, JSON 파싱 오류 모두 여기로
            throw WeatherFetchException.requestFailed(city, e);
        }

        int status = response.getStatusCode().value();
        if (status != 200) {
            throw WeatherFetchException.unexpectedStatus(city, status);
        }

        OpenWeatherResponse body = response.getBody();
        if (body == null || body.getMain() == null || body.getMain().getTemp() == null) {
            throw WeatherFetchException.missingTemperature(city);
        }

        log.debug("날씨 API 응답 - city: {}, temp: {}", city, body.getMain().getTemp());
        return body.getMain().getTemp();
    }
}
