package kr.weatherbalance.server.application.port.out;

import kr.weatherbalance.server.domain.weather.WeatherFetchException;

/**
 * 외부 날씨 API 포트 (캐시 없이 매번 호출)
 */
public interface WeatherPort {

    /**
     * @return 섭씨 기준 현재 온도
     * @throws WeatherFetchException 비정상 응답, 통신 오류, 온도 필드 누락 시
     */
    double currentTemperature(String city);
}
