package kr.weatherbalance.server.application.usecase.weather;

/**
 * 온도 조회 결과: 성공(Found) 또는 실패(Unavailable)
 */
public sealed interface TemperatureLookup permits TemperatureLookup.Found, TemperatureLookup.Unavailable {

    record Found(double temperature, boolean fromCache) implements TemperatureLookup {}

    record Unavailable(String city, String reason) implements TemperatureLookup {}

    static TemperatureLookup found(double temperature, boolean fromCache) {
        return new Found(temperature, fromCache);
    }

    static TemperatureLookup unavailable(String city, String reason) {
        return new Unavailable(city, reason);
    }
}
