package kr.weatherbalance.server.domain.weather;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * 온도를 얻지 못해 잔액 변경을 중단할 때 발생하는 예외
 */
public class WeatherUnavailableException extends RuntimeException {

    private final String city;

    public WeatherUnavailableException(String city) {
        super(String.format("Failed to fetch weather in %s. Balance not changed", displayName(city)));
        this.city = city;
    }

    public static WeatherUnavailableException forCity(String city) {
        return new WeatherUnavailableException(city);
    }

    // 첫 글자만 대문자, 나머지는 소문자
    static String displayName(String city) {
        if (city == null) {
            return "";
        }
        return StringUtils.capitalize(city.toLowerCase(Locale.ROOT));
    }

    public String getCity() {
        return city;
    }
}
