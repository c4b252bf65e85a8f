package kr.weatherbalance.server.domain.weather;

/**
 * 외부 날씨 API 호출 실패 (비정상 응답, 통신 오류, 응답 형식 오류)
 */
public class WeatherFetchException extends RuntimeException {

    private final String city;

    public WeatherFetchException(String city, String message) {
        super(message);
        this.city = city;
    }

    public WeatherFetchException(String city, String message, Throwable cause) {
        super(message, cause);
        this.city = city;
    }

    // 편의 팩토리 메서드들
    public static WeatherFetchException unexpectedStatus(String city, int status) {
        return new WeatherFetchException(city,
                String.format("weather API returned status %d for %s", status, city));
    }

    public static WeatherFetchException requestFailed(String city, Throwable cause) {
        return new WeatherFetchException(city,
                String.format("weather API request failed for %s: %s", city, cause.getMessage()), cause);
    }

    public static WeatherFetchException missingTemperature(String city) {
        return new WeatherFetchException(city,
                String.format("weather API response for %s has no main.temp", city));
    }

    public String getCity() {
        return city;
    }
}
