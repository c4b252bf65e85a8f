package kr.weatherbalance.server.application.usecase.weather;

import kr.weatherbalance.server.application.port.out.WeatherPort;
import kr.weatherbalance.server.domain.weather.WeatherFetchException;
import kr.weatherbalance.server.infrastructure.cache.InMemoryTemperatureCache;
import kr.weatherbalance.server.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WeatherLookupServiceTest {

    private static final Duration TTL = Duration.ofSeconds(600);

    @Mock
    private WeatherPort weatherPort;

    private MutableClock clock;
    private InMemoryTemperatureCache cache;
    private WeatherLookupService weatherLookupService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        cache = new InMemoryTemperatureCache(clock, TTL);
        weatherLookupService = new WeatherLookupService(cache, weatherPort, clock);
    }

    @Test
    @DisplayName("TTL 안에 두 번 조회하면 외부 호출은 1회")
    void fetchTwiceWithinTtl_callsApiOnce() {
        // given
        when(weatherPort.currentTemperature("Moscow")).thenReturn(15.5);

        // when
        TemperatureLookup first = weatherLookupService.fetch("Moscow");
        clock.advance(Duration.ofSeconds(599));
        TemperatureLookup second = weatherLookupService.fetch("Moscow");

        // then
        assertThat(first).isEqualTo(new TemperatureLookup.Found(15.5, false));
        assertThat(second).isEqualTo(new TemperatureLookup.Found(15.5, true));
        verify(weatherPort, times(1)).currentTemperature("Moscow");
    }

    @Test
    @DisplayName("TTL 경과 후에는 다시 외부 호출")
    void fetchAfterTtl_callsApiAgain() {
        // given
        when(weatherPort.currentTemperature("Moscow")).thenReturn(15.5, 12.0);

        // when
        weatherLookupService.fetch("Moscow");
        clock.advance(TTL.plusSeconds(1));
        TemperatureLookup refreshed = weatherLookupService.fetch("Moscow");

        // then
        assertThat(refreshed).isEqualTo(new TemperatureLookup.Found(12.0, false));
        verify(weatherPort, times(2)).currentTemperature("Moscow");
        assertThat(cache.get("Moscow")).contains(12.0);
    }

    @Test
    @DisplayName("외부 조회 실패 시 Unavailable, 캐시에 기록하지 않음")
    void fetchFailure_returnsUnavailable() {
        // given
        when(weatherPort.currentTemperature("Atlantis"))
                .thenThrow(WeatherFetchException.unexpectedStatus("Atlantis", 404));

        // when
        TemperatureLookup result = weatherLookupService.fetch("Atlantis");

        // then
        assertThat(result).isInstanceOf(TemperatureLookup.Unavailable.class);
        assertThat(((TemperatureLookup.Unavailable) result).city()).isEqualTo("Atlantis");
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("실패 후 재조회는 다시 외부 호출")
    void failureIsNotCached() {
        // given
        when(weatherPort.currentTemperature("Moscow"))
                .thenThrow(WeatherFetchException.missingTemperature("Moscow"))
                .thenReturn(3.0);

        // when
        weatherLookupService.fetch("Moscow");
        TemperatureLookup second = weatherLookupService.fetch("Moscow");

        // then
        assertThat(second).isEqualTo(new TemperatureLookup.Found(3.0, false));
        verify(weatherPort, times(2)).currentTemperature("Moscow");
    }

    @Test
    @DisplayName("0도도 정상 값으로 캐시된다")
    void zeroTemperatureIsCached() {
        when(weatherPort.currentTemperature("Oslo")).thenReturn(0.0);

        weatherLookupService.fetch("Oslo");
        TemperatureLookup second = weatherLookupService.fetch("Oslo");

        assertThat(second).isEqualTo(new TemperatureLookup.Found(0.0, true));
        verify(weatherPort, times(1)).currentTemperature("Oslo");
    }
}
