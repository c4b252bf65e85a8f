package kr.weatherbalance.server.infrastructure.cache;

import kr.weatherbalance.server.infrastructure.config.WeatherProperties;
import kr.weatherbalance.server.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTemperatureCacheTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
    private static final Duration TTL = Duration.ofSeconds(600);

    private MutableClock clock;
    private InMemoryTemperatureCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new InMemoryTemperatureCache(clock, TTL);
    }

    @Test
    @DisplayName("저장 직후 같은 시각에 조회하면 저장한 온도를 반환")
    void putThenGet() {
        cache.put("Moscow", 15.5, clock.instant());

        assertThat(cache.get("Moscow")).contains(15.5);
    }

    @Test
    @DisplayName("만료 시각과 정확히 같은 순간까지는 캐시 히트")
    void get_atExactExpiry_returnsValue() {
        cache.put("Moscow", 15.5, START);

        clock.setInstant(START.plus(TTL));

        assertThat(cache.get("Moscow")).contains(15.5);
    }

    @Test
    @DisplayName("만료 시각 직후에는 캐시 미스")
    void get_afterExpiry_returnsEmpty() {
        cache.put("Moscow", 15.5, START);

        clock.setInstant(START.plus(TTL).plusNanos(1));

        assertThat(cache.get("Moscow")).isEmpty();
        // 만료 항목은 삭제되지 않고 무시만 된다
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("없는 도시는 캐시 미스")
    void get_unknownCity() {
        assertThat(cache.get("Paris")).isEmpty();
    }

    @Test
    @DisplayName("도시명은 대소문자를 구분한다")
    void keysAreCaseSensitive() {
        cache.put("Moscow", 15.5, START);

        assertThat(cache.get("moscow")).isEmpty();
        assertThat(cache.get("Moscow")).contains(15.5);
    }

    @Test
    @DisplayName("같은 도시에 다시 저장하면 값과 만료 시각 모두 덮어쓴다")
    void put_overwritesEntry() {
        cache.put("Moscow", 15.5, START);
        clock.advance(Duration.ofSeconds(500));
        cache.put("Moscow", 17.0, clock.instant());

        clock.advance(Duration.ofSeconds(300));

        assertThat(cache.get("Moscow")).contains(17.0);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("설정의 TTL 을 사용한다")
    void usesConfiguredTtl() {
        WeatherProperties properties = new WeatherProperties();
        properties.getCache().setTtl(Duration.ofSeconds(30));
        InMemoryTemperatureCache configured = new InMemoryTemperatureCache(clock, properties);

        configured.put("Moscow", 1.0, START);
        clock.setInstant(START.plusSeconds(31));

        assertThat(configured.get("Moscow")).isEmpty();
    }

    @Test
    void negativeTtlRejected() {
        assertThatThrownBy(() -> new InMemoryTemperatureCache(clock, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("동시 쓰기/읽기 중에도 항목은 도시당 1개, 읽은 값은 항상 기록된 값 중 하나")
    void concurrentPutAndGet() throws InterruptedException {
        int threadCount = 20;
        int iterations = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger invalidReads = new AtomicInteger();

        for (int i = 0; i < threadCount; i++) {
            final double temperature = i;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int j = 0; j < iterations; j++) {
                        cache.put("Seoul", temperature, START);
                        cache.get("Seoul").ifPresent(value -> {
                            if (value < 0 || value >= threadCount || value != Math.floor(value)) {
                                invalidReads.incrementAndGet();
                            }
                        });
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        boolean finished = done.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        assertThat(finished).isTrue();
        assertThat(invalidReads.get()).isZero();
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("Seoul")).isPresent();
    }
}
