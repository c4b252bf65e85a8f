package kr.weatherbalance.server.application.usecase.balance;

import kr.weatherbalance.server.application.port.in.BalanceUpdateUseCase;
import kr.weatherbalance.server.application.port.out.UserPort;
import kr.weatherbalance.server.application.usecase.weather.TemperatureLookup;
import kr.weatherbalance.server.application.usecase.weather.WeatherLookupService;
import kr.weatherbalance.server.domain.balance.BalanceOperation;
import kr.weatherbalance.server.domain.balance.BalanceUpdateFailedException;
import kr.weatherbalance.server.domain.balance.InvalidBalanceOperationException;
import kr.weatherbalance.server.domain.user.UserNotFoundException;
import kr.weatherbalance.server.domain.weather.WeatherUnavailableException;
import kr.weatherbalance.server.infrastructure.config.WeatherProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 온도 기반 잔액 변경 흐름
 * 1. 사용자 확인 (GET 경로만)
 * 2. 온도 조회 (캐시 → 외부 API)
 * 3. delta 계산
 * 4. 원장 적용
 *
 * 외부 호출 중 DB 트랜잭션을 잡지 않도록 서비스 자체는 비트랜잭션.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BalanceUpdateService implements BalanceUpdateUseCase {

    private final UserPort userPort;
    private final WeatherLookupService weatherLookupService;
    private final BalanceLedger balanceLedger;
    private final WeatherProperties weatherProperties;

    @Override
    public BalanceUpdateResult updateByPath(String operation, Long userId, String city) {
        if (!userExists(userId)) {
            throw UserNotFoundException.withId(userId);
        }

        double temperature = resolveTemperature(city, false);
        double delta = BalanceOperation.lenient(operation).signedDelta(temperature);
        return applyDelta(userId, delta);
    }

    @Override
    public BalanceUpdateResult updateByRequest(Long userId, String operation, String city) {
        BalanceOperation op = BalanceOperation.parse(operation)
                .orElseThrow(() -> InvalidBalanceOperationException.of(operation));

        // 사용자 존재 여부는 원장 단계에서 판단
        double temperature = resolveTemperature(city, weatherProperties.isZeroTemperatureAsFailure());
        double delta = op.signedDelta(temperature);
        return applyDelta(userId, delta);
    }

    private boolean userExists(Long userId) {
        try {
            return userPort.findById(userId).isPresent();
        } catch (DataAccessException e) {
            // 조회 실패는 없는 사용자와 동일하게 응답
            log.warn("사용자 조회 실패 - userId: {}, cause: {}", userId, e.getMessage());
            return false;
        }
    }

    private double resolveTemperature(String city, boolean zeroAsFailure) {
        TemperatureLookup lookup = weatherLookupService.fetch(city);
        if (lookup instanceof TemperatureLookup.Found found) {
            if (zeroAsFailure && found.temperature() == 0.0) {
                log.warn("0도 응답을 조회 실패로 처리 - city: {}", city);
                throw WeatherUnavailableException.forCity(city);
            }
            return found.temperature();
        }
        TemperatureLookup.Unavailable unavailable = (TemperatureLookup.Unavailable) lookup;
        log.warn("온도 없음으로 잔액 변경 중단 - city: {}, reason: {}", unavailable.city(), unavailable.reason());
        throw WeatherUnavailableException.forCity(city);
    }

    private BalanceUpdateResult applyDelta(Long userId, double delta) {
        LedgerResult result = balanceLedger.apply(userId, delta);
        if (result instanceof LedgerResult.Applied applied) {
            return new BalanceUpdateResult(userId, delta, applied.balance(), applied.message());
        }
        throw BalanceUpdateFailedException.of(userId, result.message());
    }
}
