package kr.weatherbalance.server.application.usecase.balance;

import kr.weatherbalance.server.application.port.out.UserPort;
import kr.weatherbalance.server.domain.user.UserNotFoundException;
import kr.weatherbalance.server.domain.user.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * 잔액 원장
 * - 조회 → 계산(0 미만이면 0.0) → 저장을 하나의 트랜잭션에서 수행
 * - 저장소 오류 시 전체 롤백 후 Rejected 반환
 * - 사용자 단위 잠금 없음: 같은 사용자 동시 요청은 lost update 가능
 */
@Slf4j
@Component
public class BalanceLedger {

    private final UserPort userPort;
    private final TransactionTemplate transactionTemplate;

    public BalanceLedger(UserPort userPort, PlatformTransactionManager transactionManager) {
        this.userPort = userPort;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public LedgerResult apply(Long userId, double delta) {
        LedgerResult result;
        try {
            result = transactionTemplate.execute(status -> {
                Optional<User> found = userPort.findById(userId);
                if (found.isEmpty()) {
                    return LedgerResult.userNotFound(userId);
                }
                User user = found.get();
                user.applyBalanceDelta(delta);
                User saved = userPort.save(user);
                return LedgerResult.applied(userId, saved.username(), delta, saved.balance());
            });
        } catch (UserNotFoundException e) {
            // 조회 이후 삭제된 경우
            result = LedgerResult.userNotFound(userId);
        } catch (DataAccessException | TransactionException e) {
            log.warn("잔액 변경 롤백 - userId: {}, delta: {}, cause: {}", userId, delta, e.getMessage());
            return LedgerResult.persistenceFailure(userId, e);
        }

        if (result instanceof LedgerResult.Applied applied) {
            log.info("잔액 변경 완료 - userId: {}, delta: {}, balance: {}", userId, delta, applied.balance());
        } else {
            log.warn("잔액 변경 거부 - userId: {}, message: {}", userId, result.message());
        }
        return result;
    }
}
