package kr.weatherbalance.server.application.usecase.balance;

import kr.weatherbalance.server.domain.user.UserNotFoundException;

import java.util.Locale;

/**
 * 원장 적용 결과: 반영(Applied) 또는 거부(Rejected)
 */
public sealed interface LedgerResult permits LedgerResult.Applied, LedgerResult.Rejected {

    String message();

    /**
     * delta 는 요청된 값(클램프 이전) 그대로 보고한다.
     */
    record Applied(Long userId, String username, double delta, double balance) implements LedgerResult {
        @Override
        public String message() {
            return String.format(Locale.ROOT, "User %s balance updated successfully by %s to %.2f",
                    username, formatDelta(delta), balance);
        }

        // 정수 온도는 소수점 없이 (예: -50)
        static String formatDelta(double delta) {
            if (delta == Math.rint(delta) && Math.abs(delta) < 1e15) {
                return Long.toString((long) delta);
            }
            return Double.toString(delta);
        }
    }

    record Rejected(Long userId, Reason reason, String message) implements LedgerResult {}

    enum Reason {
        USER_NOT_FOUND,
        PERSISTENCE_FAILURE
    }

    static LedgerResult applied(Long userId, String username, double delta, double balance) {
        return new Applied(userId, username, delta, balance);
    }

    static LedgerResult userNotFound(Long userId) {
        return new Rejected(userId, Reason.USER_NOT_FOUND, UserNotFoundException.MESSAGE);
    }

    static LedgerResult persistenceFailure(Long userId, Throwable cause) {
        return new Rejected(userId, Reason.PERSISTENCE_FAILURE, "Error updating balance: " + cause.getMessage());
    }
}
