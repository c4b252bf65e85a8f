package kr.weatherbalance.server.domain.balance;

/**
 * 원장 적용 단계에서 거부된 잔액 변경
 * - 사용자 없음, 저장소 오류 모두 포함
 */
public class BalanceUpdateFailedException extends RuntimeException {

    private final Long userId;

    public BalanceUpdateFailedException(Long userId, String message) {
        super(message);
        this.userId = userId;
    }

    public static BalanceUpdateFailedException of(Long userId, String message) {
        return new BalanceUpdateFailedException(userId, message);
    }

    public Long getUserId() {
        return userId;
    }
}
