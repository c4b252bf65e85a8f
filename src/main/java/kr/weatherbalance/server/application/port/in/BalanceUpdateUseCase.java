package kr.weatherbalance.server.application.port.in;

public interface BalanceUpdateUseCase {

    /**
     * GET /update-balance/{operation}/{userId}/{city}
     * - operation 검증 없음: "decrease" 외에는 모두 증가
     */
    BalanceUpdateResult updateByPath(String operation, Long userId, String city);

    /**
     * POST /update-balance
     * - operation 은 "increase" / "decrease" 만 허용
     */
    BalanceUpdateResult updateByRequest(Long userId, String operation, String city);

    record BalanceUpdateResult(Long userId, double delta, double balance, String message) {}
}
