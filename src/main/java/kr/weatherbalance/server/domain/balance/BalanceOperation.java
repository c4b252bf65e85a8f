package kr.weatherbalance.server.domain.balance;

import java.util.Arrays;
import java.util.Optional;

public enum BalanceOperation {
    INCREASE("increase"),
    DECREASE("decrease");

    private final String value;

    BalanceOperation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 정확히 "increase" / "decrease" 만 허용 (대소문자 구분)
     */
    public static Optional<BalanceOperation> parse(String raw) {
        return Arrays.stream(values())
                .filter(op -> op.value.equals(raw))
                .findFirst();
    }

    /**
     * 경로 파라미터용: "decrease" 가 아니면 모두 INCREASE 로 취급
     */
    public static BalanceOperation lenient(String raw) {
        return DECREASE.value.equals(raw) ? DECREASE : INCREASE;
    }

    public double signedDelta(double temperature) {
        return this == DECREASE ? -temperature : temperature;
    }
}
