package kr.weatherbalance.server.domain.user.model;

public class User {
    private static final int MAX_USERNAME_LENGTH = 50;

    private final Long id;
    private String username;
    private double balance;

    private User(Long id, String username, double balance) {
        this.id = id;
        this.username = username;
        this.balance = balance;
    }

    /**
     * 신규 사용자 생성 (id는 저장 시 발급)
     */
    public static User create(String username, double balance) {
        validateUsername(username);
        validateBalance(balance);
        return new User(null, username, balance);
    }

    /**
     * 저장소에서 읽어온 상태 복원
     */
    public static User restore(Long id, String username, double balance) {
        if (id == null) {
            throw new IllegalArgumentException("user id cannot be null");
        }
        return new User(id, username, balance);
    }

    // ========== 비즈니스 메서드 ==========

    /**
     * 잔액에 delta 를 더한다. 결과가 음수면 0.0 으로 고정.
     *
     * @return 적용 후 잔액
     */
    public double applyBalanceDelta(double delta) {
        double updated = this.balance + delta;
        this.balance = updated < 0 ? 0.0 : updated;
        return this.balance;
    }

    public void rename(String username) {
        validateUsername(username);
        this.username = username;
    }

    public void changeBalance(double balance) {
        validateBalance(balance);
        this.balance = balance;
    }

    // ========== Validation ==========

    private static void validateUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            throw new IllegalArgumentException("username must not exceed " + MAX_USERNAME_LENGTH + " characters");
        }
    }

    private static void validateBalance(double balance) {
        if (Double.isNaN(balance) || balance < 0) {
            throw new IllegalArgumentException("balance must be zero or greater");
        }
    }

    // ========== Getters ==========
    public Long id() { return id; }
    public String username() { return username; }
    public double balance() { return balance; }
}
