package kr.weatherbalance.server.domain.user;

/**
 * 사용자를 찾을 수 없을 때 발생하는 예외
 */
public class UserNotFoundException extends RuntimeException {

    public static final String MESSAGE = "User not found";

    private final Long userId;

    public UserNotFoundException(Long userId) {
        super(MESSAGE);
        this.userId = userId;
    }

    public static UserNotFoundException withId(Long userId) {
        return new UserNotFoundException(userId);
    }

    public Long getUserId() {
        return userId;
    }
}
