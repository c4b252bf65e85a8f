package kr.weatherbalance.server.domain.user;

/**
 * 사용자 정보 수정 실패 (PUT /users/{id} 경로 전용)
 */
public class UserUpdateFailedException extends UserPersistenceException {

    public UserUpdateFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public static UserUpdateFailedException causedBy(Throwable cause) {
        return new UserUpdateFailedException(String.valueOf(cause.getMessage()), cause);
    }
}
