package kr.weatherbalance.server.domain.user;

/**
 * 사용자 저장/조회/삭제 중 저장소 오류
 * - 원인 메시지를 그대로 노출 (내부용 서비스)
 */
public class UserPersistenceException extends RuntimeException {

    public UserPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static UserPersistenceException causedBy(Throwable cause) {
        return new UserPersistenceException(String.valueOf(cause.getMessage()), cause);
    }
}
