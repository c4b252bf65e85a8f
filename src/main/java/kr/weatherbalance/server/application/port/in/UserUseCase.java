package kr.weatherbalance.server.application.port.in;

import kr.weatherbalance.server.domain.user.model.User;

import java.util.List;

public interface UserUseCase {
    User create(CreateUserCommand command);
    User get(Long id);
    User update(Long id, UpdateUserCommand command);
    void delete(Long id);
    List<User> list();

    record CreateUserCommand(String username, double balance) {}

    /**
     * 수정 가능한 필드만 허용. null 은 변경하지 않음.
     */
    record UpdateUserCommand(String username, Double balance) {
        public boolean isEmpty() {
            return username == null && balance == null;
        }
    }
}
