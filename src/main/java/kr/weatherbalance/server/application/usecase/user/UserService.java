package kr.weatherbalance.server.application.usecase.user;

import kr.weatherbalance.server.application.port.in.UserUseCase;
import kr.weatherbalance.server.application.port.out.UserPort;
import kr.weatherbalance.server.domain.user.UserNotFoundException;
import kr.weatherbalance.server.domain.user.UserPersistenceException;
import kr.weatherbalance.server.domain.user.UserUpdateFailedException;
import kr.weatherbalance.server.domain.user.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class UserService implements UserUseCase {

    private final UserPort userPort;

    @Override
    public User create(CreateUserCommand command) {
        User user = User.create(command.username(), command.balance());
        try {
            User saved = userPort.save(user);
            log.info("사용자 생성 - id: {}, username: {}", saved.id(), saved.username());
            return saved;
        } catch (DataAccessException e) {
            log.warn("사용자 생성 실패 - username: {}, cause: {}", command.username(), e.getMessage());
            throw UserPersistenceException.causedBy(e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public User get(Long id) {
        try {
            return userPort.findById(id)
                    .orElseThrow(() -> UserNotFoundException.withId(id));
        } catch (DataAccessException e) {
            // 조회 실패는 없는 사용자와 동일하게 응답
            log.warn("사용자 조회 실패 - id: {}, cause: {}", id, e.getMessage());
            throw UserNotFoundException.withId(id);
        }
    }

    /**
     * username, balance 만 변경 가능
     */
    @Override
    public User update(Long id, UpdateUserCommand command) {
        try {
            User user = userPort.findById(id)
                    .orElseThrow(() -> UserNotFoundException.withId(id));
            if (command.username() != null) {
                user.rename(command.username());
            }
            if (command.balance() != null) {
                user.changeBalance(command.balance());
            }
            return command.isEmpty() ? user : userPort.save(user);
        } catch (DataAccessException e) {
            log.warn("사용자 수정 실패 - id: {}, cause: {}", id, e.getMessage());
            throw UserUpdateFailedException.causedBy(e);
        }
    }

    @Override
    public void delete(Long id) {
        try {
            User user = userPort.findById(id)
                    .orElseThrow(() -> UserNotFoundException.withId(id));
            userPort.delete(user);
            log.info("사용자 삭제 - id: {}", id);
        } catch (DataAccessException e) {
            log.warn("사용자 삭제 실패 - id: {}, cause: {}", id, e.getMessage());
            throw UserPersistenceException.causedBy(e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<User> list() {
        try {
            return userPort.findAll();
        } catch (DataAccessException e) {
            throw UserPersistenceException.causedBy(e);
        }
    }
}
