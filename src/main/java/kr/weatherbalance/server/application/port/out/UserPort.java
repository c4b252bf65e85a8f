package kr.weatherbalance.server.application.port.out;

import kr.weatherbalance.server.domain.user.model.User;

import java.util.List;
import java.util.Optional;

/**
 * 사용자 저장소 포트
 * - 저장 실패는 Spring DataAccessException 으로 전파
 */
public interface UserPort {
    Optional<User> findById(Long id);
    List<User> findAll();
    User save(User user);
    void delete(User user);
}
