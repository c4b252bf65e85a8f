package kr.weatherbalance.server.infrastructure.persistence.user.jpa.adapter;

import kr.weatherbalance.server.application.port.out.UserPort;
import kr.weatherbalance.server.domain.user.UserNotFoundException;
import kr.weatherbalance.server.domain.user.model.User;
import kr.weatherbalance.server.infrastructure.persistence.user.jpa.entity.UserJpaEntity;
import kr.weatherbalance.server.infrastructure.persistence.user.jpa.repository.UserJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 사용자 JPA 어댑터
 * - 순수한 데이터 접근만 담당
 * - 트랜잭션 관리는 애플리케이션 서비스에서
 */
@Repository
@RequiredArgsConstructor
public class UserJpaAdapter implements UserPort {

    private final UserJpaRepository repo;

    @Override
    public Optional<User> findById(Long id) {
        return repo.findById(id).map(this::toDomain);
    }

    @Override
    public List<User> findAll() {
        return repo.findAll().stream().map(this::toDomain).toList();
    }

    /**
     * 제약 조건 위반을 호출 지점에서 바로 받도록 flush 까지 수행
     */
    @Override
    public User save(User user) {
        UserJpaEntity entity = toJpaEntity(user);
        return toDomain(repo.saveAndFlush(entity));
    }

    @Override
    public void delete(User user) {
        repo.deleteById(user.id());
        repo.flush();
    }

    // === Private Helper Methods ===

    private User toDomain(UserJpaEntity e) {
        return User.restore(e.getId(), e.getUsername(), e.getBalance());
    }

    private UserJpaEntity toJpaEntity(User user) {
        if (user.id() == null) {
            return new UserJpaEntity(user.username(), user.balance());
        }
        // 기존 엔티티 조회 후 업데이트
        UserJpaEntity entity = repo.findById(user.id())
                .orElseThrow(() -> UserNotFoundException.withId(user.id()));
        entity.setUsername(user.username());
        entity.setBalance(user.balance());
        return entity;
    }
}
