package kr.weatherbalance.server.infrastructure.persistence.user.jpa.repository;

import kr.weatherbalance.server.infrastructure.persistence.user.jpa.entity.UserJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserJpaRepository extends JpaRepository<UserJpaEntity, Long> {
}
