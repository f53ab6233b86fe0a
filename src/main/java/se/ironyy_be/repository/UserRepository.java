package se.ironyy_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.ironyy_be.pojo.User;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByEmail(String email);
    boolean existsByEmail(String email);
}
