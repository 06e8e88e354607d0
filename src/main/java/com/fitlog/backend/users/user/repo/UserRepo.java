package com.fitlog.backend.users.user.repo;

import com.fitlog.backend.users.user.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    // setEmail already lower-cases; IgnoreCase also covers rows written before that
    boolean existsByEmailIgnoreCase(String email);

    boolean existsByUsername(String username);

    boolean existsByEmailIgnoreCaseAndIdNot(String email, Long id);

    boolean existsByUsernameAndIdNot(String username, Long id);
}
