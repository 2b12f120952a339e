package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.User;
import com.confectionery.distribution.model.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByUsername(String username);

    boolean existsByUsername(String username);

    Optional<User> findByIdAndRole(Long id, UserRole role);

    List<User> findByRoleOrderByUsernameAsc(UserRole role);
}
