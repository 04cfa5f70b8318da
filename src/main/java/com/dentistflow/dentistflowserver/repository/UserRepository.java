package com.dentistflow.dentistflowserver.repository;

import com.dentistflow.dentistflowserver.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    // login lookup
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);
}
