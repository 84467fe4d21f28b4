package com.arkive.spi.repositories;

import com.arkive.spi.models.User;

import java.time.Instant;
import java.util.Optional;

public interface UserRepository {

    /**
     * @throws com.arkive.spi.exceptions.DuplicateRecordException if the username or email is taken
     */
    User create(String username, String email, String passwordHash);

    Optional<User> findById(String id);

    Optional<User> findByUsername(String username);

    void updateLastLogin(String id, Instant lastLogin);
}
