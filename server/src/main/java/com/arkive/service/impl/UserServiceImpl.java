package com.arkive.service.impl;

import com.arkive.audit.AuditRecorder;
import com.arkive.models.dto.request.LoginRequest;
import com.arkive.models.dto.request.RegisterUserRequest;
import com.arkive.service.interfaces.UserService;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.User;
import com.arkive.spi.models.enums.AuditAction;
import com.arkive.spi.repositories.UserRepository;
import com.arkive.store.SqliteTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    @Override
    public User register(RegisterUserRequest request) {
        User user = userRepository.create(request.getUsername(), request.getEmail(), passwordEncoder.encode(request.getPassword()));
        auditRecorder.success(actorOf(user), AuditAction.REGISTER, AuditResource.of(AuditResource.USER, user.getId(), user.getUsername()),
                Map.of("email", user.getEmail()));
        log.info("Registered user {}", user.getUsername());
        return user;
    }

    @Override
    public User login(LoginRequest request) {
        Optional<User> found = userRepository.findByUsername(request.getUsername());
        if (found.isEmpty() || !passwordEncoder.matches(request.getPassword(), found.get().getPasswordHash())) {
            Actor actor = found.map(UserServiceImpl::actorOf).orElseGet(() -> Actor.anonymous(request.getUsername()));
            auditRecorder.failure(actor, AuditAction.LOGIN_FAILED, AuditResource.system(),
                    Map.of("reason", found.isEmpty() ? "unknown user" : "wrong password"));
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid username or password");
        }
        User user = found.get().toBuilder().lastLogin(SqliteTimestamps.truncate(clock.instant())).build();
        userRepository.updateLastLogin(user.getId(), user.getLastLogin());
        auditRecorder.success(actorOf(user), AuditAction.LOGIN, AuditResource.system(), Map.of());
        return user;
    }

    private static Actor actorOf(User user) {
        return new Actor(user.getId(), user.getUsername());
    }
}
