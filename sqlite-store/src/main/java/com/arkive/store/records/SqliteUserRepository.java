package com.arkive.store.records;

import com.arkive.spi.exceptions.DuplicateRecordException;
import com.arkive.spi.models.User;
import com.arkive.spi.repositories.UserRepository;
import com.arkive.store.SqliteStore;
import com.arkive.store.SqliteTimestamps;
import lombok.AllArgsConstructor;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@AllArgsConstructor
public class SqliteUserRepository implements UserRepository {

    static final int SQLITE_CONSTRAINT = 19;

    private static final String COLUMNS = "id, username, email, password_hash, created_at, last_login";

    private final SqliteStore store;
    private final Clock clock;

    @Override
    public User create(String username, String email, String passwordHash) {
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .username(username)
                .email(email)
                .passwordHash(passwordHash)
                .createdAt(SqliteTimestamps.truncate(clock.instant()))
                .build();
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO users (id, username, email, password_hash, created_at) VALUES (?, ?, ?, ?, ?)")) {
                statement.setString(1, user.getId());
                statement.setString(2, username);
                statement.setString(3, email);
                statement.setString(4, passwordHash);
                statement.setString(5, SqliteTimestamps.format(user.getCreatedAt()));
                statement.executeUpdate();
                return user;
            } catch (SQLException e) {
                if ((e.getErrorCode() & 0xff) == SQLITE_CONSTRAINT) {
                    throw new DuplicateRecordException("username or email already registered: " + username, e);
                }
                throw e;
            }
        });
    }

    @Override
    public Optional<User> findById(String id) {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE id = ?", id);
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE username = ?", username);
    }

    @Override
    public void updateLastLogin(String id, Instant lastLogin) {
        store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("UPDATE users SET last_login = ? WHERE id = ?")) {
                statement.setString(1, SqliteTimestamps.format(lastLogin));
                statement.setString(2, id);
                return statement.executeUpdate();
            }
        });
    }

    private Optional<User> findOne(String sql, String key) {
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, key);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(toUser(resultSet)) : Optional.empty();
                }
            }
        });
    }

    private User toUser(ResultSet resultSet) throws SQLException {
        return User.builder()
                .id(resultSet.getString("id"))
                .username(resultSet.getString("username"))
                .email(resultSet.getString("email"))
                .passwordHash(resultSet.getString("password_hash"))
                .createdAt(SqliteTimestamps.parse(resultSet.getString("created_at")))
                .lastLogin(SqliteTimestamps.parse(resultSet.getString("last_login")))
                .build();
    }
}
