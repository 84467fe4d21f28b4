package com.arkive.store.records;

import com.arkive.spi.exceptions.DuplicateRecordException;
import com.arkive.spi.models.Activity;
import com.arkive.spi.models.User;
import com.arkive.store.MutableClock;
import com.arkive.store.SqliteStore;
import com.arkive.store.StoreFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqliteUserRepositoryTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private SqliteStore store;
    private SqliteUserRepository users;
    private SqliteActivityRepository activities;

    @BeforeEach
    void setUp() {
        store = StoreFixtures.open(tempDir.resolve("arkive.db"));
        users = new SqliteUserRepository(store, clock);
        activities = new SqliteActivityRepository(store, clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void createAndFind() {
        User created = users.create("alice", "alice@example.com", "$2a$10$hash");

        assertEquals(created, users.findById(created.getId()).orElseThrow());
        assertEquals(created, users.findByUsername("alice").orElseThrow());
        assertTrue(users.findByUsername("bob").isEmpty());
        assertNull(created.getLastLogin());
    }

    @Test
    void duplicateUsernameIsRejected() {
        users.create("alice", "alice@example.com", "hash");

        assertThrows(DuplicateRecordException.class, () -> users.create("alice", "other@example.com", "hash"));
        assertThrows(DuplicateRecordException.class, () -> users.create("alice2", "alice@example.com", "hash"));
    }

    @Test
    void updateLastLogin() {
        User created = users.create("alice", "alice@example.com", "hash");
        Instant login = Instant.parse("2024-03-02T08:30:00.250Z");

        users.updateLastLogin(created.getId(), login);

        assertEquals(login, users.findById(created.getId()).orElseThrow().getLastLogin());
    }

    @Test
    void activitiesAreNewestFirstAndCapped() {
        for (int i = 0; i < 4; i++) {
            activities.create("u1", "UPLOAD", "DOCUMENT", "doc-" + i, "uploaded doc-" + i);
            clock.advance(Duration.ofSeconds(1));
        }
        activities.create("u2", "UPLOAD", "DOCUMENT", "doc-x", null);

        List<Activity> recent = activities.findRecentByUser("u1", 3);

        assertEquals(List.of("doc-3", "doc-2", "doc-1"), recent.stream().map(Activity::getResourceId).toList());
    }
}
