package com.arkive.spi.models;

import java.util.Objects;

/**
 * An already authenticated principal on whose behalf an action is recorded.
 */
public record Actor(String userId, String username) {

    public static final String ANONYMOUS_ID = "anonymous";

    public Actor {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(username, "username");
    }

    /**
     * Actor for attempts that could not be tied to a known user, such as a failed login with an unknown name.
     */
    public static Actor anonymous(String attemptedUsername) {
        return new Actor(ANONYMOUS_ID, attemptedUsername == null ? ANONYMOUS_ID : attemptedUsername);
    }
}
