package com.arkive.spi.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class User {
    private String id;
    private String username;
    private String email;

    /**
     * BCrypt hash supplied by the caller. Never serialized.
     */
    @JsonIgnore
    private String passwordHash;

    private Instant createdAt;
    private Instant lastLogin;
}
