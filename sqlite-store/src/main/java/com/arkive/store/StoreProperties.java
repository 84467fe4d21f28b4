package com.arkive.store;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "arkive.store")
@Validated
public class StoreProperties {
    /**
     * location of the SQLite database file, parent directories are created on startup
     */
    @NotEmpty
    private String path;
    /**
     * how long SQLite itself waits on a locked database before reporting SQLITE_BUSY
     */
    @Min(0)
    private int busyTimeoutMillis = 30000;
    @Min(1)
    private int cacheSizePages = 10000;
    @Min(1)
    private int walAutocheckpointPages = 1000;
    /**
     * total attempts for an operation that keeps hitting a busy or locked database
     */
    @Min(1)
    private int maxAttempts = 3;
    /**
     * the n-th retry sleeps n times this long
     */
    @Min(1)
    private long retryBackoffMillis = 100;

    public Duration getRetryBackoff() {
        return Duration.ofMillis(retryBackoffMillis);
    }
}
