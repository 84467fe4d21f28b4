package com.arkive.spi.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * User-facing activity feed entry. Unlike {@link AuditEntry} this is ordinary business data with no integrity guarantees.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Activity {
    private String id;
    private String userId;
    private String action;
    private String resourceType;
    private String resourceId;
    private String details;
    private Instant createdAt;
}
