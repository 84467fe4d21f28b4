package com.arkive.spi.repositories;

import com.arkive.spi.models.Activity;

import java.util.List;

public interface ActivityRepository {

    Activity create(String userId, String action, String resourceType, String resourceId, String details);

    /**
     * Most recent activities of a user, newest first.
     */
    List<Activity> findRecentByUser(String userId, int limit);
}
