package com.arkive.store.records;

import com.arkive.spi.models.Activity;
import com.arkive.spi.repositories.ActivityRepository;
import com.arkive.store.SqliteStore;
import com.arkive.store.SqliteTimestamps;
import lombok.AllArgsConstructor;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@AllArgsConstructor
public class SqliteActivityRepository implements ActivityRepository {

    private final SqliteStore store;
    private final Clock clock;

    @Override
    public Activity create(String userId, String action, String resourceType, String resourceId, String details) {
        Activity activity = Activity.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .details(details)
                .createdAt(SqliteTimestamps.truncate(clock.instant()))
                .build();
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO activities (id, user_id, action, resource_type, resource_id, details, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                statement.setString(1, activity.getId());
                statement.setString(2, userId);
                statement.setString(3, action);
                statement.setString(4, resourceType);
                statement.setString(5, resourceId);
                statement.setString(6, details);
                statement.setString(7, SqliteTimestamps.format(activity.getCreatedAt()));
                statement.executeUpdate();
                return activity;
            }
        });
    }

    @Override
    public List<Activity> findRecentByUser(String userId, int limit) {
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT id, user_id, action, resource_type, resource_id, details, created_at FROM activities "
                            + "WHERE user_id = ? ORDER BY created_at DESC, rowid DESC LIMIT ?")) {
                statement.setString(1, userId);
                statement.setInt(2, limit);
                try (ResultSet resultSet = statement.executeQuery()) {
                    List<Activity> activities = new ArrayList<>();
                    while (resultSet.next()) {
                        activities.add(Activity.builder()
                                .id(resultSet.getString("id"))
                                .userId(resultSet.getString("user_id"))
                                .action(resultSet.getString("action"))
                                .resourceType(resultSet.getString("resource_type"))
                                .resourceId(resultSet.getString("resource_id"))
                                .details(resultSet.getString("details"))
                                .createdAt(SqliteTimestamps.parse(resultSet.getString("created_at")))
                                .build());
                    }
                    return activities;
                }
            }
        });
    }
}
