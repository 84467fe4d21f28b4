package com.arkive.spi.repositories;

import com.arkive.spi.models.Document;
import com.arkive.spi.models.DocumentStats;

import java.util.List;
import java.util.Optional;

public interface DocumentRepository {

    Document create(Document document);

    Optional<Document> findById(String id);

    /**
     * Active documents of a user, newest first.
     */
    List<Document> findActiveByUser(String userId);

    /**
     * Marks the document inactive.
     *
     * @return false if the user owns no such active document
     */
    boolean softDelete(String id, String userId);

    /**
     * Removes the document row and its search content.
     */
    boolean hardDelete(String id, String userId);

    /**
     * Active documents of a user whose name or indexed text contains {@code query}, ignoring case. No ranking.
     */
    List<Document> search(String userId, String query, int limit);

    DocumentStats stats(String userId);
}
