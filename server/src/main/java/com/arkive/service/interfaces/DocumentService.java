package com.arkive.service.interfaces;

import com.arkive.models.dto.request.CreateDocumentRequest;
import com.arkive.models.dto.request.IndexDocumentRequest;
import com.arkive.spi.models.Activity;
import com.arkive.spi.models.Document;
import com.arkive.spi.models.DocumentStats;

import java.util.List;

/**
 * Documents of the calling user.
 */
public interface DocumentService {

    List<Document> listDocuments();

    Document getDocument(String documentId);

    Document createDocument(CreateDocumentRequest request);

    void deleteDocument(String documentId);

    void indexDocument(String documentId, IndexDocumentRequest request);

    List<Document> searchDocuments(String query, int limit);

    DocumentStats getStats();

    List<Activity> getRecentActivities(int limit);
}
