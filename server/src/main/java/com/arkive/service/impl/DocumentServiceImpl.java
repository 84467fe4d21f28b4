package com.arkive.service.impl;

import com.arkive.audit.AuditRecorder;
import com.arkive.models.dto.request.CreateDocumentRequest;
import com.arkive.models.dto.request.IndexDocumentRequest;
import com.arkive.service.interfaces.DocumentService;
import com.arkive.service.utils.AuthnUtil;
import com.arkive.spi.DocumentIndexer;
import com.arkive.spi.exceptions.RecordNotFoundException;
import com.arkive.spi.models.Activity;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.Document;
import com.arkive.spi.models.DocumentStats;
import com.arkive.spi.models.enums.AuditAction;
import com.arkive.spi.repositories.ActivityRepository;
import com.arkive.spi.repositories.DocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private static final String DOCUMENT = "document";

    private final DocumentRepository documentRepository;
    private final ActivityRepository activityRepository;
    private final DocumentIndexer documentIndexer;
    private final AuditRecorder auditRecorder;
    private final AuthnUtil authnUtil;

    @Override
    public List<Document> listDocuments() {
        return documentRepository.findActiveByUser(authnUtil.currentUserId());
    }

    @Override
    public Document getDocument(String documentId) {
        Actor actor = authnUtil.currentActor();
        Document document = requireOwned(documentId, actor);
        auditRecorder.success(actor, AuditAction.VIEW, resourceOf(document), Map.of());
        return document;
    }

    @Override
    public Document createDocument(CreateDocumentRequest request) {
        Actor actor = authnUtil.currentActor();
        Document document = documentRepository.create(Document.builder()
                .userId(actor.userId())
                .name(request.getName())
                .filePath(request.getFilePath())
                .fileType(request.getFileType())
                .fileSize(request.getFileSize())
                .category(request.getCategory() == null ? Document.DEFAULT_CATEGORY : request.getCategory())
                .build());
        activityRepository.create(actor.userId(), AuditAction.UPLOAD.name(), AuditResource.DOCUMENT, document.getId(),
                "Uploaded " + document.getName());
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("file_type", document.getFileType());
        metadata.put("file_size", document.getFileSize());
        metadata.put("category", document.getCategory());
        auditRecorder.success(actor, AuditAction.DOCUMENT_CREATE, resourceOf(document), metadata);
        return document;
    }

    @Override
    public void deleteDocument(String documentId) {
        Actor actor = authnUtil.currentActor();
        Document document = requireOwned(documentId, actor);
        if (!documentRepository.softDelete(documentId, actor.userId())) {
            throw new RecordNotFoundException(DOCUMENT, documentId);
        }
        activityRepository.create(actor.userId(), AuditAction.DELETE.name(), AuditResource.DOCUMENT, documentId,
                "Deleted " + document.getName());
        auditRecorder.success(actor, AuditAction.DELETE, resourceOf(document), Map.of("soft_delete", true));
    }

    @Override
    public void indexDocument(String documentId, IndexDocumentRequest request) {
        Actor actor = authnUtil.currentActor();
        Document document = requireOwned(documentId, actor);
        documentIndexer.index(documentId, request.getExtractedText(), request.getDocumentType(), request.getFields());
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("document_type", request.getDocumentType());
        metadata.put("text_length", request.getExtractedText().length());
        metadata.put("fields", request.getFields() == null ? 0 : request.getFields().size());
        auditRecorder.success(actor, AuditAction.INDEX, resourceOf(document), metadata);
    }

    @Override
    public List<Document> searchDocuments(String query, int limit) {
        Actor actor = authnUtil.currentActor();
        List<Document> results = documentRepository.search(actor.userId(), query, limit);
        auditRecorder.success(actor, AuditAction.SEARCH, AuditResource.of(AuditResource.DOCUMENT, null, null),
                Map.of("query", query, "results", results.size()));
        return results;
    }

    @Override
    public DocumentStats getStats() {
        return documentRepository.stats(authnUtil.currentUserId());
    }

    @Override
    public List<Activity> getRecentActivities(int limit) {
        return activityRepository.findRecentByUser(authnUtil.currentUserId(), limit);
    }

    private Document requireOwned(String documentId, Actor actor) {
        return documentRepository.findById(documentId)
                .filter(document -> document.isActive() && document.getUserId().equals(actor.userId()))
                .orElseThrow(() -> new RecordNotFoundException(DOCUMENT, documentId));
    }

    private static AuditResource resourceOf(Document document) {
        return AuditResource.of(AuditResource.DOCUMENT, document.getId(), document.getName());
    }
}
