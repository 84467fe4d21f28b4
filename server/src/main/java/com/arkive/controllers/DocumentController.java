package com.arkive.controllers;

import com.arkive.models.dto.request.CreateDocumentRequest;
import com.arkive.models.dto.request.IndexDocumentRequest;
import com.arkive.models.dto.response.ResponseTemplate;
import com.arkive.service.interfaces.DocumentService;
import com.arkive.spi.models.Activity;
import com.arkive.spi.models.Document;
import com.arkive.spi.models.DocumentStats;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class DocumentController {

    private final DocumentService documentService;

    @Operation(summary = "Lists the active documents of the caller, newest first.")
    @GetMapping("/v1/documents")
    public ResponseTemplate<List<Document>> listDocuments() {
        return ResponseTemplate.success(documentService.listDocuments(), "Successfully listed documents.");
    }

    @Operation(summary = "Registers an uploaded document.")
    @PostMapping("/v1/documents")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseTemplate<Document> createDocument(@Valid @RequestBody CreateDocumentRequest request) {
        return ResponseTemplate.success(documentService.createDocument(request), "Successfully created document.");
    }

    @Operation(summary = "Searches names and extracted text of the caller's documents. Plain substring match.")
    @GetMapping("/v1/documents/search")
    public ResponseTemplate<List<Document>> searchDocuments(
            @RequestParam("q") @NotBlank @Size(max = 255) String query,
            @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseTemplate.success(documentService.searchDocuments(query, limit), "Successfully searched documents.");
    }

    @Operation(summary = "Document counts and sizes of the caller.")
    @GetMapping("/v1/documents/stats")
    public ResponseTemplate<DocumentStats> getStats() {
        return ResponseTemplate.success(documentService.getStats(), "Successfully computed document stats.");
    }

    @Operation(summary = "Reads one document of the caller.")
    @GetMapping("/v1/documents/{documentId}")
    public ResponseTemplate<Document> getDocument(@PathVariable("documentId") @NotBlank @Size(max = 64) String documentId) {
        return ResponseTemplate.success(documentService.getDocument(documentId), "Successfully read document.");
    }

    @Operation(summary = "Soft deletes a document.")
    @DeleteMapping("/v1/documents/{documentId}")
    public ResponseTemplate<Void> deleteDocument(@PathVariable("documentId") @NotBlank @Size(max = 64) String documentId) {
        documentService.deleteDocument(documentId);
        return ResponseTemplate.success("Successfully deleted document.");
    }

    @Operation(summary = "Stores the extracted text and fields of a document. Replaces earlier content.")
    @PutMapping("/v1/documents/{documentId}/index")
    public ResponseTemplate<Void> indexDocument(
            @PathVariable("documentId") @NotBlank @Size(max = 64) String documentId,
            @Valid @RequestBody IndexDocumentRequest request) {
        documentService.indexDocument(documentId, request);
        return ResponseTemplate.success("Successfully indexed document.");
    }

    @Operation(summary = "Recent activity feed of the caller.")
    @GetMapping("/v1/activities")
    public ResponseTemplate<List<Activity>> getRecentActivities(
            @RequestParam(name = "limit", defaultValue = "20") @Min(1) @Max(200) int limit) {
        return ResponseTemplate.success(documentService.getRecentActivities(limit), "Successfully listed activities.");
    }
}
