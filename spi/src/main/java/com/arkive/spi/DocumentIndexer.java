package com.arkive.spi;

import java.util.Map;

/**
 * Entry point for the ingestion pipeline (OCR, text extraction) to hand structured results to the store.
 */
public interface DocumentIndexer {

    /**
     * Stores the searchable content of a document. Idempotent: indexing the same document again replaces the previous content.
     */
    void index(String documentId, String extractedText, String documentType, Map<String, String> fields);
}
