package com.arkive.spi.models;

import java.time.Instant;
import java.util.Map;

/**
 * Searchable content of one document as handed over by the ingestion pipeline.
 */
public record DocumentSearchContent(String documentId, String extractedText, String documentType,
                                    Map<String, String> fields, Instant indexedAt) {
}
