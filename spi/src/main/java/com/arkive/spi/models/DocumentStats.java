package com.arkive.spi.models;

public record DocumentStats(long totalDocuments, long uploadsToday, long totalSize, long activeDocuments) {
}
