package com.arkive.spi.models.enums;

/**
 * Security relevant verbs recorded in the audit trail.
 */
public enum AuditAction {
    LOGIN,
    LOGIN_FAILED,
    LOGOUT,
    REGISTER,
    UPLOAD,
    DOWNLOAD,
    VIEW,
    DELETE,
    SEARCH,
    /**
     * Extracted text of a document was stored for search.
     */
    INDEX,
    DOCUMENT_CREATE,
    /**
     * Audit entries were exported for a compliance report.
     */
    EXPORT_AUDIT,
    BACKUP_CREATE,
    BACKUP_RESTORE,
    BACKUP_CLEANUP
}
