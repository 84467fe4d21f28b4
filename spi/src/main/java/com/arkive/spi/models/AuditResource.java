package com.arkive.spi.models;

import java.util.Objects;

/**
 * The resource an audited action touched. Only the type is mandatory.
 */
public record AuditResource(String type, String id, String name) {

    public static final String SYSTEM = "SYSTEM";
    public static final String DOCUMENT = "DOCUMENT";
    public static final String USER = "USER";
    public static final String BACKUP = "BACKUP";
    public static final String AUDIT_LOG = "AUDIT_LOG";

    public AuditResource {
        Objects.requireNonNull(type, "type");
    }

    public static AuditResource system() {
        return new AuditResource(SYSTEM, null, null);
    }

    public static AuditResource of(String type, String id, String name) {
        return new AuditResource(type, id, name);
    }
}
