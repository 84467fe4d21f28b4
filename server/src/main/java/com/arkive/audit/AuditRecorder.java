package com.arkive.audit;

import com.arkive.audit.utils.RequestUtils;
import com.arkive.spi.AuditTrail;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditEntry;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.enums.AuditAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Appends audit entries on behalf of the services, adding the caller's address to the metadata.
 * A failed append surfaces as {@link com.arkive.spi.exceptions.AuditWriteException}.
 */
@Component
@RequiredArgsConstructor
public class AuditRecorder {

    public static final String IP_ADDRESS = "ip_address";

    private final AuditTrail auditTrail;
    private final RequestUtils requestUtils;

    public AuditEntry record(Actor actor, AuditAction action, AuditResource resource, Map<String, Object> metadata, boolean success) {
        Map<String, Object> auditMetadata = new HashMap<>(metadata);
        String remoteIp = requestUtils.getRemoteIp();
        if (remoteIp != null) {
            auditMetadata.put(IP_ADDRESS, remoteIp);
        }
        return auditTrail.append(actor, action, resource, auditMetadata, success);
    }

    public AuditEntry success(Actor actor, AuditAction action, AuditResource resource, Map<String, Object> metadata) {
        return record(actor, action, resource, metadata, true);
    }

    public AuditEntry failure(Actor actor, AuditAction action, AuditResource resource, Map<String, Object> metadata) {
        return record(actor, action, resource, metadata, false);
    }
}
