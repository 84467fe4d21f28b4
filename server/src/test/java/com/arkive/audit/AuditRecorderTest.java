package com.arkive.audit;

import com.arkive.audit.utils.RequestUtils;
import com.arkive.spi.AuditTrail;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.enums.AuditAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Map;

import static org.mockito.Mockito.*;

class AuditRecorderTest {

    private static final Actor ALICE = new Actor("u-1", "alice");

    private final AuditTrail auditTrail = mock();
    private final AuditRecorder auditRecorder = new AuditRecorder(auditTrail, new RequestUtils());

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void recordsForwardedAddressOfCurrentRequest() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.2");
        request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        // When
        auditRecorder.success(ALICE, AuditAction.LOGIN, AuditResource.system(), Map.of("k", "v"));

        // Then
        verify(auditTrail).append(ALICE, AuditAction.LOGIN, AuditResource.system(),
                Map.of("k", "v", AuditRecorder.IP_ADDRESS, "203.0.113.9"), true);
    }

    @Test
    void fallsBackToRemoteAddress() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.2");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        // When
        auditRecorder.failure(ALICE, AuditAction.LOGIN_FAILED, AuditResource.system(), Map.of());

        // Then
        verify(auditTrail).append(ALICE, AuditAction.LOGIN_FAILED, AuditResource.system(), Map.of(AuditRecorder.IP_ADDRESS, "10.0.0.2"), false);
    }

    @Test
    void omitsAddressOutsideRequest() {
        // When
        auditRecorder.success(ALICE, AuditAction.BACKUP_CLEANUP, AuditResource.of(AuditResource.BACKUP, null, null), Map.of("removed", 1));

        // Then
        verify(auditTrail).append(ALICE, AuditAction.BACKUP_CLEANUP, AuditResource.of(AuditResource.BACKUP, null, null), Map.of("removed", 1), true);
    }
}
