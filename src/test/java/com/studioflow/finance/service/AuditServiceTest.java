package com.studioflow.finance.service;

import com.studioflow.finance.model.AuditLog;
import com.studioflow.finance.repository.AuditLogRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;
    @Mock
    private PlatformTransactionManager transactionManager;

    @InjectMocks
    private AuditService auditService;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void currentActor_ShouldBeSystemWithoutAuthentication() {
        assertEquals(AuditService.SYSTEM_ACTOR, auditService.currentActor());
    }

    @Test
    void log_ShouldAttributeAuthenticatedUserAndTruncateDetails() {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("meera", "n/a", List.of()));

        auditService.log("RECORD_PAYMENT", "x".repeat(1500));

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(saved.capture());
        assertEquals("meera", saved.getValue().getUsername());
        assertEquals(1000, saved.getValue().getDetails().length());
    }

    @Test
    void log_ShouldNotPropagateStorageFailure() {
        when(auditLogRepository.save(any(AuditLog.class))).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> auditService.log("PAY_CLAIM", "Claim 4", "ravi"));
        verify(transactionManager).rollback(any());
    }
}
