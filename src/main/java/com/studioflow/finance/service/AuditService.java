package com.studioflow.finance.service;

import com.studioflow.finance.model.AuditLog;
import com.studioflow.finance.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Finance activity feed. Every settlement the core records leaves a line here,
 * attributed to the authenticated user or to {@code SYSTEM} for scheduled work.
 *
 * <p>Rows are written in their own transaction, so a failed audit write is logged and
 * leaves the caller's transaction committable.
 */
@Slf4j
@Service
public class AuditService {

    public static final String SYSTEM_ACTOR = "SYSTEM";

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate separateTransaction;

    public AuditService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.separateTransaction = new TransactionTemplate(transactionManager);
        this.separateTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void log(String action, String details) {
        log(action, details, currentActor());
    }

    public void log(String action, String details, String actor) {
        try {
            AuditLog entry = new AuditLog();
            entry.setAction(action);
            entry.setDetails(details != null && details.length() > 1000 ? details.substring(0, 1000) : details);
            entry.setUsername(actor != null ? actor : SYSTEM_ACTOR);
            separateTransaction.executeWithoutResult(status -> auditLogRepository.save(entry));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit log for {}: {}", action, e.getMessage());
        }
    }

    public String currentActor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getName() != null) {
            return auth.getName();
        }
        return SYSTEM_ACTOR;
    }
}
