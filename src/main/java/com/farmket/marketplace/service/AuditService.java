package com.farmket.marketplace.service;

import com.farmket.marketplace.model.AuditLog;
import com.farmket.marketplace.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Records administrative changes (account creation, deletions) in the {@code audit_logs} table.
 * Each entry is written in its own transaction, so a failed write never rolls back the caller's change.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate auditTx;

    public AuditService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.auditTx = new TransactionTemplate(transactionManager);
        this.auditTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void log(String action, String details) {
        AuditLog entry = new AuditLog();
        entry.setAction(action);
        entry.setDetails(details);

        var auth = SecurityContextHolder.getContext().getAuthentication();
        entry.setUsername(auth != null ? auth.getName() : "SYSTEM");

        try {
            auditTx.executeWithoutResult(status -> auditLogRepository.save(entry));
        } catch (DataAccessException | TransactionException e) {
            log.warn("Failed to write audit log {} ({}): {}", action, details, e.getMessage());
        }
    }
}
