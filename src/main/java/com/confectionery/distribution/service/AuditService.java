package com.confectionery.distribution.service;

import com.confectionery.distribution.model.AuditLog;
import com.confectionery.distribution.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void log(String action, String details) {
        try {
            AuditLog entry = new AuditLog();
            entry.setAction(action);
            entry.setDetails(details);

            var auth = SecurityContextHolder.getContext().getAuthentication();
            entry.setUsername(auth != null ? auth.getName() : "SYSTEM");

            auditLogRepository.save(entry);
        } catch (RuntimeException e) {
            // Audit trail must not fail the business operation
            log.warn("Failed to write audit log {}: {}", action, e.getMessage());
        }
    }
}
