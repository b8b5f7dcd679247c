package com.farmket.marketplace.repository;

import com.farmket.marketplace.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByActionOrderByTimestampDesc(String action);
}
