package com.trialstruct.repository;

import com.trialstruct.model.audit.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for pipeline audit records.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    List<AuditLog> findByTargetTypeAndTargetIdOrderByTimestampAsc(String targetType, String targetId);
}
