package com.myancamp.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.myancamp.backend.modules.audit.domain.AuditAction;
import com.myancamp.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByActorUserIdOrderByCreatedAtAsc(UUID actorUserId);

    long countByActionType(AuditAction actionType);
}
