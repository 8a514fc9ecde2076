package com.myancamp.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.myancamp.backend.modules.audit.domain.AuditAction;
import com.myancamp.backend.modules.audit.domain.AuditLog;
import com.myancamp.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only security trail. Never pass token values, codes or secrets in {@code detail}.
 */
@Service
public class AuditLogService {

    private static final String REQUEST_ID_MDC_KEY = "requestId";
    private static final String RESOURCE_USER = "USER";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.action());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setIpAddress(command.ipAddress());
        auditLog.setRequestId(MDC.get(REQUEST_ID_MDC_KEY));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public void recordUserEvent(AuditAction action, UUID userId, String ipAddress, Map<String, Object> detail) {
        record(new AuditLogCommand(action, RESOURCE_USER, userId.toString(), userId, ipAddress, detail));
    }

    public record AuditLogCommand(
            AuditAction action,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String ipAddress,
            Map<String, Object> detail
    ) {
    }
}
