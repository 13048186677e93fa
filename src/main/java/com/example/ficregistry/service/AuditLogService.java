package com.example.ficregistry.service;

import com.example.ficregistry.access.AuditSink;
import com.example.ficregistry.models.LookupAuditEntry;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Append-only audit trail for lookups against personal data. Details are passed in already
 * hashed; this service does no redaction of its own.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    public static final String DEFAULT_ACTOR = "system";

    private final AuditSink auditSink;
    private final Clock clock;

    public void record(LookupAuditEntry.Operation operation, String detail) {
        record(operation, detail, DEFAULT_ACTOR);
    }

    public void record(LookupAuditEntry.Operation operation, String detail, String actor) {
        LookupAuditEntry entry = LookupAuditEntry.builder()
                .timestamp(clock.instant())
                .operation(operation)
                .actor(actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor)
                .detail(detail == null ? "" : detail)
                .build();
        auditSink.append(entry);
    }
}
