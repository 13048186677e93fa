package com.example.ficregistry.access;

import com.example.ficregistry.models.LookupAuditEntry;

/**
 * Append-only destination for audit entries. Implementations write each entry as one line
 * with a single append so concurrent writers never interleave partial lines.
 */
public interface AuditSink {
    void append(LookupAuditEntry entry);
}
