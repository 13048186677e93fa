package com.example.ficregistry.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.ficregistry.models.LookupAuditEntry.Operation;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LookupAuditEntryTest {

    private static final Instant TS = Instant.parse("2024-10-01T12:34:56Z");

    @Test
    @DisplayName("log line joins timestamp, operation, actor and detail")
    void logLine() {
        LookupAuditEntry entry = LookupAuditEntry.builder()
                .timestamp(TS)
                .operation(Operation.EXACT_LOOKUP)
                .actor("admin")
                .detail("name=0123456789abcdef matches=1")
                .build();

        assertEquals("2024-10-01T12:34:56Z | exact-lookup | admin | name=0123456789abcdef matches=1",
                entry.toLogLine());
    }

    @Test
    @DisplayName("line breaks cannot split an entry")
    void flattensNewlines() {
        LookupAuditEntry entry = LookupAuditEntry.builder()
                .timestamp(TS)
                .operation(Operation.SEARCH)
                .actor("evil\nactor")
                .detail("a\r\nb")
                .build();

        assertEquals("2024-10-01T12:34:56Z | search | evil actor | a  b", entry.toLogLine());
    }

    @Test
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> LookupAuditEntry.builder()
                .timestamp(TS)
                .operation(Operation.SEARCH)
                .detail("x")
                .build());
    }

    @Test
    void operationWireNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"fetch-miss\"", mapper.writeValueAsString(Operation.FETCH_MISS));
        assertEquals(Operation.REMOTE_FETCH, mapper.readValue("\"remote-fetch\"", Operation.class));
        assertEquals(Operation.CACHE_CLEAR, Operation.fromString("CACHE_CLEAR"));
        assertThrows(IllegalArgumentException.class, () -> Operation.fromString("delete"));
    }
}
