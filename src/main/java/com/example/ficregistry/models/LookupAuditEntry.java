package com.example.ficregistry.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter
public class LookupAuditEntry {

    static final String SEPARATOR = " | ";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ISO_INSTANT.withZone(ZoneOffset.UTC);

    // Required; @NonNull makes the builder reject nulls
    @NonNull private Instant timestamp;
    @NonNull private Operation operation;
    @NonNull private String actor;

    // hashed key or a non-identifying note such as "rows=12"
    @NonNull private String detail;

    /**
     * Renders the entry as a single audit line: timestamp, operation, actor, detail.
     * Line breaks inside fields are flattened so one entry never spans two lines.
     */
    public String toLogLine() {
        return String.join(SEPARATOR,
                TIMESTAMP_FORMAT.format(timestamp),
                operation.wireName(),
                flatten(actor),
                flatten(detail));
    }

    private static String flatten(String value) {
        return value.replace('\r', ' ').replace('\n', ' ');
    }

    public enum Operation {
        SEARCH("search"),
        EXACT_LOOKUP("exact-lookup"),
        REMOTE_FETCH("remote-fetch"),
        FETCH_MISS("fetch-miss"),
        FETCH_ERROR("fetch-error"),

        LOAD("load"),
        CACHE_CLEAR("cache-clear"),
        FIC_PROJECTION("fic-projection"),
        VALIDATION("validation"),
        LISTING("listing"),
        SOURCE_ENCRYPT("source-encrypt"),
        CONNECT("connect");

        private final String wireName;

        Operation(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static Operation fromString(String v) {
            for (Operation op : values()) {
                if (op.wireName.equals(v) || op.name().equals(v)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown LookupAuditEntry.Operation: " + v);
        }
    }
}
