package com.example.ficregistry.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Verdict of one validation rule for one field. Never persisted.
 */
public record ValidationResult(
        @JsonProperty("field") String field,
        @JsonProperty("status") Status status,
        @JsonProperty("reason") String reason
) {

    public enum Status {
        VALID,
        INVALID,
        ABSENT
    }

    public ValidationResult {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(reason, "reason");
    }

    public static ValidationResult valid(String field, String reason) {
        return new ValidationResult(field, Status.VALID, reason);
    }

    public static ValidationResult invalid(String field, String reason) {
        return new ValidationResult(field, Status.INVALID, reason);
    }

    public static ValidationResult absent(String field) {
        return new ValidationResult(field, Status.ABSENT, field + " not provided");
    }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
