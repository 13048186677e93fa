package com.example.ficregistry.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated validation results for one person. Absent and invalid fields become alerts;
 * the caller decides whether alerts block document generation.
 */
public record ValidationReport(
        @JsonProperty("results") List<ValidationResult> results,
        @JsonProperty("alerts") List<String> alerts,
        @JsonProperty("overall_status") OverallStatus overallStatus
) {

    public enum OverallStatus {
        VALID,
        WITH_ALERTS
    }

    public ValidationReport {
        Objects.requireNonNull(results, "results");
        results = List.copyOf(results);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        Objects.requireNonNull(overallStatus, "overallStatus");
    }

    public static ValidationReport of(List<ValidationResult> results) {
        List<String> alerts = results.stream()
                .filter(r -> r.status() != ValidationResult.Status.VALID)
                .map(ValidationResult::reason)
                .toList();
        return new ValidationReport(results, alerts,
                alerts.isEmpty() ? OverallStatus.VALID : OverallStatus.WITH_ALERTS);
    }

    public ValidationResult resultFor(String field) {
        return results.stream()
                .filter(r -> r.field().equals(field))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No result for " + field));
    }
}
