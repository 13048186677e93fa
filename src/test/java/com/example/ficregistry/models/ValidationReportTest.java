package com.example.ficregistry.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationReportTest {

    @Test
    void allValid() {
        ValidationReport report = ValidationReport.of(List.of(
                ValidationResult.valid("national_id", "ok"),
                ValidationResult.valid("phone", "ok")));

        assertEquals(ValidationReport.OverallStatus.VALID, report.overallStatus());
        assertTrue(report.alerts().isEmpty());
    }

    @Test
    void absentAndInvalidBecomeAlerts() {
        ValidationReport report = ValidationReport.of(List.of(
                ValidationResult.valid("national_id", "ok"),
                ValidationResult.invalid("email", "format check failed"),
                ValidationResult.absent("phone")));

        assertEquals(ValidationReport.OverallStatus.WITH_ALERTS, report.overallStatus());
        assertEquals(List.of("format check failed", "phone not provided"), report.alerts());
        assertEquals(ValidationResult.Status.ABSENT, report.resultFor("phone").status());
    }
}
