package com.example.ficregistry.models;

import java.time.Instant;
import java.util.Objects;

/**
 * A person as needed to fill a FIC document, together with the validation diagnostics of
 * its sensitive attributes. Closing the projection closes the underlying record.
 */
public record FicProjection(
        PersonRecord person,
        ValidationReport validation,
        Instant generatedAt
) implements AutoCloseable {

    public FicProjection {
        Objects.requireNonNull(person, "person");
        Objects.requireNonNull(validation, "validation");
        Objects.requireNonNull(generatedAt, "generatedAt");
    }

    public ValidationResult.Status statusOf(PersonColumn column) {
        return validation.resultFor(column.key()).status();
    }

    @Override
    public void close() {
        person.close();
    }
}
