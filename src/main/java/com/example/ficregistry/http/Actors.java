package com.example.ficregistry.http;

import com.example.ficregistry.service.AuditLogService;
import com.example.ficregistry.validation.FieldValidator;

final class Actors {

    private static final int MAX_LENGTH = 64;

    private Actors() {
    }

    /** Sanitized actor name from the {@code X-Actor} header, "system" when absent. */
    static String resolve(String header) {
        String actor = FieldValidator.sanitize(header);
        if (actor.isEmpty()) {
            return AuditLogService.DEFAULT_ACTOR;
        }
        return actor.length() > MAX_LENGTH ? actor.substring(0, MAX_LENGTH) : actor;
    }
}
