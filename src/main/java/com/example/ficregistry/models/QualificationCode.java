package com.example.ficregistry.models;

import java.util.Locale;
import java.util.Map;

/**
 * Qualification codes used in the "HAB 1" column and their descriptions.
 */
public final class QualificationCode {

    /** Written as a bare "--" in the source table. */
    public static final String COP_CHIEF = "--";

    private static final Map<String, String> DESCRIPTIONS = Map.of(
            "S", "Supervisor",
            "I", "Instrutor",
            "O", "Operador",
            "F", "FMC",
            "S/H", "Sem habilitação",
            "CHEQ", "Chefe de equipe",
            "E", "Estagiário",
            COP_CHIEF, "Chefe do COP"
    );

    private QualificationCode() {
    }

    /**
     * Returns "code - description" for known codes, the code unchanged otherwise and an
     * empty string for blank input.
     */
    public static String describe(String code) {
        if (code == null || code.isBlank()) {
            return "";
        }
        String trimmed = code.trim();
        String description = DESCRIPTIONS.get(trimmed.toUpperCase(Locale.ROOT));
        return description == null ? trimmed : trimmed + " - " + description;
    }
}
