package com.example.ficregistry.models;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical person attributes and the header variants accepted for each of them in the
 * backing table. Header comparison ignores case, accents, underscores and repeated
 * whitespace, so "NASCIMENTO\n", "Praça" and "NOME_COMPLETO" all resolve.
 */
public enum PersonColumn {

    SEQUENCE("sequence", false, "N", "Nº", "NUMERO"),
    REGISTRATION_NUMBER("registration_number", true, "SARAM"),
    RANK("rank", false, "GRAD", "POSTO", "POSTO GRADUACAO", "POSTO/GRAD"),
    SPECIALTY("specialty", false, "ESP", "ESPECIALIDADE"),
    FULL_NAME("full_name", false, "NOME COMPLETO", "NOME"),
    WAR_NAME("war_name", false, "NOME DE GUERRA", "NOME GUERRA"),
    BIRTH_DATE("birth_date", false, "NASCIMENTO", "DATA NASC", "DATA NASCIMENTO"),
    ENLISTMENT_DATE("enlistment_date", false, "PRACA", "DATA PRACA"),
    LAST_PROMOTION_DATE("last_promotion_date", false,
            "ULT PROM", "ULTPROM", "ULTIMA PROMOCAO", "DATA ULTIMA PROMOCAO"),
    NATIONAL_ID("national_id", true, "CPF"),
    ADMIN_RECORD("admin_record", false, "RA", "REGISTRO ADMINISTRATIVO"),
    UNIT("unit", false, "SECAO", "OM", "OM INDICADO"),
    QUALIFICATION("qualification", false, "HAB 1", "HAB1", "HABILITACAO"),
    INTERNAL_EMAIL("internal_email", true, "EMAIL INTERNO"),
    EMAIL("email", true, "EMAIL EXTERNO", "EMAIL"),
    PHONE("phone", true, "TELEFONE", "TEL");

    private final String key;
    private final boolean sensitive;
    private final List<String> aliases;

    PersonColumn(String key, boolean sensitive, String... aliases) {
        this.key = key;
        this.sensitive = sensitive;
        this.aliases = List.of(aliases);
    }

    /** Snake-case attribute name used in views, reports and audit details. */
    public String key() {
        return key;
    }

    public boolean isSensitive() {
        return sensitive;
    }

    public List<String> aliases() {
        return aliases;
    }

    public static List<PersonColumn> sensitiveColumns() {
        return Arrays.stream(values()).filter(PersonColumn::isSensitive).toList();
    }

    /**
     * Finds the column a raw header names, either through an alias or through the
     * canonical key itself.
     */
    public static Optional<PersonColumn> forHeader(String header) {
        String normalized = normalizeHeader(header);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (PersonColumn column : values()) {
            if (normalizeHeader(column.key).equals(normalized)) {
                return Optional.of(column);
            }
            for (String alias : column.aliases) {
                if (normalizeHeader(alias).equals(normalized)) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }

    static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String stripped = Normalizer.normalize(header, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "");
        return stripped.replace('_', ' ')
                .replaceAll("\\s+", " ")
                .trim()
                .toUpperCase(Locale.ROOT);
    }
}
