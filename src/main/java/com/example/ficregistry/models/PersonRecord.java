package com.example.ficregistry.models;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * One individual known to the registry. Sensitive attributes hold plaintext only while the
 * enclosing request runs; callers close the record when they are done with it.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter
public class PersonRecord implements AutoCloseable {

    private static final int MIN_NAME_LENGTH = 2;

    // Identity
    private String fullName;
    private String warName;
    private String rank;
    private String specialty;
    private String unit;

    // Carried from the source table
    private Integer sequence;
    private String birthDate;
    private String enlistmentDate;
    private String lastPromotionDate;
    private String adminRecord;
    private String qualification;

    // Sensitive
    private String nationalId;
    private String registrationNumber;
    private String internalEmail;
    private String email;
    private String phone;

    // column -> 16 hex chars, log correlation only
    private Map<PersonColumn, String> sensitiveHashes;

    public static PersonRecord fromColumns(Map<PersonColumn, String> values) {
        return PersonRecord.builder()
                .sequence(parseSequence(values.get(PersonColumn.SEQUENCE)))
                .fullName(values.get(PersonColumn.FULL_NAME))
                .warName(values.get(PersonColumn.WAR_NAME))
                .rank(values.get(PersonColumn.RANK))
                .specialty(values.get(PersonColumn.SPECIALTY))
                .unit(values.get(PersonColumn.UNIT))
                .birthDate(values.get(PersonColumn.BIRTH_DATE))
                .enlistmentDate(values.get(PersonColumn.ENLISTMENT_DATE))
                .lastPromotionDate(values.get(PersonColumn.LAST_PROMOTION_DATE))
                .adminRecord(values.get(PersonColumn.ADMIN_RECORD))
                .qualification(values.get(PersonColumn.QUALIFICATION))
                .nationalId(values.get(PersonColumn.NATIONAL_ID))
                .registrationNumber(values.get(PersonColumn.REGISTRATION_NUMBER))
                .internalEmail(values.get(PersonColumn.INTERNAL_EMAIL))
                .email(values.get(PersonColumn.EMAIL))
                .phone(values.get(PersonColumn.PHONE))
                .build();
    }

    /**
     * Value of the given attribute, sequence rendered as text.
     */
    public String value(PersonColumn column) {
        return switch (column) {
            case SEQUENCE -> sequence == null ? null : String.valueOf(sequence);
            case REGISTRATION_NUMBER -> registrationNumber;
            case RANK -> rank;
            case SPECIALTY -> specialty;
            case FULL_NAME -> fullName;
            case WAR_NAME -> warName;
            case BIRTH_DATE -> birthDate;
            case ENLISTMENT_DATE -> enlistmentDate;
            case LAST_PROMOTION_DATE -> lastPromotionDate;
            case NATIONAL_ID -> nationalId;
            case ADMIN_RECORD -> adminRecord;
            case UNIT -> unit;
            case QUALIFICATION -> qualification;
            case INTERNAL_EMAIL -> internalEmail;
            case EMAIL -> email;
            case PHONE -> phone;
        };
    }

    public Map<PersonColumn, String> getSensitiveHashes() {
        return sensitiveHashes == null ? Map.of() : Collections.unmodifiableMap(sensitiveHashes);
    }

    public String qualificationDescription() {
        return QualificationCode.describe(qualification);
    }

    /** "rank name" when a rank is known, the bare name otherwise. */
    public String displayName() {
        if (rank == null || rank.isBlank()) {
            return fullName;
        }
        return rank + " " + fullName;
    }

    public boolean hasSensitiveValues() {
        return nationalId != null || registrationNumber != null || internalEmail != null
                || email != null || phone != null || !getSensitiveHashes().isEmpty();
    }

    @Override
    public void close() {
        nationalId = null;
        registrationNumber = null;
        internalEmail = null;
        email = null;
        phone = null;
        sensitiveHashes = null;
    }

    @Override
    public String toString() {
        return "PersonRecord(sequence=" + sequence + ", rank=" + rank + ", unit=" + unit + ")";
    }

    /** Sequence numbers may arrive as "12" or "12.0". Anything else is treated as absent. */
    public static Integer parseSequence(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String digits = raw.trim();
        int dot = digits.indexOf('.');
        if (dot > 0) {
            digits = digits.substring(0, dot);
        }
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static class PersonRecordBuilder {
        public PersonRecord build() {
            if (fullName == null || fullName.trim().length() < MIN_NAME_LENGTH) {
                throw new IllegalArgumentException("fullName must have at least "
                        + MIN_NAME_LENGTH + " characters");
            }
            Map<PersonColumn, String> hashes = null;
            if (sensitiveHashes != null) {
                hashes = new EnumMap<>(PersonColumn.class);
                hashes.putAll(sensitiveHashes);
            }
            return new PersonRecord(fullName.trim(), warName, rank, specialty, unit,
                    sequence, birthDate, enlistmentDate, lastPromotionDate, adminRecord,
                    qualification, nationalId, registrationNumber, internalEmail, email,
                    phone, hashes);
        }
    }
}
