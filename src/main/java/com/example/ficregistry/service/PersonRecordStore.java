package com.example.ficregistry.service;

import com.example.ficregistry.access.ColumnMapping;
import com.example.ficregistry.access.PersonTable;
import com.example.ficregistry.access.PersonTableAccess;
import com.example.ficregistry.config.StoreProperties;
import com.example.ficregistry.crypto.CredentialCipher;
import com.example.ficregistry.crypto.Fingerprints;
import com.example.ficregistry.models.EncryptedField;
import com.example.ficregistry.models.FicProjection;
import com.example.ficregistry.models.LookupAuditEntry.Operation;
import com.example.ficregistry.models.PersonColumn;
import com.example.ficregistry.models.PersonRecord;
import com.example.ficregistry.models.QualificationCode;
import com.example.ficregistry.models.ValidationReport;
import com.example.ficregistry.models.ValidationResult;
import com.example.ficregistry.validation.FieldValidator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Person records read from the local table. The table is read once and kept in memory in
 * its stored form (sanitized, sensitive cells still encrypted); every call that returns
 * records builds fresh instances and decrypts them, so callers can close what they get
 * without affecting the cache.
 *
 * <p>Audit entries carry fingerprints of names and search terms, never the values.
 */
@Slf4j
@Service
public class PersonRecordStore {

    private final PersonTableAccess tableAccess;
    private final CredentialCipher cipher;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final int defaultSuggestionLimit;

    private List<Map<PersonColumn, String>> cachedRows;

    public PersonRecordStore(PersonTableAccess tableAccess,
                             CredentialCipher cipher,
                             AuditLogService auditLogService,
                             Clock clock,
                             StoreProperties properties) {
        this.tableAccess = tableAccess;
        this.cipher = cipher;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.defaultSuggestionLimit = properties.getSuggestionLimit();
    }

    public List<PersonRecord> load() {
        return load(true, true);
    }

    /**
     * @param useCache reuse rows read earlier by this instance when present
     * @param decrypt  decrypt sensitive columns; when false they keep their stored form
     */
    public synchronized List<PersonRecord> load(boolean useCache, boolean decrypt) {
        return storedRows(useCache).stream()
                .map(row -> materialize(row, decrypt))
                .collect(Collectors.toList());
    }

    public List<PersonRecord> searchByName(String fragment) {
        return searchByName(fragment, false, AuditLogService.DEFAULT_ACTOR);
    }

    /**
     * Records whose full name or war name contains {@code fragment}, in source order.
     *
     * @throws PersonRegistryException {@code INVALID_INPUT} when the fragment is empty
     *         after sanitization
     */
    public synchronized List<PersonRecord> searchByName(String fragment, boolean caseSensitive, String actor) {
        String term = requireTerm(fragment, "Search term is empty");
        String needle = caseSensitive ? term : term.toLowerCase(Locale.ROOT);
        Predicate<String> matches = candidate -> !candidate.isEmpty()
                && (caseSensitive ? candidate : candidate.toLowerCase(Locale.ROOT)).contains(needle);

        List<PersonRecord> found = storedRows(true).stream()
                .filter(row -> matches.test(row.getOrDefault(PersonColumn.FULL_NAME, ""))
                        || matches.test(row.getOrDefault(PersonColumn.WAR_NAME, "")))
                .map(row -> materialize(row, true))
                .collect(Collectors.toList());

        auditLogService.record(Operation.SEARCH,
                "term=" + Fingerprints.of(term) + " matches=" + found.size(), actor);
        return found;
    }

    public Optional<PersonRecord> lookupExact(String name) {
        return lookupExact(name, AuditLogService.DEFAULT_ACTOR);
    }

    /**
     * Single record whose full name or war name equals {@code name}, ignoring case.
     *
     * @throws PersonRegistryException {@code AMBIGUOUS_MATCH} when more than one row matches
     */
    public synchronized Optional<PersonRecord> lookupExact(String name, String actor) {
        String term = requireTerm(name, "Name is empty");
        String nameHash = Fingerprints.of(term.toLowerCase(Locale.ROOT));

        List<Map<PersonColumn, String>> matches = storedRows(true).stream()
                .filter(row -> term.equalsIgnoreCase(row.getOrDefault(PersonColumn.FULL_NAME, ""))
                        || term.equalsIgnoreCase(row.getOrDefault(PersonColumn.WAR_NAME, "")))
                .collect(Collectors.toList());

        auditLogService.record(Operation.EXACT_LOOKUP,
                "name=" + nameHash + " matches=" + matches.size(), actor);
        if (matches.size() > 1) {
            throw PersonRegistryException.ambiguousMatch(nameHash, matches.size());
        }
        return matches.stream().findFirst().map(row -> materialize(row, true));
    }

    public Optional<FicProjection> getFicProjection(String name) {
        return getFicProjection(name, AuditLogService.DEFAULT_ACTOR);
    }

    /**
     * The person behind {@code name} with a validation result for every sensitive
     * attribute. Invalid or absent values are reported, never fatal.
     */
    public synchronized Optional<FicProjection> getFicProjection(String name, String actor) {
        Optional<PersonRecord> person = lookupExact(name, actor);
        person.ifPresent(p -> auditLogService.record(Operation.FIC_PROJECTION,
                "name=" + Fingerprints.of(p.getFullName()), actor));
        return person.map(p -> new FicProjection(p, validate(p), clock.instant()));
    }

    public Optional<ValidationReport> validatePerson(String name) {
        return validatePerson(name, AuditLogService.DEFAULT_ACTOR);
    }

    public synchronized Optional<ValidationReport> validatePerson(String name, String actor) {
        Optional<PersonRecord> person = lookupExact(name, actor);
        if (person.isEmpty()) {
            return Optional.empty();
        }
        try (PersonRecord p = person.get()) {
            ValidationReport report = validate(p);
            auditLogService.record(Operation.VALIDATION,
                    "name=" + Fingerprints.of(p.getFullName()) + " status=" + report.overallStatus(), actor);
            return Optional.of(report);
        }
    }

    public synchronized List<PersonRecord> listAll(boolean decrypt, String actor) {
        List<PersonRecord> all = load(true, decrypt);
        auditLogService.record(Operation.LISTING, "rows=" + all.size() + " decrypted=" + decrypt, actor);
        return all;
    }

    /**
     * "rank name" for every record, sorted ignoring case. Reads no sensitive column.
     */
    public synchronized List<String> formattedNames() {
        return storedRows(true).stream()
                .map(row -> displayName(row.getOrDefault(PersonColumn.RANK, ""),
                        row.getOrDefault(PersonColumn.FULL_NAME, "")))
                .sorted(String.CASE_INSENSITIVE_ORDER)
                .collect(Collectors.toList());
    }

    public List<String> nameSuggestions(String term) {
        return nameSuggestions(term, defaultSuggestionLimit);
    }

    /**
     * Distinct full and war names containing {@code term}, sorted, at most {@code limit}.
     * A blank term gives an empty list.
     */
    public synchronized List<String> nameSuggestions(String term, int limit) {
        String clean = FieldValidator.sanitize(term).toLowerCase(Locale.ROOT);
        if (clean.isEmpty()) {
            return List.of();
        }
        int max = limit > 0 ? limit : defaultSuggestionLimit;
        Set<String> names = new LinkedHashSet<>();
        for (Map<PersonColumn, String> row : storedRows(true)) {
            for (PersonColumn column : List.of(PersonColumn.FULL_NAME, PersonColumn.WAR_NAME)) {
                String candidate = row.getOrDefault(column, "");
                if (!candidate.isEmpty() && candidate.toLowerCase(Locale.ROOT).contains(clean)) {
                    names.add(candidate);
                }
            }
        }
        return names.stream()
                .sorted(String.CASE_INSENSITIVE_ORDER)
                .limit(max)
                .collect(Collectors.toList());
    }

    /**
     * Rewrites the backing table so every non-empty sensitive cell is a ciphertext token.
     * Cells that already look encrypted are left as they are.
     *
     * @return number of cells encrypted by this call
     */
    public synchronized int encryptSource(String actor) {
        PersonTable table = tableAccess.read();
        ColumnMapping mapping = ColumnMapping.resolve(table.headers());
        Map<PersonColumn, Integer> sensitiveIndexes = new EnumMap<>(PersonColumn.class);
        for (PersonColumn column : PersonColumn.sensitiveColumns()) {
            mapping.indexOf(column).ifPresent(index -> sensitiveIndexes.put(column, index));
        }

        int encrypted = 0;
        List<List<String>> rows = new ArrayList<>(table.rows().size());
        for (List<String> source : table.rows()) {
            List<String> row = new ArrayList<>(source);
            for (Map.Entry<PersonColumn, Integer> entry : sensitiveIndexes.entrySet()) {
                int index = entry.getValue();
                if (index >= row.size()) {
                    continue;
                }
                EncryptedField field = cipher.inspect(entry.getKey(), row.get(index));
                if (field.isEmpty() || field.ciphertext()) {
                    continue;
                }
                row.set(index, cipher.encrypt(field.storedValue()));
                encrypted++;
            }
            rows.add(row);
        }

        if (encrypted > 0) {
            tableAccess.write(new PersonTable(table.headers(), rows));
        }
        cachedRows = null;
        log.info("Encrypted {} sensitive cells in {}", encrypted, tableAccess.location());
        auditLogService.record(Operation.SOURCE_ENCRYPT, "cells=" + encrypted, actor);
        return encrypted;
    }

    public synchronized void clearCache() {
        cachedRows = null;
        auditLogService.record(Operation.CACHE_CLEAR, "cache cleared");
    }

    static ValidationReport validate(PersonRecord person) {
        List<ValidationResult> results = List.of(
                FieldValidator.validateNationalId(person.getNationalId()),
                FieldValidator.validateRegistrationNumber(person.getRegistrationNumber()),
                FieldValidator.validateEmail(PersonColumn.INTERNAL_EMAIL, person.getInternalEmail()),
                FieldValidator.validateEmail(PersonColumn.EMAIL, person.getEmail()),
                FieldValidator.validatePhone(person.getPhone()));
        return ValidationReport.of(results);
    }

    private List<Map<PersonColumn, String>> storedRows(boolean useCache) {
        if (useCache && cachedRows != null) {
            return cachedRows;
        }
        PersonTable table = tableAccess.read();
        ColumnMapping mapping = ColumnMapping.resolve(table.headers());
        if (!mapping.has(PersonColumn.FULL_NAME)) {
            throw PersonRegistryException.sourceUnreadable(tableAccess.location(),
                    new IllegalStateException("no full name column among " + table.headers().size() + " headers"));
        }

        List<Map<PersonColumn, String>> rows = new ArrayList<>(table.rows().size());
        int skipped = 0;
        for (List<String> raw : table.rows()) {
            Map<PersonColumn, String> row = new EnumMap<>(PersonColumn.class);
            mapping.extract(raw).forEach((column, value) -> row.put(column, storedForm(column, value)));
            if (row.getOrDefault(PersonColumn.FULL_NAME, "").length() < 2) {
                skipped++;
                continue;
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        if (skipped > 0) {
            log.warn("Skipped {} rows without a usable full name in {}", skipped, tableAccess.location());
        }

        cachedRows = Collections.unmodifiableList(rows);
        auditLogService.record(Operation.LOAD, "rows=" + rows.size() + " skipped=" + skipped);
        return cachedRows;
    }

    // Ciphertext tokens and the bare "--" qualification code would not survive sanitization.
    private String storedForm(PersonColumn column, String value) {
        if (column.isSensitive() && cipher.looksEncrypted(value)) {
            return value.trim();
        }
        if (column == PersonColumn.QUALIFICATION && value != null
                && QualificationCode.COP_CHIEF.equals(value.trim())) {
            return QualificationCode.COP_CHIEF;
        }
        return FieldValidator.sanitize(value);
    }

    private PersonRecord materialize(Map<PersonColumn, String> stored, boolean decrypt) {
        Map<PersonColumn, String> values = new EnumMap<>(stored);
        Map<PersonColumn, String> hashes = new EnumMap<>(PersonColumn.class);
        if (decrypt) {
            for (PersonColumn column : PersonColumn.sensitiveColumns()) {
                String value = values.get(column);
                if (value == null || value.isEmpty()) {
                    continue;
                }
                String plain = cipher.decrypt(value);
                values.put(column, plain);
                hashes.put(column, Fingerprints.of(plain));
            }
        }
        return PersonRecord.fromColumns(values).toBuilder()
                .sensitiveHashes(hashes)
                .build();
    }

    private static String requireTerm(String raw, String message) {
        String term = FieldValidator.sanitize(raw);
        if (term.isEmpty()) {
            throw PersonRegistryException.invalidInput(message);
        }
        return term;
    }

    private static String displayName(String rank, String name) {
        return rank.isEmpty() ? name : rank + " " + name;
    }
}
