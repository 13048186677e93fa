package com.example.ficregistry.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.ficregistry.access.CsvPersonTableAccess;
import com.example.ficregistry.access.PersonTable;
import com.example.ficregistry.access.PersonTableAccess;
import com.example.ficregistry.config.StoreProperties;
import com.example.ficregistry.crypto.CredentialCipher;
import com.example.ficregistry.crypto.Fingerprints;
import com.example.ficregistry.models.FicProjection;
import com.example.ficregistry.models.LookupAuditEntry.Operation;
import com.example.ficregistry.models.PersonColumn;
import com.example.ficregistry.models.PersonRecord;
import com.example.ficregistry.models.ValidationReport;
import com.example.ficregistry.models.ValidationResult.Status;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersonRecordStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-01T12:34:56Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private Path source;
    private PersonTableAccess tableAccess;
    private CredentialCipher cipher;
    private InMemoryAuditSink auditSink;
    private PersonRecordStore store;

    @BeforeEach
    void setUp() throws Exception {
        source = dir.resolve("efetivo.csv");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/efetivo.csv")) {
            Files.copy(in, source);
        }
        tableAccess = spy(new CsvPersonTableAccess(source));
        cipher = new CredentialCipher(dir.resolve(".field.key"));
        auditSink = new InMemoryAuditSink();
        store = new PersonRecordStore(tableAccess, cipher, new AuditLogService(auditSink, CLOCK), CLOCK,
                new StoreProperties());
    }

    @Test
    @DisplayName("load skips rows without a usable name and caches the table")
    void loadCaches() {
        List<PersonRecord> first = store.load();
        List<PersonRecord> second = store.load();

        assertEquals(4, first.size());
        assertEquals(4, second.size());
        verify(tableAccess, times(1)).read();
        assertEquals("rows=4 skipped=1", auditSink.entries(Operation.LOAD).get(0).getDetail());
    }

    @Test
    @DisplayName("records are fresh per call, so closing one does not touch the cache")
    void freshRecords() {
        PersonRecord joao = store.load().get(0);
        joao.close();

        PersonRecord again = store.load().get(0);
        assertEquals("529.982.247-25", again.getNationalId());
        assertEquals(Fingerprints.of("529.982.247-25"), again.getSensitiveHashes().get(PersonColumn.NATIONAL_ID));
    }

    @Test
    @DisplayName("clearCache forces the next load to read the source again")
    void clearCache() {
        store.load();
        store.clearCache();
        store.load();

        verify(tableAccess, times(2)).read();
        assertEquals(1, auditSink.entries(Operation.CACHE_CLEAR).size());
    }

    @Test
    @DisplayName("search matches full name or war name in source order")
    void searchByName() {
        List<PersonRecord> found = store.searchByName("alves");

        assertEquals(2, found.size());
        assertEquals(3, found.get(0).getSequence());
        assertEquals(4, found.get(1).getSequence());
        assertEquals(1, store.searchByName("SoUzA").size());
    }

    @Test
    void caseSensitiveSearch() {
        assertTrue(store.searchByName("Silva", true, "alice").isEmpty());
        assertEquals(1, store.searchByName("SILVA", true, "alice").size());
        assertTrue(auditSink.lines().get(auditSink.lines().size() - 1).contains("| search | alice |"));
    }

    @Test
    @DisplayName("a search term that sanitizes to nothing is rejected")
    void emptySearch() {
        PersonRegistryException ex = assertThrows(PersonRegistryException.class, () -> store.searchByName("<>;"));
        assertEquals(PersonRegistryException.Code.INVALID_INPUT, ex.getCode());
        assertTrue(auditSink.entries(Operation.SEARCH).isEmpty());
    }

    @Test
    @DisplayName("exact lookup matches the war name ignoring case")
    void lookupExact() {
        Optional<PersonRecord> person = store.lookupExact("silva");

        assertTrue(person.isPresent());
        assertEquals("JOAO DA SILVA", person.get().getFullName());
        assertTrue(store.lookupExact("NOBODY HERE").isEmpty());
    }

    @Test
    @DisplayName("exact lookup refuses to pick between namesakes")
    void ambiguousLookup() {
        PersonRegistryException ex = assertThrows(PersonRegistryException.class,
                () -> store.lookupExact("pedro alves"));

        assertEquals(PersonRegistryException.Code.AMBIGUOUS_MATCH, ex.getCode());
        assertFalse(ex.getAdminDetail().contains("PEDRO"));
        assertEquals(1, auditSink.entries(Operation.EXACT_LOOKUP).size());
    }

    @Test
    @DisplayName("FIC projection of a valid person reports a valid national ID")
    void ficProjectionValid() {
        try (FicProjection fic = store.getFicProjection("JOAO DA SILVA").orElseThrow()) {
            assertEquals("529.982.247-25", fic.person().getNationalId());
            assertEquals(Status.VALID, fic.statusOf(PersonColumn.NATIONAL_ID));
            assertEquals(Status.VALID, fic.statusOf(PersonColumn.REGISTRATION_NUMBER));
            assertEquals(Status.VALID, fic.statusOf(PersonColumn.EMAIL));
            assertEquals(Status.VALID, fic.statusOf(PersonColumn.PHONE));
            assertEquals(Status.ABSENT, fic.statusOf(PersonColumn.INTERNAL_EMAIL));
            assertEquals(Instant.now(CLOCK), fic.generatedAt());
        }
    }

    @Test
    @DisplayName("invalid attributes are reported, not fatal")
    void ficProjectionInvalid() {
        FicProjection fic = store.getFicProjection("MARIA SOUZA").orElseThrow();

        assertEquals(Status.INVALID, fic.statusOf(PersonColumn.NATIONAL_ID));
        assertTrue(fic.validation().resultFor("national_id").reason().startsWith("repeated-digit"));
        assertEquals(Status.INVALID, fic.statusOf(PersonColumn.EMAIL));
        assertEquals(Status.INVALID, fic.statusOf(PersonColumn.PHONE));

        fic.close();
        assertFalse(fic.person().hasSensitiveValues());
    }

    @Test
    void validatePerson() {
        ValidationReport report = store.validatePerson("souza").orElseThrow();

        assertEquals(ValidationReport.OverallStatus.WITH_ALERTS, report.overallStatus());
        assertEquals(4, report.alerts().size());
        assertTrue(store.validatePerson("NOBODY HERE").isEmpty());
        assertEquals(1, auditSink.entries(Operation.VALIDATION).size());
    }

    @Test
    void formattedNames() {
        assertEquals(List.of("1S PEDRO ALVES", "2S JOAO DA SILVA", "3S MARIA SOUZA", "SO PEDRO ALVES"),
                store.formattedNames());
    }

    @Test
    void nameSuggestions() {
        assertEquals(List.of("ALVES", "JOAO DA SILVA"), store.nameSuggestions("a", 2));
        assertEquals(6, store.nameSuggestions("a").size());
        assertTrue(store.nameSuggestions("  ").isEmpty());
    }

    @Test
    void listAll() {
        List<PersonRecord> all = store.listAll(false, "auditor");

        assertEquals(4, all.size());
        assertEquals("rows=4 decrypted=false", auditSink.entries(Operation.LISTING).get(0).getDetail());
    }

    @Test
    @DisplayName("encryptSource leaves only ciphertext in sensitive columns and is idempotent")
    void encryptSource() throws Exception {
        assertEquals(14, store.encryptSource("admin"));

        String raw = Files.readString(source);
        assertFalse(raw.contains("529.982.247-25"));
        assertFalse(raw.contains("1234567"));
        assertFalse(raw.contains("joao.silva@example.com"));

        PersonTable table = new CsvPersonTableAccess(source).read();
        for (List<String> row : table.rows()) {
            String saram = row.get(1);
            assertTrue(cipher.looksEncrypted(saram), "registration number should be ciphertext");
        }

        assertEquals(0, store.encryptSource("admin"));

        PersonRecord joao = store.lookupExact("JOAO DA SILVA").orElseThrow();
        assertEquals("529.982.247-25", joao.getNationalId());
        assertEquals("1234567", joao.getRegistrationNumber());

        PersonRecord stored = store.load(true, false).get(0);
        assertTrue(stored.getNationalId().startsWith(CredentialCipher.TOKEN_PREFIX));
    }

    @Test
    @DisplayName("records still load when the key file becomes unusable")
    void unusableKeyKeepsTokens() throws Exception {
        store.encryptSource("admin");
        Path keyPath = dir.resolve(".field.key");
        Files.write(keyPath, Arrays.copyOf(Files.readAllBytes(keyPath), 16));
        PersonRecordStore reloaded = new PersonRecordStore(tableAccess, new CredentialCipher(keyPath),
                new AuditLogService(auditSink, CLOCK), CLOCK, new StoreProperties());

        List<PersonRecord> all = reloaded.load();

        assertEquals(4, all.size());
        assertTrue(all.get(0).getNationalId().startsWith(CredentialCipher.TOKEN_PREFIX));
        assertEquals("JOAO DA SILVA", all.get(0).getFullName());
    }

    @Test
    @DisplayName("encryptSource keeps the stored value byte for byte")
    void encryptSourcePreservesValues() throws Exception {
        Files.writeString(source, "NOME COMPLETO,EMAIL,TELEFONE\n"
                + "ANA O'NEIL,ana.o'neil+50%&co@example.com,<>\n");

        assertEquals(2, store.encryptSource("admin"));

        List<String> row = new CsvPersonTableAccess(source).read().rows().get(0);
        assertEquals("ana.o'neil+50%&co@example.com", cipher.decrypt(row.get(1)));
        assertEquals("<>", cipher.decrypt(row.get(2)));
    }

    @Test
    @DisplayName("the bare \"--\" qualification code survives loading")
    void copChiefQualification() throws Exception {
        Files.writeString(source, "NOME COMPLETO,HAB 1\nANA LIMA,--\nBETO LIMA,S--\n");

        List<PersonRecord> all = store.load();

        assertEquals("-- - Chefe do COP", all.get(0).qualificationDescription());
        assertEquals("S - Supervisor", all.get(1).qualificationDescription());
    }

    @Test
    @DisplayName("audit lines never carry a raw identifier or name")
    void auditCarriesHashesOnly() {
        store.searchByName("silva");
        store.lookupExact("JOAO DA SILVA");
        store.getFicProjection("JOAO DA SILVA");
        store.validatePerson("JOAO DA SILVA");
        store.encryptSource("admin");

        List<String> lines = auditSink.lines();
        assertFalse(lines.isEmpty());
        for (String line : lines) {
            assertFalse(line.contains("52998224725"), line);
            assertFalse(line.contains("529.982.247-25"), line);
            assertFalse(line.contains("1234567"), line);
            assertFalse(line.toUpperCase().contains("SILVA"), line);
        }
    }

    @Test
    void missingSource() throws Exception {
        Files.delete(source);

        PersonRegistryException ex = assertThrows(PersonRegistryException.class, () -> store.load());
        assertEquals(PersonRegistryException.Code.SOURCE_NOT_FOUND, ex.getCode());
    }

    @Test
    @DisplayName("a table without a name column is unreadable")
    void noNameColumn() throws Exception {
        Files.writeString(source, "CPF,TELEFONE\n52998224725,61999991234\n");

        PersonRegistryException ex = assertThrows(PersonRegistryException.class, () -> store.load());
        assertEquals(PersonRegistryException.Code.SOURCE_UNREADABLE, ex.getCode());
    }
}
