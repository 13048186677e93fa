package com.example.ficregistry.http;

import com.example.ficregistry.crypto.Masking;
import com.example.ficregistry.models.FicProjection;
import com.example.ficregistry.models.PersonRecord;
import com.example.ficregistry.models.ValidationReport;
import com.example.ficregistry.service.PersonRecordStore;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for the local person table. Responses carry masked views only; the
 * records are closed before the response is written.
 */
@RestController
public class PersonController {

    private final PersonRecordStore store;

    public PersonController(PersonRecordStore store) {
        this.store = store;
    }

    @GetMapping("/persons")
    public ResponseEntity<List<Map<String, String>>> search(
            @RequestParam("name") String name,
            @RequestParam(value = "caseSensitive", defaultValue = "false") boolean caseSensitive,
            @RequestHeader(value = RequestIdFilter.ACTOR_HEADER, required = false) String actor
    ) {
        List<PersonRecord> found = store.searchByName(name, caseSensitive, Actors.resolve(actor));
        return ResponseEntity.ok(found.stream().map(PersonController::maskAndClose).toList());
    }

    @GetMapping("/persons/exact")
    public ResponseEntity<Map<String, String>> exact(
            @RequestParam("name") String name,
            @RequestHeader(value = RequestIdFilter.ACTOR_HEADER, required = false) String actor
    ) {
        Optional<PersonRecord> person = store.lookupExact(name, Actors.resolve(actor));
        return person.map(PersonController::maskAndClose)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/persons/fic")
    public ResponseEntity<FicResponse> fic(
            @RequestParam("name") String name,
            @RequestHeader(value = RequestIdFilter.ACTOR_HEADER, required = false) String actor
    ) {
        Optional<FicProjection> projection = store.getFicProjection(name, Actors.resolve(actor));
        if (projection.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        try (FicProjection fic = projection.get()) {
            return ResponseEntity.ok(new FicResponse(
                    Masking.maskedView(fic.person()),
                    fic.validation(),
                    fic.generatedAt().toString()));
        }
    }

    @GetMapping("/persons/validation")
    public ResponseEntity<ValidationReport> validation(
            @RequestParam("name") String name,
            @RequestHeader(value = RequestIdFilter.ACTOR_HEADER, required = false) String actor
    ) {
        return store.validatePerson(name, Actors.resolve(actor))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/persons/names")
    public ResponseEntity<List<String>> names() {
        return ResponseEntity.ok(store.formattedNames());
    }

    @GetMapping("/persons/suggestions")
    public ResponseEntity<List<String>> suggestions(
            @RequestParam("term") String term,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(limit == null
                ? store.nameSuggestions(term)
                : store.nameSuggestions(term, limit));
    }

    @PostMapping("/persons/cache/clear")
    public ResponseEntity<Void> clearCache() {
        store.clearCache();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/persons/source/encrypt")
    public ResponseEntity<EncryptSourceResponse> encryptSource(
            @RequestHeader(value = RequestIdFilter.ACTOR_HEADER, required = false) String actor
    ) {
        return ResponseEntity.ok(new EncryptSourceResponse(store.encryptSource(Actors.resolve(actor))));
    }

    static Map<String, String> maskAndClose(PersonRecord person) {
        try (person) {
            return Masking.maskedView(person);
        }
    }
}
