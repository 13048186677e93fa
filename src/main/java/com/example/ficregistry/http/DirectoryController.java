package com.example.ficregistry.http;

import com.example.ficregistry.service.RemoteDirectoryClient;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@ConditionalOnProperty(prefix = "registry.directory", name = "enabled", havingValue = "true")
public class DirectoryController {

    private final RemoteDirectoryClient client;

    public DirectoryController(RemoteDirectoryClient client) {
        this.client = client;
    }

    @GetMapping("/directory/persons/{identifier}")
    public ResponseEntity<Map<String, String>> fetch(
            @PathVariable String identifier,
            @RequestHeader(value = RequestIdFilter.ACTOR_HEADER, required = false) String actor
    ) {
        return client.fetchByIdentifier(identifier, Actors.resolve(actor))
                .map(PersonController::maskAndClose)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
