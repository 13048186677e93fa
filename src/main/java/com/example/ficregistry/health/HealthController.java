package com.example.ficregistry.health;

import com.example.ficregistry.models.SecurityStatus;
import com.example.ficregistry.service.RemoteDirectoryClient;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final ObjectProvider<BuildProperties> buildProperties;
    private final ObjectProvider<RemoteDirectoryClient> directoryClient;
    private final Clock clock;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            ObjectProvider<RemoteDirectoryClient> directoryClient,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties;
        this.directoryClient = directoryClient;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        BuildProperties build = buildProperties.getIfAvailable();
        RemoteDirectoryClient client = directoryClient.getIfAvailable();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("ts", clock.instant().toString());
        body.put("env", env);
        body.put("app", build != null ? build.getName() : "fic-registry");
        body.put("version", build != null ? build.getVersion() : "dev");
        body.put("directory_enabled", client != null);
        if (client != null) {
            SecurityStatus security = client.securityStatus();
            body.put("security", security);
        }
        return ResponseEntity.ok(body);
    }
}
