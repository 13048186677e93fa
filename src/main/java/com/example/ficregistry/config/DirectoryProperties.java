package com.example.ficregistry.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Remote directory settings, bound from application.yml (registry.directory.*).
 * The directory is off unless registry.directory.enabled=true.
 *
 * <p>{@code credentialsFile} exists only so a misconfiguration can be detected: the client
 * refuses to start when it is set. Credentials and target are read from the managed secret
 * store through {@code credentialsSecretId} and {@code targetSecretId}.
 */
@Component
@ConfigurationProperties(prefix = "registry.directory")
@Data
@Validated
public class DirectoryProperties {

    private boolean enabled = false;
    private String credentialsSecretId = "fic-registry/directory/credentials";
    private String targetSecretId = "fic-registry/directory/target";
    private String credentialsFile;
    @NotBlank
    private String identifierAttribute = "SARAM";

    @NotBlank
    private String region = "us-east-1";
    private String endpoint;

    private Duration minDelay = Duration.ofSeconds(1);
    @Min(1)
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(4);
    private Duration callTimeout = Duration.ofSeconds(10);
}
