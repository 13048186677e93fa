package com.example.ficregistry.access;

import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

@Slf4j
public class AwsSecretsManagerSecretStore implements SecretStore {

    private final SecretsManagerClient client;

    public AwsSecretsManagerSecretStore(SecretsManagerClient client) {
        this.client = client;
    }

    @Override
    public Optional<String> getSecret(String secretId) {
        if (secretId == null || secretId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(client.getSecretValue(r -> r.secretId(secretId)).secretString());
        } catch (ResourceNotFoundException ex) {
            log.warn("Secret {} is not present in the managed secret store", secretId);
            return Optional.empty();
        }
    }

    @Override
    public String describe() {
        return "aws-secrets-manager";
    }
}
