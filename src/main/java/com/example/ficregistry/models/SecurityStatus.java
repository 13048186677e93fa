package com.example.ficregistry.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Security posture of the remote directory client. Booleans and counts only; no secret
 * value or identifier ever appears here.
 */
public record SecurityStatus(
        @JsonProperty("credentials_configured") boolean credentialsConfigured,
        @JsonProperty("target_configured") boolean targetConfigured,
        @JsonProperty("secret_store_required") boolean secretStoreRequired,
        @JsonProperty("encryption_available") boolean encryptionAvailable,
        @JsonProperty("protected_field_count") int protectedFieldCount,
        @JsonProperty("connected") boolean connected,
        @JsonProperty("level") Level level
) {

    public enum Level {
        HIGH,
        MEDIUM
    }
}
