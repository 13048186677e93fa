package com.example.ficregistry.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Service-account credential bundle kept in the managed secret store. {@code client_id}
 * and {@code private_key} authenticate the read-only directory session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceAccountCredentials(
        @JsonProperty("type") String type,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("private_key") String privateKey,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_email") String clientEmail
) {

    public static final String SERVICE_ACCOUNT_TYPE = "service_account";

    public boolean isServiceAccount() {
        return SERVICE_ACCOUNT_TYPE.equals(type);
    }

    @Override
    public String toString() {
        return "ServiceAccountCredentials(type=" + type + ", projectId=" + projectId
                + ", privateKey=****, clientId=****)";
    }
}
