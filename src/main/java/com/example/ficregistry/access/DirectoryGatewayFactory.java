package com.example.ficregistry.access;

import com.example.ficregistry.models.ServiceAccountCredentials;

public interface DirectoryGatewayFactory {

    /**
     * Opens a read-only session for the given target. Must not perform writes.
     */
    DirectoryGateway open(ServiceAccountCredentials credentials, String target);
}
