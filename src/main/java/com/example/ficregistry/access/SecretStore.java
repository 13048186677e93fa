package com.example.ficregistry.access;

import java.util.Optional;

/**
 * Read access to the managed secret store. The only place the directory client may take
 * its target identifier and credentials from.
 */
public interface SecretStore {

    Optional<String> getSecret(String secretId);

    /** Name of the backing store, for logs and health output. */
    String describe();
}
