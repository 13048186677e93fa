package com.example.ficregistry.access;

import java.util.List;
import java.util.Map;

/**
 * Read-only session against the remote person directory. Rows are keyed by the directory's
 * own attribute names; mapping to canonical columns happens in the client.
 */
public interface DirectoryGateway extends AutoCloseable {

    /**
     * Confirms the session can reach the target resource.
     *
     * @throws DirectoryUnavailableException when it cannot
     */
    void verify();

    /**
     * Rows whose identifier attribute equals {@code identifier}, in the order the
     * directory returned them.
     *
     * @throws DirectoryUnavailableException on transport or service failure
     */
    List<Map<String, String>> findByIdentifier(String identifier);

    @Override
    void close();
}
