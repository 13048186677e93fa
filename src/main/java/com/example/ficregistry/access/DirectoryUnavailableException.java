package com.example.ficregistry.access;

/**
 * Transient failure talking to the remote directory. Messages never include credentials.
 */
public class DirectoryUnavailableException extends RuntimeException {

    public DirectoryUnavailableException(String message) {
        super(message);
    }

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
