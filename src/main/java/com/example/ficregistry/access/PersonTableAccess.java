package com.example.ficregistry.access;

/**
 * Storage abstraction for the local person table.
 */
public interface PersonTableAccess {

    /**
     * Reads the whole table.
     *
     * @throws com.example.ficregistry.service.PersonRegistryException with
     *         {@code SOURCE_NOT_FOUND} or {@code SOURCE_UNREADABLE}
     */
    PersonTable read();

    /**
     * Replaces the table contents. Implementations must not leave a half-written table.
     */
    void write(PersonTable table);

    /** Human-readable location used in admin details. */
    String location();
}
