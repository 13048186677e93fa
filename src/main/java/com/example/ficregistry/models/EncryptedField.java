package com.example.ficregistry.models;

/**
 * A sensitive attribute as stored in the backing table. Stored values may be ciphertext
 * tokens or legacy plaintext; {@link #ciphertext()} tells which one the cipher recognized.
 */
public record EncryptedField(PersonColumn column, String storedValue, boolean ciphertext) {

    public EncryptedField {
        if (column == null || !column.isSensitive()) {
            throw new IllegalArgumentException("column must be a sensitive column");
        }
        storedValue = storedValue == null ? "" : storedValue;
    }

    public boolean isEmpty() {
        return storedValue.isEmpty();
    }

    @Override
    public String toString() {
        return "EncryptedField(" + column.key() + ", ciphertext=" + ciphertext + ")";
    }
}
