package com.example.ficregistry.service;

import lombok.Getter;

/**
 * Failure surfaced by the registry core. The message is short and safe to show to end
 * users; {@link #getAdminDetail()} adds context for administrators and never carries a raw
 * sensitive value.
 */
public class PersonRegistryException extends RuntimeException {

    public enum Code {
        INVALID_INPUT,
        AMBIGUOUS_MATCH,
        SECURITY_VIOLATION,
        SOURCE_NOT_FOUND,
        SOURCE_UNREADABLE,
        FETCH_FAILED
    }

    @Getter
    private final Code code;

    @Getter
    private final String adminDetail;

    private PersonRegistryException(Code code, String message, String adminDetail, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.adminDetail = adminDetail;
    }

    public static PersonRegistryException invalidInput(String message) {
        return new PersonRegistryException(Code.INVALID_INPUT, message, message, null);
    }

    public static PersonRegistryException ambiguousMatch(String nameHash, int matches) {
        return new PersonRegistryException(Code.AMBIGUOUS_MATCH,
                "More than one person matches the given name",
                "name hash " + nameHash + " matched " + matches + " records", null);
    }

    public static PersonRegistryException securityViolation(String message) {
        return new PersonRegistryException(Code.SECURITY_VIOLATION, message, message, null);
    }

    public static PersonRegistryException securityViolation(String message, String adminDetail) {
        return new PersonRegistryException(Code.SECURITY_VIOLATION, message, adminDetail, null);
    }

    public static PersonRegistryException sourceNotFound(String location) {
        return new PersonRegistryException(Code.SOURCE_NOT_FOUND,
                "Person data source is not available",
                "source " + location + " does not exist", null);
    }

    public static PersonRegistryException sourceUnreadable(String location, Throwable cause) {
        return new PersonRegistryException(Code.SOURCE_UNREADABLE,
                "Person data source could not be read",
                "source " + location + " failed to parse: " + cause.getClass().getSimpleName(), cause);
    }

    public static PersonRegistryException fetchFailed(int attempts, Throwable cause) {
        return new PersonRegistryException(Code.FETCH_FAILED,
                "Remote directory is unavailable",
                "remote fetch failed after " + attempts + " attempt(s): "
                        + (cause == null ? "unknown" : cause.getClass().getSimpleName()),
                cause);
    }
}
