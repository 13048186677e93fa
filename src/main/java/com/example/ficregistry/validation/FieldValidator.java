package com.example.ficregistry.validation;

import com.example.ficregistry.models.PersonColumn;
import com.example.ficregistry.models.ValidationResult;
import java.util.regex.Pattern;

/**
 * Sanitization and identifier validation. Validators report a {@link ValidationResult}
 * instead of throwing so callers can aggregate many failures into one report.
 */
public final class FieldValidator {

    private static final Pattern FORBIDDEN = Pattern.compile("[<>\"';`|&%]|--|/\\*|\\*/");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern EMAIL =
            Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    static final int NATIONAL_ID_LENGTH = 11;
    static final int REGISTRATION_MIN_DIGITS = 4;
    static final int REGISTRATION_MAX_DIGITS = 8;
    static final int EMAIL_MAX_LENGTH = 254;
    static final int PHONE_MIN_DIGITS = 10;
    static final int PHONE_MAX_DIGITS = 13;

    private FieldValidator() {
    }

    /**
     * Removes characters and sequences used in injection payloads, collapses whitespace
     * and trims. Removal repeats until stable so "-;-" cannot turn into "--".
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        String previous;
        do {
            previous = current;
            current = FORBIDDEN.matcher(current).replaceAll("");
        } while (!current.equals(previous));
        return WHITESPACE.matcher(current).replaceAll(" ").trim();
    }

    public static String digitsOnly(String value) {
        return value == null ? "" : NON_DIGIT.matcher(value).replaceAll("");
    }

    public static ValidationResult validateNationalId(String value) {
        String field = PersonColumn.NATIONAL_ID.key();
        if (value == null || value.isBlank()) {
            return ValidationResult.absent(field);
        }
        String digits = digitsOnly(value);
        if (digits.length() != NATIONAL_ID_LENGTH) {
            return ValidationResult.invalid(field, "length check failed: national ID must have "
                    + NATIONAL_ID_LENGTH + " digits (got " + digits.length() + ")");
        }
        if (digits.chars().distinct().count() == 1) {
            return ValidationResult.invalid(field,
                    "repeated-digit check failed: national ID cannot repeat a single digit");
        }
        int first = checkDigit(digits, 9);
        int second = checkDigit(digits, 10);
        if (digits.charAt(9) - '0' != first || digits.charAt(10) - '0' != second) {
            return ValidationResult.invalid(field,
                    "check-digit check failed: national ID check digits do not match");
        }
        return ValidationResult.valid(field, "national ID valid");
    }

    /**
     * Weighted-sum-mod-11 over the first {@code length} digits, weights running from
     * {@code length + 1} down to 2.
     */
    static int checkDigit(String digits, int length) {
        int sum = 0;
        for (int i = 0; i < length; i++) {
            sum += (digits.charAt(i) - '0') * (length + 1 - i);
        }
        int remainder = sum % 11;
        return remainder < 2 ? 0 : 11 - remainder;
    }

    public static ValidationResult validateRegistrationNumber(String value) {
        String field = PersonColumn.REGISTRATION_NUMBER.key();
        if (value == null || value.isBlank()) {
            return ValidationResult.absent(field);
        }
        String digits = digitsOnly(value);
        if (digits.length() < REGISTRATION_MIN_DIGITS || digits.length() > REGISTRATION_MAX_DIGITS) {
            return ValidationResult.invalid(field, "length check failed: registration number must have "
                    + REGISTRATION_MIN_DIGITS + " to " + REGISTRATION_MAX_DIGITS
                    + " digits (got " + digits.length() + ")");
        }
        return ValidationResult.valid(field, "registration number valid");
    }

    public static boolean isValidEmail(String value) {
        if (value == null) {
            return false;
        }
        String email = value.trim();
        if (email.isEmpty() || email.length() > EMAIL_MAX_LENGTH) {
            return false;
        }
        if (email.contains("..") || email.contains("@.") || email.contains(".@")
                || email.startsWith(".") || email.endsWith(".")) {
            return false;
        }
        return EMAIL.matcher(email).matches();
    }

    public static ValidationResult validateEmail(PersonColumn column, String value) {
        String field = column.key();
        if (value == null || value.isBlank()) {
            return ValidationResult.absent(field);
        }
        if (!isValidEmail(value)) {
            return ValidationResult.invalid(field, "format check failed: " + field
                    + " is not a valid address");
        }
        return ValidationResult.valid(field, field + " valid");
    }

    public static ValidationResult validatePhone(String value) {
        String field = PersonColumn.PHONE.key();
        if (value == null || value.isBlank()) {
            return ValidationResult.absent(field);
        }
        int length = digitsOnly(value).length();
        if (length < PHONE_MIN_DIGITS || length > PHONE_MAX_DIGITS) {
            return ValidationResult.invalid(field, "length check failed: phone must have "
                    + PHONE_MIN_DIGITS + " to " + PHONE_MAX_DIGITS + " digits (got " + length + ")");
        }
        return ValidationResult.valid(field, "phone valid");
    }
}
