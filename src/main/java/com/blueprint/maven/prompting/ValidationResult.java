package com.blueprint.maven.prompting;

/**
 * Outcome of a {@link Validator}: accepted, or rejected with a message shown to the user.
 */
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(null);

    private final String message;

    private ValidationResult(String message) {
        this.message = message;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String message) {
        return new ValidationResult(message == null ? "Invalid value" : message);
    }

    public boolean isValid() {
        return message == null;
    }

    public String getMessage() {
        return message;
    }
}
