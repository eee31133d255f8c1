package com.blueprint.maven.prompting;

/**
 * Acceptance check applied to a value after it has been read successfully.
 */
@FunctionalInterface
public interface Validator<T> {

    ValidationResult validate(T value);

    /**
     * Returns a validator that applies this validator first and {@code other} only if this one passes.
     */
    default Validator<T> and(Validator<? super T> other) {
        return value -> {
            ValidationResult result = validate(value);
            return result.isValid() ? other.validate(value) : result;
        };
    }

    static <T> Validator<T> acceptAll() {
        return value -> ValidationResult.ok();
    }
}
