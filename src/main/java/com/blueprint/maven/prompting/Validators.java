package com.blueprint.maven.prompting;

import java.util.regex.Pattern;

/**
 * Common string validators.
 */
public final class Validators {

    private static final Pattern PACKAGE_PATTERN =
            Pattern.compile("[a-zA-Z][0-9a-zA-Z]*(\\.[a-zA-Z][0-9a-zA-Z]*)*");

    private static final Pattern CLASS_PATTERN = Pattern.compile("\\b[A-Z]+[\\w\\d]*");

    /**
     * Accepts strings matching {@code pattern} as a whole.
     */
    public static Validator<String> regex(String pattern, String failMessage) {
        return regex(Pattern.compile(pattern), failMessage);
    }

    public static Validator<String> regex(Pattern pattern, String failMessage) {
        return value -> pattern.matcher(value).matches()
                ? ValidationResult.ok()
                : ValidationResult.fail(failMessage);
    }

    /**
     * Accepts dotted package names such as {@code com.company.app}.
     */
    public static Validator<String> isPackage() {
        return isPackage("Is not valid package name");
    }

    public static Validator<String> isPackage(String failMessage) {
        return regex(PACKAGE_PATTERN, failMessage);
    }

    /**
     * Accepts capitalized class names such as {@code OrderLine}.
     */
    public static Validator<String> isClass() {
        return isClass("Invalid class name");
    }

    public static Validator<String> isClass(String failMessage) {
        return regex(CLASS_PATTERN, failMessage);
    }

    public static Validator<String> notBlank(String failMessage) {
        return value -> value.isBlank() ? ValidationResult.fail(failMessage) : ValidationResult.ok();
    }

    private Validators() {
    }
}
