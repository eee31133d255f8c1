package com.blueprint.maven.prompting;

import java.util.Locale;

/**
 * Yes or no question, answered with a single {@code y} or {@code n} in any case.
 */
public final class ConfirmationQuestion extends Question<Boolean> {

    public ConfirmationQuestion(String name, String caption) {
        super(name, caption, Boolean.class, Validator.acceptAll());
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.CONFIRMATION;
    }

    @Override
    public Boolean read(String raw) throws ReadException {
        String normalized = raw.toLowerCase(Locale.ROOT).trim();
        if (normalized.length() != 1) {
            throw new ReadException();
        }
        switch (normalized.charAt(0)) {
            case 'y':
                return true;
            case 'n':
                return false;
            default:
                throw new ReadException();
        }
    }

    @Override
    public String print(Boolean value) {
        return value ? "y" : "n";
    }

    /**
     * The upper-case letter marks the default answer.
     */
    @Override
    public String printDefaultValue(Answers answers) {
        return getDefaultValue().resolve(answers)
                .map(value -> value ? "(Y/n) " : "(y/N) ")
                .orElse("(y/n) ");
    }
}
