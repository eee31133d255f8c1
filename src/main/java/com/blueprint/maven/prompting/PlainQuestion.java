package com.blueprint.maven.prompting;

/**
 * Free text question. The answer is the text as typed.
 */
public final class PlainQuestion extends Question<String> implements WithValidation<String> {

    public PlainQuestion(String name, String caption) {
        super(name, caption, String.class, Validator.acceptAll());
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.PLAIN;
    }

    @Override
    public void validate(Validator<String> validator) {
        replaceValidator(validator);
    }

    @Override
    public String read(String raw) {
        return raw;
    }

    @Override
    public String print(String value) {
        return value;
    }
}
