package com.blueprint.maven.prompting;

import java.util.Optional;

/**
 * A typed question: reads raw input into a value of type {@code T}, validates it,
 * and renders its prompt together with its default value.
 * <p>
 * The set of variants is closed, see {@link QuestionKind}.
 */
public abstract class Question<T> implements Read<T>, Print<T>, HasDefault<T> {

    private final String name;
    private final String caption;
    private final Class<T> valueType;

    private DefaultValue<T> defaultValue = DefaultValue.none();
    private Validator<T> validator;
    private boolean validatorReplaced;

    Question(String name, String caption, Class<T> valueType, Validator<T> validator) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Question name is required");
        }
        this.name = name;
        this.caption = caption == null ? "" : caption;
        this.valueType = valueType;
        this.validator = validator;
    }

    public String getName() {
        return name;
    }

    public String getCaption() {
        return caption;
    }

    public abstract QuestionKind getKind();

    @Override
    public DefaultValue<T> getDefaultValue() {
        return defaultValue;
    }

    @Override
    public void setDefaultValue(DefaultValue<T> defaultValue) {
        this.defaultValue = defaultValue == null ? DefaultValue.none() : defaultValue;
    }

    /**
     * Installs a validator in place of the built-in one. Allowed once per question.
     */
    protected void replaceValidator(Validator<T> validator) {
        if (validatorReplaced) {
            throw new IllegalStateException("Validation for question " + name + " is already set");
        }
        if (validator == null) {
            throw new IllegalArgumentException("Validator must not be null");
        }
        this.validator = validator;
        this.validatorReplaced = true;
    }

    /**
     * Answers this question with raw user input.
     * <p>
     * Empty input is replaced by the printed default when there is one. The input is
     * read first and validated only if reading succeeds. {@code answers} is never modified.
     *
     * @param rawText text typed by the user, may be null or empty; whitespace is input like any other
     * @param answers answers to the questions asked before this one
     * @return the committed value, or the message explaining why the input was rejected
     */
    public AnswerResult<T> answer(String rawText, Answers answers) {
        String text = rawText == null ? "" : rawText;
        if (text.isEmpty()) {
            Optional<T> resolved = defaultValue.resolve(answers);
            if (resolved.isPresent()) {
                text = print(resolved.get());
            }
        }

        T value;
        try {
            value = read(text);
        } catch (ReadException e) {
            return AnswerResult.rejected(e.getMessage());
        }

        ValidationResult result = validator.validate(value);
        if (!result.isValid()) {
            return AnswerResult.rejected(result.getMessage());
        }
        return AnswerResult.committed(value);
    }

    /**
     * Prints a committed answer of this question.
     */
    public String printAnswer(Object value) {
        return print(valueType.cast(value));
    }

    public String printPrompts(Answers answers) {
        return "> " + caption + " " + printDefaultValue(answers);
    }

    /**
     * Renders the default value hint, or an empty string when there is no default.
     */
    public String printDefaultValue(Answers answers) {
        return defaultValue.resolve(answers)
                .map(this::print)
                .filter(printed -> !printed.isEmpty())
                .map(printed -> "(" + printed + ") ")
                .orElse("");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
