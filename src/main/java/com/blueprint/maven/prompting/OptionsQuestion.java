package com.blueprint.maven.prompting;

import java.util.List;

/**
 * Single choice question. The user types the one-based number of an option,
 * the answer is its zero-based index.
 */
public final class OptionsQuestion extends Question<Integer> implements WithValidation<Integer> {

    private final List<String> options;

    public OptionsQuestion(String name, String caption, List<String> options) {
        super(name, caption, Integer.class, inRange(options == null ? 0 : options.size()));
        if (options == null || options.isEmpty()) {
            throw new IllegalStateException("Options question " + name + " has no options");
        }
        this.options = List.copyOf(options);
    }

    private static Validator<Integer> inRange(int size) {
        return index -> index >= 0 && index < size
                ? ValidationResult.ok()
                : ValidationResult.fail(rangeHint(size));
    }

    private static String rangeHint(int size) {
        return "Input 1-" + size;
    }

    public List<String> getOptions() {
        return options;
    }

    /**
     * Returns the label of the option at the given zero-based index.
     */
    public String getOption(int index) {
        return options.get(index);
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.OPTIONS;
    }

    @Override
    public void validate(Validator<Integer> validator) {
        replaceValidator(validator);
    }

    @Override
    public Integer read(String raw) throws ReadException {
        try {
            return Integer.parseInt(raw.trim()) - 1;
        } catch (NumberFormatException e) {
            throw new ReadException(rangeHint(options.size()), e);
        }
    }

    @Override
    public String print(Integer value) {
        return String.valueOf(value + 1);
    }

    @Override
    public String printPrompts(Answers answers) {
        StringBuilder sb = new StringBuilder(super.printPrompts(answers));
        for (int i = 0; i < options.size(); i++) {
            sb.append("\n").append(i + 1).append(". ").append(options.get(i));
        }
        return sb.toString();
    }
}
