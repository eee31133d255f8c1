package com.blueprint.maven.prompting;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Ordered list of questions, asked in the order they were added.
 * <p>
 * Built with {@link #builder()}; the list is never empty and question names are unique.
 * <pre>
 * QuestionsList questions = QuestionsList.builder()
 *         .question("projectName", "Project name", q -&gt; q.validate(Validators.notBlank("Required")))
 *         .question("rootPackage", "Root package", q -&gt; {
 *             q.calculateDefault(answers -&gt; "com.company." + answers.getString("projectName"));
 *             q.validate(Validators.isPackage());
 *         })
 *         .confirmation("tests", "Generate tests?", q -&gt; q.setDefault(true))
 *         .build();
 * </pre>
 * A calculated default may only read answers of questions added before it.
 */
public final class QuestionsList implements Iterable<Question<?>> {

    private final List<Question<?>> questions;

    private QuestionsList(List<Question<?>> questions) {
        this.questions = List.copyOf(questions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Question<?>> getQuestions() {
        return questions;
    }

    public int size() {
        return questions.size();
    }

    public Optional<Question<?>> find(String name) {
        return questions.stream()
                .filter(q -> q.getName().equals(name))
                .findFirst();
    }

    @Override
    public Iterator<Question<?>> iterator() {
        return questions.iterator();
    }

    /**
     * Collects questions in call order. Each method takes an optional configuration
     * applied to the new question before it is appended.
     */
    public static final class Builder {

        private final List<Question<?>> questions = new ArrayList<>();

        private Builder() {
        }

        public Builder question(String name, String caption) {
            return question(name, caption, null);
        }

        public Builder question(String name, String caption, Consumer<PlainQuestion> configuration) {
            return add(new PlainQuestion(name, caption), configuration);
        }

        public Builder options(String name, String caption, List<String> options) {
            return options(name, caption, options, null);
        }

        public Builder options(String name, String caption, List<String> options,
                Consumer<OptionsQuestion> configuration) {
            return add(new OptionsQuestion(name, caption, options), configuration);
        }

        public Builder confirmation(String name, String caption) {
            return confirmation(name, caption, null);
        }

        public Builder confirmation(String name, String caption, Consumer<ConfirmationQuestion> configuration) {
            return add(new ConfirmationQuestion(name, caption), configuration);
        }

        private <Q extends Question<?>> Builder add(Q question, Consumer<Q> configuration) {
            if (configuration != null) {
                configuration.accept(question);
            }
            questions.add(question);
            return this;
        }

        /**
         * Freezes the list.
         *
         * @throws IllegalStateException if no question was added, or two questions share a name; the first name
         *         in question order that is used twice is reported
         */
        public QuestionsList build() {
            if (questions.isEmpty()) {
                throw new IllegalStateException("Questions list is empty");
            }
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (Question<?> question : questions) {
                counts.merge(question.getName(), 1, Integer::sum);
            }
            counts.entrySet().stream()
                    .filter(entry -> entry.getValue() > 1)
                    .findFirst()
                    .ifPresent(entry -> {
                        throw new IllegalStateException("Duplicated questions with name " + entry.getKey());
                    });
            return new QuestionsList(questions);
        }
    }
}
