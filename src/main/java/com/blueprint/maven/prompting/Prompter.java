package com.blueprint.maven.prompting;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Asks the questions of a {@link QuestionsList} in order.
 * <p>
 * In interactive mode a rejected answer is reported and the same question is asked
 * again. In batch mode the first rejected answer ends the session with a
 * {@link PromptingException}.
 */
public class Prompter {

    private final InputSource input;
    private final PrintStream out;
    private final boolean interactive;

    public Prompter(InputSource input, PrintStream out, boolean interactive) {
        this.input = input;
        this.out = out;
        this.interactive = interactive;
    }

    public Answers ask(QuestionsList questions) throws IOException {
        return ask(questions, Answers.empty());
    }

    /**
     * Asks every question and commits the answers into {@code answers}.
     *
     * @param answers answers collected so far; calculated defaults can read them
     * @return {@code answers}
     */
    public Answers ask(QuestionsList questions, Answers answers) throws IOException {
        for (Question<?> question : questions) {
            ask(question, answers);
        }
        return answers;
    }

    private <T> void ask(Question<T> question, Answers answers) throws IOException {
        while (true) {
            out.println(question.printPrompts(answers));
            String raw = input.readLine(question);
            if (raw == null) {
                throw new PromptingException("No input for question " + question.getName());
            }

            AnswerResult<T> result = question.answer(raw, answers);
            if (result.isCommitted()) {
                answers.put(question.getName(), result.getValue());
                return;
            }
            if (!interactive) {
                throw new PromptingException(
                        "Invalid answer for question " + question.getName() + ": " + result.getMessage());
            }
            out.println(result.getMessage());
        }
    }
}
