package com.blueprint.maven.prompting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConfirmationQuestionTest {

    private final ConfirmationQuestion question = new ConfirmationQuestion("tests", "Generate tests?");

    @Test
    void read_yesAndNoInAnyCase() throws Exception {
        assertThat(question.read("y")).isTrue();
        assertThat(question.read("Y")).isTrue();
        assertThat(question.read("N")).isFalse();
        assertThat(question.read(" n ")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "no", "x", "", "yn"})
    void read_anythingElseFails(String raw) {
        assertThrows(ReadException.class, () -> question.read(raw));
        assertThat(question.answer(raw, Answers.empty()).isCommitted()).isFalse();
    }

    @Test
    void print() {
        assertThat(question.print(true)).isEqualTo("y");
        assertThat(question.print(false)).isEqualTo("n");
    }

    @Test
    void answer_emptyInputUsesDefault() {
        question.setDefault(false);

        AnswerResult<Boolean> result = question.answer("", Answers.empty());

        assertThat(result.isCommitted()).isTrue();
        assertThat(result.getValue()).isFalse();
    }

    @Test
    void printPrompts_withoutDefault() {
        assertThat(question.printPrompts(Answers.empty())).isEqualTo("> Generate tests? (y/n) ");
    }

    @Test
    void printPrompts_upperCaseMarksDefault() {
        question.setDefault(true);
        assertThat(question.printPrompts(Answers.empty())).isEqualTo("> Generate tests? (Y/n) ");

        question.setDefault(false);
        assertThat(question.printPrompts(Answers.empty())).isEqualTo("> Generate tests? (y/N) ");
    }

    @Test
    void printPrompts_calculatedDefaultFollowsAnswers() {
        question.calculateDefault(answers -> answers.getInt("database") == 0);

        assertThat(question.printDefaultValue(Answers.of(Map.of("database", 0)))).isEqualTo("(Y/n) ");
        assertThat(question.printDefaultValue(Answers.of(Map.of("database", 2)))).isEqualTo("(y/N) ");
    }

    @Test
    void getKind() {
        assertThat(question.getKind()).isEqualTo(QuestionKind.CONFIRMATION);
        assertThat(question).isNotInstanceOf(WithValidation.class);
    }
}
