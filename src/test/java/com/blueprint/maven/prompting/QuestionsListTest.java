package com.blueprint.maven.prompting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class QuestionsListTest {

    @Test
    void build_keepsInsertionOrder() {
        QuestionsList questions = QuestionsList.builder()
                .question("projectName", "Project name")
                .options("database", "Database", List.of("HSQLDB", "PostgreSQL"))
                .confirmation("tests", "Generate tests?")
                .build();

        List<String> names = new ArrayList<>();
        questions.forEach(q -> names.add(q.getName()));

        assertThat(names).containsExactly("projectName", "database", "tests");
        assertThat(questions.size()).isEqualTo(3);
        assertThat(questions.getQuestions()).extracting(Question::getKind)
                .containsExactly(QuestionKind.PLAIN, QuestionKind.OPTIONS, QuestionKind.CONFIRMATION);
    }

    @Test
    void build_appliesConfiguration() {
        QuestionsList questions = QuestionsList.builder()
                .question("rootPackage", "Root package", q -> {
                    q.setDefault("com.company");
                    q.validate(Validators.isPackage());
                })
                .options("database", "Database", List.of("HSQLDB", "PostgreSQL"), q -> q.setDefault(1))
                .confirmation("tests", "Generate tests?", q -> q.setDefault(true))
                .build();

        Question<?> rootPackage = questions.find("rootPackage").orElseThrow();
        assertThat(rootPackage.getDefaultValue().getType()).isEqualTo(DefaultValue.Type.PLAIN);
        assertThat(rootPackage.answer("not a package", Answers.empty()).getMessage())
                .isEqualTo("Is not valid package name");
        assertThat(questions.find("database").orElseThrow().printDefaultValue(Answers.empty())).isEqualTo("(2) ");
        assertThat(questions.find("tests").orElseThrow().printDefaultValue(Answers.empty())).isEqualTo("(Y/n) ");
        assertThat(questions.find("missing")).isEmpty();
    }

    @Test
    void build_emptyListFails() {
        assertThrows(IllegalStateException.class, () -> QuestionsList.builder().build());
    }

    @Test
    void build_duplicateNameFailsWithName() {
        QuestionsList.Builder builder = QuestionsList.builder()
                .question("name", "Name")
                .confirmation("name", "Name again");

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertThat(e.getMessage()).isEqualTo("Duplicated questions with name name");
    }

    @Test
    void build_reportsFirstDuplicatedNameInQuestionOrder() {
        QuestionsList.Builder builder = QuestionsList.builder()
                .question("a", "A")
                .question("b", "B")
                .question("b", "B again")
                .question("a", "A again");

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertThat(e.getMessage()).endsWith(" a");
    }

    @Test
    void build_secondValidatorInConfigurationFails() {
        assertThrows(IllegalStateException.class, () -> QuestionsList.builder()
                .question("name", "Name", q -> {
                    q.validate(Validators.notBlank("Required"));
                    q.validate(Validators.isClass());
                }));
    }

    @Test
    void build_emptyOptionsFail() {
        assertThrows(IllegalStateException.class,
                () -> QuestionsList.builder().options("database", "Database", List.of()));
    }

    @Test
    void getQuestions_isImmutable() {
        QuestionsList questions = QuestionsList.builder().question("name", "Name").build();

        assertThrows(UnsupportedOperationException.class,
                () -> questions.getQuestions().add(new PlainQuestion("other", "Other")));
    }
}
