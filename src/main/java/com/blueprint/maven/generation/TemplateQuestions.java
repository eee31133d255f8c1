package com.blueprint.maven.generation;

import java.util.List;
import java.util.Optional;

import com.blueprint.maven.prompting.QuestionsList;

/**
 * Turns the questions declared by a template into questions that can be asked.
 */
public final class TemplateQuestions {

    /**
     * @return the questions of the template, or empty if it declares none
     * @throws IllegalStateException if two questions share a name
     */
    public static Optional<QuestionsList> toQuestionsList(Template template) {
        return toQuestionsList(template.getQuestions());
    }

    public static Optional<QuestionsList> toQuestionsList(List<TemplateQuestion> templateQuestions) {
        if (templateQuestions.isEmpty()) {
            return Optional.empty();
        }
        QuestionsList.Builder builder = QuestionsList.builder();
        for (TemplateQuestion question : templateQuestions) {
            switch (question.getKind()) {
                case PLAIN -> builder.question(question.getName(), question.getCaption());
                case OPTIONS -> builder.options(question.getName(), question.getCaption(), question.getOptions());
            }
        }
        return Optional.of(builder.build());
    }

    private TemplateQuestions() {
    }
}
