package com.blueprint.maven.project;

import java.util.Locale;

import com.blueprint.maven.prompting.Answers;
import com.blueprint.maven.prompting.QuestionsList;
import com.blueprint.maven.prompting.Validators;

/**
 * Questions asked when a new project is created. Captions and the list of databases
 * come from {@link Messages}.
 */
public final class ProjectInitQuestions {

    public static final String PROJECT_NAME = "projectName";
    public static final String NAMESPACE = "namespace";
    public static final String ROOT_PACKAGE = "rootPackage";
    public static final String PLATFORM_VERSION = "platformVersion";
    public static final String DATABASE = "database";

    static final String DATABASES_KEY = "databases";

    private static final int MAX_NAMESPACE_LENGTH = 8;

    public static QuestionsList create(Messages messages) {
        return QuestionsList.builder()
                .question(PROJECT_NAME, messages.get(PROJECT_NAME), q -> {
                    q.setDefault(messages.get("defaultProjectName"));
                    q.validate(Validators.regex("[a-zA-Z][\\w-]*", messages.get("invalidProjectName")));
                })
                .question(NAMESPACE, messages.get(NAMESPACE), q -> {
                    q.calculateDefault(answers -> namespaceOf(answers.getString(PROJECT_NAME)));
                    q.validate(Validators.regex("[a-z][a-z0-9]*", messages.get("invalidNamespace")));
                })
                .question(ROOT_PACKAGE, messages.get(ROOT_PACKAGE), q -> {
                    q.calculateDefault(ProjectInitQuestions::rootPackageOf);
                    q.validate(Validators.isPackage(messages.get("invalidPackage")));
                })
                .question(PLATFORM_VERSION, messages.get(PLATFORM_VERSION), q -> {
                    q.setDefault(messages.get("defaultPlatformVersion"));
                    q.validate(Validators.regex("\\d+\\.\\d+(\\.\\d+)?(-SNAPSHOT)?",
                            messages.get("invalidPlatformVersion")));
                })
                .options(DATABASE, messages.get(DATABASE), messages.getList(DATABASES_KEY), q -> q.setDefault(0))
                .build();
    }

    /**
     * Lower-case letters and digits of the project name, at most eight of them.
     */
    static String namespaceOf(String projectName) {
        String namespace = projectName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        return namespace.length() > MAX_NAMESPACE_LENGTH ? namespace.substring(0, MAX_NAMESPACE_LENGTH) : namespace;
    }

    static String rootPackageOf(Answers answers) {
        return "com.company." + answers.getString(NAMESPACE);
    }

    private ProjectInitQuestions() {
    }
}
