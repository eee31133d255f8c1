package com.blueprint.maven.project;

import com.blueprint.maven.prompting.Answers;

/**
 * Model of a new project, built from the answers to {@link ProjectInitQuestions}.
 * Exposed to project templates as {@code project}.
 */
public class ProjectInitModel {

    private final String projectName;
    private final String namespace;
    private final String rootPackage;
    private final String rootPackageDirectory;
    private final String platformVersion;
    private final DatabaseModel database;

    public ProjectInitModel(Answers answers, Messages messages) {
        this.projectName = answers.getString(ProjectInitQuestions.PROJECT_NAME);
        this.namespace = answers.getString(ProjectInitQuestions.NAMESPACE);
        this.rootPackage = answers.getString(ProjectInitQuestions.ROOT_PACKAGE);
        this.rootPackageDirectory = rootPackage.replace('.', '/');
        this.platformVersion = answers.getString(ProjectInitQuestions.PLATFORM_VERSION);
        this.database = new DatabaseModel(
                answers.getInt(ProjectInitQuestions.DATABASE),
                messages.getList(ProjectInitQuestions.DATABASES_KEY),
                projectName);
    }

    public String getProjectName() {
        return projectName;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getRootPackage() {
        return rootPackage;
    }

    public String getRootPackageDirectory() {
        return rootPackageDirectory;
    }

    public String getPlatformVersion() {
        return platformVersion;
    }

    public DatabaseModel getDatabase() {
        return database;
    }
}
