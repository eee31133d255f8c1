package com.blueprint.maven;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.project.MavenProject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GenerateMojoTest {

    private GenerateMojo mojo;
    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        mojo = new GenerateMojo();

        // Use target directory for test output instead of temp directory
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
                String.valueOf(System.nanoTime()));
        Files.createDirectories(testBaseDir);

        setField(mojo, "templatesDir", new File("src/test/resources/templates"));
        setField(mojo, "outputDir", testBaseDir.toFile());
        setField(mojo, "interactiveMode", false);
        setField(mojo, "template", "greeting");
    }

    static void setField(Object target, String fieldName, Object value) throws Exception {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException e) {
                type = type.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }

    @Test
    void execute_generatesTemplateFromPresetAnswers() throws Exception {
        setField(mojo, "answers", Map.of("className", "Greeter", "language", "2"));

        mojo.execute();

        assertThat(testBaseDir.resolve("banner.txt")).exists();
        assertThat(Files.readString(testBaseDir.resolve("src/Greeter.java")))
                .contains("public class Greeter {")
                .contains("// language 2: German");
        assertThat(Files.readString(testBaseDir.resolve("README.md"))).contains("Greets in German.");
    }

    @Test
    void execute_exposesMavenProject() throws Exception {
        MavenProject project = new MavenProject();
        project.setGroupId("com.company");
        project.setArtifactId("sales");
        project.setVersion("1.0");
        setField(mojo, "project", project);
        setField(mojo, "template", "pom-info");

        mojo.execute();

        assertThat(testBaseDir.resolve("sales.txt")).hasContent("com.company:sales:1.0");
    }

    @Test
    void execute_questionNamedLikeMavenProjectFails() throws Exception {
        setField(mojo, "project", new MavenProject());
        setField(mojo, "template", "reserved");

        MojoExecutionException e = assertThrows(MojoExecutionException.class, mojo::execute);

        assertThat(e.getMessage()).isEqualTo(
                "Failed to generate template reserved: Invalid template reserved: question pom uses reserved name pom");
        assertThat(testBaseDir.resolve("out.txt")).doesNotExist();
    }

    @Test
    void execute_questionNamedLikeMavenProjectIsFineWithoutProject() throws Exception {
        setField(mojo, "template", "reserved");
        setField(mojo, "answers", Map.of("pom", "pom.xml"));

        mojo.execute();

        assertThat(testBaseDir.resolve("out.txt")).hasContent("pom.xml");
    }

    @Test
    void execute_invalidAnswerFails() throws Exception {
        setField(mojo, "answers", Map.of("className", "Greeter", "language", "3"));

        MojoExecutionException e = assertThrows(MojoExecutionException.class, mojo::execute);

        assertThat(e.getMessage()).isEqualTo(
                "Failed to generate template greeting: Invalid answer for question language: Input 1-2");
        assertThat(testBaseDir.resolve("banner.txt")).doesNotExist();
    }

    @Test
    void execute_brokenTemplateFails() throws Exception {
        setField(mojo, "template", "broken");

        MojoExecutionException e = assertThrows(MojoExecutionException.class, mojo::execute);

        assertThat(e.getMessage()).isEqualTo(
                "Failed to generate template broken: Invalid template broken: unknown operation <delete>");
    }

    @Test
    void execute_unknownTemplateFails() throws Exception {
        setField(mojo, "template", "report");

        MojoExecutionException e = assertThrows(MojoExecutionException.class, mojo::execute);

        assertThat(e.getMessage()).startsWith(
                "Failed to generate template report: Unable to find template.xml for template report");
    }

    @Test
    void execute_requiresTemplateName() throws Exception {
        setField(mojo, "template", " ");

        assertThrows(MojoExecutionException.class, mojo::execute);
    }
}
