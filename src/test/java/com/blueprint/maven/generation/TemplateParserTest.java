package com.blueprint.maven.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemplateParserTest {

    private static final Path TEMPLATES = Path.of("src/test/resources/templates");

    @Mock
    private Log log;

    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
                String.valueOf(System.nanoTime()));
        Files.createDirectories(testBaseDir);
    }

    private Path writeTemplate(String name, String xml) throws Exception {
        Path dir = testBaseDir.resolve(name);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(TemplateLocator.DESCRIPTOR_NAME), xml);
        return dir;
    }

    @Test
    void parse_greetingTemplate() throws Exception {
        TemplateParser parser = new TemplateParser(new TemplateLocator(TEMPLATES, null, log));

        Template template = parser.parse("greeting");

        assertThat(template.getModelName()).isEqualTo("greeting");
        assertThat(template.getPath()).isEqualTo(TEMPLATES.toAbsolutePath().normalize().resolve("greeting"));
        assertThat(template.getQuestions()).extracting(TemplateQuestion::getName)
                .containsExactly("className", "language");
        assertThat(template.getQuestions().get(0).getKind()).isEqualTo(TemplateQuestion.Kind.PLAIN);
        assertThat(template.getQuestions().get(0).getCaption()).isEqualTo("Class name");
        assertThat(template.getQuestions().get(1).getKind()).isEqualTo(TemplateQuestion.Kind.OPTIONS);
        assertThat(template.getQuestions().get(1).getOptions()).containsExactly("English", "German");

        assertThat(template.getInstructions()).hasSize(3);
        GenerationInstruction copy = template.getInstructions().get(0);
        assertThat(copy.isTransform()).isFalse();
        assertThat(copy.getSource()).isEqualTo("static/banner.txt");
        assertThat(copy.getDestination()).isEqualTo("banner.txt");
        assertThat(template.getInstructions().get(1).isTransform()).isTrue();
        assertThat(template.getInstructions().get(1).getDestination()).isEqualTo("src/{{className}}.java");
    }

    @Test
    void parse_withoutQuestionsSection() throws Exception {
        Path dir = writeTemplate("static", """
                <template>
                    <operations>
                        <copy src="a.txt" dst="b.txt"/>
                    </operations>
                </template>
                """);

        Template template = TemplateParser.parse("static", dir);

        assertThat(template.getQuestions()).isEmpty();
        assertThat(template.getModelName()).isEmpty();
        assertThat(template.getInstructions()).extracting(GenerationInstruction::toString)
                .containsExactly("copy a.txt -> b.txt");
    }

    @Test
    void parse_unknownOperationFailsWholeTemplate() {
        TemplateParser parser = new TemplateParser(new TemplateLocator(TEMPLATES, null, log));

        TemplateException e = assertThrows(TemplateException.class, () -> parser.parse("broken"));

        assertThat(e.getMessage()).isEqualTo("Invalid template broken: unknown operation <delete>");
    }

    @Test
    void parse_unknownQuestionTagFails() throws Exception {
        Path dir = writeTemplate("confirm", """
                <template>
                    <questions>
                        <confirmation name="tests" caption="Tests?"/>
                    </questions>
                    <operations>
                        <copy src="a.txt" dst="a.txt"/>
                    </operations>
                </template>
                """);

        TemplateException e = assertThrows(TemplateException.class, () -> TemplateParser.parse("confirm", dir));

        assertThat(e.getMessage()).isEqualTo("Invalid template confirm: unknown question <confirmation>");
    }

    @Test
    void parse_missingOperationsFails() throws Exception {
        Path dir = writeTemplate("empty", """
                <template>
                    <questions>
                        <plain name="name" caption="Name"/>
                    </questions>
                </template>
                """);

        TemplateException e = assertThrows(TemplateException.class, () -> TemplateParser.parse("empty", dir));

        assertThat(e.getMessage()).contains("no operations section");
    }

    @Test
    void parse_missingAttributesFail() throws Exception {
        Path noDestination = writeTemplate("nodst", """
                <template>
                    <operations>
                        <transform src="a.txt"/>
                    </operations>
                </template>
                """);
        Path noName = writeTemplate("noname", """
                <template>
                    <questions>
                        <plain caption="Name"/>
                    </questions>
                    <operations>
                        <copy src="a.txt" dst="a.txt"/>
                    </operations>
                </template>
                """);

        assertThat(assertThrows(TemplateException.class, () -> TemplateParser.parse("nodst", noDestination))
                .getMessage()).isEqualTo("Invalid template nodst: <transform> without dst");
        assertThat(assertThrows(TemplateException.class, () -> TemplateParser.parse("noname", noName))
                .getMessage()).isEqualTo("Invalid template noname: <plain> without name");
    }

    @Test
    void parse_optionsWithoutOptionsFail() throws Exception {
        Path dir = writeTemplate("nooptions", """
                <template>
                    <questions>
                        <options name="database" caption="Database"/>
                    </questions>
                    <operations>
                        <copy src="a.txt" dst="a.txt"/>
                    </operations>
                </template>
                """);

        TemplateException e = assertThrows(TemplateException.class, () -> TemplateParser.parse("nooptions", dir));

        assertThat(e.getMessage()).isEqualTo("Invalid template nooptions: question database has no options");
    }

    @Test
    void parse_malformedXmlFails() throws Exception {
        Path dir = writeTemplate("malformed", "<template><operations></template>");

        TemplateException e = assertThrows(TemplateException.class, () -> TemplateParser.parse("malformed", dir));

        assertThat(e.getMessage()).startsWith("Invalid template malformed: ");
    }

    @Test
    void parse_missingDescriptorFails() throws Exception {
        Path dir = testBaseDir.resolve("nothing");
        Files.createDirectories(dir);

        TemplateException e = assertThrows(TemplateException.class, () -> TemplateParser.parse("nothing", dir));

        assertThat(e.getMessage()).isEqualTo("Unable to find template.xml for template nothing");
    }
}
