package com.blueprint.maven.generation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Parses template descriptions ({@code template.xml}).
 * <p>
 * Format:
 * <pre>
 * &lt;template modelName="entity"&gt;
 *     &lt;questions&gt;
 *         &lt;plain name="entityName" caption="Entity name"/&gt;
 *         &lt;options name="kind" caption="Kind"&gt;
 *             &lt;option&gt;Standard&lt;/option&gt;
 *             &lt;option&gt;Embedded&lt;/option&gt;
 *         &lt;/options&gt;
 *     &lt;/questions&gt;
 *     &lt;operations&gt;
 *         &lt;copy src="logo.png" dst="img/logo.png"/&gt;
 *         &lt;transform src="Entity.java" dst="src/{{entityName}}.java"/&gt;
 *     &lt;/operations&gt;
 * &lt;/template&gt;
 * </pre>
 * The {@code questions} section is optional, {@code operations} is required. Any
 * unknown tag inside them makes the whole template invalid.
 */
public class TemplateParser {

    private final TemplateLocator locator;

    public TemplateParser(TemplateLocator locator) {
        this.locator = locator;
    }

    /**
     * Locates and parses the named template.
     *
     * @throws TemplateException if the template cannot be found or its description is invalid
     */
    public Template parse(String templateName) throws TemplateException {
        return parse(templateName, locator.locate(templateName));
    }

    /**
     * Parses the description of a template whose directory is already known.
     */
    public static Template parse(String templateName, Path templateDir) throws TemplateException {
        Path descriptor = templateDir.resolve(TemplateLocator.DESCRIPTOR_NAME);
        if (!Files.isRegularFile(descriptor)) {
            throw new TemplateException("Unable to find " + TemplateLocator.DESCRIPTOR_NAME
                    + " for template " + templateName);
        }

        Element root = readDocument(templateName, descriptor).getDocumentElement();

        Element questionsElement = findChild(root, "questions");
        List<TemplateQuestion> questions = questionsElement == null
                ? List.of()
                : parseQuestions(templateName, questionsElement);

        Element operationsElement = findChild(root, "operations");
        if (operationsElement == null) {
            throw invalid(templateName, "no operations section");
        }
        List<GenerationInstruction> instructions = parseInstructions(templateName, operationsElement);

        return new Template(templateDir, root.getAttribute("modelName"), questions, instructions);
    }

    private static Document readDocument(String templateName, Path descriptor) throws TemplateException {
        try (InputStream inputStream = Files.newInputStream(descriptor)) {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setNamespaceAware(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document document = builder.parse(inputStream);
            document.getDocumentElement().normalize();
            return document;
        } catch (SAXException e) {
            throw new TemplateException("Invalid template " + templateName + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new TemplateException("Unable to read " + descriptor + ": " + e.getMessage(), e);
        }
    }

    private static List<TemplateQuestion> parseQuestions(String templateName, Element questionsElement)
            throws TemplateException {
        List<TemplateQuestion> questions = new ArrayList<>();
        for (Element element : childElements(questionsElement)) {
            TemplateQuestion.Kind kind = switch (element.getTagName()) {
                case "plain" -> TemplateQuestion.Kind.PLAIN;
                case "options" -> TemplateQuestion.Kind.OPTIONS;
                default -> throw invalid(templateName, "unknown question <" + element.getTagName() + ">");
            };
            String name = requireAttribute(templateName, element, "name");
            String caption = element.getAttribute("caption");

            questions.add(kind == TemplateQuestion.Kind.PLAIN
                    ? TemplateQuestion.plain(name, caption)
                    : TemplateQuestion.options(name, caption, parseOptions(templateName, element)));
        }
        return questions;
    }

    private static List<String> parseOptions(String templateName, Element optionsElement)
            throws TemplateException {
        List<String> options = new ArrayList<>();
        for (Element element : childElements(optionsElement)) {
            if (!"option".equals(element.getTagName())) {
                throw invalid(templateName, "unknown option <" + element.getTagName() + ">");
            }
            options.add(element.getTextContent().trim());
        }
        if (options.isEmpty()) {
            throw invalid(templateName, "question " + optionsElement.getAttribute("name") + " has no options");
        }
        return options;
    }

    private static List<GenerationInstruction> parseInstructions(String templateName, Element operationsElement)
            throws TemplateException {
        List<GenerationInstruction> instructions = new ArrayList<>();
        for (Element element : childElements(operationsElement)) {
            boolean transform = switch (element.getTagName()) {
                case "transform" -> true;
                case "copy" -> false;
                default -> throw invalid(templateName, "unknown operation <" + element.getTagName() + ">");
            };
            String src = requireAttribute(templateName, element, "src");
            String dst = requireAttribute(templateName, element, "dst");
            instructions.add(new GenerationInstruction(src, dst, transform));
        }
        return instructions;
    }

    private static String requireAttribute(String templateName, Element element, String attribute)
            throws TemplateException {
        String value = element.getAttribute(attribute);
        if (value.isBlank()) {
            throw invalid(templateName, "<" + element.getTagName() + "> without " + attribute);
        }
        return value;
    }

    private static TemplateException invalid(String templateName, String reason) {
        return new TemplateException("Invalid template " + templateName + ": " + reason);
    }

    private static Element findChild(Element parent, String tagName) {
        for (Element element : childElements(parent)) {
            if (tagName.equals(element.getTagName())) {
                return element;
            }
        }
        return null;
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }
}
