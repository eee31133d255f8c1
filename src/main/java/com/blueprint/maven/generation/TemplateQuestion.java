package com.blueprint.maven.generation;

import java.util.List;

/**
 * A question declared in a template description: free text or a choice of options.
 * Defaults and validation are not part of the description.
 */
public class TemplateQuestion {

    public enum Kind {
        PLAIN,
        OPTIONS
    }

    private final Kind kind;
    private final String name;
    private final String caption;
    private final List<String> options;

    private TemplateQuestion(Kind kind, String name, String caption, List<String> options) {
        this.kind = kind;
        this.name = name;
        this.caption = caption;
        this.options = List.copyOf(options);
    }

    public static TemplateQuestion plain(String name, String caption) {
        return new TemplateQuestion(Kind.PLAIN, name, caption, List.of());
    }

    public static TemplateQuestion options(String name, String caption, List<String> options) {
        return new TemplateQuestion(Kind.OPTIONS, name, caption, options);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getCaption() {
        return caption;
    }

    /**
     * Option labels in declaration order; empty for plain questions.
     */
    public List<String> getOptions() {
        return options;
    }
}
