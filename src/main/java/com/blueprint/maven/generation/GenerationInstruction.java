package com.blueprint.maven.generation;

/**
 * One step of a template: copy {@code source} to {@code destination}, rendering it
 * against the answers first when {@code transform} is set.
 */
public class GenerationInstruction {

    private final String source;
    private final String destination;
    private final boolean transform;

    public GenerationInstruction(String source, String destination, boolean transform) {
        this.source = source;
        this.destination = destination;
        this.transform = transform;
    }

    public static GenerationInstruction copy(String source, String destination) {
        return new GenerationInstruction(source, destination, false);
    }

    public static GenerationInstruction transform(String source, String destination) {
        return new GenerationInstruction(source, destination, true);
    }

    public String getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }

    public boolean isTransform() {
        return transform;
    }

    @Override
    public String toString() {
        return (transform ? "transform " : "copy ") + source + " -> " + destination;
    }
}
