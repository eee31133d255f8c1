package com.blueprint.maven.prompting;

import java.util.Optional;
import java.util.function.Function;

/**
 * Default value of a question: none, a plain value, or a value calculated from
 * the answers given so far.
 * <p>
 * A calculated default is evaluated on every {@link #resolve(Answers)} call and
 * never at construction, so it may only read answers of questions that are
 * asked before the question it belongs to.
 */
public final class DefaultValue<T> {

    public enum Type {
        NONE,
        PLAIN,
        CALCULATED
    }

    private static final DefaultValue<?> NONE = new DefaultValue<>(Type.NONE, null, null);

    private final Type type;
    private final T value;
    private final Function<Answers, T> function;

    private DefaultValue(Type type, T value, Function<Answers, T> function) {
        this.type = type;
        this.value = value;
        this.function = function;
    }

    @SuppressWarnings("unchecked")
    public static <T> DefaultValue<T> none() {
        return (DefaultValue<T>) NONE;
    }

    public static <T> DefaultValue<T> plain(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Default value must not be null, use none() instead");
        }
        return new DefaultValue<>(Type.PLAIN, value, null);
    }

    public static <T> DefaultValue<T> calculated(Function<Answers, T> function) {
        if (function == null) {
            throw new IllegalArgumentException("Default value function must not be null");
        }
        return new DefaultValue<>(Type.CALCULATED, null, function);
    }

    public Type getType() {
        return type;
    }

    public boolean isPresent() {
        return type != Type.NONE;
    }

    /**
     * Resolves the default against the answers given so far.
     *
     * @throws IllegalStateException if a calculated default reads a question that is not answered yet
     */
    public Optional<T> resolve(Answers answers) {
        return switch (type) {
            case NONE -> Optional.empty();
            case PLAIN -> Optional.of(value);
            case CALCULATED -> Optional.ofNullable(function.apply(answers));
        };
    }
}
