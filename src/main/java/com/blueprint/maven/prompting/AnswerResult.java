package com.blueprint.maven.prompting;

/**
 * Outcome of answering a single question: the committed value, or the message
 * to show before asking the same question again.
 */
public final class AnswerResult<T> {

    private final T value;
    private final String message;

    private AnswerResult(T value, String message) {
        this.value = value;
        this.message = message;
    }

    public static <T> AnswerResult<T> committed(T value) {
        return new AnswerResult<>(value, null);
    }

    public static <T> AnswerResult<T> rejected(String message) {
        return new AnswerResult<>(null, message);
    }

    public boolean isCommitted() {
        return message == null;
    }

    public T getValue() {
        if (!isCommitted()) {
            throw new IllegalStateException("Answer was rejected: " + message);
        }
        return value;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isCommitted() ? "Committed[" + value + "]" : "Rejected[" + message + "]";
    }
}
