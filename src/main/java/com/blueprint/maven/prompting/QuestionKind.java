package com.blueprint.maven.prompting;

/**
 * The closed set of question variants.
 */
public enum QuestionKind {
    /** Free text, see {@link PlainQuestion}. */
    PLAIN,
    /** Single choice from a list, see {@link OptionsQuestion}. */
    OPTIONS,
    /** Yes or no, see {@link ConfirmationQuestion}. */
    CONFIRMATION
}
