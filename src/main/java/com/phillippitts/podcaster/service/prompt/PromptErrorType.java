package com.phillippitts.podcaster.service.prompt;

/**
 * Classification of a failed prompt run.
 */
public enum PromptErrorType {
    /** Params rejected by the input schema; the model was not called. */
    INPUT_VALIDATION("InputValidationError"),
    /** The model call threw, reported an error, or returned no content. */
    MODEL("ModelError"),
    /** The cleaned response is not valid JSON. */
    PARSE("ParseError"),
    /** Valid JSON that does not satisfy the output schema. */
    OUTPUT_VALIDATION("OutputValidationError");

    private final String label;

    PromptErrorType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
