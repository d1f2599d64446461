package com.phillippitts.podcaster.service.prompt;

import com.phillippitts.podcaster.service.llm.TokenUsage;

import java.util.Objects;

/**
 * Outcome of a prompt run: exactly one of structured output or error is present.
 *
 * @param <O> structured output type
 */
public final class PromptResult<O> {

    private final O structuredOutput;
    private final PromptError error;
    private final TokenUsage usage;

    private PromptResult(O structuredOutput, PromptError error, TokenUsage usage) {
        this.structuredOutput = structuredOutput;
        this.error = error;
        this.usage = usage;
    }

    public static <O> PromptResult<O> success(O structuredOutput, TokenUsage usage) {
        return new PromptResult<>(Objects.requireNonNull(structuredOutput, "structuredOutput"), null, usage);
    }

    public static <O> PromptResult<O> failure(PromptError error) {
        return failure(error, null);
    }

    public static <O> PromptResult<O> failure(PromptError error, TokenUsage usage) {
        return new PromptResult<>(null, Objects.requireNonNull(error, "error"), usage);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public O structuredOutput() {
        if (error != null) {
            throw new IllegalStateException("Prompt failed: " + error.describe());
        }
        return structuredOutput;
    }

    /**
     * @throws IllegalStateException if this result is a success
     */
    public PromptError error() {
        if (error == null) {
            throw new IllegalStateException("Prompt succeeded; no error present");
        }
        return error;
    }

    /** Token usage if the model reported it, otherwise null. */
    public TokenUsage usage() {
        return usage;
    }

    @Override
    public String toString() {
        return isSuccess() ? "PromptResult[success]" : "PromptResult[" + error.describe() + "]";
    }
}
