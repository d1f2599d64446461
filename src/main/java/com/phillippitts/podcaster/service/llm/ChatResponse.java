package com.phillippitts.podcaster.service.llm;

/**
 * Result of a chat completion.
 *
 * @param content text returned by the model, may be null on failure
 * @param usage   token usage, null when the provider does not report it
 * @param error   provider error message, null on success
 */
public record ChatResponse(String content, TokenUsage usage, String error) {

    public static ChatResponse of(String content) {
        return new ChatResponse(content, null, null);
    }

    public static ChatResponse of(String content, TokenUsage usage) {
        return new ChatResponse(content, usage, null);
    }

    public static ChatResponse failed(String error) {
        return new ChatResponse(null, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
