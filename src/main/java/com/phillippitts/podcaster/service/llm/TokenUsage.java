package com.phillippitts.podcaster.service.llm;

/**
 * Token accounting reported by the model provider.
 */
public record TokenUsage(int promptTokens, int completionTokens, int totalTokens) {
}
