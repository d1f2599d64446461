package com.phillippitts.podcaster.service.llm;

import java.util.List;

/**
 * Chat-completion capable language model.
 *
 * <p>Vendor clients live outside this project and are registered as Spring beans.
 * Implementations may either throw or return a {@link ChatResponse} with an error; the
 * prompt engine treats both as a model error.
 */
public interface LlmClient {

    /**
     * Sends the messages and returns the model's reply.
     *
     * @param messages ordered conversation, usually one system and one user message
     * @param options  fully merged sampling options
     * @return the model response, never null for a well-behaved client
     */
    ChatResponse chatCompletion(List<ChatMessage> messages, ChatOptions options);

    /**
     * Short provider name for logs and metrics.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
