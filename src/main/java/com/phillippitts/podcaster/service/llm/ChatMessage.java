package com.phillippitts.podcaster.service.llm;

import java.util.Objects;

/**
 * One message of a chat completion request.
 *
 * @param role    "system", "user" or "assistant"
 * @param content message text
 */
public record ChatMessage(String role, String content) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }
}
