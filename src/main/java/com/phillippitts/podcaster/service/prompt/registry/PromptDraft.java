package com.phillippitts.podcaster.service.prompt.registry;

import java.time.Instant;

/**
 * Content of a prompt version before the registry numbers and stores it.
 *
 * @param key          prompt key, e.g. {@code podcast-script-generator}
 * @param template     user prompt text with {@code {{placeholder}}} markers
 * @param systemPrompt system message (nullable, engine default when null)
 * @param temperature  sampling temperature, 0.0 to 2.0
 * @param maxTokens    response token cap
 */
public record PromptDraft(
        String key,
        String template,
        String systemPrompt,
        double temperature,
        int maxTokens
) {

    public PromptDraft {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Prompt key must not be blank");
        }
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Prompt template must not be blank");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("Temperature must be between 0.0 and 2.0, got " + temperature);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
    }

    PromptVersion toVersion(int version, boolean active, Instant createdAt) {
        return new PromptVersion(key, version, template, systemPrompt, temperature, maxTokens, active, createdAt);
    }
}
