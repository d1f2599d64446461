package com.phillippitts.podcaster.service.prompt.registry;

import com.phillippitts.podcaster.service.llm.ChatOptions;
import org.apache.commons.text.StringSubstitutor;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One stored version of a prompt. At most one version per key is active.
 *
 * @param key          prompt key
 * @param version      version number, 1-based and unique per key
 * @param template     user prompt text with {@code {{placeholder}}} markers
 * @param systemPrompt system message (nullable)
 * @param temperature  sampling temperature
 * @param maxTokens    response token cap
 * @param active       whether {@link PromptRegistry#get(String)} returns this version
 * @param createdAt    registration time
 */
public record PromptVersion(
        String key,
        int version,
        String template,
        String systemPrompt,
        double temperature,
        int maxTokens,
        boolean active,
        Instant createdAt
) {

    public PromptVersion {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (version < 1) {
            throw new IllegalArgumentException("Prompt version must be >= 1, got " + version);
        }
    }

    /**
     * Fills the template's {@code {{name}}} markers. Placeholder values are inserted as-is and
     * never scanned for further markers.
     *
     * @throws IllegalArgumentException if the template names a placeholder that is not supplied
     */
    public String render(Map<String, ?> placeholders) {
        StringSubstitutor substitutor = new StringSubstitutor(placeholders, "{{", "}}");
        substitutor.setEnableUndefinedVariableException(true);
        substitutor.setDisableSubstitutionInValues(true);
        return substitutor.replace(template);
    }

    /** Model options stored with this version. */
    public ChatOptions options() {
        return new ChatOptions(null, systemPrompt, temperature, maxTokens, null);
    }

    public String label() {
        return key + " v" + version;
    }

    PromptVersion withActive(boolean isActive) {
        return new PromptVersion(key, version, template, systemPrompt, temperature, maxTokens, isActive, createdAt);
    }
}
