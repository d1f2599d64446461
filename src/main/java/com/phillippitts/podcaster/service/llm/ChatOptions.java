package com.phillippitts.podcaster.service.llm;

/**
 * Sampling options for a chat completion. Null fields mean "not set" so that options can be
 * layered with {@link #overriddenBy(ChatOptions)}.
 *
 * @param model        model name, provider default when null
 * @param systemPrompt system message text
 * @param temperature  sampling temperature
 * @param maxTokens    response token cap
 * @param topP         nucleus sampling cutoff
 */
public record ChatOptions(
        String model,
        String systemPrompt,
        Double temperature,
        Integer maxTokens,
        Double topP
) {

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant.";

    private static final ChatOptions DEFAULTS =
            new ChatOptions(null, DEFAULT_SYSTEM_PROMPT, 0.7, 1024, 1.0);

    public static ChatOptions defaults() {
        return DEFAULTS;
    }

    public static ChatOptions none() {
        return new ChatOptions(null, null, null, null, null);
    }

    public static ChatOptions of(double temperature, int maxTokens) {
        return new ChatOptions(null, null, temperature, maxTokens, null);
    }

    /**
     * Returns a copy where every field set in {@code overrides} replaces this one.
     */
    public ChatOptions overriddenBy(ChatOptions overrides) {
        if (overrides == null) {
            return this;
        }
        return new ChatOptions(
                overrides.model != null ? overrides.model : model,
                overrides.systemPrompt != null ? overrides.systemPrompt : systemPrompt,
                overrides.temperature != null ? overrides.temperature : temperature,
                overrides.maxTokens != null ? overrides.maxTokens : maxTokens,
                overrides.topP != null ? overrides.topP : topP
        );
    }
}
