package com.phillippitts.podcaster.config.prompt;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Model options for the podcast script prompt.
 *
 * <p>Properties: {@code podcaster.script.temperature}, {@code podcaster.script.max-tokens},
 * {@code podcaster.script.system-prompt} (engine default when unset).
 */
@Validated
@ConfigurationProperties(prefix = "podcaster.script")
public record ScriptPromptProperties(
        @DefaultValue("0.7") @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
        @DefaultValue("3000") @Positive int maxTokens,
        String systemPrompt
) {

    public static ScriptPromptProperties defaults() {
        return new ScriptPromptProperties(0.7, 3000, null);
    }
}
