package com.phillippitts.podcaster.service.script;

import com.phillippitts.podcaster.config.prompt.ScriptPromptProperties;
import com.phillippitts.podcaster.service.prompt.PromptDefinition;
import com.phillippitts.podcaster.service.prompt.registry.PromptDraft;
import com.phillippitts.podcaster.service.prompt.registry.PromptVersion;

import java.util.Map;

/**
 * The prompt that turns page content into a two-host podcast script.
 *
 * <p>Template text and model options come from a {@link PromptVersion} stored under
 * {@link #NAME}; {@link #firstVersion(ScriptPromptProperties)} is the draft seeded at startup.
 * Templates may use the placeholders {@code hostName}, {@code hostPersonalityDescription},
 * {@code cohostName}, {@code cohostPersonalityDescription} and {@code htmlContent}.
 */
public final class PodcastScriptPrompt {

    public static final String NAME = "podcast-script-generator";

    static final String DEFAULT_TEMPLATE = "You are a podcast script writer. Turn the web page content below "
            + "into an engaging conversation between two hosts.\n\n"
            + "## Hosts\n"
            + "- {{hostName}} (host): {{hostPersonalityDescription}}\n"
            + "- {{cohostName}} (cohost): {{cohostPersonalityDescription}}\n\n"
            + "## Rules\n"
            + "- Use exactly the names \"{{hostName}}\" and \"{{cohostName}}\" as speaker values.\n"
            + "- Alternate naturally between the hosts; the host opens and closes the episode.\n"
            + "- Stay faithful to the source; do not invent facts.\n"
            + "- Write spoken language only: no stage directions, sound effects or Markdown.\n"
            + "- Provide a catchy title, a summary of at most 300 characters and a few topical tags.\n\n"
            + "## Source content\n"
            + "{{htmlContent}}";

    private PodcastScriptPrompt() {
    }

    /**
     * Version 1 of the script prompt, with model options from {@code podcaster.script.*}.
     */
    public static PromptDraft firstVersion(ScriptPromptProperties properties) {
        return new PromptDraft(NAME, DEFAULT_TEMPLATE, properties.systemPrompt(),
                properties.temperature(), properties.maxTokens());
    }

    /**
     * Builds the runnable definition for a stored version of the script prompt.
     */
    public static PromptDefinition<ScriptParams, PodcastScript> create(PromptVersion version) {
        return PromptDefinition.builder(version.key(), ScriptParams.class, PodcastScript.class)
                .description("Generates a podcast script with a title, summary, tags and two-speaker dialogue ("
                        + version.label() + ").")
                .template(params -> version.render(placeholders(params)))
                .defaultOptions(version.options())
                .build();
    }

    static Map<String, String> placeholders(ScriptParams p) {
        return Map.of(
                "htmlContent", p.htmlContent(),
                "hostName", p.hostName(),
                "hostPersonalityDescription", p.hostPersonalityDescription(),
                "cohostName", p.cohostName(),
                "cohostPersonalityDescription", p.cohostPersonalityDescription());
    }
}
