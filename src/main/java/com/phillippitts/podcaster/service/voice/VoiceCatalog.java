package com.phillippitts.podcaster.service.voice;

import com.phillippitts.podcaster.service.tts.TtsProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalog of personalities and their voice handle per speech provider.
 *
 * <p>Lookup is table driven on {@code (provider, personalityId)}. A missing entry resolves to
 * {@link Optional#empty()}; there is no fallback voice.
 */
@Component
public class VoiceCatalog {

    private record VoiceKey(TtsProvider provider, String personalityId) {
    }

    private final Map<String, Personality> personalities = new LinkedHashMap<>();
    private final Map<VoiceKey, String> voiceHandles = new HashMap<>();

    public VoiceCatalog() {
        register(new Personality("Arthur",
                "The Erudite Analyst: Delivers insights with precision and depth, often referencing historical "
                        + "context or academic research. Speaks thoughtfully and perhaps a bit formally.",
                "Indeed, the historical data suggests a compelling trend."),
                "echo", "en-US-GuyNeural");
        register(new Personality("Chloe",
                "The Witty Commentator: Quick with a clever quip or sarcastic observation, finding humor in the "
                        + "details and keeping the conversation light and engaging.",
                "Well, isn't that just fascinatingly predictable?"),
                "nova", "en-US-JennyNeural");
        register(new Personality("Maya",
                "The Passionate Advocate: Speaks with infectious energy and optimism. Finds the exciting angle in "
                        + "any topic and isn't afraid to show her passion.",
                "This is incredibly exciting! Think of the possibilities!"),
                "shimmer", "en-GB-LibbyNeural");
        register(new Personality("Sam",
                "The Measured Moderator: Calm, thoughtful, and objective. Ensures all sides are considered, often "
                        + "summarizing complex points clearly and providing a steadying presence.",
                "Let's consider the key points from a balanced perspective."),
                "alloy", "en-GB-RyanNeural");
        register(new Personality("Evelyn",
                "The Sharp Skeptic: Analytical and questioning, Evelyn probes assumptions and challenges "
                        + "conventional wisdom. She brings a critical eye and encourages deeper thought.",
                "Are we certain that assumption holds true under scrutiny?"),
                "fable", "en-AU-NatashaNeural");
        register(new Personality("David",
                "The Relatable Storyteller: Warm, approachable, and focuses on the human angle. Connects the "
                        + "topic to everyday experiences and tells compelling anecdotes.",
                "It really makes you think about how this affects everyday people, doesn't it?"),
                "onyx", "en-IN-NeerjaNeural");
    }

    private void register(Personality personality, String openAiVoice, String azureVoice) {
        personalities.put(personality.id(), personality);
        voiceHandles.put(new VoiceKey(TtsProvider.OPENAI, personality.id()), openAiVoice);
        voiceHandles.put(new VoiceKey(TtsProvider.AZURE, personality.id()), azureVoice);
    }

    public boolean isKnown(String personalityId) {
        return personalityId != null && personalities.containsKey(personalityId);
    }

    public Optional<Personality> personality(String personalityId) {
        return Optional.ofNullable(personalityId == null ? null : personalities.get(personalityId));
    }

    /**
     * Resolves a personality to its voice on the given provider.
     *
     * @return the profile, or empty when the personality is unknown or has no voice on that provider
     */
    public Optional<VoiceProfile> resolve(String personalityId, TtsProvider provider) {
        if (personalityId == null || provider == null) {
            return Optional.empty();
        }
        Personality personality = personalities.get(personalityId);
        String handle = voiceHandles.get(new VoiceKey(provider, personalityId));
        if (personality == null || handle == null) {
            return Optional.empty();
        }
        return Optional.of(new VoiceProfile(personality, provider, handle, null));
    }

    /**
     * All personalities that have a voice on the provider, in catalog order.
     */
    public List<VoiceProfile> profiles(TtsProvider provider) {
        List<VoiceProfile> profiles = new ArrayList<>();
        for (String id : personalities.keySet()) {
            resolve(id, provider).ifPresent(profiles::add);
        }
        return Collections.unmodifiableList(profiles);
    }
}
