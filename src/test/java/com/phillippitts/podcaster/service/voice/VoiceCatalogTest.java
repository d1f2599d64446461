package com.phillippitts.podcaster.service.voice;

import com.phillippitts.podcaster.service.tts.TtsProvider;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceCatalogTest {

    private final VoiceCatalog catalog = new VoiceCatalog();

    @Test
    void resolvesHandlePerProvider() {
        assertThat(catalog.resolve("Arthur", TtsProvider.OPENAI))
                .hasValueSatisfying(v -> assertThat(v.voiceHandle()).isEqualTo("echo"));
        assertThat(catalog.resolve("Arthur", TtsProvider.AZURE))
                .hasValueSatisfying(v -> assertThat(v.voiceHandle()).isEqualTo("en-US-GuyNeural"));
        assertThat(catalog.resolve("Chloe", TtsProvider.OPENAI))
                .hasValueSatisfying(v -> assertThat(v.voiceHandle()).isEqualTo("nova"));
    }

    @Test
    void unknownPersonalityHasNoFallback() {
        assertThat(catalog.resolve("Zed", TtsProvider.OPENAI)).isEmpty();
        assertThat(catalog.resolve(null, TtsProvider.OPENAI)).isEmpty();
        assertThat(catalog.resolve("Arthur", null)).isEmpty();
        assertThat(catalog.isKnown("Zed")).isFalse();
    }

    @Test
    void profileCarriesPersonalityDescription() {
        VoiceProfile maya = catalog.resolve("Maya", TtsProvider.OPENAI).orElseThrow();

        assertThat(maya.id()).isEqualTo("Maya");
        assertThat(maya.description()).startsWith("The Passionate Advocate");
        assertThat(maya.previewAudioUri()).isNull();
    }

    @Test
    void listsSixPersonalitiesInCatalogOrder() {
        assertThat(catalog.profiles(TtsProvider.AZURE))
                .extracting(VoiceProfile::id)
                .containsExactly("Arthur", "Chloe", "Maya", "Sam", "Evelyn", "David");
        assertThat(catalog.personality("Sam")).isPresent();
    }
}
