package com.phillippitts.podcaster.service.voice;

import com.phillippitts.podcaster.config.voice.VoiceProperties;
import com.phillippitts.podcaster.service.audio.AudioDataUri;
import com.phillippitts.podcaster.service.tts.SpeechSynthesizer;
import com.phillippitts.podcaster.service.tts.TtsProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Voices offered to users for the active speech provider, enriched with preview audio.
 *
 * <p>Results are memoized per provider. A provider switch reads a different entry, and
 * {@link #invalidate()} drops every entry. Lists built after an enrichment failure are
 * returned but not cached.
 */
@Service
public class VoiceDirectory {

    private static final Logger LOG = LogManager.getLogger(VoiceDirectory.class);

    private final VoiceCatalog catalog;
    private final SpeechSynthesizer speechSynthesizer;
    private final VoiceProperties properties;
    private final Map<TtsProvider, List<VoiceProfile>> cache = new ConcurrentHashMap<>();

    public VoiceDirectory(VoiceCatalog catalog, SpeechSynthesizer speechSynthesizer, VoiceProperties properties) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.speechSynthesizer = Objects.requireNonNull(speechSynthesizer, "speechSynthesizer");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public List<VoiceProfile> availableVoices() {
        TtsProvider provider = speechSynthesizer.activeProvider();
        List<VoiceProfile> cached = cache.get(provider);
        if (cached != null) {
            LOG.debug("Returning cached voices for {}", provider);
            return cached;
        }

        LOG.info("Enriching voices for {}", provider);
        Enrichment enrichment = enrich(provider);
        if (enrichment.complete()) {
            cache.putIfAbsent(provider, enrichment.profiles());
        }
        return enrichment.profiles();
    }

    public void invalidate() {
        cache.clear();
    }

    private record Enrichment(List<VoiceProfile> profiles, boolean complete) {
    }

    private Enrichment enrich(TtsProvider provider) {
        Path baseDir = Path.of(properties.previewDir(), provider.name().toLowerCase());
        List<VoiceProfile> enriched = new ArrayList<>();
        boolean complete = true;

        for (VoiceProfile profile : catalog.profiles(provider)) {
            Path preview = baseDir.resolve(profile.id() + "." + properties.previewFormat());
            try {
                byte[] audio = Files.readAllBytes(preview);
                enriched.add(profile.withPreview(AudioDataUri.encode(audio, properties.previewFormat())));
            } catch (NoSuchFileException e) {
                LOG.warn("Preview audio not found for {} at {}", profile.id(), preview);
                enriched.add(profile);
            } catch (IOException e) {
                LOG.error("Failed to read preview audio for {} at {}", profile.id(), preview, e);
                enriched.add(profile);
                complete = false;
            }
        }
        return new Enrichment(List.copyOf(enriched), complete);
    }
}
