package com.phillippitts.podcaster.service.tts;

import com.phillippitts.podcaster.config.properties.SynthesisProperties;
import com.phillippitts.podcaster.domain.DialogueSegment;
import com.phillippitts.podcaster.exception.SegmentSynthesisException;
import com.phillippitts.podcaster.service.metrics.PipelineMetrics;
import com.phillippitts.podcaster.service.util.ConcurrencyGuard;
import com.phillippitts.podcaster.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a dialogue into one audio buffer per line.
 *
 * <p><b>Fan-out:</b> one synthesis task per non-empty line runs on {@code synthesisExecutor};
 * a per-call {@link ConcurrencyGuard} caps in-flight provider calls at
 * {@code podcaster.synthesis.concurrency}. Excess lines queue for a permit.
 *
 * <p><b>Fail-soft:</b> the returned list has the dialogue's length and order. A line that is
 * empty, or whose synthesis fails, yields {@code null} at its index; siblings are unaffected
 * and {@link #synthesize} never throws for provider errors. Callers decide whether the
 * surviving buffers are enough.
 */
@Service
public class DialogueSynthesizer {

    private static final Logger LOG = LogManager.getLogger(DialogueSynthesizer.class);
    private static final int LINE_PREVIEW_CHARS = 40;

    private final SpeechSynthesizer speechSynthesizer;
    private final Executor executor;
    private final SynthesisProperties properties;
    private final PipelineMetrics metrics;

    public DialogueSynthesizer(SpeechSynthesizer speechSynthesizer,
                               @Qualifier("synthesisExecutor") Executor executor,
                               SynthesisProperties properties,
                               PipelineMetrics metrics) {
        this.speechSynthesizer = Objects.requireNonNull(speechSynthesizer, "speechSynthesizer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Synthesizes every line of the dialogue.
     *
     * @param dialogue     ordered segments
     * @param voiceMap     speaker display name to provider voice handle
     * @param defaultVoice voice used for speakers missing from the map
     * @return index-aligned buffers; {@code null} marks a line that produced no audio
     */
    public List<byte[]> synthesize(List<DialogueSegment> dialogue, Map<String, String> voiceMap,
                                   String defaultVoice) {
        if (dialogue == null || dialogue.isEmpty()) {
            return List.of();
        }
        Map<String, String> voices = voiceMap == null ? Map.of() : voiceMap;
        ConcurrencyGuard guard = ConcurrencyGuard.blocking(Math.max(1, properties.getConcurrency()), "tts");

        byte[][] results = new byte[dialogue.size()][];
        AtomicInteger failed = new AtomicInteger();
        int skipped = 0;
        List<CompletableFuture<Void>> futures = new ArrayList<>(dialogue.size());

        for (int i = 0; i < dialogue.size(); i++) {
            DialogueSegment segment = dialogue.get(i);
            if (segment == null || !segment.hasLine()) {
                LOG.debug("Skipping segment {}: empty line", i);
                skipped++;
                continue;
            }
            final int index = i;
            String voice = resolveVoice(index, segment.speaker(), voices, defaultVoice);
            try {
                futures.add(CompletableFuture.runAsync(() -> {
                    results[index] = synthesizeSegment(index, segment, voice, guard);
                    if (results[index] == null) {
                        failed.incrementAndGet();
                    }
                }, executor));
            } catch (RejectedExecutionException e) {
                LOG.error("Segment {} could not be scheduled", index, e);
                failed.incrementAndGet();
            }
        }

        awaitAll(futures);

        int succeeded = dialogue.size() - skipped - failed.get();
        metrics.recordSegments("success", succeeded);
        metrics.recordSegments("failed", failed.get());
        metrics.recordSegments("skipped", skipped);
        LOG.info("Synthesized {}/{} segments ({} failed, {} skipped)",
                succeeded, dialogue.size(), failed.get(), skipped);

        return Collections.unmodifiableList(Arrays.asList(results));
    }

    private String resolveVoice(int index, String speaker, Map<String, String> voices, String defaultVoice) {
        String voice = speaker == null ? null : voices.get(speaker);
        if (voice == null) {
            LOG.warn("No voice mapped for speaker '{}' at segment {}; using default voice {}",
                    speaker, index, defaultVoice);
            return defaultVoice;
        }
        return voice;
    }

    private byte[] synthesizeSegment(int index, DialogueSegment segment, String voice,
                                     ConcurrencyGuard guard) {
        try {
            if (voice == null) {
                throw new IllegalStateException("no voice available");
            }
            SpeechOptions options = new SpeechOptions(voice, properties.getFormat(), properties.getSpeed());
            byte[] audio;
            guard.acquire();
            try {
                audio = speechSynthesizer.synthesize(segment.line(), options);
            } finally {
                guard.release();
            }
            if (audio == null || audio.length == 0) {
                throw new IllegalStateException("provider returned no audio");
            }
            return audio;
        } catch (RuntimeException e) {
            SegmentSynthesisException failure = new SegmentSynthesisException(index, segment.speaker(), e);
            LOG.warn("{}: {} (line: '{}')", failure.getMessage(), e.getMessage(),
                    LogSanitizer.preview(segment.line(), LINE_PREVIEW_CHARS));
            return null;
        }
    }

    private void awaitAll(List<CompletableFuture<Void>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            LOG.error("Synthesis task terminated unexpectedly", e);
        }
    }
}
