package com.phillippitts.podcaster.service.orchestration;

import com.phillippitts.podcaster.domain.DialogueSegment;
import com.phillippitts.podcaster.domain.PodcastStatus;
import com.phillippitts.podcaster.domain.PodcastUpdate;
import com.phillippitts.podcaster.exception.PipelineException;
import com.phillippitts.podcaster.exception.PodcasterException;
import com.phillippitts.podcaster.exception.ScriptGenerationException;
import com.phillippitts.podcaster.exception.VoiceNotFoundException;
import com.phillippitts.podcaster.service.orchestration.event.PodcastFinishedEvent;
import com.phillippitts.podcaster.service.prompt.PromptDefinition;
import com.phillippitts.podcaster.service.prompt.PromptError;
import com.phillippitts.podcaster.service.prompt.PromptResult;
import com.phillippitts.podcaster.service.prompt.registry.PromptVersion;
import com.phillippitts.podcaster.service.script.PodcastScript;
import com.phillippitts.podcaster.service.script.PodcastScriptPrompt;
import com.phillippitts.podcaster.service.script.ScriptParams;
import com.phillippitts.podcaster.service.tts.TtsProvider;
import com.phillippitts.podcaster.service.voice.VoiceProfile;
import com.phillippitts.podcaster.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Drives a podcast from source reference to finished audio and owns its status transitions.
 *
 * <p><b>State machine:</b> {@code PROCESSING -> SUCCESS | FAILED}. This class is the only writer
 * that moves a podcast out of {@code PROCESSING}.
 *
 * <p><b>Generation:</b> resolve voices, fetch content, run the active version of the script
 * prompt from the prompt registry, persist transcript and tags, synthesize each line, stitch,
 * measure, encode, then write the final record.
 * <b>Regeneration</b> starts at synthesis with a caller-supplied dialogue.
 *
 * <p><b>Failure handling:</b> any failure of a run, including one raised by the executor, is
 * formatted into a single message and written as {@code FAILED}. If that write fails too, the
 * problem is logged at FATAL and not retried.
 *
 * <p>Every run sets the Log4j2 {@code podcastId} context key; the executors' task decorator
 * carries it to synthesis workers.
 */
public class GenerationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(GenerationOrchestrator.class);

    static final String MDC_PODCAST_ID = "podcastId";
    static final String GENERATE = "generate";
    static final String REGENERATE = "regenerate";

    private final PipelineDependencies deps;

    public GenerationOrchestrator(PipelineDependencies deps) {
        this.deps = Objects.requireNonNull(deps, "deps must not be null");
    }

    /**
     * Starts a detached generation run.
     *
     * @return future completing once the run has written its final status; it never completes
     *         exceptionally because failures are already persisted
     */
    public CompletableFuture<Void> submitGeneration(GenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return spawn(GENERATE, request.podcastId(), () -> runGeneration(request));
    }

    /**
     * Starts a detached regeneration run.
     *
     * @see #submitGeneration(GenerationRequest)
     */
    public CompletableFuture<Void> submitRegeneration(RegenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return spawn(REGENERATE, request.podcastId(), () -> runRegeneration(request));
    }

    /**
     * Runs a full generation on the calling thread. Never throws.
     */
    public void generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        runGuarded(GENERATE, request.podcastId(), () -> runGeneration(request));
    }

    /**
     * Runs an audio regeneration on the calling thread. Never throws.
     */
    public void regenerate(RegenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        runGuarded(REGENERATE, request.podcastId(), () -> runRegeneration(request));
    }

    private CompletableFuture<Void> spawn(String pipeline, String podcastId, Runnable run) {
        CompletableFuture<Void> task;
        try {
            task = CompletableFuture.runAsync(() -> withPodcastContext(podcastId, run), deps.pipelineExecutor());
        } catch (RejectedExecutionException e) {
            task = CompletableFuture.failedFuture(e);
        }
        return task.handle((ignored, error) -> {
            if (error != null) {
                withPodcastContext(podcastId, () -> markFailed(pipeline, podcastId, unwrap(error)));
            }
            return null;
        });
    }

    private void runGuarded(String pipeline, String podcastId, Runnable run) {
        withPodcastContext(podcastId, () -> {
            try {
                run.run();
            } catch (RuntimeException e) {
                markFailed(pipeline, podcastId, e);
            }
        });
    }

    private void runGeneration(GenerationRequest request) {
        long start = System.nanoTime();
        String podcastId = request.podcastId();
        LOG.info("Generating podcast {} from {}", podcastId, request.source().detail());

        TtsProvider provider = deps.speechSynthesizer().activeProvider();
        VoiceProfile host = resolveVoice(request.hostVoiceId(), provider);
        VoiceProfile cohost = resolveVoice(request.cohostVoiceId(), provider);

        String content = timed("fetch", () -> deps.contentFetcher().fetch(request.source()));

        PromptVersion promptVersion = deps.promptRegistry().get(PodcastScriptPrompt.NAME);
        PromptDefinition<ScriptParams, PodcastScript> scriptPrompt = PodcastScriptPrompt.create(promptVersion);
        ScriptParams params = new ScriptParams(content, host.id(), host.description(),
                cohost.id(), cohost.description());
        LOG.debug("Podcast {} uses prompt {}", podcastId, promptVersion.label());
        PromptResult<PodcastScript> result = timed("script",
                () -> deps.promptEngine().run(scriptPrompt, params));
        if (!result.isSuccess()) {
            PromptError error = result.error();
            throw new ScriptGenerationException(error.type().label(), error.describe());
        }
        PodcastScript script = result.structuredOutput();
        LOG.info("Script for podcast {}: '{}' with {} lines", podcastId, script.title(), script.dialogue().size());

        deps.repository().updateTranscript(podcastId, script.dialogue());
        deps.repository().replaceTags(podcastId, script.tags());

        RenderedAudio audio = renderAudio(podcastId, script.dialogue(), host, cohost);

        deps.repository().update(podcastId, PodcastUpdate.builder()
                .title(script.title())
                .summary(script.summary())
                .audio(audio.reference(), audio.durationSeconds())
                .generatedAt(now())
                .status(PodcastStatus.SUCCESS)
                .build());
        finishSuccess(GENERATE, podcastId, start);
    }

    private void runRegeneration(RegenerationRequest request) {
        long start = System.nanoTime();
        String podcastId = request.podcastId();
        LOG.info("Regenerating audio for podcast {} ({} lines)", podcastId, request.dialogue().size());

        TtsProvider provider = deps.speechSynthesizer().activeProvider();
        VoiceProfile host = resolveVoice(request.hostVoiceId(), provider);
        VoiceProfile cohost = resolveVoice(request.cohostVoiceId(), provider);

        deps.repository().updateTranscript(podcastId, request.dialogue());

        RenderedAudio audio = renderAudio(podcastId, request.dialogue(), host, cohost);

        deps.repository().update(podcastId, PodcastUpdate.builder()
                .title(request.title())
                .audio(audio.reference(), audio.durationSeconds())
                .generatedAt(now())
                .status(PodcastStatus.SUCCESS)
                .build());
        finishSuccess(REGENERATE, podcastId, start);
    }

    private record RenderedAudio(String reference, int durationSeconds) {
    }

    private RenderedAudio renderAudio(String podcastId, List<DialogueSegment> dialogue,
                                      VoiceProfile host, VoiceProfile cohost) {
        Map<String, String> voiceMap = new HashMap<>();
        voiceMap.put(host.id(), host.voiceHandle());
        voiceMap.put(cohost.id(), cohost.voiceHandle());

        List<byte[]> buffers = timed("synthesis",
                () -> deps.synthesizer().synthesize(dialogue, voiceMap, host.voiceHandle()));
        long usable = buffers.stream().filter(Objects::nonNull).count();
        if (usable == 0) {
            throw new PipelineException("No dialogue lines could be synthesized", "synthesis");
        }
        if (usable < buffers.size()) {
            LOG.warn("Podcast {} continues with {}/{} synthesized lines", podcastId, usable, buffers.size());
        }

        return timed("assembly", () -> {
            byte[] merged = deps.audioAssembler().stitch(buffers, podcastId);
            int duration = deps.audioAssembler().duration(merged);
            return new RenderedAudio(deps.audioAssembler().encode(merged), duration);
        });
    }

    private VoiceProfile resolveVoice(String personalityId, TtsProvider provider) {
        return deps.voiceCatalog().resolve(personalityId, provider)
                .orElseThrow(() -> new VoiceNotFoundException(personalityId, provider.name()));
    }

    private void finishSuccess(String pipeline, String podcastId, long startNanos) {
        deps.metrics().recordStageLatency(pipeline + ".total", System.nanoTime() - startNanos);
        deps.metrics().incrementOutcome(pipeline, "success");
        LOG.info("Podcast {} {} succeeded in {}ms", podcastId, pipeline, TimeUtils.elapsedMillis(startNanos));
        publish(new PodcastFinishedEvent(podcastId, pipeline, PodcastStatus.SUCCESS, null, now()));
    }

    private void markFailed(String pipeline, String podcastId, Throwable error) {
        String message = (REGENERATE.equals(pipeline) ? "Regeneration failed: " : "Generation failed: ")
                + describe(error);
        if (error instanceof PodcasterException) {
            LOG.warn("Podcast {} {} failed: {}", podcastId, pipeline, error.getMessage());
        } else {
            LOG.error("Podcast {} {} failed with an unexpected error", podcastId, pipeline, error);
        }
        deps.metrics().incrementOutcome(pipeline, "failed");

        try {
            deps.repository().updateStatus(podcastId, PodcastStatus.FAILED, message);
        } catch (RuntimeException writeFailure) {
            LOG.fatal("CRITICAL FAILURE: could not mark podcast {} as FAILED (original error: {})",
                    podcastId, message, writeFailure);
            return;
        }
        publish(new PodcastFinishedEvent(podcastId, pipeline, PodcastStatus.FAILED, message, now()));
    }

    private void publish(PodcastFinishedEvent event) {
        try {
            deps.publisher().publishEvent(event);
        } catch (RuntimeException e) {
            LOG.error("Listener failed for {} of podcast {}", event.status(), event.podcastId(), e);
        }
    }

    private <T> T timed(String stage, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            return work.get();
        } finally {
            deps.metrics().recordStageLatency(stage, System.nanoTime() - start);
        }
    }

    private Instant now() {
        return deps.clock().instant();
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (error instanceof PodcasterException) {
            return message;
        }
        String type = error.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void withPodcastContext(String podcastId, Runnable body) {
        String previous = ThreadContext.get(MDC_PODCAST_ID);
        ThreadContext.put(MDC_PODCAST_ID, podcastId);
        try {
            body.run();
        } finally {
            if (previous == null) {
                ThreadContext.remove(MDC_PODCAST_ID);
            } else {
                ThreadContext.put(MDC_PODCAST_ID, previous);
            }
        }
    }
}
