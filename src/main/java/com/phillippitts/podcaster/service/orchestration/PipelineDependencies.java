package com.phillippitts.podcaster.service.orchestration;

import com.phillippitts.podcaster.service.audio.AudioAssembler;
import com.phillippitts.podcaster.service.fetch.ContentFetcher;
import com.phillippitts.podcaster.service.metrics.PipelineMetrics;
import com.phillippitts.podcaster.service.persistence.PodcastRepository;
import com.phillippitts.podcaster.service.prompt.PromptEngine;
import com.phillippitts.podcaster.service.prompt.registry.PromptRegistry;
import com.phillippitts.podcaster.service.tts.DialogueSynthesizer;
import com.phillippitts.podcaster.service.tts.SpeechSynthesizer;
import com.phillippitts.podcaster.service.voice.VoiceCatalog;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Everything the {@link GenerationOrchestrator} talks to, passed in one place.
 *
 * @param repository        podcast store, the pipeline's only state channel
 * @param contentFetcher    source content retrieval
 * @param promptEngine      structured prompt execution
 * @param promptRegistry    versioned prompts, consulted for the active script prompt on every run
 * @param synthesizer       per-line speech fan-out
 * @param speechSynthesizer provider client, consulted for the active provider
 * @param voiceCatalog      personality to voice lookup
 * @param audioAssembler    stitch, duration and encode
 * @param pipelineExecutor  executor for detached runs
 * @param publisher         completion event sink
 * @param metrics           pipeline metrics
 * @param clock             time source for generated-at stamps
 */
public record PipelineDependencies(
        PodcastRepository repository,
        ContentFetcher contentFetcher,
        PromptEngine promptEngine,
        PromptRegistry promptRegistry,
        DialogueSynthesizer synthesizer,
        SpeechSynthesizer speechSynthesizer,
        VoiceCatalog voiceCatalog,
        AudioAssembler audioAssembler,
        Executor pipelineExecutor,
        ApplicationEventPublisher publisher,
        PipelineMetrics metrics,
        Clock clock
) {

    public PipelineDependencies {
        Objects.requireNonNull(repository, "repository must not be null");
        Objects.requireNonNull(contentFetcher, "contentFetcher must not be null");
        Objects.requireNonNull(promptEngine, "promptEngine must not be null");
        Objects.requireNonNull(promptRegistry, "promptRegistry must not be null");
        Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        Objects.requireNonNull(speechSynthesizer, "speechSynthesizer must not be null");
        Objects.requireNonNull(voiceCatalog, "voiceCatalog must not be null");
        Objects.requireNonNull(audioAssembler, "audioAssembler must not be null");
        Objects.requireNonNull(pipelineExecutor, "pipelineExecutor must not be null");
        Objects.requireNonNull(publisher, "publisher must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
    }
}
