package com.phillippitts.podcaster.config.orchestration;

import com.phillippitts.podcaster.config.prompt.ScriptPromptProperties;
import com.phillippitts.podcaster.service.audio.AudioAssembler;
import com.phillippitts.podcaster.service.fetch.ContentFetcher;
import com.phillippitts.podcaster.service.metrics.PipelineMetrics;
import com.phillippitts.podcaster.service.orchestration.GenerationOrchestrator;
import com.phillippitts.podcaster.service.orchestration.PipelineDependencies;
import com.phillippitts.podcaster.service.persistence.PodcastRepository;
import com.phillippitts.podcaster.service.prompt.PromptEngine;
import com.phillippitts.podcaster.service.prompt.registry.InMemoryPromptRegistry;
import com.phillippitts.podcaster.service.prompt.registry.PromptRegistry;
import com.phillippitts.podcaster.service.script.PodcastScriptPrompt;
import com.phillippitts.podcaster.service.tts.DialogueSynthesizer;
import com.phillippitts.podcaster.service.tts.SpeechSynthesizer;
import com.phillippitts.podcaster.service.voice.VoiceCatalog;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the GenerationOrchestrator explicitly; its collaborators are grouped in
 * {@link PipelineDependencies}.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public Clock podcasterClock() {
        return Clock.systemUTC();
    }

    /**
     * In-memory prompt registry seeded with version 1 of the script prompt, active.
     */
    @Bean
    public PromptRegistry promptRegistry(ScriptPromptProperties properties, Clock podcasterClock) {
        PromptRegistry registry = new InMemoryPromptRegistry(podcasterClock);
        registry.create(PodcastScriptPrompt.firstVersion(properties), 1, true);
        return registry;
    }

    @Bean
    public PipelineDependencies pipelineDependencies(PodcastRepository repository,
                                                     ContentFetcher contentFetcher,
                                                     PromptEngine promptEngine,
                                                     PromptRegistry promptRegistry,
                                                     DialogueSynthesizer synthesizer,
                                                     SpeechSynthesizer speechSynthesizer,
                                                     VoiceCatalog voiceCatalog,
                                                     AudioAssembler audioAssembler,
                                                     @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                                                     ApplicationEventPublisher publisher,
                                                     PipelineMetrics metrics,
                                                     Clock podcasterClock) {
        return new PipelineDependencies(repository, contentFetcher, promptEngine, promptRegistry,
                synthesizer, speechSynthesizer, voiceCatalog, audioAssembler, pipelineExecutor,
                publisher, metrics, podcasterClock);
    }

    @Bean
    public GenerationOrchestrator generationOrchestrator(PipelineDependencies pipelineDependencies) {
        return new GenerationOrchestrator(pipelineDependencies);
    }
}
