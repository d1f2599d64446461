package com.phillippitts.podcaster.service.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.podcaster.config.ThreadPoolConfig;
import com.phillippitts.podcaster.config.audio.AudioToolsProperties;
import com.phillippitts.podcaster.config.prompt.ScriptPromptProperties;
import com.phillippitts.podcaster.config.properties.SynthesisProperties;
import com.phillippitts.podcaster.config.properties.ThreadPoolProperties;
import com.phillippitts.podcaster.domain.DialogueSegment;
import com.phillippitts.podcaster.domain.Podcast;
import com.phillippitts.podcaster.domain.PodcastStatus;
import com.phillippitts.podcaster.domain.SourceReference;
import com.phillippitts.podcaster.exception.ContentFetchException;
import com.phillippitts.podcaster.service.audio.AudioAssembler;
import com.phillippitts.podcaster.service.audio.AudioToolchain;
import com.phillippitts.podcaster.service.fetch.ContentFetcher;
import com.phillippitts.podcaster.service.llm.ChatOptions;
import com.phillippitts.podcaster.service.llm.ChatResponse;
import com.phillippitts.podcaster.service.llm.LlmClient;
import com.phillippitts.podcaster.service.metrics.PipelineMetrics;
import com.phillippitts.podcaster.service.orchestration.event.PodcastFinishedEvent;
import com.phillippitts.podcaster.service.persistence.InMemoryPodcastRepository;
import com.phillippitts.podcaster.service.prompt.PromptEngine;
import com.phillippitts.podcaster.service.prompt.registry.InMemoryPromptRegistry;
import com.phillippitts.podcaster.service.prompt.registry.PromptDraft;
import com.phillippitts.podcaster.service.script.PodcastScriptPrompt;
import com.phillippitts.podcaster.service.tts.DialogueSynthesizer;
import com.phillippitts.podcaster.service.voice.VoiceCatalog;
import com.phillippitts.podcaster.testutil.EventCapturingPublisher;
import com.phillippitts.podcaster.testutil.FakeSpeechSynthesizer;
import com.phillippitts.podcaster.testutil.LogCapture;
import com.phillippitts.podcaster.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final SourceReference SOURCE = SourceReference.url("https://example.com/robots");

    private static final String SCRIPT = "```json\n{"
            + "\"title\":\"Tiny Robots\","
            + "\"summary\":\"Two hosts talk about tiny robots.\","
            + "\"tags\":[\"robots\",\"science\"],"
            + "\"dialogue\":["
            + "{\"speaker\":\"Arthur\",\"line\":\"Welcome back.\"},"
            + "{\"speaker\":\"Chloe\",\"line\":\"Today: tiny robots.\"},"
            + "{\"speaker\":\"Arthur\",\"line\":\"Let's dig in.\"}"
            + "]}\n```";

    @TempDir
    Path scratch;

    private InMemoryPodcastRepository repository;
    private FakeSpeechSynthesizer speech;
    private RecordingToolchain toolchain;
    private EventCapturingPublisher publisher;
    private final AtomicReference<String> modelReply = new AtomicReference<>(SCRIPT);
    private ContentFetcher fetcher = source -> "<p>Robots are getting smaller.</p>";
    private InMemoryPromptRegistry prompts;
    private final List<ChatOptions> modelOptions = new CopyOnWriteArrayList<>();
    private final List<String> userPrompts = new CopyOnWriteArrayList<>();

    /** Concatenates inputs and reports a fixed duration. */
    private static final class RecordingToolchain implements AudioToolchain {
        final List<List<Path>> merges = new ArrayList<>();

        @Override
        public void merge(List<Path> orderedInputs, Path output) {
            merges.add(List.copyOf(orderedInputs));
            ByteArrayOutputStream merged = new ByteArrayOutputStream();
            try {
                for (Path input : orderedInputs) {
                    merged.write(Files.readAllBytes(input));
                }
                Files.write(output, merged.toByteArray());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public double probe(Path file) {
            return 12.6;
        }
    }

    @BeforeEach
    void setUp() {
        repository = new InMemoryPodcastRepository();
        speech = new FakeSpeechSynthesizer();
        toolchain = new RecordingToolchain();
        publisher = new EventCapturingPublisher();
        prompts = new InMemoryPromptRegistry(Clock.fixed(NOW, ZoneOffset.UTC));
        prompts.create(PodcastScriptPrompt.firstVersion(ScriptPromptProperties.defaults()), 1, true);
    }

    private GenerationOrchestrator orchestrator(Executor pipelineExecutor) {
        PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry());
        LlmClient llm = (messages, options) -> {
            modelOptions.add(options);
            userPrompts.add(messages.get(1).content());
            return ChatResponse.of(modelReply.get());
        };
        PromptEngine engine = new PromptEngine(llm,
                Validation.buildDefaultValidatorFactory().getValidator(), new ObjectMapper());
        DialogueSynthesizer synthesizer = new DialogueSynthesizer(speech, new SyncExecutor(),
                new SynthesisProperties(), metrics);
        AudioAssembler assembler = new AudioAssembler(toolchain,
                AudioToolsProperties.withScratchDir(scratch.toString()));
        ContentFetcher delegatingFetcher = source -> fetcher.fetch(source);
        return new GenerationOrchestrator(new PipelineDependencies(repository, delegatingFetcher, engine,
                prompts, synthesizer, speech,
                new VoiceCatalog(), assembler, pipelineExecutor, publisher, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    private GenerationOrchestrator orchestrator() {
        return orchestrator(new SyncExecutor());
    }

    private Podcast create() {
        return repository.createInitial("owner-1", SOURCE, "Arthur", "Chloe");
    }

    private Podcast reload(Podcast podcast) {
        return repository.findById(podcast.id()).orElseThrow();
    }

    @Test
    void generationPersistsScriptAndAudio() {
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        Podcast done = reload(podcast);
        assertThat(done.status()).isEqualTo(PodcastStatus.SUCCESS);
        assertThat(done.title()).isEqualTo("Tiny Robots");
        assertThat(done.summary()).isEqualTo("Two hosts talk about tiny robots.");
        assertThat(done.audioReference()).startsWith("data:audio/mp3;base64,");
        assertThat(done.durationSeconds()).isEqualTo(13);
        assertThat(done.generatedAt()).isEqualTo(NOW);
        assertThat(done.errorMessage()).isNull();
        assertThat(repository.findTranscript(podcast.id()).orElseThrow().segments()).hasSize(3);
        assertThat(repository.findTags(podcast.id())).containsExactly("robots", "science");

        assertThat(publisher.finishedEvents()).hasSize(1);
        PodcastFinishedEvent event = publisher.finishedEvents().get(0);
        assertThat(event.succeeded()).isTrue();
        assertThat(event.pipeline()).isEqualTo("generate");
    }

    @Test
    void speakersAreVoicedWithProviderHandles() {
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        assertThat(speech.calls())
                .extracting(FakeSpeechSynthesizer.Call::voice)
                .containsExactly("echo", "nova", "echo");
        assertThat(toolchain.merges).hasSize(1);
        assertThat(toolchain.merges.get(0)).hasSize(3);
    }

    @Test
    void failedLineIsDroppedButPodcastSucceeds() {
        speech.failOn("Today: tiny robots.");
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        assertThat(reload(podcast).status()).isEqualTo(PodcastStatus.SUCCESS);
        assertThat(toolchain.merges.get(0)).hasSize(2);
        assertThat(repository.findTranscript(podcast.id()).orElseThrow().segments()).hasSize(3);
    }

    @Test
    void invalidScriptFailsWithoutWritingTranscript() {
        modelReply.set("{\"title\":\"T\",\"summary\":\"S\",\"tags\":[\"a\"],"
                + "\"dialogue\":[{\"speaker\":\"Arthur\",\"line\":\"\"}]}");
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        Podcast failed = reload(podcast);
        assertThat(failed.status()).isEqualTo(PodcastStatus.FAILED);
        assertThat(failed.errorMessage())
                .startsWith("Generation failed: ")
                .contains("OutputValidationError");
        assertThat(repository.findTranscript(podcast.id()).orElseThrow().isEmpty()).isTrue();
        assertThat(repository.findTags(podcast.id())).isEmpty();
        assertThat(speech.calls()).isEmpty();
        assertThat(publisher.finishedEvents().get(0).errorMessage()).isEqualTo(failed.errorMessage());
    }

    @Test
    void allLinesFailingSkipsAssembly() {
        speech.failOn("Welcome back.").failOn("Today: tiny robots.").failOn("Let's dig in.");
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        Podcast failed = reload(podcast);
        assertThat(failed.status()).isEqualTo(PodcastStatus.FAILED);
        assertThat(failed.errorMessage()).isEqualTo("Generation failed: No dialogue lines could be synthesized");
        assertThat(toolchain.merges).isEmpty();
    }

    @Test
    void unknownVoiceFailsBeforeFetching() {
        List<SourceReference> fetched = new ArrayList<>();
        fetcher = source -> {
            fetched.add(source);
            return "content";
        };
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Zed"));

        Podcast failed = reload(podcast);
        assertThat(failed.status()).isEqualTo(PodcastStatus.FAILED);
        assertThat(failed.errorMessage()).contains("Zed");
        assertThat(fetched).isEmpty();
    }

    @Test
    void fetchFailureIsPersisted() {
        fetcher = source -> {
            throw new ContentFetchException(source.detail(), 503);
        };
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        assertThat(reload(podcast).errorMessage()).startsWith("Generation failed: ").contains("503");
    }

    @Test
    void unexpectedErrorIsDescribedByType() {
        fetcher = source -> {
            throw new IllegalStateException("socket closed");
        };
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        assertThat(reload(podcast).errorMessage())
                .isEqualTo("Generation failed: IllegalStateException: socket closed");
    }

    @Test
    void podcastDeletedMidRunIsLoggedFatal() {
        Podcast podcast = create();
        fetcher = source -> {
            repository.delete(podcast.id());
            throw new IllegalStateException("late failure");
        };

        try (LogCapture logs = LogCapture.attach(GenerationOrchestrator.class)) {
            orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

            List<String> fatal = logs.messagesAt(Level.FATAL);
            assertThat(fatal).hasSize(1);
            assertThat(fatal.get(0)).contains("CRITICAL FAILURE").contains(podcast.id());
        }
        assertThat(publisher.finishedEvents()).isEmpty();
    }

    @Test
    void rejectedSubmissionMarksPodcastFailed() {
        Podcast podcast = create();
        Executor rejecting = task -> {
            throw new RejectedExecutionException("pipeline queue full");
        };

        orchestrator(rejecting)
                .submitGeneration(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"))
                .join();

        assertThat(reload(podcast).errorMessage())
                .isEqualTo("Generation failed: RejectedExecutionException: pipeline queue full");
    }

    private static ThreadPoolTaskExecutor singleSlotPipelinePool() {
        ThreadPoolProperties.PoolProperties pool = new ThreadPoolProperties.PoolProperties();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(0);
        pool.setThreadNamePrefix("pipeline-");
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setPipeline(pool);
        return new ThreadPoolConfig(properties).pipelineExecutor();
    }

    @Test
    void saturatedPipelinePoolFailsTheOverflowRunWithoutRunningItOnTheCaller() throws Exception {
        ThreadPoolTaskExecutor pool = singleSlotPipelinePool();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> fetchThreads = new CopyOnWriteArrayList<>();
        fetcher = source -> {
            fetchThreads.add(Thread.currentThread().getName());
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "<p>Robots are getting smaller.</p>";
        };
        Podcast first = create();
        Podcast second = create();
        try {
            GenerationOrchestrator orchestrator = orchestrator(pool);
            CompletableFuture<Void> firstRun =
                    orchestrator.submitGeneration(new GenerationRequest(first.id(), SOURCE, "Arthur", "Chloe"));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            CompletableFuture<Void> overflow =
                    orchestrator.submitGeneration(new GenerationRequest(second.id(), SOURCE, "Arthur", "Chloe"));

            assertThat(overflow).isDone();
            Podcast rejected = reload(second);
            assertThat(rejected.status()).isEqualTo(PodcastStatus.FAILED);
            assertThat(rejected.errorMessage()).startsWith("Generation failed: TaskRejectedException");
            assertThat(reload(first).status()).isEqualTo(PodcastStatus.PROCESSING);

            release.countDown();
            firstRun.get(5, TimeUnit.SECONDS);
            assertThat(reload(first).status()).isEqualTo(PodcastStatus.SUCCESS);
            assertThat(fetchThreads).containsExactly("pipeline-1");
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    @Test
    void runSubmittedAfterShutdownIsMarkedFailed() throws Exception {
        ThreadPoolTaskExecutor pool = singleSlotPipelinePool();
        pool.shutdown();
        Podcast podcast = create();

        orchestrator(pool)
                .submitGeneration(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"))
                .get(5, TimeUnit.SECONDS);

        Podcast failed = reload(podcast);
        assertThat(failed.status()).isEqualTo(PodcastStatus.FAILED);
        assertThat(failed.errorMessage()).startsWith("Generation failed: TaskRejectedException");
        assertThat(publisher.finishedEvents()).singleElement()
                .extracting(PodcastFinishedEvent::status)
                .isEqualTo(PodcastStatus.FAILED);
    }

    @Test
    void scriptPromptComesFromTheActiveRegistryVersion() {
        prompts.createNewVersion(new PromptDraft(PodcastScriptPrompt.NAME,
                "Write a short show for {{hostName}} and {{cohostName}} about: {{htmlContent}}",
                "You write radio shows.", 0.3, 1500), true);
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        assertThat(reload(podcast).status()).isEqualTo(PodcastStatus.SUCCESS);
        assertThat(userPrompts.get(0))
                .startsWith("Write a short show for Arthur and Chloe about: <p>Robots are getting smaller.</p>");
        ChatOptions sent = modelOptions.get(0);
        assertThat(sent.temperature()).isEqualTo(0.3);
        assertThat(sent.maxTokens()).isEqualTo(1500);
        assertThat(sent.systemPrompt()).isEqualTo("You write radio shows.");
    }

    @Test
    void reactivatedVersionIsUsedByTheNextRun() {
        prompts.createNewVersion(new PromptDraft(PodcastScriptPrompt.NAME,
                "Version two for {{hostName}}: {{htmlContent}}", null, 0.9, 2000), true);
        prompts.setActive(PodcastScriptPrompt.NAME, 1);
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        assertThat(userPrompts.get(0)).startsWith("You are a podcast script writer.");
        assertThat(modelOptions.get(0).temperature()).isEqualTo(0.7);
        assertThat(modelOptions.get(0).maxTokens()).isEqualTo(3000);
    }

    @Test
    void missingActiveScriptPromptFailsTheRun() {
        prompts = new InMemoryPromptRegistry(Clock.fixed(NOW, ZoneOffset.UTC));
        Podcast podcast = create();

        orchestrator().generate(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"));

        Podcast failed = reload(podcast);
        assertThat(failed.status()).isEqualTo(PodcastStatus.FAILED);
        assertThat(failed.errorMessage())
                .isEqualTo("Generation failed: No active prompt for key 'podcast-script-generator'");
        assertThat(modelOptions).isEmpty();
    }

    @Test
    void submittedRunCompletesNormally() {
        Podcast podcast = create();

        orchestrator()
                .submitGeneration(new GenerationRequest(podcast.id(), SOURCE, "Arthur", "Chloe"))
                .join();

        assertThat(reload(podcast).status()).isEqualTo(PodcastStatus.SUCCESS);
    }

    @Test
    void regenerationRebuildsAudioFromEditedDialogue() {
        Podcast podcast = create();
        List<DialogueSegment> dialogue = List.of(
                new DialogueSegment("Maya", "Hello there."),
                new DialogueSegment("Sam", "Hi Maya."));

        orchestrator().regenerate(new RegenerationRequest(podcast.id(), dialogue, "Maya", "Sam", "Edited"));

        Podcast done = reload(podcast);
        assertThat(done.status()).isEqualTo(PodcastStatus.SUCCESS);
        assertThat(done.title()).isEqualTo("Edited");
        assertThat(done.hasAudio()).isTrue();
        assertThat(repository.findTranscript(podcast.id()).orElseThrow().segments()).isEqualTo(dialogue);
        assertThat(speech.calls()).extracting(FakeSpeechSynthesizer.Call::voice).containsExactly("shimmer", "alloy");
        assertThat(publisher.finishedEvents().get(0).pipeline()).isEqualTo("regenerate");
    }

    @Test
    void regenerationFailureUsesRegenerationPrefix() {
        speech.failOn("Hello there.");
        Podcast podcast = create();

        orchestrator().regenerate(new RegenerationRequest(podcast.id(),
                List.of(new DialogueSegment("Arthur", "Hello there.")), "Arthur", "Chloe", null));

        assertThat(reload(podcast).errorMessage())
                .isEqualTo("Regeneration failed: No dialogue lines could be synthesized");
    }
}
