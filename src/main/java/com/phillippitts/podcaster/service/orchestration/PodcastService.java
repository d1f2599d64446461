package com.phillippitts.podcaster.service.orchestration;

import com.phillippitts.podcaster.domain.DialogueSegment;
import com.phillippitts.podcaster.domain.Podcast;
import com.phillippitts.podcaster.domain.PodcastEdit;
import com.phillippitts.podcaster.domain.PodcastStatus;
import com.phillippitts.podcaster.domain.PodcastUpdate;
import com.phillippitts.podcaster.domain.SourceReference;
import com.phillippitts.podcaster.domain.Transcript;
import com.phillippitts.podcaster.exception.InvalidPodcastRequestException;
import com.phillippitts.podcaster.exception.PodcastNotFoundException;
import com.phillippitts.podcaster.service.persistence.PodcastRepository;
import com.phillippitts.podcaster.service.tts.SpeechSynthesizer;
import com.phillippitts.podcaster.service.tts.TtsProvider;
import com.phillippitts.podcaster.service.voice.VoiceCatalog;
import com.phillippitts.podcaster.service.voice.VoiceDirectory;
import com.phillippitts.podcaster.service.voice.VoiceProfile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for callers: creates podcasts, applies edits and answers lookups.
 *
 * <p>Requests are validated before anything is written. Pipeline work is handed to the
 * {@link GenerationOrchestrator} and runs detached; callers get the {@code processing} record
 * back immediately.
 */
@Service
public class PodcastService {

    private static final Logger LOG = LogManager.getLogger(PodcastService.class);

    static final String DEFAULT_HOST = "Arthur";
    static final String DEFAULT_COHOST = "Chloe";

    private final PodcastRepository repository;
    private final GenerationOrchestrator orchestrator;
    private final VoiceCatalog voiceCatalog;
    private final VoiceDirectory voiceDirectory;
    private final SpeechSynthesizer speechSynthesizer;

    public PodcastService(PodcastRepository repository,
                          GenerationOrchestrator orchestrator,
                          VoiceCatalog voiceCatalog,
                          VoiceDirectory voiceDirectory,
                          SpeechSynthesizer speechSynthesizer) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.voiceCatalog = Objects.requireNonNull(voiceCatalog, "voiceCatalog");
        this.voiceDirectory = Objects.requireNonNull(voiceDirectory, "voiceDirectory");
        this.speechSynthesizer = Objects.requireNonNull(speechSynthesizer, "speechSynthesizer");
    }

    /**
     * Creates a podcast and starts generating it.
     *
     * @param hostVoiceId   host personality id, "Arthur" when null
     * @param cohostVoiceId cohost personality id, "Chloe" when null
     * @return the freshly created {@code processing} record
     * @throws InvalidPodcastRequestException if the request is rejected; nothing is written
     */
    public Podcast create(String ownerId, SourceReference source, String hostVoiceId, String cohostVoiceId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidPodcastRequestException("owner id is required");
        }
        if (source == null || source.detail() == null || source.detail().isBlank()) {
            throw new InvalidPodcastRequestException("source reference is required");
        }
        String host = hostVoiceId == null ? DEFAULT_HOST : hostVoiceId;
        String cohost = cohostVoiceId == null ? DEFAULT_COHOST : cohostVoiceId;
        validateVoices(host, cohost);

        Podcast podcast = repository.createInitial(ownerId, source, host, cohost);
        LOG.info("Created podcast {} for owner {} (host={}, cohost={})", podcast.id(), ownerId, host, cohost);
        orchestrator.submitGeneration(new GenerationRequest(podcast.id(), source, host, cohost));
        return podcast;
    }

    /**
     * Applies a user edit.
     *
     * <p>A changed dialogue or voice resets the podcast to {@code processing}, clears its audio
     * and starts a regeneration. Anything else is a metadata edit, written directly; it marks
     * the podcast {@code success} when audio already exists.
     *
     * @return the record as written by this call
     * @throws PodcastNotFoundException       if the podcast is missing or owned by someone else
     * @throws InvalidPodcastRequestException if the edit is rejected; nothing is written
     */
    public Podcast edit(PodcastEdit edit) {
        Objects.requireNonNull(edit, "edit must not be null");
        Podcast current = findById(edit.ownerId(), edit.podcastId());

        if (edit.dialogue() != null) {
            validateDialogue(edit.dialogue());
        }
        String host = edit.hostVoiceId() == null ? current.hostVoiceId() : edit.hostVoiceId();
        String cohost = edit.cohostVoiceId() == null ? current.cohostVoiceId() : edit.cohostVoiceId();
        boolean voicesChanged = !host.equals(current.hostVoiceId()) || !cohost.equals(current.cohostVoiceId());
        if (voicesChanged) {
            validateVoices(host, cohost);
        }

        List<DialogueSegment> stored = repository.findTranscript(current.id())
                .map(Transcript::segments)
                .orElse(List.of());
        boolean dialogueChanged = edit.dialogue() != null && !edit.dialogue().equals(stored);

        if (!dialogueChanged && !voicesChanged) {
            return applyMetadata(current, edit);
        }
        if (current.status() == PodcastStatus.PROCESSING) {
            throw new InvalidPodcastRequestException("podcast " + current.id() + " is still being generated");
        }
        List<DialogueSegment> dialogue = dialogueChanged ? edit.dialogue() : stored;
        if (dialogue.isEmpty()) {
            throw new InvalidPodcastRequestException("podcast " + current.id() + " has no dialogue to synthesize");
        }

        Podcast reset = repository.update(current.id(), PodcastUpdate.builder()
                .title(edit.title())
                .summary(edit.summary())
                .voices(host, cohost)
                .clearAudio()
                .status(PodcastStatus.PROCESSING)
                .build());
        LOG.info("Regenerating podcast {} (dialogueChanged={}, voicesChanged={})",
                current.id(), dialogueChanged, voicesChanged);
        orchestrator.submitRegeneration(new RegenerationRequest(current.id(), dialogue, host, cohost, edit.title()));
        return reset;
    }

    public Podcast findById(String ownerId, String podcastId) {
        return repository.findById(podcastId)
                .filter(p -> p.ownerId().equals(ownerId))
                .orElseThrow(() -> new PodcastNotFoundException(podcastId));
    }

    public List<Podcast> findByOwner(String ownerId) {
        return repository.findByOwner(ownerId);
    }

    public Transcript transcript(String ownerId, String podcastId) {
        Podcast podcast = findById(ownerId, podcastId);
        return repository.findTranscript(podcast.id()).orElseGet(() -> Transcript.empty(podcast.id()));
    }

    public Set<String> tags(String ownerId, String podcastId) {
        return repository.findTags(findById(ownerId, podcastId).id());
    }

    /**
     * Deletes a podcast with its transcript and tags. A run still in flight will fail to write
     * its final status.
     */
    public void delete(String ownerId, String podcastId) {
        Podcast podcast = findById(ownerId, podcastId);
        repository.delete(podcast.id());
        LOG.info("Deleted podcast {} (status was {})", podcast.id(), podcast.status());
    }

    public List<VoiceProfile> availableVoices() {
        return voiceDirectory.availableVoices();
    }

    private Podcast applyMetadata(Podcast current, PodcastEdit edit) {
        PodcastUpdate.Builder update = PodcastUpdate.builder()
                .title(edit.title())
                .summary(edit.summary());
        if (current.hasAudio()) {
            update.status(PodcastStatus.SUCCESS);
        }
        LOG.debug("Metadata-only edit of podcast {}", current.id());
        return repository.update(current.id(), update.build());
    }

    private void validateVoices(String host, String cohost) {
        if (host.equals(cohost)) {
            throw new InvalidPodcastRequestException("host and cohost must use different voices");
        }
        TtsProvider provider = speechSynthesizer.activeProvider();
        for (String id : List.of(host, cohost)) {
            if (voiceCatalog.resolve(id, provider).isEmpty()) {
                throw new InvalidPodcastRequestException("unknown voice '" + id + "' for provider " + provider);
            }
        }
    }

    private static void validateDialogue(List<DialogueSegment> dialogue) {
        if (dialogue.isEmpty()) {
            throw new InvalidPodcastRequestException("dialogue must not be empty");
        }
        for (int i = 0; i < dialogue.size(); i++) {
            DialogueSegment segment = dialogue.get(i);
            if (segment == null || segment.speaker() == null || segment.speaker().isBlank()) {
                throw new InvalidPodcastRequestException("dialogue[" + i + "] has no speaker");
            }
            if (segment.line() == null || segment.line().isBlank()) {
                throw new InvalidPodcastRequestException("dialogue[" + i + "] has an empty line");
            }
        }
    }
}
