package com.phillippitts.podcaster.service.persistence;

import com.phillippitts.podcaster.domain.DialogueSegment;
import com.phillippitts.podcaster.domain.Podcast;
import com.phillippitts.podcaster.domain.PodcastStatus;
import com.phillippitts.podcaster.domain.PodcastUpdate;
import com.phillippitts.podcaster.domain.SourceReference;
import com.phillippitts.podcaster.domain.Transcript;
import com.phillippitts.podcaster.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Thread-safe in-memory {@link PodcastRepository}.
 *
 * <p>Podcast, transcript and tags of one id live in a single immutable entry that is replaced
 * atomically with {@link ConcurrentHashMap#compute}, so readers never see a half-applied write.
 */
@Repository
public class InMemoryPodcastRepository implements PodcastRepository {

    private static final Logger LOG = LogManager.getLogger(InMemoryPodcastRepository.class);
    static final String UNKNOWN_ERROR = "Unknown error";

    private record Entry(Podcast podcast, Transcript transcript, Set<String> tags) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPodcastRepository() {
        this(Clock.systemUTC());
    }

    InMemoryPodcastRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Podcast createInitial(String ownerId, SourceReference source, String hostVoiceId, String cohostVoiceId) {
        Instant now = clock.instant();
        String id = UUID.randomUUID().toString();
        Podcast podcast;
        try {
            podcast = Podcast.builder()
                    .id(id)
                    .ownerId(ownerId)
                    .title("Podcast from " + source.detail())
                    .status(PodcastStatus.PROCESSING)
                    .source(source)
                    .hostVoiceId(hostVoiceId)
                    .cohostVoiceId(cohostVoiceId)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new PersistenceException("Cannot create podcast: " + e.getMessage(), e);
        }
        entries.put(id, new Entry(podcast, new Transcript(id, List.of(), now), Set.of()));
        LOG.debug("Created podcast {} for owner {}", id, ownerId);
        return podcast;
    }

    @Override
    public Podcast updateStatus(String podcastId, PodcastStatus status, String errorMessage) {
        return mutatePodcast(podcastId, p -> {
            Podcast.Builder b = p.toBuilder().status(status);
            if (status == PodcastStatus.FAILED) {
                b.errorMessage(errorMessage == null || errorMessage.isBlank() ? UNKNOWN_ERROR : errorMessage);
            } else if (status == PodcastStatus.SUCCESS) {
                b.errorMessage(null);
            }
            return b;
        });
    }

    @Override
    public void updateTranscript(String podcastId, List<DialogueSegment> segments) {
        Instant now = clock.instant();
        mutate(podcastId, e -> new Entry(e.podcast().toBuilder().updatedAt(now).build(),
                new Transcript(podcastId, segments, now), e.tags()));
    }

    @Override
    public void addTags(String podcastId, Collection<String> tags) {
        mutate(podcastId, e -> {
            Set<String> merged = new LinkedHashSet<>(e.tags());
            merged.addAll(normalize(tags));
            return new Entry(e.podcast(), e.transcript(), Collections.unmodifiableSet(merged));
        });
    }

    @Override
    public void replaceTags(String podcastId, Collection<String> tags) {
        mutate(podcastId, e -> new Entry(e.podcast(), e.transcript(),
                Collections.unmodifiableSet(normalize(tags))));
    }

    @Override
    public Podcast update(String podcastId, PodcastUpdate update) {
        return mutatePodcast(podcastId, p -> {
            Podcast.Builder b = p.toBuilder();
            if (update.title() != null) {
                b.title(update.title());
            }
            if (update.summary() != null) {
                b.summary(update.summary());
            }
            if (update.hostVoiceId() != null) {
                b.hostVoiceId(update.hostVoiceId());
            }
            if (update.cohostVoiceId() != null) {
                b.cohostVoiceId(update.cohostVoiceId());
            }
            if (update.clearAudio()) {
                b.audioReference(null).durationSeconds(null);
            } else if (update.audioReference() != null) {
                b.audioReference(update.audioReference()).durationSeconds(update.durationSeconds());
            }
            if (update.generatedAt() != null) {
                b.generatedAt(update.generatedAt());
            }
            if (update.status() != null) {
                b.status(update.status());
                if (update.status() == PodcastStatus.FAILED) {
                    b.errorMessage(update.errorMessage() == null ? UNKNOWN_ERROR : update.errorMessage());
                } else {
                    b.errorMessage(null);
                }
            }
            return b;
        });
    }

    @Override
    public Optional<Podcast> findById(String podcastId) {
        Entry entry = podcastId == null ? null : entries.get(podcastId);
        return Optional.ofNullable(entry).map(Entry::podcast);
    }

    @Override
    public List<Podcast> findByOwner(String ownerId) {
        return entries.values().stream()
                .map(Entry::podcast)
                .filter(p -> p.ownerId().equals(ownerId))
                .sorted(Comparator.comparing(Podcast::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public Optional<Transcript> findTranscript(String podcastId) {
        Entry entry = podcastId == null ? null : entries.get(podcastId);
        return Optional.ofNullable(entry).map(Entry::transcript);
    }

    @Override
    public Set<String> findTags(String podcastId) {
        Entry entry = podcastId == null ? null : entries.get(podcastId);
        return entry == null ? Set.of() : entry.tags();
    }

    @Override
    public boolean delete(String podcastId) {
        boolean removed = podcastId != null && entries.remove(podcastId) != null;
        if (removed) {
            LOG.debug("Deleted podcast {}", podcastId);
        }
        return removed;
    }

    private Podcast mutatePodcast(String podcastId, Function<Podcast, Podcast.Builder> change) {
        Instant now = clock.instant();
        Entry updated = mutate(podcastId, e -> new Entry(
                change.apply(e.podcast()).updatedAt(now).build(), e.transcript(), e.tags()));
        return updated.podcast();
    }

    private Entry mutate(String podcastId, UnaryOperator<Entry> change) {
        if (podcastId == null) {
            throw new PersistenceException("Podcast id is required");
        }
        try {
            Entry updated = entries.computeIfPresent(podcastId, (id, current) -> change.apply(current));
            if (updated == null) {
                throw new PersistenceException("Podcast not found: " + podcastId);
            }
            return updated;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new PersistenceException("Rejected write to podcast " + podcastId + ": " + e.getMessage(), e);
        }
    }

    private static Set<String> normalize(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    normalized.add(tag.trim());
                }
            }
        }
        return normalized;
    }
}
