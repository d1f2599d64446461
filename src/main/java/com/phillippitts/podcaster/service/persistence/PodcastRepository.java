package com.phillippitts.podcaster.service.persistence;

import com.phillippitts.podcaster.domain.DialogueSegment;
import com.phillippitts.podcaster.domain.Podcast;
import com.phillippitts.podcaster.domain.PodcastStatus;
import com.phillippitts.podcaster.domain.PodcastUpdate;
import com.phillippitts.podcaster.domain.SourceReference;
import com.phillippitts.podcaster.domain.Transcript;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store of podcasts, their transcripts and tags.
 *
 * <p>The generation pipeline communicates outcomes only through this gateway. Every write to
 * an unknown podcast, and every write that would break a record invariant, fails with
 * {@link com.phillippitts.podcaster.exception.PersistenceException}.
 */
public interface PodcastRepository {

    /**
     * Creates a {@code processing} podcast together with an empty transcript, atomically.
     */
    Podcast createInitial(String ownerId, SourceReference source, String hostVoiceId, String cohostVoiceId);

    /**
     * Sets the status. {@code SUCCESS} clears the error; {@code FAILED} stores the message,
     * or "Unknown error" when none is given.
     */
    Podcast updateStatus(String podcastId, PodcastStatus status, String errorMessage);

    /** Overwrites the transcript. */
    void updateTranscript(String podcastId, List<DialogueSegment> segments);

    /** Adds tags with set semantics. */
    void addTags(String podcastId, Collection<String> tags);

    /** Replaces all tags. */
    void replaceTags(String podcastId, Collection<String> tags);

    Podcast update(String podcastId, PodcastUpdate update);

    Optional<Podcast> findById(String podcastId);

    /** Podcasts of one owner, newest first. */
    List<Podcast> findByOwner(String ownerId);

    Optional<Transcript> findTranscript(String podcastId);

    Set<String> findTags(String podcastId);

    /**
     * Removes the podcast with its transcript and tags.
     *
     * @return true if something was deleted
     */
    boolean delete(String podcastId);
}
