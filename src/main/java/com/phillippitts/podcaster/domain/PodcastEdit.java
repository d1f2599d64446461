package com.phillippitts.podcaster.domain;

import java.util.List;

/**
 * User edit of an existing podcast. Null fields mean "unchanged".
 *
 * @param podcastId     podcast to edit
 * @param ownerId       caller; must own the podcast
 * @param title         new title
 * @param summary       new summary
 * @param dialogue      replacement dialogue
 * @param hostVoiceId   new host personality id
 * @param cohostVoiceId new cohost personality id
 */
public record PodcastEdit(
        String podcastId,
        String ownerId,
        String title,
        String summary,
        List<DialogueSegment> dialogue,
        String hostVoiceId,
        String cohostVoiceId
) {

    public static PodcastEdit metadata(String podcastId, String ownerId, String title, String summary) {
        return new PodcastEdit(podcastId, ownerId, title, summary, null, null, null);
    }
}
