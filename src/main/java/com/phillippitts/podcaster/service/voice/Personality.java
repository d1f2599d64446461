package com.phillippitts.podcaster.service.voice;

/**
 * A host persona the script writer and the speech provider can both play.
 *
 * @param id            stable identifier, also used as the speaker name in scripts
 * @param description   persona summary handed to the script prompt
 * @param previewPhrase short line used for voice previews
 */
public record Personality(String id, String description, String previewPhrase) {
}
