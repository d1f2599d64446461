package com.phillippitts.podcaster.service.script;

import com.phillippitts.podcaster.domain.DialogueSegment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Structured output of the podcast script prompt.
 */
public record PodcastScript(
        @NotBlank(message = "Title cannot be empty.") String title,
        @NotBlank(message = "Summary cannot be empty.")
        @Size(max = 300, message = "Summary must be at most 300 characters.") String summary,
        @NotEmpty(message = "At least one tag is required.") List<@NotBlank String> tags,
        @NotEmpty(message = "Dialogue must contain at least one line.") @Valid List<DialogueSegment> dialogue
) {
}
