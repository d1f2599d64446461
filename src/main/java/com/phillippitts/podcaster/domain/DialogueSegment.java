package com.phillippitts.podcaster.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

/**
 * One spoken line of a podcast script.
 *
 * <p>Constraints are checked when a script is validated; the record itself accepts empty
 * lines so that downstream stages can decide how to treat them.
 *
 * @param speaker display name of the speaking personality
 * @param line    text to be spoken
 */
public record DialogueSegment(
        @NotBlank(message = "Speaker cannot be empty.") String speaker,
        @NotEmpty(message = "Dialogue line cannot be empty.") String line
) {

    public boolean hasLine() {
        return line != null && !line.isBlank();
    }
}
