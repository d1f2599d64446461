package com.phillippitts.podcaster.service.script;

import jakarta.validation.constraints.NotBlank;

/**
 * Params of the podcast script prompt.
 */
public record ScriptParams(
        @NotBlank(message = "Source content cannot be empty.") String htmlContent,
        @NotBlank(message = "Host name cannot be empty.") String hostName,
        @NotBlank(message = "Host personality description cannot be empty.") String hostPersonalityDescription,
        @NotBlank(message = "Cohost name cannot be empty.") String cohostName,
        @NotBlank(message = "Cohost personality description cannot be empty.") String cohostPersonalityDescription
) {
}
