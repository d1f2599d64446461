package com.phillippitts.podcaster.config.voice;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Voice preview settings.
 *
 * @param previewDir directory holding {@code <provider>/<PersonalityId>.<format>} preview clips
 * @param previewFormat preview file extension and data URI subtype
 */
@Validated
@ConfigurationProperties(prefix = "podcaster.voices")
public record VoiceProperties(
        @DefaultValue("previews") @NotBlank String previewDir,
        @DefaultValue("mp3") @NotBlank String previewFormat
) {
}
