package com.phillippitts.podcaster.config.fetch;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * HTTP content fetch settings.
 *
 * @param timeoutSeconds connect and request timeout
 * @param userAgent      User-Agent header sent with requests
 * @param maxChars       cap on content handed to the script prompt
 */
@Validated
@ConfigurationProperties(prefix = "podcaster.fetch")
public record ContentFetchProperties(
        @DefaultValue("15") @Positive int timeoutSeconds,
        @DefaultValue("Mozilla/5.0 (compatible; podcaster/0.1)") @NotBlank String userAgent,
        @DefaultValue("200000") @Positive int maxChars
) {
}
