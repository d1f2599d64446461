package com.phillippitts.podcaster.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Dialogue synthesis settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>{@code podcaster.synthesis.concurrency} - max in-flight synthesis calls per dialogue (default 5)</li>
 *   <li>{@code podcaster.synthesis.format} - requested audio format (default mp3)</li>
 *   <li>{@code podcaster.synthesis.speed} - speaking rate, provider default when unset</li>
 * </ul>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "podcaster.synthesis")
public class SynthesisProperties {

    @Positive
    private int concurrency = 5;

    @NotBlank
    private String format = "mp3";

    private Double speed;

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Double getSpeed() {
        return speed;
    }

    public void setSpeed(Double speed) {
        this.speed = speed;
    }
}
