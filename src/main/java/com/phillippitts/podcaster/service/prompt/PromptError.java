package com.phillippitts.podcaster.service.prompt;

import java.util.List;
import java.util.Objects;

/**
 * Classified prompt failure.
 *
 * @param type    failure class
 * @param message human readable summary
 * @param details per-field issues ({@code path: message}) or a response snippet; may be empty
 */
public record PromptError(PromptErrorType type, String message, List<String> details) {

    public PromptError {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static PromptError of(PromptErrorType type, String message) {
        return new PromptError(type, message, List.of());
    }

    /**
     * One-line description, e.g. {@code OutputValidationError: Output failed validation [dialogue: ...]}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(type.label()).append(": ").append(message);
        if (!details.isEmpty()) {
            sb.append(" [").append(String.join("; ", details)).append(']');
        }
        return sb.toString();
    }
}
