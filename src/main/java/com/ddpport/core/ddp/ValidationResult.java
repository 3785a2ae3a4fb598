package com.ddpport.core.ddp;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of classifying one submitted archive. Created per submission attempt and
 * threaded through extraction and rendering.
 *
 * @param status   selected status code
 * @param category matched category, {@code null} unless the status is recognized
 */
public record ValidationResult(StatusCode status, DdpCategory category) {

    public ValidationResult {
        Objects.requireNonNull(status, "status");
        if (status.isRecognized() && category == null) {
            throw new IllegalArgumentException("A recognized archive needs a matched category");
        }
    }

    public static ValidationResult recognized(StatusCode status, DdpCategory category) {
        return new ValidationResult(status, Objects.requireNonNull(category, "category"));
    }

    public static ValidationResult rejected(StatusCode status) {
        return new ValidationResult(status, null);
    }

    public boolean isRecognized() {
        return status.isRecognized();
    }

    public Optional<DdpCategory> matchedCategory() {
        return Optional.ofNullable(category);
    }
}
