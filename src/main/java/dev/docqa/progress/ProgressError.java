package dev.docqa.progress;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Structured error attached to the terminal record of a failed job.
 *
 * @param code machine-readable error code, e.g. {@code EXTRACTION_FAILURE}; may be absent
 * @param message human-readable cause
 */
public record ProgressError(@Nullable String code, String message) {

  public ProgressError {
    Objects.requireNonNull(message, "message must not be null");
  }

  public static ProgressError of(String message) {
    return new ProgressError(null, message);
  }
}
