package dev.docqa.progress;

import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of a job's progress as presented to pollers.
 *
 * <p>Each update produces a new record via {@link #apply(ProgressUpdate)}. Once {@code done} is
 * true the record is terminal: it carries a result locator, an error, or both, and further updates
 * leave it unchanged.
 *
 * @param percent completion percentage in [0, 100], non-decreasing until terminal
 * @param done whether the job reached a terminal state
 * @param resultLocator locator of the result (or error) artifact; null until known
 * @param error structured error of a failed job; null otherwise
 * @param partial true when some checkpointed segments could not be merged into the result
 */
public record ProgressRecord(
    int percent,
    boolean done,
    @Nullable String resultLocator,
    @Nullable ProgressError error,
    boolean partial) {

  private static final ProgressRecord INITIAL = new ProgressRecord(0, false, null, null, false);

  public ProgressRecord {
    if (percent < 0 || percent > 100) {
      throw new IllegalArgumentException("percent must be in [0, 100], got: " + percent);
    }
  }

  /** The record created at submission, also returned for unknown keys. */
  public static ProgressRecord initial() {
    return INITIAL;
  }

  /**
   * Merge a partial update into this record. Fields the update leaves unspecified keep their
   * current value; percent never moves backwards; a terminal record is returned unchanged.
   */
  public ProgressRecord apply(ProgressUpdate update) {
    if (done) {
      return this;
    }
    return new ProgressRecord(
        update.percent() != null ? Math.max(percent, update.percent()) : percent,
        update.done() != null ? update.done() : done,
        update.resultLocator() != null ? update.resultLocator() : resultLocator,
        update.error() != null ? update.error() : error,
        update.partial() != null ? update.partial() : partial);
  }

  /** Whether this record looks complete but was never marked done. */
  public boolean stalledAtCompletion() {
    return percent >= 100 && !done;
  }
}
