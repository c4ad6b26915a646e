package dev.docqa.progress;

import org.jspecify.annotations.Nullable;

/**
 * Partial update of a {@link ProgressRecord}. A {@code null} component means "leave unchanged".
 *
 * @param percent new completion percentage in [0, 100]
 * @param done terminal flag
 * @param resultLocator locator of the result or error artifact
 * @param error structured error of a failed job
 * @param partial short-result flag
 */
public record ProgressUpdate(
    @Nullable Integer percent,
    @Nullable Boolean done,
    @Nullable String resultLocator,
    @Nullable ProgressError error,
    @Nullable Boolean partial) {

  public ProgressUpdate {
    if (percent != null && (percent < 0 || percent > 100)) {
      throw new IllegalArgumentException("percent must be in [0, 100], got: " + percent);
    }
    if (Boolean.TRUE.equals(done) && resultLocator == null && error == null) {
      throw new IllegalArgumentException("A terminal update needs a result locator or an error");
    }
  }

  /** Full field set of a freshly submitted job. */
  public static ProgressUpdate initial() {
    return new ProgressUpdate(0, false, null, null, false);
  }

  public static ProgressUpdate percent(int percent) {
    return new ProgressUpdate(percent, null, null, null, null);
  }

  public static ProgressUpdate completed(String resultLocator, boolean partial) {
    return new ProgressUpdate(100, true, resultLocator, null, partial);
  }

  public static ProgressUpdate failed(ProgressError error, @Nullable String resultLocator) {
    return new ProgressUpdate(100, true, resultLocator, error, null);
  }

  /** Promotion of a stalled-but-complete record, restating every field it was read with. */
  static ProgressUpdate healed(ProgressRecord stalled) {
    return new ProgressUpdate(
        stalled.percent(), true, stalled.resultLocator(), stalled.error(), stalled.partial());
  }

  public boolean terminal() {
    return Boolean.TRUE.equals(done);
  }

  /** Copy with percent raised to at least {@code floor}, keeping percent unset if it was. */
  ProgressUpdate withPercentAtLeast(int floor) {
    if (percent == null || percent >= floor) {
      return this;
    }
    return new ProgressUpdate(floor, done, resultLocator, error, partial);
  }
}
