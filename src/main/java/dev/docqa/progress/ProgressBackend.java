package dev.docqa.progress;

import java.util.Optional;

/**
 * Storage strategy behind the {@link ProgressLedger}. Exactly one implementation is active,
 * selected at startup by {@code docqa.progress.backend}.
 *
 * <p>Implementations throw {@link dev.docqa.failure.PersistenceFailureException} when the store
 * cannot be written or read.
 */
public interface ProgressBackend {

  /** Short name reported by diagnostics, e.g. {@code "redis"}. */
  String name();

  /**
   * Persist the fields supplied by the update; unspecified fields keep their stored value.
   *
   * @param jobKey job whose record is updated
   * @param update fields to write
   */
  void write(String jobKey, ProgressUpdate update);

  /** Read the full stored record, or empty when the key is unknown. */
  Optional<ProgressRecord> read(String jobKey);

  /** Whether the result artifact named by the record can be fetched. */
  boolean isResultReachable(ProgressRecord record);
}
