package dev.docqa.progress;

import dev.docqa.failure.PersistenceFailureException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

/**
 * Keyed store of job progress shared by job runners and pollers.
 *
 * <p>Constructed once at startup around the configured {@link ProgressBackend} and passed to every
 * component that reads or writes progress. Guarantees for a given key:
 *
 * <ul>
 *   <li>percent never decreases; lower values are raised to the last written value
 *   <li>a terminal record is never modified again
 *   <li>non-terminal write failures are logged and swallowed so the job keeps running
 *   <li>terminal writes are retried, and surface a {@link PersistenceFailureException} only when
 *       every attempt failed
 *   <li>a record stuck at 100% without {@code done} whose result is reachable is promoted to done
 *       on read (auto-heal)
 * </ul>
 */
public class ProgressLedger {

  private static final Logger log = LoggerFactory.getLogger(ProgressLedger.class);

  private final ProgressBackend backend;
  private final RetryTemplate terminalRetry;

  /** Last record written by this process, per key with a job running here. */
  private final Map<String, ProgressRecord> inFlight = new ConcurrentHashMap<>();

  public ProgressLedger(ProgressBackend backend, RetryTemplate terminalRetry) {
    this.backend = backend;
    this.terminalRetry = terminalRetry;
  }

  public String backendName() {
    return backend.name();
  }

  /**
   * Create the record of a newly submitted job: {@code {0, false, null, null}}.
   *
   * @param jobKey key of the new job
   */
  public void start(String jobKey) {
    backend.write(jobKey, ProgressUpdate.initial());
  }

  /**
   * Apply a partial update. Unspecified (null) fields are left unchanged. A terminal update is
   * retried; a failing non-terminal update is logged and dropped.
   */
  public void setProgress(
      String jobKey,
      @Nullable Integer percent,
      @Nullable String resultLocator,
      @Nullable Boolean done,
      @Nullable ProgressError error) {
    ProgressUpdate update = new ProgressUpdate(percent, done, resultLocator, error, null);
    if (update.terminal()) {
      writeTerminal(jobKey, update);
    } else {
      writeBestEffort(jobKey, update);
    }
  }

  /** Report intermediate progress; never throws on storage failure. */
  public void updatePercent(String jobKey, int percent) {
    writeBestEffort(jobKey, ProgressUpdate.percent(percent));
  }

  /** Mark the job complete with its result locator. */
  public void complete(String jobKey, String resultLocator, boolean partial) {
    writeTerminal(jobKey, ProgressUpdate.completed(resultLocator, partial));
  }

  /** Mark the job failed with a structured error and, when written, the error artifact locator. */
  public void fail(String jobKey, ProgressError error, @Nullable String errorLocator) {
    writeTerminal(jobKey, ProgressUpdate.failed(error, errorLocator));
  }

  /**
   * Read a job's progress, healing a record stuck at 100% whose result is reachable.
   *
   * @param jobKey the job to look up
   * @return the record, or empty when the key is unknown
   */
  public Optional<ProgressRecord> find(String jobKey) {
    Optional<ProgressRecord> stored = backend.read(jobKey);
    if (stored.isEmpty() || !stored.get().stalledAtCompletion()) {
      return stored;
    }
    ProgressRecord stalled = stored.get();
    if (!backend.isResultReachable(stalled)) {
      return stored;
    }
    ProgressUpdate healed = ProgressUpdate.healed(stalled);
    try {
      backend.write(jobKey, healed);
      log.info("Promoted stalled progress record {} to done", jobKey);
    } catch (PersistenceFailureException e) {
      log.warn("Failed to persist healed progress for {}: {}", jobKey, e.getMessage());
    }
    return Optional.of(stalled.apply(healed));
  }

  /** Read a job's progress; unknown keys yield {@link ProgressRecord#initial()}. */
  public ProgressRecord getProgress(String jobKey) {
    return find(jobKey).orElse(ProgressRecord.initial());
  }

  private void writeBestEffort(String jobKey, ProgressUpdate update) {
    try {
      write(jobKey, update);
    } catch (PersistenceFailureException e) {
      log.warn("Dropped progress update for {}: {}", jobKey, e.getMessage());
    }
  }

  private void writeTerminal(String jobKey, ProgressUpdate update) {
    terminalRetry.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            log.info(
                "Retrying terminal progress write for {} (attempt {})",
                jobKey,
                context.getRetryCount() + 1);
          }
          write(jobKey, update);
          return null;
        });
  }

  private void write(String jobKey, ProgressUpdate update) {
    ProgressRecord current = inFlight.get(jobKey);
    if (current == null) {
      current = backend.read(jobKey).orElse(ProgressRecord.initial());
    }
    if (current.done()) {
      log.debug("Ignoring update for terminal job {}", jobKey);
      inFlight.remove(jobKey);
      return;
    }
    ProgressUpdate effective = update.withPercentAtLeast(current.percent());
    ProgressRecord merged = current.apply(effective);
    if (merged.equals(current)) {
      return;
    }
    backend.write(jobKey, effective);
    if (merged.done()) {
      inFlight.remove(jobKey);
    } else {
      inFlight.put(jobKey, merged);
    }
  }
}
