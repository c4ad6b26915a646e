package dev.docqa.fixture;

import dev.docqa.failure.PersistenceFailureException;
import dev.docqa.progress.ProgressBackend;
import dev.docqa.progress.ProgressRecord;
import dev.docqa.progress.ProgressUpdate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test {@link ProgressBackend} holding records in a map. Writes can be made to fail, and every
 * update that reached storage is kept for assertions.
 *
 * <pre>{@code
 * InMemoryProgressBackend backend = new InMemoryProgressBackend().failNextWrites(2);
 * }</pre>
 */
public final class InMemoryProgressBackend implements ProgressBackend {

  private final Map<String, ProgressRecord> records = new ConcurrentHashMap<>();
  private final List<ProgressUpdate> writes = new ArrayList<>();
  private int failingWrites;
  private boolean resultReachable = true;

  public InMemoryProgressBackend failNextWrites(int count) {
    this.failingWrites = count;
    return this;
  }

  public InMemoryProgressBackend resultReachable(boolean reachable) {
    this.resultReachable = reachable;
    return this;
  }

  /** Store a record directly, bypassing merge rules. */
  public InMemoryProgressBackend seed(String jobKey, ProgressRecord record) {
    records.put(jobKey, record);
    return this;
  }

  public synchronized List<ProgressUpdate> writes() {
    return List.copyOf(writes);
  }

  public ProgressRecord stored(String jobKey) {
    return records.get(jobKey);
  }

  @Override
  public String name() {
    return "memory";
  }

  @Override
  public synchronized void write(String jobKey, ProgressUpdate update) {
    if (failingWrites > 0) {
      failingWrites--;
      throw new PersistenceFailureException("simulated write failure", null);
    }
    writes.add(update);
    records.merge(
        jobKey, ProgressRecord.initial().apply(update), (old, ignored) -> old.apply(update));
  }

  @Override
  public Optional<ProgressRecord> read(String jobKey) {
    return Optional.ofNullable(records.get(jobKey));
  }

  @Override
  public boolean isResultReachable(ProgressRecord record) {
    return resultReachable && record.resultLocator() != null;
  }
}
