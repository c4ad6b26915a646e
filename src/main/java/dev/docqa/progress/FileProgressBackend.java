package dev.docqa.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.docqa.failure.PersistenceFailureException;
import dev.docqa.storage.BlobSink;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local {@link ProgressBackend} keeping one JSON file per job key.
 *
 * <p>Updates are merged into the record currently on disk, then the whole record is written to a
 * temporary file in the same directory and renamed over the previous file. Readers in other
 * processes therefore see either the old or the new record, never a torn write. The last record
 * written for a key still in flight is kept in memory and only used when the file is unreadable.
 * No lock is taken: one runner owns a key at a time.
 */
public class FileProgressBackend implements ProgressBackend {

  private static final Logger log = LoggerFactory.getLogger(FileProgressBackend.class);

  private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

  private final Path progressDir;
  private final ObjectMapper objectMapper;
  private final BlobSink blobSink;
  private final ConcurrentHashMap<String, ProgressRecord> lastKnown = new ConcurrentHashMap<>();

  public FileProgressBackend(Path progressDir, ObjectMapper objectMapper, BlobSink blobSink) {
    this.progressDir = progressDir;
    this.objectMapper = objectMapper;
    this.blobSink = blobSink;
  }

  @Override
  public String name() {
    return "file";
  }

  @Override
  public void write(String jobKey, ProgressUpdate update) {
    Path path = pathFor(jobKey);
    lastKnown.compute(
        jobKey,
        (key, known) -> {
          ProgressRecord merged = currentRecord(key, path, known).apply(update);
          persist(path, merged);
          return merged.done() ? null : merged;
        });
  }

  /**
   * The record to merge into: the file's contents, which may have been written by another process.
   * The last record written here is used only when the file cannot be parsed.
   */
  private ProgressRecord currentRecord(String jobKey, Path path, @Nullable ProgressRecord known) {
    try {
      return readFile(path).orElse(known != null ? known : ProgressRecord.initial());
    } catch (PersistenceFailureException e) {
      if (known == null) {
        throw e;
      }
      log.warn("Unreadable progress file for {}, merging into last known record", jobKey);
      return known;
    }
  }

  @Override
  public Optional<ProgressRecord> read(String jobKey) {
    Path path = pathFor(jobKey);
    try {
      Optional<ProgressRecord> stored = readFile(path);
      if (stored.isPresent()) {
        return stored;
      }
    } catch (PersistenceFailureException e) {
      log.warn(
          "Unreadable progress file for {}, using last known record: {}", jobKey, e.getMessage());
    }
    return Optional.ofNullable(lastKnown.get(jobKey));
  }

  @Override
  public boolean isResultReachable(ProgressRecord record) {
    return record.resultLocator() != null && blobSink.exists(record.resultLocator());
  }

  Path pathFor(String jobKey) {
    if (jobKey == null || !SAFE_KEY.matcher(jobKey).matches()) {
      throw new IllegalArgumentException("Invalid job key: " + jobKey);
    }
    return progressDir.resolve(jobKey + ".json");
  }

  private Optional<ProgressRecord> readFile(Path path) {
    try {
      return Optional.of(objectMapper.readValue(Files.readAllBytes(path), ProgressRecord.class));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to read " + path, e);
    }
  }

  private void persist(Path path, ProgressRecord record) {
    Path temp = null;
    try {
      Files.createDirectories(progressDir);
      temp = Files.createTempFile(progressDir, path.getFileName().toString(), ".tmp");
      objectMapper.writeValue(temp.toFile(), record);
      try {
        Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.warn("Atomic rename unsupported in {}, replacing {} non-atomically", progressDir, path);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new PersistenceFailureException("Failed to write " + path, e);
    }
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.debug("Could not remove temporary progress file {}: {}", temp, e.getMessage());
    }
  }
}
