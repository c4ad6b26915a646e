package dev.docqa.storage;

import dev.docqa.failure.PersistenceFailureException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * {@link BlobSink} backed by a local exports directory.
 *
 * <p>Locators are plain file names inside the directory. Every file is first written under a
 * temporary name and then renamed into place, so a reader never sees a half-written artifact.
 * Registered by {@link StorageConfig}.
 */
public class FileSystemBlobSink implements BlobSink {

  private static final Logger log = LoggerFactory.getLogger(FileSystemBlobSink.class);

  static final List<String> RESULT_HEADER = List.of("Page", "Field", "Result", "Output");

  private static final Pattern SAFE_LOCATOR = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path exportsDir;

  public FileSystemBlobSink(Path exportsDir) {
    this.exportsDir = exportsDir;
  }

  @Override
  public String writeSegment(String jobKey, int segmentIndex, List<List<String>> rows) {
    String locator = jobKey + "_segment_" + segmentIndex + "_validation_summary.csv";
    write(locator, RESULT_HEADER, rows);
    log.debug("Wrote segment {} ({} rows) for job {}", segmentIndex, rows.size(), jobKey);
    return locator;
  }

  @Override
  public List<List<String>> readSegment(String locator) {
    Path path = resolve(locator);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      List<List<String>> records = CsvFormat.readAll(reader);
      if (records.isEmpty() || !records.get(0).equals(RESULT_HEADER)) {
        throw new PersistenceFailureException("Segment " + locator + " has no result header", null);
      }
      return records.subList(1, records.size());
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to read segment " + locator, e);
    }
  }

  @Override
  public void deleteSegment(String locator) {
    try {
      Files.deleteIfExists(resolve(locator));
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to delete segment " + locator, e);
    }
  }

  @Override
  public ArtifactWriter writeFinalArtifact(String jobKey, List<String> header) {
    String locator = ArtifactKind.VALIDATION_SUMMARY.fileName(jobKey);
    Path target = resolve(locator);
    Path temp = tempFor(target);
    try {
      Files.createDirectories(exportsDir);
      BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
      CsvFormat.writeRecord(writer, header);
      return new FileArtifactWriter(locator, temp, target, writer);
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to open final artifact " + locator, e);
    }
  }

  @Override
  public String writeArtifact(
      String jobKey, ArtifactKind kind, List<String> header, List<List<String>> rows) {
    String locator = kind.fileName(jobKey);
    write(locator, header, rows);
    return locator;
  }

  @Override
  public String writeErrorArtifact(String jobKey, String message, List<String> trace) {
    String locator = ArtifactKind.ERROR.fileName(jobKey);
    try {
      writeAtomically(
          resolve(locator),
          writer -> {
            CsvFormat.writeRecord(writer, List.of("Error"));
            CsvFormat.writeRecord(writer, List.of(message));
            CsvFormat.writeRecord(writer, List.of("Traceback:"));
            for (String line : trace) {
              CsvFormat.writeRecord(writer, List.of(line));
            }
          });
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to write error artifact for " + jobKey, e);
    }
    return locator;
  }

  @Override
  public boolean exists(String locator) {
    return isSafe(locator) && Files.isRegularFile(exportsDir.resolve(locator));
  }

  @Override
  public Optional<Resource> load(String locator) {
    if (!exists(locator)) {
      return Optional.empty();
    }
    return Optional.of(new FileSystemResource(exportsDir.resolve(locator)));
  }

  private void write(String locator, List<String> header, List<List<String>> rows) {
    try {
      writeAtomically(
          resolve(locator),
          writer -> {
            CsvFormat.writeRecord(writer, header);
            for (List<String> row : rows) {
              CsvFormat.writeRecord(writer, row);
            }
          });
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to write " + locator, e);
    }
  }

  private void writeAtomically(Path target, CsvBody body) throws IOException {
    Files.createDirectories(exportsDir);
    Path temp = tempFor(target);
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        body.write(writer);
      }
      moveIntoPlace(temp, target);
    } catch (IOException | RuntimeException e) {
      deleteQuietly(temp);
      throw e;
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.debug("Could not remove temporary artifact {}: {}", temp, e.getMessage());
    }
  }

  static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static Path tempFor(Path target) {
    return target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
  }

  private Path resolve(String locator) {
    if (!isSafe(locator)) {
      throw new IllegalArgumentException("Invalid artifact locator: " + locator);
    }
    return exportsDir.resolve(locator);
  }

  private static boolean isSafe(String locator) {
    return locator != null && SAFE_LOCATOR.matcher(locator).matches() && !locator.contains("..");
  }

  @FunctionalInterface
  private interface CsvBody {
    void write(BufferedWriter writer) throws IOException;
  }

  private static final class FileArtifactWriter implements ArtifactWriter {

    private final String locator;
    private final Path temp;
    private final Path target;
    private final BufferedWriter writer;
    private long rowCount;
    private boolean open = true;

    FileArtifactWriter(String locator, Path temp, Path target, BufferedWriter writer) {
      this.locator = locator;
      this.temp = temp;
      this.target = target;
      this.writer = writer;
    }

    @Override
    public void writeRows(List<List<String>> rows) {
      if (!open) {
        throw new IllegalStateException("Artifact " + locator + " is already closed");
      }
      try {
        for (List<String> row : rows) {
          CsvFormat.writeRecord(writer, row);
          rowCount++;
        }
      } catch (IOException e) {
        throw new PersistenceFailureException("Failed to append to " + locator, e);
      }
    }

    @Override
    public long rowCount() {
      return rowCount;
    }

    @Override
    public String commit() {
      if (!open) {
        throw new IllegalStateException("Artifact " + locator + " is already closed");
      }
      open = false;
      try {
        writer.close();
        moveIntoPlace(temp, target);
      } catch (IOException e) {
        throw new PersistenceFailureException("Failed to commit " + locator, e);
      }
      return locator;
    }

    @Override
    public void close() {
      if (!open) {
        return;
      }
      open = false;
      try {
        writer.close();
        Files.deleteIfExists(temp);
      } catch (IOException e) {
        log.warn("Failed to discard uncommitted artifact {}: {}", locator, e.getMessage());
      }
    }
  }
}
