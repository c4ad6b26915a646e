package dev.docqa.storage;

import java.util.List;
import java.util.Optional;
import org.springframework.core.io.Resource;

/**
 * Durable storage for segment checkpoints and job artifacts.
 *
 * <p>Locators are opaque strings returned by the write methods and accepted by the read methods.
 * Implementations throw {@link dev.docqa.failure.PersistenceFailureException} when storage fails.
 */
public interface BlobSink {

  /**
   * Checkpoint one segment of result rows.
   *
   * @param jobKey owning job
   * @param segmentIndex zero-based segment index
   * @param rows result rows in page order
   * @return the segment's locator
   */
  String writeSegment(String jobKey, int segmentIndex, List<List<String>> rows);

  /** Read a segment back, rows in the order they were written, header excluded. */
  List<List<String>> readSegment(String locator);

  /** Delete a consumed segment. Deleting a missing segment is not an error. */
  void deleteSegment(String locator);

  /**
   * Open the final result artifact for streaming writes.
   *
   * @param jobKey owning job
   * @param header header row written before any data row
   * @return a writer whose {@link ArtifactWriter#commit()} publishes the final result
   */
  ArtifactWriter writeFinalArtifact(String jobKey, List<String> header);

  /** Write a complete, small artifact in one call and return its locator. */
  String writeArtifact(
      String jobKey, ArtifactKind kind, List<String> header, List<List<String>> rows);

  /**
   * Write the error artifact of a failed job: an {@code Error} header, the message, a literal
   * {@code Traceback:} row, then one row per trace line.
   */
  String writeErrorArtifact(String jobKey, String message, List<String> trace);

  /** Whether an artifact exists under the locator. */
  boolean exists(String locator);

  /** Load an artifact for download. */
  Optional<Resource> load(String locator);
}
