package dev.docqa.storage;

import java.util.List;

/**
 * Streaming writer for an artifact that is too large to build in memory. Rows are appended in
 * order after the header. Nothing is visible under the locator until {@link #commit()}; closing an
 * uncommitted writer discards what was written.
 */
public interface ArtifactWriter extends AutoCloseable {

  /** Append rows to the artifact, in order. */
  void writeRows(List<List<String>> rows);

  /** Number of data rows written so far, excluding the header. */
  long rowCount();

  /**
   * Make the artifact durable and visible.
   *
   * @return the locator under which the artifact can be fetched
   */
  String commit();

  @Override
  void close();
}
