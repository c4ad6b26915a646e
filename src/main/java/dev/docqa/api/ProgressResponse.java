package dev.docqa.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.docqa.progress.ProgressError;
import dev.docqa.progress.ProgressRecord;
import org.jspecify.annotations.Nullable;

/**
 * JSON shape of {@code GET /api/progress/{key}}. The result locator is exposed as {@code
 * csv_filename}, the file name to pass to {@code /download/{file}}.
 */
public record ProgressResponse(
    int percent,
    boolean done,
    @JsonProperty("csv_filename") @Nullable String csvFilename,
    @Nullable ProgressError error,
    boolean partial) {

  static final String UNKNOWN_KEY_MESSAGE = "Progress key not found";

  static ProgressResponse from(ProgressRecord record) {
    return new ProgressResponse(
        record.percent(), record.done(), record.resultLocator(), record.error(), record.partial());
  }

  /** Zeroed record returned, with 404, for keys the ledger does not know. */
  static ProgressResponse unknownKey() {
    ProgressRecord zeroed = ProgressRecord.initial();
    return new ProgressResponse(
        zeroed.percent(), zeroed.done(), null, ProgressError.of(UNKNOWN_KEY_MESSAGE), false);
  }
}
