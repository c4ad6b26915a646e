package dev.docqa.storage;

/** Job artifacts written to the exports directory, identified by their file name suffix. */
public enum ArtifactKind {
  /** Per (page, field) result table; also the shape of each checkpointed segment. */
  VALIDATION_SUMMARY("_validation_summary.csv"),
  /** One row per vocabulary field with every value found for it. */
  FIELD_SUMMARY("_field_info_summary.csv"),
  /** Missing, out-of-range and inconsistent field findings. */
  ANOMALIES("_anomalies.csv"),
  /** Message and stack trace of a failed job. */
  ERROR("_error.csv");

  private final String suffix;

  ArtifactKind(String suffix) {
    this.suffix = suffix;
  }

  public String fileName(String jobKey) {
    return jobKey + suffix;
  }
}
