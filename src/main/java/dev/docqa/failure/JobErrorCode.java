package dev.docqa.failure;

/**
 * Structured error codes written to the progress ledger when a job fails.
 *
 * <p>Page-level problems (missing, out-of-range or inconsistent fields) are anomalies, not errors,
 * and never map to one of these codes.
 */
public enum JobErrorCode {
  /** The page-text backend or the submitted document is not available. */
  DEPENDENCY_UNAVAILABLE,
  /** An unexpected exception while processing a page. */
  EXTRACTION_FAILURE,
  /** A ledger, segment or artifact write failed. */
  PERSISTENCE_FAILURE
}
