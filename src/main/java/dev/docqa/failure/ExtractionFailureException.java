package dev.docqa.failure;

/** Wraps an unexpected exception raised while a page was being extracted or validated. */
public class ExtractionFailureException extends JobFailureException {

  private final int page;

  public ExtractionFailureException(int page, Throwable cause) {
    super(
        JobErrorCode.EXTRACTION_FAILURE,
        "Failed to process page " + page + ": " + cause.getMessage(),
        cause);
    this.page = page;
  }

  public int page() {
    return page;
  }
}
