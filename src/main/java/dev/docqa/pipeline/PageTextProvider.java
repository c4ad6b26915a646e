package dev.docqa.pipeline;

/**
 * Source of per-page text for one document, typically backed by a PDF text layer or OCR.
 *
 * <p>Implementations may throw {@link dev.docqa.failure.DependencyUnavailableException} when the
 * underlying text backend cannot be reached.
 */
public interface PageTextProvider {

  /** Number of pages in the document; zero for an empty document. */
  int pageCount();

  /**
   * Text of one page.
   *
   * @param pageIndex 1-based page number, at most {@link #pageCount()}
   * @return the page text; empty when the page has no recognisable text
   */
  String getPageText(int pageIndex);
}
