package dev.docqa.pipeline;

import dev.docqa.failure.DependencyUnavailableException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link PageTextProvider} over a document stored by {@link DocumentStore}: one UTF-8 text file per
 * page, read on demand so only the current page is held in memory.
 */
class FormFeedPageTextProvider implements PageTextProvider {

  private final List<Path> pageFiles;

  FormFeedPageTextProvider(List<Path> pageFiles) {
    this.pageFiles = List.copyOf(pageFiles);
  }

  @Override
  public int pageCount() {
    return pageFiles.size();
  }

  @Override
  public String getPageText(int pageIndex) {
    if (pageIndex < 1 || pageIndex > pageFiles.size()) {
      throw new IndexOutOfBoundsException(
          "Page " + pageIndex + " outside 1.." + pageFiles.size());
    }
    Path page = pageFiles.get(pageIndex - 1);
    try {
      return Files.readString(page, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DependencyUnavailableException("Page text unavailable: " + page.getFileName(), e);
    }
  }
}
