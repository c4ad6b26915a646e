package dev.docqa.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.docqa.failure.DependencyUnavailableException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentStoreTest {

  @TempDir Path uploadsDir;

  private DocumentStore store;

  @BeforeEach
  void setUp() {
    store = new DocumentStore(uploadsDir);
  }

  @Test
  void splitsPagesOnFormFeed() {
    assertThat(DocumentStore.splitPages("one\ftwo\fthree")).containsExactly("one", "two", "three");
  }

  @Test
  void trailingFormFeedClosesLastPage() {
    assertThat(DocumentStore.splitPages("one\ftwo\f")).containsExactly("one", "two");
  }

  @Test
  void emptyPagesInTheMiddleAreKept() {
    assertThat(DocumentStore.splitPages("one\f\fthree")).containsExactly("one", "", "three");
  }

  @Test
  void emptyTextIsOneEmptyPage() {
    assertThat(DocumentStore.splitPages("")).containsExactly("");
  }

  @Test
  void storedDocumentOpensWithPagesInOrder() {
    StringBuilder text = new StringBuilder();
    for (int page = 1; page <= 12; page++) {
      text.append("Lot Number: L").append(page).append('\f');
    }

    int pages = store.store("job-1", text.toString());
    PageTextProvider provider = store.open("job-1");

    assertThat(pages).isEqualTo(12);
    assertThat(provider.pageCount()).isEqualTo(12);
    assertThat(provider.getPageText(1)).isEqualTo("Lot Number: L1");
    assertThat(provider.getPageText(10)).isEqualTo("Lot Number: L10");
    assertThat(provider.getPageText(12)).isEqualTo("Lot Number: L12");
  }

  @Test
  void pageIndexIsOneBased() {
    store.store("job-1", "only page");
    PageTextProvider provider = store.open("job-1");

    assertThatThrownBy(() -> provider.getPageText(0))
        .isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> provider.getPageText(2))
        .isInstanceOf(IndexOutOfBoundsException.class);
  }

  @Test
  void openingUnknownDocumentIsDependencyUnavailable() {
    assertThatThrownBy(() -> store.open("never-stored"))
        .isInstanceOf(DependencyUnavailableException.class)
        .hasMessageContaining("never-stored");
  }

  @Test
  void invalidJobKeyIsRejected() {
    assertThatThrownBy(() -> store.store("../x", "text"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
