package dev.docqa.pipeline;

import dev.docqa.failure.DependencyUnavailableException;
import dev.docqa.failure.PersistenceFailureException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps submitted documents under the uploads directory until a worker validates them.
 *
 * <p>A document arrives as extracted text with pages separated by form feeds ({@code \f}), the
 * format produced by {@code pdftotext}. One trailing form feed closes the last page rather than
 * opening an empty one. Each page is stored as its own file so any worker process sharing the
 * directory can open the document by job key.
 */
public class DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

  static final char PAGE_SEPARATOR = '\f';

  private static final Pattern PAGE_FILE = Pattern.compile("page-(\\d+)\\.txt");

  private final Path uploadsDir;

  public DocumentStore(Path uploadsDir) {
    this.uploadsDir = uploadsDir;
  }

  /**
   * Store a document for a job.
   *
   * @param jobKey job that will validate the document
   * @param text page texts separated by form feeds
   * @return number of pages stored
   */
  public int store(String jobKey, String text) {
    List<String> pages = splitPages(text);
    Path dir = documentDir(jobKey);
    try {
      Files.createDirectories(dir);
      for (int i = 0; i < pages.size(); i++) {
        Files.writeString(dir.resolve(pageFileName(i + 1)), pages.get(i), StandardCharsets.UTF_8);
      }
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to store document for job " + jobKey, e);
    }
    log.debug("Stored {} pages for job {}", pages.size(), jobKey);
    return pages.size();
  }

  /**
   * Open a stored document.
   *
   * @throws DependencyUnavailableException when no document is stored for the job
   */
  public PageTextProvider open(String jobKey) {
    Path dir = documentDir(jobKey);
    try (Stream<Path> files = Files.list(dir)) {
      List<Path> pages =
          files
              .filter(path -> PAGE_FILE.matcher(path.getFileName().toString()).matches())
              .sorted(Comparator.comparingLong(DocumentStore::pageNumber))
              .toList();
      return new FormFeedPageTextProvider(pages);
    } catch (NoSuchFileException e) {
      throw new DependencyUnavailableException("No document stored for job " + jobKey, e);
    } catch (IOException e) {
      throw new DependencyUnavailableException("Document for job " + jobKey + " is unreadable", e);
    }
  }

  static List<String> splitPages(String text) {
    String body =
        text.isEmpty() || text.charAt(text.length() - 1) != PAGE_SEPARATOR
            ? text
            : text.substring(0, text.length() - 1);
    return List.of(body.split(Pattern.quote(String.valueOf(PAGE_SEPARATOR)), -1));
  }

  private Path documentDir(String jobKey) {
    if (!jobKey.matches("[A-Za-z0-9][A-Za-z0-9_-]*")) {
      throw new IllegalArgumentException("Invalid job key: " + jobKey);
    }
    return uploadsDir.resolve(jobKey);
  }

  private static long pageNumber(Path pageFile) {
    Matcher matcher = PAGE_FILE.matcher(pageFile.getFileName().toString());
    return matcher.matches() ? Long.parseLong(matcher.group(1)) : Long.MAX_VALUE;
  }

  private static String pageFileName(int page) {
    return String.format(Locale.ROOT, "page-%06d.txt", page);
  }
}
