package dev.docqa.validation;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A data-quality finding for one field, either on a single page or across all pages.
 *
 * <p>Anomalies are data, not errors: they are collected into the job's anomaly artifact and never
 * thrown.
 *
 * @param page 1-based page number, or {@code null} for a finding that spans all pages
 * @param field vocabulary field name
 * @param kind what is wrong with the field
 * @param value the offending value for {@link Kind#OUT_OF_RANGE}; null otherwise
 */
public record Anomaly(@Nullable Integer page, String field, Kind kind, @Nullable String value) {

  /** Page reference used for cross-page findings. */
  public static final String ALL_PAGES = "All Pages";

  public Anomaly {
    Objects.requireNonNull(field, "field must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    if (page != null && page < 1) {
      throw new IllegalArgumentException("page must be >= 1, got: " + page);
    }
    if (kind == Kind.OUT_OF_RANGE && value == null) {
      throw new IllegalArgumentException("Out-of-range anomalies must carry the offending value");
    }
  }

  public static Anomaly missing(int page, String field) {
    return new Anomaly(page, field, Kind.MISSING, null);
  }

  public static Anomaly outOfRange(int page, String field, String value) {
    return new Anomaly(page, field, Kind.OUT_OF_RANGE, value);
  }

  public static Anomaly inconsistent(String field) {
    return new Anomaly(null, field, Kind.INCONSISTENT, null);
  }

  /** Page column text: the page number, or {@value #ALL_PAGES}. */
  public String pageRef() {
    return page == null ? ALL_PAGES : page.toString();
  }

  /** Issue column text, e.g. {@code "Out of range: 110"}. */
  public String issue() {
    return switch (kind) {
      case MISSING -> "Missing";
      case OUT_OF_RANGE -> "Out of range: " + value;
      case INCONSISTENT -> "Inconsistent values";
    };
  }

  /** Whether this finding is critical; missing fields are reported but not critical. */
  public boolean critical() {
    return kind != Kind.MISSING;
  }

  /** Row of the anomaly artifact: page reference, field, issue. */
  public List<String> toRow() {
    return List.of(pageRef(), field, issue());
  }

  /** Kinds of data-quality finding. */
  public enum Kind {
    MISSING,
    OUT_OF_RANGE,
    INCONSISTENT
  }
}
