package dev.docqa.pipeline;

import dev.docqa.extraction.FieldMap;
import dev.docqa.extraction.FieldVocabulary;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One (page, field) row of the validation summary.
 *
 * @param page 1-based page number
 * @param field vocabulary field name
 * @param status whether the field was found on the page
 * @param value extracted value; empty when missing
 */
public record ResultRow(int page, String field, Status status, String value) {

  public static final List<String> HEADER = List.of("Page", "Field", "Result", "Output");

  public ResultRow {
    Objects.requireNonNull(field, "field must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(value, "value must not be null");
  }

  /** Rows for every vocabulary field of one page, in vocabulary order. */
  public static List<ResultRow> forPage(int page, FieldMap fields) {
    List<ResultRow> rows = new ArrayList<>(FieldVocabulary.size());
    for (String field : FieldVocabulary.FIELDS) {
      rows.add(
          fields
              .get(field)
              .map(value -> new ResultRow(page, field, Status.FOUND, value))
              .orElseGet(() -> new ResultRow(page, field, Status.MISSING, "")));
    }
    return rows;
  }

  public List<String> toCsvRow() {
    return List.of(Integer.toString(page), field, status.label(), value);
  }

  /** Result column values. */
  public enum Status {
    FOUND("Found"),
    MISSING("Missing");

    private final String label;

    Status(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }
}
