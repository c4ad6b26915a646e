package dev.docqa.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed, ordered set of labeled fields looked for on every page of a QA document.
 *
 * <p>Also carries the two field subsets with extra rules: the numeric fields and their inclusive
 * ranges, and the fields that must hold the same value on every page. All collections are
 * immutable and shared read-only by the extractor and the validators.
 */
public final class FieldVocabulary {

  /** Required fields, in output order. */
  public static final List<String> FIELDS =
      List.of(
          "Customer Name",
          "Customer P.O. Number",
          "Customer Part Number",
          "Customer Part Number Revision",
          "AEM Part Number",
          "AEM Lot Number",
          "AEM Date Code",
          "AEM Cage Code",
          "Customer Quality Clauses",
          "FAI Form 3",
          "Solderability Test Report",
          "DPA",
          "Visual Inspection Record",
          "Shipment Quantity",
          "Reel Labels",
          "Certificate of Conformance",
          "Route Sheet",
          "Part Number",
          "Lot Number",
          "Date",
          "Resistance",
          "Dimension",
          "Test Result");

  /** Fields compared across all pages once extraction is complete. */
  public static final List<String> CONSISTENCY_FIELDS =
      List.of("Part Number", "Lot Number", "Date");

  private static final Map<String, NumericRange> NUMERIC_RANGES = numericRanges();

  private FieldVocabulary() {
    // utility class
  }

  /** Number of vocabulary fields; every page contributes exactly this many output rows. */
  public static int size() {
    return FIELDS.size();
  }

  public static boolean contains(String field) {
    return FIELDS.contains(field);
  }

  /**
   * Look up the inclusive numeric range for a field.
   *
   * @param field vocabulary field name
   * @return the range, or empty when the field carries no numeric rule
   */
  public static Optional<NumericRange> rangeOf(String field) {
    return Optional.ofNullable(NUMERIC_RANGES.get(field));
  }

  /** Fields with a numeric range, in vocabulary order. */
  public static List<String> numericFields() {
    return List.copyOf(NUMERIC_RANGES.keySet());
  }

  private static Map<String, NumericRange> numericRanges() {
    Map<String, NumericRange> ranges = new LinkedHashMap<>();
    ranges.put("Resistance", new NumericRange(95, 105));
    ranges.put("Dimension", new NumericRange(0.9, 1.1));
    return Collections.unmodifiableMap(ranges);
  }

  /**
   * Inclusive numeric bounds for a field value.
   *
   * @param min lowest accepted value
   * @param max highest accepted value
   */
  public record NumericRange(double min, double max) {

    public NumericRange {
      if (min > max) {
        throw new IllegalArgumentException("min must not exceed max: " + min + " > " + max);
      }
    }

    public boolean contains(double value) {
      return min <= value && value <= max;
    }
  }
}
