package dev.docqa.extraction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static utility checking numeric field values against the ranges in {@link FieldVocabulary}.
 *
 * <p>The first run of digits and decimal points in the value is parsed as a double. A value with no
 * such run, a run that does not parse (e.g. {@code "1.2.3"}), or a field with no configured range
 * all count as a validation failure rather than an error.
 */
public final class NumericRangeValidator {

  private static final Pattern NUMBER_RUN = Pattern.compile("[\\d.]+");

  private NumericRangeValidator() {
    // utility class
  }

  /**
   * Check whether the value of a numeric field lies within its inclusive range.
   *
   * @param field vocabulary field name
   * @param value extracted value, e.g. {@code "100 ohms"}
   * @return true iff a number was parsed and falls inside the field's range
   */
  public static boolean validateNumeric(String field, String value) {
    Optional<FieldVocabulary.NumericRange> range = FieldVocabulary.rangeOf(field);
    if (range.isEmpty() || value == null) {
      return false;
    }
    Matcher matcher = NUMBER_RUN.matcher(value);
    if (!matcher.find()) {
      return false;
    }
    try {
      return range.get().contains(Double.parseDouble(matcher.group()));
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
