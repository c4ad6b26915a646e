package dev.docqa.validation;

import dev.docqa.extraction.FieldMap;
import dev.docqa.extraction.FieldVocabulary;
import dev.docqa.extraction.NumericRangeValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Presence and numeric-range checks for the fields extracted from a single page. */
@Component
public class PageValidator {

  /**
   * Validate one page's extracted fields.
   *
   * <p>Emits one {@code Missing} anomaly per vocabulary field absent from the map (in vocabulary
   * order), followed by one {@code Out of range} anomaly per present numeric field whose value
   * fails its range check.
   *
   * @param pageIndex 1-based page number
   * @param fieldMap fields extracted from that page
   * @return the page's anomalies; empty when every field is present and in range
   */
  public List<Anomaly> validatePage(int pageIndex, FieldMap fieldMap) {
    List<Anomaly> anomalies = new ArrayList<>();
    for (String field : FieldVocabulary.FIELDS) {
      if (!fieldMap.contains(field)) {
        anomalies.add(Anomaly.missing(pageIndex, field));
      }
    }
    for (String field : FieldVocabulary.numericFields()) {
      Optional<String> value = fieldMap.get(field);
      if (value.isPresent() && !NumericRangeValidator.validateNumeric(field, value.get())) {
        anomalies.add(Anomaly.outOfRange(pageIndex, field, value.get()));
      }
    }
    return anomalies;
  }
}
