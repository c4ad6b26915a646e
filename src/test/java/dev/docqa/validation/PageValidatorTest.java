package dev.docqa.validation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.docqa.extraction.FieldMap;
import dev.docqa.extraction.FieldVocabulary;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PageValidatorTest {

  private final PageValidator validator = new PageValidator();

  @Test
  void emptyPageReportsEveryFieldMissingInVocabularyOrder() {
    List<Anomaly> anomalies = validator.validatePage(3, FieldMap.empty());

    assertThat(anomalies).hasSize(FieldVocabulary.size());
    assertThat(anomalies)
        .extracting(Anomaly::field)
        .containsExactlyElementsOf(FieldVocabulary.FIELDS);
    assertThat(anomalies).allMatch(a -> a.kind() == Anomaly.Kind.MISSING && a.page() == 3);
  }

  @Test
  void completePageInRangeHasNoAnomalies() {
    assertThat(validator.validatePage(1, completePage("100", "1.0"))).isEmpty();
  }

  @Test
  void outOfRangeValuesAreReportedAfterMissingFields() {
    Map<String, String> values = new LinkedHashMap<>(completePage("110", "1.0").asMap());
    values.remove("Date");

    List<Anomaly> anomalies = validator.validatePage(2, FieldMap.of(values));

    assertThat(anomalies)
        .containsExactly(Anomaly.missing(2, "Date"), Anomaly.outOfRange(2, "Resistance", "110"));
  }

  @Test
  void unparseableNumericValueIsOutOfRange() {
    List<Anomaly> anomalies = validator.validatePage(1, completePage("100", "unknown"));

    assertThat(anomalies).containsExactly(Anomaly.outOfRange(1, "Dimension", "unknown"));
    assertThat(anomalies.get(0).issue()).isEqualTo("Out of range: unknown");
  }

  private static FieldMap completePage(String resistance, String dimension) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String field : FieldVocabulary.FIELDS) {
      values.put(field, "value");
    }
    values.put("Resistance", resistance);
    values.put("Dimension", dimension);
    return FieldMap.of(values);
  }
}
