package dev.docqa.pipeline;

import dev.docqa.extraction.FieldMap;
import dev.docqa.extraction.FieldVocabulary;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Accumulates every value found per vocabulary field, for the field summary artifact. */
class FieldValueSummary {

  static final List<String> HEADER = List.of("Field", "Status", "Output");

  private final Map<String, List<String>> valuesByField = new LinkedHashMap<>();

  FieldValueSummary() {
    for (String field : FieldVocabulary.FIELDS) {
      valuesByField.put(field, new ArrayList<>());
    }
  }

  void record(FieldMap fields) {
    fields.asMap().forEach((field, value) -> valuesByField.get(field).add(value));
  }

  List<List<String>> toRows() {
    List<List<String>> rows = new ArrayList<>(valuesByField.size());
    valuesByField.forEach(
        (field, values) ->
            rows.add(
                values.isEmpty()
                    ? List.of(field, "Not found", "Not found")
                    : List.of(field, "Found", String.join("; ", values))));
    return rows;
  }
}
