package dev.docqa.validation;

import dev.docqa.extraction.FieldMap;
import dev.docqa.extraction.FieldVocabulary;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Cross-page check that selected fields carry a single value throughout a document. */
@Component
public class ConsistencyChecker {

  /**
   * Check whether a field has at most one distinct value across pages.
   *
   * @param fieldName vocabulary field name
   * @param allFieldMaps per-page field maps, in page order
   * @return true if the field holds one value everywhere it appears, or appears nowhere
   */
  public boolean checkConsistency(String fieldName, List<FieldMap> allFieldMaps) {
    Set<String> distinct = new HashSet<>();
    for (FieldMap fields : allFieldMaps) {
      fields.get(fieldName).ifPresent(distinct::add);
      if (distinct.size() > 1) {
        return false;
      }
    }
    return true;
  }

  /**
   * Run {@link #checkConsistency} for every field in {@link FieldVocabulary#CONSISTENCY_FIELDS}.
   *
   * @return one {@code Inconsistent values} anomaly per failing field, tagged "All Pages"
   */
  public List<Anomaly> findInconsistencies(List<FieldMap> allFieldMaps) {
    List<Anomaly> anomalies = new ArrayList<>();
    for (String field : FieldVocabulary.CONSISTENCY_FIELDS) {
      if (!checkConsistency(field, allFieldMaps)) {
        anomalies.add(Anomaly.inconsistent(field));
      }
    }
    return anomalies;
  }
}
