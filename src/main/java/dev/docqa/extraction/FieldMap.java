package dev.docqa.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping of vocabulary field name to extracted value for a single page.
 *
 * <p>Keys are a subset of {@link FieldVocabulary#FIELDS}; values are whitespace-normalized and
 * never blank. Iteration follows the order in which fields were recorded.
 */
public final class FieldMap {

  private static final FieldMap EMPTY = new FieldMap(Map.of());

  private final Map<String, String> values;

  private FieldMap(Map<String, String> values) {
    this.values = values;
  }

  public static FieldMap empty() {
    return EMPTY;
  }

  /**
   * Copy the given entries into a new field map, keeping their iteration order.
   *
   * @param values field to value entries; keys must be vocabulary fields
   * @return an immutable field map
   */
  public static FieldMap of(Map<String, String> values) {
    Objects.requireNonNull(values, "values must not be null");
    Map<String, String> copy = new LinkedHashMap<>();
    values.forEach(
        (field, value) -> {
          if (!FieldVocabulary.contains(field)) {
            throw new IllegalArgumentException("Not a vocabulary field: " + field);
          }
          copy.put(field, Objects.requireNonNull(value, "value must not be null for " + field));
        });
    return new FieldMap(Collections.unmodifiableMap(copy));
  }

  public Optional<String> get(String field) {
    return Optional.ofNullable(values.get(field));
  }

  public boolean contains(String field) {
    return values.containsKey(field);
  }

  public Set<String> fields() {
    return values.keySet();
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<String, String> asMap() {
    return values;
  }

  /**
   * Keep only the given fields. Used to retain the small per-page projection needed for
   * cross-page checks without holding every page's full map.
   */
  public FieldMap retainOnly(Iterable<String> fields) {
    Map<String, String> kept = new LinkedHashMap<>();
    for (String field : fields) {
      String value = values.get(field);
      if (value != null) {
        kept.put(field, value);
      }
    }
    return kept.isEmpty() ? EMPTY : new FieldMap(Collections.unmodifiableMap(kept));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FieldMap other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "FieldMap" + values;
  }
}
