package dev.docqa.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Label-positional field extraction over noisy page text.
 *
 * <p>Every case-insensitive occurrence of a vocabulary label marks the start of a value; the value
 * runs until the next label occurrence (or the end of the text). Values are stripped of leading
 * separators, whitespace-collapsed and capped at {@value #MAX_VALUE_LENGTH} characters. Fields that
 * the positional pass does not yield are retried once with a single-line {@code label: value}
 * pattern. When no label occurs at all, only the single-line patterns are used.
 *
 * <p>Matching is plain substring search, not longest-match: a label contained in another label
 * (e.g. {@code Part Number} inside {@code Customer Part Number}) also matches inside the longer
 * one, which shortens the longer label's value span. Output is deterministic for a given input.
 */
@Component
public class FieldExtractor {

  static final int MAX_VALUE_LENGTH = 1000;

  private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s:.-]*");
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private static final Map<String, Pattern> LABEL_PATTERNS = compile("");
  private static final Map<String, Pattern> LINE_PATTERNS = compile("[:\\s]*([^\\n]+)");

  /**
   * Extract vocabulary fields from one page of text.
   *
   * @param text raw page text; may be empty
   * @return extracted fields; empty when the text is empty or holds no recognisable field
   */
  public FieldMap extract(String text) {
    if (text == null || text.isEmpty()) {
      return FieldMap.empty();
    }

    List<LabelOccurrence> occurrences = findOccurrences(text);
    Map<String, String> fields = new LinkedHashMap<>();

    if (occurrences.isEmpty()) {
      applyLinePatterns(text, fields);
      return FieldMap.of(fields);
    }

    occurrences.sort(Comparator.comparingInt(LabelOccurrence::start));
    for (int i = 0; i < occurrences.size(); i++) {
      LabelOccurrence occurrence = occurrences.get(i);
      int valueEnd = i + 1 < occurrences.size() ? occurrences.get(i + 1).start() : text.length();
      // overlapping labels can put the next start before this end
      int valueStart = Math.min(occurrence.end(), valueEnd);
      String value = normalize(text.substring(valueStart, valueEnd));
      if (!value.isEmpty()) {
        fields.put(occurrence.field(), value);
      }
    }

    applyLinePatterns(text, fields);
    return FieldMap.of(fields);
  }

  private static List<LabelOccurrence> findOccurrences(String text) {
    List<LabelOccurrence> occurrences = new ArrayList<>();
    for (Map.Entry<String, Pattern> entry : LABEL_PATTERNS.entrySet()) {
      Matcher matcher = entry.getValue().matcher(text);
      while (matcher.find()) {
        occurrences.add(new LabelOccurrence(matcher.start(), matcher.end(), entry.getKey()));
      }
    }
    return occurrences;
  }

  /** Single-line fallback for every field not yet recorded. */
  private static void applyLinePatterns(String text, Map<String, String> fields) {
    for (Map.Entry<String, Pattern> entry : LINE_PATTERNS.entrySet()) {
      if (fields.containsKey(entry.getKey())) {
        continue;
      }
      Matcher matcher = entry.getValue().matcher(text);
      if (matcher.find()) {
        String value = collapse(matcher.group(1));
        if (!value.isEmpty()) {
          fields.put(entry.getKey(), value);
        }
      }
    }
  }

  static String normalize(String rawValue) {
    return collapse(LEADING_SEPARATORS.matcher(rawValue).replaceFirst(""));
  }

  private static String collapse(String value) {
    String collapsed = WHITESPACE_RUN.matcher(value).replaceAll(" ").strip();
    return collapsed.length() > MAX_VALUE_LENGTH
        ? collapsed.substring(0, MAX_VALUE_LENGTH)
        : collapsed;
  }

  private static Map<String, Pattern> compile(String suffix) {
    Map<String, Pattern> patterns = new LinkedHashMap<>();
    for (String field : FieldVocabulary.FIELDS) {
      patterns.put(
          field,
          Pattern.compile(
              Pattern.quote(field) + suffix, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
    return patterns;
  }

  private record LabelOccurrence(int start, int end, String field) {}
}
