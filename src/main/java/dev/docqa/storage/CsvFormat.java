package dev.docqa.storage;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 CSV writing and reading for job artifacts.
 *
 * <p>Values are quoted only when they contain a comma, a double quote, CR or LF; embedded quotes
 * are doubled. Records are terminated by CRLF.
 */
public final class CsvFormat {

  static final String RECORD_SEPARATOR = "\r\n";

  private CsvFormat() {
    // utility class
  }

  public static String escape(String value) {
    if (value.indexOf(',') >= 0
        || value.indexOf('"') >= 0
        || value.indexOf('\n') >= 0
        || value.indexOf('\r') >= 0) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  /** Write one record, including its terminator. */
  public static void writeRecord(Writer writer, List<String> values) throws IOException {
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        writer.write(',');
      }
      writer.write(escape(values.get(i)));
    }
    writer.write(RECORD_SEPARATOR);
  }

  /**
   * Read every record from the reader. Quoted values may span lines; a trailing empty line does not
   * produce a record.
   */
  public static List<List<String>> readAll(BufferedReader reader) throws IOException {
    List<List<String>> records = new ArrayList<>();
    List<String> record = new ArrayList<>();
    StringBuilder value = new StringBuilder();
    boolean quoted = false;
    boolean recordStarted = false;

    int c;
    while ((c = reader.read()) != -1) {
      char ch = (char) c;
      if (quoted) {
        if (ch == '"') {
          reader.mark(1);
          int next = reader.read();
          if (next == '"') {
            value.append('"');
          } else {
            quoted = false;
            if (next != -1) {
              reader.reset();
            }
          }
        } else {
          value.append(ch);
        }
        continue;
      }
      switch (ch) {
        case '"' -> {
          quoted = true;
          recordStarted = true;
        }
        case ',' -> {
          record.add(value.toString());
          value.setLength(0);
          recordStarted = true;
        }
        case '\r' -> {
          // CR is only meaningful as part of CRLF outside quotes
        }
        case '\n' -> {
          if (recordStarted || value.length() > 0) {
            record.add(value.toString());
            records.add(List.copyOf(record));
          }
          record.clear();
          value.setLength(0);
          recordStarted = false;
        }
        default -> {
          value.append(ch);
          recordStarted = true;
        }
      }
    }
    if (recordStarted || value.length() > 0) {
      record.add(value.toString());
      records.add(List.copyOf(record));
    }
    return records;
  }
}
