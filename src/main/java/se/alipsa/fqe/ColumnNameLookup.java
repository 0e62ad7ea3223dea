package se.alipsa.fqe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import se.alipsa.fqe.wire.ColumnMeta;

/**
 * Utility helpers for resolving column labels to indexes.
 */
final class ColumnNameLookup {

  private ColumnNameLookup() {
  }

  /**
   * Build a case-insensitive lookup map for the supplied columns. When several columns share a label the first one
   * wins.
   *
   * @param columns
   *          the result columns in order
   * @return an immutable map associating lower-cased column names to their 1-based column index
   */
  static Map<String, Integer> buildCaseInsensitiveIndex(List<ColumnMeta> columns) {
    if (columns == null || columns.isEmpty()) {
      return Map.of();
    }
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      String key = normalizeKey(columns.get(i).name());
      if (!key.isEmpty()) {
        index.putIfAbsent(key, i + 1);
      }
    }
    return index.isEmpty() ? Map.of() : Collections.unmodifiableMap(index);
  }

  /**
   * Normalize a column name for case-insensitive lookups.
   *
   * @param name
   *          the column name to normalize (may be {@code null})
   * @return the normalized key, or an empty string when {@code name} is {@code null} or blank
   */
  static String normalizeKey(String name) {
    if (name == null) {
      return "";
    }
    String trimmed = name.trim();
    if (trimmed.isEmpty()) {
      return "";
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }
}
