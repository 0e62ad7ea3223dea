package se.alipsa.fqe.helper;

import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import se.alipsa.fqe.FqeResultSet;
import se.alipsa.fqe.wire.ColumnMeta;
import se.alipsa.fqe.wire.WireResult;

/** Utility methods. */
public final class FqeUtil {

  private FqeUtil() {
  }

  /**
   * Parses a descriptor query string into an ordered option map.
   *
   * <p>
   * Pairs are separated by {@code &} and split on the first {@code =}. A pair without {@code =} or with an empty key is
   * dropped. Keys and values are kept verbatim; a later duplicate key replaces an earlier one.
   * </p>
   *
   * @param qs
   *          the query string, with or without a leading {@code ?} (may be {@code null})
   * @return an unmodifiable map of the key-value pairs
   */
  public static Map<String, String> parseUrlQuery(String qs) {
    if (qs == null || qs.isEmpty()) {
      return Map.of();
    }
    String s = qs.charAt(0) == '?' ? qs.substring(1) : qs;
    Map<String, String> options = new LinkedHashMap<>();
    for (String kv : s.split("&")) {
      if (kv.isEmpty()) {
        continue;
      }
      String[] arr = kv.split("=", 2);
      if (arr.length != 2 || arr[0].isEmpty()) {
        continue;
      }
      options.put(arr[0], arr[1]);
    }
    return Collections.unmodifiableMap(options);
  }

  /**
   * Merge descriptor options with explicitly supplied properties. Properties win on conflicts.
   *
   * @param options
   *          options parsed from the descriptor
   * @param overrides
   *          properties passed to {@code connect} (may be {@code null})
   * @return an unmodifiable merged map
   */
  public static Map<String, String> mergeOptions(Map<String, String> options, Properties overrides) {
    Map<String, String> merged = new LinkedHashMap<>(options);
    if (overrides != null) {
      for (String name : overrides.stringPropertyNames()) {
        merged.put(name, overrides.getProperty(name));
      }
    }
    return Collections.unmodifiableMap(merged);
  }

  /**
   * Parse an integer option, falling back to a default when absent or malformed.
   *
   * @param value
   *          the raw option value (may be {@code null})
   * @param defaultValue
   *          value used when {@code value} is not a valid integer
   * @return the parsed value or {@code defaultValue}
   */
  public static int parseIntOrDefault(String value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Creates a ResultSet from the given headers and rows.
   *
   * <p>
   * Column types are taken from the first non-null value of each column: integral numbers become
   * {@code INTEGER}/{@code SMALLINT}/{@code BIGINT}, booleans {@code BOOLEAN} and anything else {@code VARCHAR}.
   * </p>
   *
   * @param headers
   *          the column headers
   * @param rows
   *          the rows, each with one value per header
   * @return a scrollable, detached ResultSet
   */
  public static ResultSet listResultSet(String[] headers, List<Object[]> rows) {
    List<ColumnMeta> columns = new ArrayList<>(headers.length);
    for (int c = 0; c < headers.length; c++) {
      columns.add(new ColumnMeta(headers[c], "NULLABLE(" + columnType(rows, c) + ")"));
    }
    List<List<Object>> values = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      values.add(Arrays.asList(row));
    }
    return new FqeResultSet(null, WireResult.of(columns, values));
  }

  /**
   * Creates a ResultSet from the given headers and rows.
   *
   * @param headers
   *          the column headers
   * @param rows
   *          the rows
   * @return a scrollable, detached ResultSet
   */
  public static ResultSet listResultSet(List<String> headers, List<Object[]> rows) {
    return listResultSet(headers.toArray(new String[0]), rows);
  }

  private static String columnType(List<Object[]> rows, int column) {
    for (Object[] row : rows) {
      Object v = row[column];
      if (v == null) {
        continue;
      }
      if (v instanceof Short) {
        return "SMALLINT";
      }
      if (v instanceof Integer) {
        return "INTEGER";
      }
      if (v instanceof Long) {
        return "BIGINT";
      }
      if (v instanceof Boolean) {
        return "BOOLEAN";
      }
      return "VARCHAR";
    }
    return "VARCHAR";
  }
}
