package se.alipsa.fqe.helper;

import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.UUID;

/**
 * Renders a prepared statement's SQL text with its bound parameters substituted as SQL literals.
 *
 * <p>
 * Placeholders are the {@code ?} characters outside quoted literals, quoted identifiers and comments. They are
 * numbered from 1 left to right and replaced while a value is bound for their ordinal; from the first unbound
 * ordinal on, the text is kept as is. Substitution is purely textual: text values are protected only by doubling
 * embedded single quotes.
 * </p>
 */
public final class ParameterBinder {

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ISO_LOCAL_TIME;
  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
      .ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSSSS");
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private ParameterBinder() {
  }

  /**
   * Substitute bound parameters into {@code sql}.
   *
   * @param sql
   *          the statement text containing {@code ?} placeholders
   * @param parameters
   *          1-based ordinal to value; a key mapped to {@code null} is bound to SQL {@code NULL}
   * @return the text to send to the server
   * @throws SQLException
   *           if a bound value cannot be rendered as a literal
   */
  public static String bind(String sql, Map<Integer, Object> parameters) throws SQLException {
    if (parameters.isEmpty()) {
      return sql;
    }
    StringBuilder rendered = new StringBuilder(sql.length() + 32);
    ParseState state = ParseState.NORMAL;
    int ordinal = 0;
    boolean substituting = true;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      boolean consumed = false;
      switch (state) {
        case NORMAL -> {
          if (c == '\'') {
            state = ParseState.SINGLE_QUOTE;
          } else if (c == '"') {
            state = ParseState.DOUBLE_QUOTE;
          } else if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
            state = ParseState.LINE_COMMENT;
          } else if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
            state = ParseState.BLOCK_COMMENT;
          } else if (c == '?' && substituting) {
            ordinal++;
            if (parameters.containsKey(ordinal)) {
              rendered.append(renderLiteral(parameters.get(ordinal)));
              consumed = true;
            } else {
              substituting = false;
            }
          }
        }
        case SINGLE_QUOTE -> {
          if (c == '\'') {
            if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
              rendered.append(c).append(sql.charAt(i + 1));
              i++;
              consumed = true;
            } else {
              state = ParseState.NORMAL;
            }
          }
        }
        case DOUBLE_QUOTE -> {
          if (c == '"') {
            state = ParseState.NORMAL;
          }
        }
        case LINE_COMMENT -> {
          if (c == '\n' || c == '\r') {
            state = ParseState.NORMAL;
          }
        }
        case BLOCK_COMMENT -> {
          if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
            state = ParseState.NORMAL;
            rendered.append(c).append(sql.charAt(i + 1));
            i++;
            consumed = true;
          }
        }
        default -> {
        }
      }
      if (!consumed) {
        rendered.append(c);
      }
    }
    return rendered.toString();
  }

  /**
   * Count the placeholders in {@code sql}, ignoring those inside literals and comments.
   *
   * @param sql
   *          the statement text
   * @return number of placeholders
   */
  public static int countPlaceholders(String sql) {
    int count = 0;
    ParseState state = ParseState.NORMAL;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      switch (state) {
        case NORMAL -> {
          if (c == '\'') {
            state = ParseState.SINGLE_QUOTE;
          } else if (c == '"') {
            state = ParseState.DOUBLE_QUOTE;
          } else if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
            state = ParseState.LINE_COMMENT;
          } else if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
            state = ParseState.BLOCK_COMMENT;
          } else if (c == '?') {
            count++;
          }
        }
        case SINGLE_QUOTE -> {
          if (c == '\'') {
            state = ParseState.NORMAL;
          }
        }
        case DOUBLE_QUOTE -> {
          if (c == '"') {
            state = ParseState.NORMAL;
          }
        }
        case LINE_COMMENT -> {
          if (c == '\n' || c == '\r') {
            state = ParseState.NORMAL;
          }
        }
        case BLOCK_COMMENT -> {
          if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
            state = ParseState.NORMAL;
            i++;
          }
        }
        default -> {
        }
      }
    }
    return count;
  }

  /**
   * Render a value as a SQL literal.
   *
   * @param value
   *          the value (may be {@code null})
   * @return the literal text
   * @throws SQLException
   *           for streams and non-finite floating point values
   */
  public static String renderLiteral(Object value) throws SQLException {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof String str) {
      return quote(str);
    }
    if (value instanceof Character ch) {
      return quote(String.valueOf(ch));
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
      throw new SQLException("Floating point parameter cannot be NaN or infinite");
    }
    if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
      throw new SQLException("Floating point parameter cannot be NaN or infinite");
    }
    if (value instanceof Timestamp ts) {
      return quote(TIMESTAMP_FORMAT.format(ts.toLocalDateTime()));
    }
    if (value instanceof Date date) {
      return quote(DATE_FORMAT.format(date.toLocalDate()));
    }
    if (value instanceof Time time) {
      return quote(TIME_FORMAT.format(time.toLocalTime()));
    }
    if (value instanceof java.util.Date date) {
      return quote(TIMESTAMP_FORMAT.format(new Timestamp(date.getTime()).toLocalDateTime()));
    }
    if (value instanceof LocalDate ld) {
      return quote(DATE_FORMAT.format(ld));
    }
    if (value instanceof LocalTime lt) {
      return quote(TIME_FORMAT.format(lt));
    }
    if (value instanceof LocalDateTime ldt) {
      return quote(TIMESTAMP_FORMAT.format(ldt));
    }
    if (value instanceof OffsetDateTime odt) {
      return quote(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt));
    }
    if (value instanceof Instant || value instanceof UUID) {
      return quote(value.toString());
    }
    if (value instanceof byte[] bytes) {
      return toBlobLiteral(bytes);
    }
    if (value instanceof InputStream || value instanceof Reader) {
      throw new SQLException("Stream parameters are not supported");
    }
    return value.toString();
  }

  /**
   * Quote a text value, doubling embedded single quotes.
   *
   * @param value
   *          the text (must not be {@code null})
   * @return the quoted literal
   */
  public static String quote(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  private static String toBlobLiteral(byte[] bytes) {
    StringBuilder sb = new StringBuilder(10 + bytes.length * 4);
    sb.append('\'');
    for (byte b : bytes) {
      sb.append("\\x").append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
    }
    sb.append("'::BLOB");
    return sb.toString();
  }

  private enum ParseState {
    NORMAL, SINGLE_QUOTE, DOUBLE_QUOTE, LINE_COMMENT, BLOCK_COMMENT
  }
}
