package se.alipsa.fqe.helper;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import se.alipsa.fqe.wire.WireType;
import se.alipsa.fqe.wire.WireValue;

/**
 * Best-effort conversion of loosely typed wire cells into the representations requested by JDBC accessors.
 *
 * <p>
 * Every method is a pure function of the cell. A genuine null yields the zero value of the requested type
 * ({@code 0}, {@code false}, {@code null}); a non-null cell that cannot be converted also yields the zero value and is
 * never reported as null. Numeric text that fails to parse never raises.
 * </p>
 */
public final class WireCoercions {

  /** Lower-cased tokens read as {@code true} by {@link #toBoolean(WireValue)}. */
  public static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");

  private static final DateTimeFormatter SPACED_TIMESTAMP = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral(' ')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart()
      .appendOffset("+HH:mm", "Z")
      .optionalEnd()
      .toFormatter(Locale.ROOT);

  private WireCoercions() {
  }

  /**
   * Text representation. Booleans render as {@code true}/{@code false}, decimals without exponent.
   *
   * @param v
   *          the cell
   * @return the text, or {@code null} for a null cell
   */
  public static String toText(WireValue v) {
    if (v == null || v.isNull()) {
      return null;
    }
    if (v instanceof WireValue.Text t) {
      return t.value();
    }
    if (v instanceof WireValue.Bool b) {
      return Boolean.toString(b.value());
    }
    if (v instanceof WireValue.Int i) {
      return Long.toString(i.value());
    }
    if (v instanceof WireValue.Decimal d) {
      return d.value().toPlainString();
    }
    return new String(((WireValue.Bytes) v).value(), StandardCharsets.UTF_8);
  }

  /**
   * Boolean representation. Numbers are true when non-zero; text is true when its lower-cased form is one of
   * {@link #TRUTHY}.
   *
   * @param v
   *          the cell
   * @return the boolean value
   */
  public static boolean toBoolean(WireValue v) {
    if (v == null || v.isNull()) {
      return false;
    }
    if (v instanceof WireValue.Bool b) {
      return b.value();
    }
    if (v instanceof WireValue.Int i) {
      return i.value() != 0;
    }
    if (v instanceof WireValue.Decimal d) {
      return d.value().signum() != 0;
    }
    return TRUTHY.contains(toText(v).trim().toLowerCase(Locale.ROOT));
  }

  public static byte toByte(WireValue v) {
    return (byte) toIntegral(v, Byte.MIN_VALUE, Byte.MAX_VALUE);
  }

  public static short toShort(WireValue v) {
    return (short) toIntegral(v, Short.MIN_VALUE, Short.MAX_VALUE);
  }

  public static int toInt(WireValue v) {
    return (int) toIntegral(v, Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  public static long toLong(WireValue v) {
    return toIntegral(v, Long.MIN_VALUE, Long.MAX_VALUE);
  }

  /**
   * Integral conversion. Numbers are truncated toward zero and narrowed by the caller's cast; text must parse as an
   * integer within {@code [min, max]}, otherwise the result is 0.
   */
  private static long toIntegral(WireValue v, long min, long max) {
    if (v == null || v.isNull()) {
      return 0L;
    }
    if (v instanceof WireValue.Int i) {
      return i.value();
    }
    if (v instanceof WireValue.Decimal d) {
      return d.value().longValue();
    }
    if (v instanceof WireValue.Bool b) {
      return b.value() ? 1L : 0L;
    }
    try {
      long parsed = Long.parseLong(toText(v).trim());
      return parsed < min || parsed > max ? 0L : parsed;
    } catch (NumberFormatException e) {
      return 0L;
    }
  }

  /**
   * Double conversion; unparsable text yields {@code 0.0}.
   *
   * @param v
   *          the cell
   * @return the value
   */
  public static double toDouble(WireValue v) {
    if (v == null || v.isNull()) {
      return 0d;
    }
    if (v instanceof WireValue.Int i) {
      return i.value();
    }
    if (v instanceof WireValue.Decimal d) {
      return d.value().doubleValue();
    }
    if (v instanceof WireValue.Bool b) {
      return b.value() ? 1d : 0d;
    }
    try {
      return Double.parseDouble(toText(v).trim());
    } catch (NumberFormatException e) {
      return 0d;
    }
  }

  public static float toFloat(WireValue v) {
    return (float) toDouble(v);
  }

  /**
   * Exact decimal conversion; unparsable text yields {@link BigDecimal#ZERO}.
   *
   * @param v
   *          the cell
   * @return the value, or {@code null} for a null cell
   */
  public static BigDecimal toBigDecimal(WireValue v) {
    if (v == null || v.isNull()) {
      return null;
    }
    if (v instanceof WireValue.Decimal d) {
      return d.value();
    }
    if (v instanceof WireValue.Int i) {
      return BigDecimal.valueOf(i.value());
    }
    if (v instanceof WireValue.Bool b) {
      return b.value() ? BigDecimal.ONE : BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(toText(v).trim());
    } catch (NumberFormatException e) {
      return BigDecimal.ZERO;
    }
  }

  /**
   * Binary content; text is encoded as UTF-8.
   *
   * @param v
   *          the cell
   * @return a fresh array, or {@code null} for a null cell
   */
  public static byte[] toBytes(WireValue v) {
    if (v == null || v.isNull()) {
      return null;
    }
    if (v instanceof WireValue.Bytes b) {
      return b.value().clone();
    }
    return toText(v).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Date conversion from ISO text; a timestamp text yields its date part.
   *
   * @param v
   *          the cell
   * @return the date, or {@code null} when the cell is null or not a recognizable date
   */
  public static Date toDate(WireValue v) {
    LocalDate date = parseLocalDate(textOf(v));
    if (date != null) {
      return Date.valueOf(date);
    }
    LocalDateTime dateTime = parseLocalDateTime(textOf(v));
    return dateTime == null ? null : Date.valueOf(dateTime.toLocalDate());
  }

  /**
   * Time conversion from ISO text; a timestamp text yields its time part.
   *
   * @param v
   *          the cell
   * @return the time, or {@code null} when the cell is null or not a recognizable time
   */
  public static Time toTime(WireValue v) {
    String text = textOf(v);
    if (text == null) {
      return null;
    }
    try {
      return Time.valueOf(LocalTime.parse(text));
    } catch (DateTimeParseException e) {
      LocalDateTime dateTime = parseLocalDateTime(text);
      return dateTime == null ? null : Time.valueOf(dateTime.toLocalTime());
    }
  }

  /**
   * Timestamp conversion from {@code yyyy-mm-dd hh:mm:ss[.f]} or ISO text, with or without an offset. A date-only
   * text yields midnight of that day.
   *
   * @param v
   *          the cell
   * @return the timestamp, or {@code null} when the cell is null or not a recognizable timestamp
   */
  public static Timestamp toTimestamp(WireValue v) {
    String text = textOf(v);
    if (text == null) {
      return null;
    }
    try {
      return Timestamp.valueOf(text);
    } catch (IllegalArgumentException e) {
      OffsetDateTime offset = parseOffsetDateTime(text);
      if (offset != null) {
        return Timestamp.from(offset.toInstant());
      }
      LocalDateTime dateTime = parseLocalDateTime(text);
      if (dateTime != null) {
        return Timestamp.valueOf(dateTime);
      }
      LocalDate date = parseLocalDate(text);
      return date == null ? null : Timestamp.valueOf(date.atStartOfDay());
    }
  }

  /**
   * The natural Java value of a cell for its column's wire type, matching
   * {@link WireType#className()}. A temporal or numeric text that cannot be parsed is returned as the raw text.
   *
   * @param v
   *          the cell
   * @param type
   *          the column's wire type
   * @return the value, or {@code null} for a null cell
   */
  public static Object toObject(WireValue v, WireType type) {
    if (v == null || v.isNull()) {
      return null;
    }
    switch (type) {
      case BOOLEAN:
        return v instanceof WireValue.Bool b ? b.value() : toBoolean(v);
      case TINYINT:
        return isNumber(v) ? (Object) toByte(v) : parsedOrText(v, Byte::valueOf);
      case SMALLINT:
        return isNumber(v) ? (Object) toShort(v) : parsedOrText(v, Short::valueOf);
      case INTEGER:
        return isNumber(v) ? (Object) toInt(v) : parsedOrText(v, Integer::valueOf);
      case BIGINT:
        return isNumber(v) ? (Object) toLong(v) : parsedOrText(v, Long::valueOf);
      case HUGEINT:
      case DECIMAL:
        return isNumber(v) ? (Object) toBigDecimal(v) : parsedOrText(v, BigDecimal::new);
      case REAL:
        return isNumber(v) ? (Object) toFloat(v) : parsedOrText(v, Float::valueOf);
      case DOUBLE:
        return isNumber(v) ? (Object) toDouble(v) : parsedOrText(v, Double::valueOf);
      case DATE:
        return orText(toDate(v), v);
      case TIME:
        return orText(toTime(v), v);
      case TIMESTAMP:
      case TIMESTAMP_TZ:
        return orText(toTimestamp(v), v);
      case BLOB:
        return toBytes(v);
      default:
        return v instanceof WireValue.Bytes ? toBytes(v) : toText(v);
    }
  }

  private static boolean isNumber(WireValue v) {
    return v instanceof WireValue.Int || v instanceof WireValue.Decimal || v instanceof WireValue.Bool;
  }

  private static Object parsedOrText(WireValue v, Function<String, Object> parser) {
    String text = toText(v);
    try {
      return parser.apply(text.trim());
    } catch (NumberFormatException e) {
      return text;
    }
  }

  private static Object orText(Object parsed, WireValue v) {
    return parsed != null ? parsed : toText(v);
  }

  private static String textOf(WireValue v) {
    if (v instanceof WireValue.Text || v instanceof WireValue.Bytes) {
      String text = toText(v).trim();
      return text.isEmpty() ? null : text;
    }
    return null;
  }

  private static LocalDate parseLocalDate(String text) {
    if (text == null) {
      return null;
    }
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static LocalDateTime parseLocalDateTime(String text) {
    if (text == null) {
      return null;
    }
    try {
      return LocalDateTime.parse(text, text.indexOf('T') > 0 ? DateTimeFormatter.ISO_LOCAL_DATE_TIME : SPACED_TIMESTAMP);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static OffsetDateTime parseOffsetDateTime(String text) {
    try {
      if (text.indexOf('T') > 0) {
        return OffsetDateTime.parse(text);
      }
      return OffsetDateTime.parse(text, SPACED_TIMESTAMP);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
