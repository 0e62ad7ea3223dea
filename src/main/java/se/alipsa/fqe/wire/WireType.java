package se.alipsa.fqe.wire;

import java.sql.Types;
import java.util.Locale;
import java.util.Map;

/**
 * The wire type table: maps the type names the engine reports in result metadata onto JDBC types, Java classes and
 * display properties. Lookup works on the inner type name, i.e. after {@link #innerTypeName(String)} has removed any
 * {@code NULLABLE(...)} wrapper; type parameters such as {@code DECIMAL(18,3)} are ignored.
 */
public enum WireType {

  BOOLEAN(Category.BOOLEAN, Types.BOOLEAN, "java.lang.Boolean", 1, 5, false),
  TINYINT(Category.INTEGER, Types.TINYINT, "java.lang.Byte", 3, 4, true),
  SMALLINT(Category.INTEGER, Types.SMALLINT, "java.lang.Short", 5, 6, true),
  INTEGER(Category.INTEGER, Types.INTEGER, "java.lang.Integer", 10, 11, true),
  BIGINT(Category.INTEGER, Types.BIGINT, "java.lang.Long", 19, 20, true),
  HUGEINT(Category.INTEGER, Types.NUMERIC, "java.math.BigDecimal", 39, 40, true),
  REAL(Category.FLOATING, Types.REAL, "java.lang.Float", 7, 13, true),
  DOUBLE(Category.FLOATING, Types.DOUBLE, "java.lang.Double", 15, 22, true),
  DECIMAL(Category.FLOATING, Types.DECIMAL, "java.math.BigDecimal", 18, 20, true),
  VARCHAR(Category.TEXT, Types.VARCHAR, "java.lang.String", 0, 255, false),
  DATE(Category.DATE, Types.DATE, "java.sql.Date", 10, 10, false),
  TIME(Category.TIME, Types.TIME, "java.sql.Time", 8, 8, false),
  TIMESTAMP(Category.TIMESTAMP, Types.TIMESTAMP, "java.sql.Timestamp", 29, 29, false),
  TIMESTAMP_TZ(Category.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE, "java.sql.Timestamp", 35, 35, false),
  BLOB(Category.BINARY, Types.BLOB, "[B", 0, 255, false),
  OTHER(Category.TEXT, Types.OTHER, "java.lang.String", 0, 255, false);

  /** How cells of a wire type are interpreted. */
  public enum Category {
    BOOLEAN, INTEGER, FLOATING, TEXT, DATE, TIME, TIMESTAMP, BINARY
  }

  private static final String NULLABLE_PREFIX = "NULLABLE(";

  private static final Map<String, WireType> ALIASES = Map.ofEntries(
      Map.entry("BOOL", BOOLEAN), Map.entry("LOGICAL", BOOLEAN),
      Map.entry("INT1", TINYINT), Map.entry("UTINYINT", SMALLINT),
      Map.entry("INT2", SMALLINT), Map.entry("SHORT", SMALLINT), Map.entry("USMALLINT", INTEGER),
      Map.entry("INT", INTEGER), Map.entry("INT4", INTEGER), Map.entry("SIGNED", INTEGER),
      Map.entry("UINTEGER", BIGINT),
      Map.entry("INT8", BIGINT), Map.entry("LONG", BIGINT),
      Map.entry("UBIGINT", HUGEINT), Map.entry("UHUGEINT", HUGEINT), Map.entry("INT128", HUGEINT),
      Map.entry("FLOAT", REAL), Map.entry("FLOAT4", REAL),
      Map.entry("FLOAT8", DOUBLE), Map.entry("DOUBLE PRECISION", DOUBLE),
      Map.entry("NUMERIC", DECIMAL),
      Map.entry("TEXT", VARCHAR), Map.entry("STRING", VARCHAR), Map.entry("CHAR", VARCHAR),
      Map.entry("BPCHAR", VARCHAR),
      Map.entry("TIMETZ", TIME), Map.entry("TIME WITH TIME ZONE", TIME),
      Map.entry("DATETIME", TIMESTAMP), Map.entry("TIMESTAMP_S", TIMESTAMP), Map.entry("TIMESTAMP_MS", TIMESTAMP),
      Map.entry("TIMESTAMP_NS", TIMESTAMP), Map.entry("TIMESTAMP_US", TIMESTAMP),
      Map.entry("TIMESTAMPTZ", TIMESTAMP_TZ), Map.entry("TIMESTAMP WITH TIME ZONE", TIMESTAMP_TZ),
      Map.entry("BYTEA", BLOB), Map.entry("BINARY", BLOB), Map.entry("VARBINARY", BLOB));

  private final Category category;
  private final int jdbcType;
  private final String className;
  private final int precision;
  private final int displaySize;
  private final boolean signed;

  WireType(Category category, int jdbcType, String className, int precision, int displaySize, boolean signed) {
    this.category = category;
    this.jdbcType = jdbcType;
    this.className = className;
    this.precision = precision;
    this.displaySize = displaySize;
    this.signed = signed;
  }

  /**
   * Resolve a wire type name. Wrappers, parameters and case are ignored; unknown names resolve to {@link #OTHER}.
   *
   * @param wireType
   *          the type name as reported by the engine (may be {@code null})
   * @return the matching table entry
   */
  public static WireType of(String wireType) {
    String base = baseName(innerTypeName(wireType));
    if (base.isEmpty()) {
      return OTHER;
    }
    if (base.endsWith("[]")) {
      return OTHER;
    }
    WireType alias = ALIASES.get(base);
    if (alias != null) {
      return alias;
    }
    for (WireType t : values()) {
      if (t.name().equals(base)) {
        return t;
      }
    }
    return OTHER;
  }

  /**
   * Remove any {@code NULLABLE(...)} wrapper and normalize to upper case.
   *
   * @param wireType
   *          the reported type name (may be {@code null})
   * @return the inner type name, empty when {@code wireType} is {@code null}
   */
  public static String innerTypeName(String wireType) {
    if (wireType == null) {
      return "";
    }
    String t = wireType.trim().toUpperCase(Locale.ROOT);
    while (t.startsWith(NULLABLE_PREFIX) && t.endsWith(")")) {
      t = t.substring(NULLABLE_PREFIX.length(), t.length() - 1).trim();
    }
    return t;
  }

  /**
   * Whether the reported type carries the {@code NULLABLE(...)} wrapper.
   *
   * @param wireType
   *          the reported type name (may be {@code null})
   * @return {@code true} if the column is declared nullable
   */
  public static boolean isNullable(String wireType) {
    return wireType != null && wireType.trim().toUpperCase(Locale.ROOT).startsWith(NULLABLE_PREFIX);
  }

  private static String baseName(String inner) {
    int paren = inner.indexOf('(');
    return (paren >= 0 ? inner.substring(0, paren) : inner).trim();
  }

  public Category category() {
    return category;
  }

  public int jdbcType() {
    return jdbcType;
  }

  public String className() {
    return className;
  }

  public int precision() {
    return precision;
  }

  public int displaySize() {
    return displaySize;
  }

  public boolean signed() {
    return signed;
  }

  public boolean isNumeric() {
    return category == Category.INTEGER || category == Category.FLOATING;
  }
}
