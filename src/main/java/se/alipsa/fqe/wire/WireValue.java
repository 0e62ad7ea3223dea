package se.alipsa.fqe.wire;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single decoded cell. The wire format is loosely typed, so a cell carries only the JSON shape it arrived in; the
 * column's wire type and the requested accessor decide how it is interpreted (see
 * {@link se.alipsa.fqe.helper.WireCoercions}).
 */
public sealed interface WireValue {

  /** The shared null cell. */
  Null NULL = new Null();

  /**
   * Whether this cell is a genuine null.
   *
   * @return {@code true} only for {@link Null}
   */
  default boolean isNull() {
    return this instanceof Null;
  }

  /**
   * Wrap a plain Java value. Integral numbers become {@link Int}, other numbers {@link Decimal}, byte arrays
   * {@link Bytes}, and anything else its {@code toString()} as {@link Text}.
   *
   * @param value
   *          the value to wrap (may be {@code null})
   * @return the wire cell
   */
  static WireValue of(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof WireValue w) {
      return w;
    }
    if (value instanceof Boolean b) {
      return new Bool(b);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return new Int(((Number) value).longValue());
    }
    if (value instanceof BigDecimal bd) {
      return new Decimal(bd);
    }
    if (value instanceof Number n) {
      return new Decimal(new BigDecimal(n.toString()));
    }
    if (value instanceof byte[] bytes) {
      return new Bytes(bytes);
    }
    return new Text(value.toString());
  }

  /** JSON {@code null}. */
  record Null() implements WireValue {
  }

  /** JSON {@code true}/{@code false}. */
  record Bool(boolean value) implements WireValue {
  }

  /** An integral JSON number that fits in a {@code long}. */
  record Int(long value) implements WireValue {
  }

  /** Any other JSON number, kept exact. */
  record Decimal(BigDecimal value) implements WireValue {
  }

  /** A JSON string, or the JSON text of a nested array/object. */
  record Text(String value) implements WireValue {
  }

  /** Binary content of a blob column. */
  record Bytes(byte[] value) implements WireValue {

    @Override
    public boolean equals(Object o) {
      return o instanceof Bytes other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "Bytes[" + new String(value, StandardCharsets.UTF_8) + "]";
    }
  }
}
