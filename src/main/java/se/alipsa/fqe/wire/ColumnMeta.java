package se.alipsa.fqe.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata for one result column.
 *
 * @param name
 *          column label as reported by the engine
 * @param wireType
 *          reported type name, possibly wrapped as {@code NULLABLE(<inner>)}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnMeta(@JsonProperty("name") String name, @JsonProperty("type") String wireType) {

  public ColumnMeta {
    name = name == null ? "" : name;
    wireType = wireType == null ? "" : wireType;
  }

  /**
   * The inner type name, upper case, with parameters kept (e.g. {@code DECIMAL(18,3)}).
   *
   * @return the inner type name
   */
  public String innerType() {
    return WireType.innerTypeName(wireType);
  }

  public WireType type() {
    return WireType.of(wireType);
  }

  public boolean nullable() {
    return WireType.isNullable(wireType);
  }

  /**
   * Precision declared in the type parameters ({@code DECIMAL(p,s)}, {@code VARCHAR(n)}), otherwise the table default.
   *
   * @return the precision
   */
  public int precision() {
    int[] params = typeParameters();
    return params.length > 0 ? params[0] : type().precision();
  }

  /**
   * Scale declared in {@code DECIMAL(p,s)}, otherwise 0.
   *
   * @return the scale
   */
  public int scale() {
    int[] params = typeParameters();
    return params.length > 1 ? params[1] : 0;
  }

  private int[] typeParameters() {
    String inner = innerType();
    int open = inner.indexOf('(');
    int close = inner.lastIndexOf(')');
    if (open < 0 || close <= open) {
      return new int[0];
    }
    String[] parts = inner.substring(open + 1, close).split(",");
    int[] values = new int[parts.length];
    for (int i = 0; i < parts.length; i++) {
      try {
        values[i] = Integer.parseInt(parts[i].trim());
      } catch (NumberFormatException e) {
        return new int[0];
      }
    }
    return values;
  }
}
