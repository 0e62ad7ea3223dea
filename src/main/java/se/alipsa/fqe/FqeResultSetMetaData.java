package se.alipsa.fqe;

import java.sql.SQLException;
import java.util.List;
import se.alipsa.fqe.error.InvalidColumnIndexException;
import se.alipsa.fqe.model.ResultSetMetaDataAdapter;
import se.alipsa.fqe.wire.ColumnMeta;
import se.alipsa.fqe.wire.WireType;

/** An implementation of the java.sql.ResultSetMetaData interface backed by the wire column metadata. */
@SuppressWarnings("checkstyle:AbbreviationAsWordInName")
public class FqeResultSetMetaData extends ResultSetMetaDataAdapter {

  private final List<ColumnMeta> columns;

  /**
   * Constructor.
   *
   * @param columns
   *          the result columns in order
   */
  public FqeResultSetMetaData(List<ColumnMeta> columns) {
    this.columns = columns == null ? List.of() : List.copyOf(columns);
  }

  private ColumnMeta column(int column) throws SQLException {
    if (column < 1 || column > columns.size()) {
      throw new InvalidColumnIndexException(column, columns.size());
    }
    return columns.get(column - 1);
  }

  @Override
  public int getColumnCount() {
    return columns.size();
  }

  @Override
  public String getColumnLabel(int column) throws SQLException {
    return column(column).name();
  }

  @Override
  public String getColumnName(int column) throws SQLException {
    return column(column).name();
  }

  /** Nullable only when the engine wrapped the type as {@code NULLABLE(...)}; otherwise unknown. */
  @Override
  public int isNullable(int column) throws SQLException {
    return column(column).nullable() ? columnNullable : columnNullableUnknown;
  }

  @Override
  public boolean isSigned(int column) throws SQLException {
    return column(column).type().signed();
  }

  @Override
  public boolean isCaseSensitive(int column) throws SQLException {
    return column(column).type().category() == WireType.Category.TEXT;
  }

  @Override
  public boolean isSearchable(int column) throws SQLException {
    column(column);
    return true;
  }

  @Override
  public int getColumnDisplaySize(int column) throws SQLException {
    ColumnMeta meta = column(column);
    if (meta.type().category() == WireType.Category.TEXT && meta.precision() > 0) {
      return meta.precision();
    }
    return meta.type().displaySize();
  }

  @Override
  public int getPrecision(int column) throws SQLException {
    return column(column).precision();
  }

  @Override
  public int getScale(int column) throws SQLException {
    return column(column).scale();
  }

  @Override
  public int getColumnType(int column) throws SQLException {
    return column(column).type().jdbcType();
  }

  @Override
  public String getColumnTypeName(int column) throws SQLException {
    String inner = column(column).innerType();
    int paren = inner.indexOf('(');
    return paren > 0 ? inner.substring(0, paren).trim() : inner;
  }

  @Override
  public String getColumnClassName(int column) throws SQLException {
    return column(column).type().className();
  }

  @Override
  public boolean isReadOnly(int column) throws SQLException {
    column(column);
    return true;
  }
}
