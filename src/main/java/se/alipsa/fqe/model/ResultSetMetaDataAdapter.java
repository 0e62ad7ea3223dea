package se.alipsa.fqe.model;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;

/**
 * Base {@link ResultSetMetaData} describing read-only columns without type information. Subclasses override what they
 * know about their columns.
 */
public class ResultSetMetaDataAdapter implements ResultSetMetaData {

  @Override
  public int getColumnCount() throws SQLException {
    return 0;
  }
  @Override
  public boolean isAutoIncrement(int column) throws SQLException {
    return false;
  }
  @Override
  public boolean isCaseSensitive(int column) throws SQLException {
    return false;
  }
  @Override
  public boolean isSearchable(int column) throws SQLException {
    return false;
  }
  @Override
  public boolean isCurrency(int column) throws SQLException {
    return false;
  }
  @Override
  public int isNullable(int column) throws SQLException {
    return columnNullableUnknown;
  }
  @Override
  public boolean isSigned(int column) throws SQLException {
    return false;
  }
  @Override
  public int getColumnDisplaySize(int column) throws SQLException {
    return 0;
  }
  @Override
  public String getColumnLabel(int column) throws SQLException {
    return "";
  }
  @Override
  public String getColumnName(int column) throws SQLException {
    return "";
  }
  @Override
  public String getSchemaName(int column) throws SQLException {
    return "";
  }
  @Override
  public int getPrecision(int column) throws SQLException {
    return 0;
  }
  @Override
  public int getScale(int column) throws SQLException {
    return 0;
  }
  @Override
  public String getTableName(int column) throws SQLException {
    return "";
  }
  @Override
  public String getCatalogName(int column) throws SQLException {
    return "";
  }
  @Override
  public int getColumnType(int column) throws SQLException {
    return java.sql.Types.OTHER;
  }
  @Override
  public String getColumnTypeName(int column) throws SQLException {
    return "";
  }
  @Override
  public boolean isReadOnly(int column) throws SQLException {
    return true;
  }
  @Override
  public boolean isWritable(int column) throws SQLException {
    return false;
  }
  @Override
  public boolean isDefinitelyWritable(int column) throws SQLException {
    return false;
  }
  @Override
  public String getColumnClassName(int column) throws SQLException {
    return Object.class.getName();
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface != null && iface.isInstance(this)) {
      return iface.cast(this);
    }
    throw new SQLException("Not a wrapper for " + iface);
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return iface != null && iface.isInstance(this);
  }
}
