package se.alipsa.fqe.model;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ResultSetMetaDataAdapterTest {

  private ResultSetMetaDataAdapter metaData;

  @BeforeEach
  public void setUp() {
    metaData = new ResultSetMetaDataAdapter();
  }

  @Test
  public void testGetColumnCount() throws SQLException {
    assertEquals(0, metaData.getColumnCount());
  }

  @Test
  public void testIsNullable() throws SQLException {
    assertEquals(ResultSetMetaData.columnNullableUnknown, metaData.isNullable(1));
  }

  @Test
  public void testColumnType() throws SQLException {
    assertEquals(Types.OTHER, metaData.getColumnType(1));
    assertEquals("", metaData.getColumnTypeName(1));
    assertEquals("java.lang.Object", metaData.getColumnClassName(1));
  }

  @Test
  public void testReadOnly() throws SQLException {
    assertTrue(metaData.isReadOnly(1));
    assertFalse(metaData.isWritable(1));
    assertFalse(metaData.isDefinitelyWritable(1));
  }

  @Test
  public void testNames() throws SQLException {
    assertEquals("", metaData.getColumnLabel(1));
    assertEquals("", metaData.getColumnName(1));
    assertEquals("", metaData.getSchemaName(1));
    assertEquals("", metaData.getTableName(1));
    assertEquals("", metaData.getCatalogName(1));
  }

  @Test
  public void testUnwrap() throws SQLException {
    assertTrue(metaData.isWrapperFor(ResultSetMetaData.class));
    assertSame(metaData, metaData.unwrap(ResultSetMetaData.class));
    assertFalse(metaData.isWrapperFor(String.class));
    assertThrows(SQLException.class, () -> metaData.unwrap(String.class));
  }
}
