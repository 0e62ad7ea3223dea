package se.alipsa.fqe.wire;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Types;
import java.util.List;
import org.junit.jupiter.api.Test;

public class WireTypeTest {

  @Test
  void stripsNullableWrapper() {
    assertEquals("INTEGER", WireType.innerTypeName("Nullable(Integer)"));
    assertEquals("VARCHAR", WireType.innerTypeName("NULLABLE(NULLABLE(varchar))"));
    assertEquals("DECIMAL(18,3)", WireType.innerTypeName("NULLABLE(DECIMAL(18,3))"));
    assertEquals("", WireType.innerTypeName(null));
    assertTrue(WireType.isNullable("NULLABLE(INTEGER)"));
    assertFalse(WireType.isNullable("INTEGER"));
  }

  @Test
  void resolvesNamesAndAliases() {
    assertEquals(WireType.INTEGER, WireType.of("INTEGER"));
    assertEquals(WireType.INTEGER, WireType.of("NULLABLE(int4)"));
    assertEquals(WireType.BIGINT, WireType.of("INT8"));
    assertEquals(WireType.SMALLINT, WireType.of("UTINYINT"));
    assertEquals(WireType.HUGEINT, WireType.of("UBIGINT"));
    assertEquals(WireType.DECIMAL, WireType.of("DECIMAL(10,2)"));
    assertEquals(WireType.VARCHAR, WireType.of("TEXT"));
    assertEquals(WireType.TIMESTAMP_TZ, WireType.of("TIMESTAMPTZ"));
    assertEquals(WireType.DOUBLE, WireType.of("DOUBLE PRECISION"));
    assertEquals(WireType.BLOB, WireType.of("BYTEA"));
  }

  @Test
  void unknownAndListTypesAreOther() {
    assertEquals(WireType.OTHER, WireType.of("STRUCT(a INTEGER)"));
    assertEquals(WireType.OTHER, WireType.of("INTEGER[]"));
    assertEquals(WireType.OTHER, WireType.of(""));
    assertEquals(WireType.OTHER, WireType.of(null));
  }

  @Test
  void jdbcMapping() {
    assertEquals(Types.BOOLEAN, WireType.BOOLEAN.jdbcType());
    assertEquals(Types.VARCHAR, WireType.VARCHAR.jdbcType());
    assertEquals(Types.TIMESTAMP_WITH_TIMEZONE, WireType.TIMESTAMP_TZ.jdbcType());
    assertEquals("java.lang.Long", WireType.BIGINT.className());
    assertTrue(WireType.DOUBLE.isNumeric());
    assertFalse(WireType.VARCHAR.isNumeric());
    assertFalse(WireType.VARCHAR.signed());
  }

  @Test
  void columnMetaReadsTypeParameters() {
    ColumnMeta price = new ColumnMeta("price", "NULLABLE(DECIMAL(12,4))");
    assertEquals(WireType.DECIMAL, price.type());
    assertTrue(price.nullable());
    assertEquals(12, price.precision());
    assertEquals(4, price.scale());

    ColumnMeta id = new ColumnMeta("id", "INTEGER");
    assertFalse(id.nullable());
    assertEquals(10, id.precision());
    assertEquals(0, id.scale());

    ColumnMeta blank = new ColumnMeta(null, null);
    assertEquals("", blank.name());
    assertEquals(WireType.OTHER, blank.type());
  }

  @Test
  void raggedRowsAreRejected() {
    List<ColumnMeta> columns = List.of(new ColumnMeta("a", "INTEGER"), new ColumnMeta("b", "INTEGER"));
    assertThrows(IllegalArgumentException.class,
        () -> new WireResult(columns, List.of(List.of(WireValue.NULL)), 1, null));
  }

  @Test
  void limitTruncatesRowsOnly() {
    List<ColumnMeta> columns = List.of(new ColumnMeta("n", "INTEGER"));
    WireResult result = WireResult.of(columns, List.of(List.of(1), List.of(2), List.of(3)));
    assertSame(result, result.limit(0));
    assertSame(result, result.limit(5));
    WireResult limited = result.limit(2);
    assertEquals(2, limited.rows().size());
    assertEquals(3, limited.rowCount());
    assertEquals(new WireValue.Int(2), limited.rows().get(1).get(0));
  }

  @Test
  void wrapsPlainValues() {
    assertSame(WireValue.NULL, WireValue.of(null));
    assertEquals(new WireValue.Int(5), WireValue.of(5));
    assertEquals(new WireValue.Bool(true), WireValue.of(Boolean.TRUE));
    assertEquals(new WireValue.Text("x"), WireValue.of("x"));
    assertEquals(new WireValue.Bytes(new byte[]{1, 2}), WireValue.of(new byte[]{1, 2}));
    assertTrue(WireValue.of(1.5d) instanceof WireValue.Decimal);
  }
}
