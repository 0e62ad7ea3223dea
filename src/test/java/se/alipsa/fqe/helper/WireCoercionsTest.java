package se.alipsa.fqe.helper;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import org.junit.jupiter.api.Test;
import se.alipsa.fqe.wire.WireType;
import se.alipsa.fqe.wire.WireValue;

/** Tests the cell conversions used by the result set getters. */
public class WireCoercionsTest {

  private static WireValue text(String s) {
    return new WireValue.Text(s);
  }

  @Test
  void nullCellsYieldZeroValues() {
    WireValue v = WireValue.NULL;
    assertEquals(0, WireCoercions.toInt(v));
    assertEquals(0L, WireCoercions.toLong(v));
    assertEquals(0d, WireCoercions.toDouble(v));
    assertFalse(WireCoercions.toBoolean(v));
    assertNull(WireCoercions.toText(v));
    assertNull(WireCoercions.toBigDecimal(v));
    assertNull(WireCoercions.toBytes(v));
    assertNull(WireCoercions.toDate(v));
    assertNull(WireCoercions.toTimestamp(v));
    assertNull(WireCoercions.toObject(v, WireType.INTEGER));
  }

  @Test
  void unparsableTextDegradesToZero() {
    assertEquals(0, WireCoercions.toInt(text("abc")));
    assertEquals(0d, WireCoercions.toDouble(text("abc")));
    assertEquals(BigDecimal.ZERO, WireCoercions.toBigDecimal(text("abc")));
    assertEquals(0, WireCoercions.toInt(text("99999999999")));
    assertEquals(0, WireCoercions.toByte(text("300")));
  }

  @Test
  void textParsesNumbers() {
    assertEquals(42, WireCoercions.toInt(text(" 42 ")));
    assertEquals(-7L, WireCoercions.toLong(text("-7")));
    assertEquals(2.5d, WireCoercions.toDouble(text("2.5")));
    assertEquals(new BigDecimal("123.456"), WireCoercions.toBigDecimal(text("123.456")));
  }

  @Test
  void decimalsTruncateTowardZero() {
    assertEquals(3, WireCoercions.toInt(new WireValue.Decimal(new BigDecimal("3.9"))));
    assertEquals(-3, WireCoercions.toInt(new WireValue.Decimal(new BigDecimal("-3.9"))));
  }

  @Test
  void integersNarrowByTruncation() {
    WireValue big = new WireValue.Int(4_294_967_297L);
    assertEquals(1, WireCoercions.toInt(big));
    assertEquals(4_294_967_297L, WireCoercions.toLong(big));
  }

  @Test
  void booleanRules() {
    assertTrue(WireCoercions.toBoolean(new WireValue.Int(2)));
    assertFalse(WireCoercions.toBoolean(new WireValue.Int(0)));
    assertTrue(WireCoercions.toBoolean(new WireValue.Decimal(new BigDecimal("0.1"))));
    assertTrue(WireCoercions.toBoolean(text("YES")));
    assertTrue(WireCoercions.toBoolean(text("On")));
    assertTrue(WireCoercions.toBoolean(text("1")));
    assertFalse(WireCoercions.toBoolean(text("y")));
    assertFalse(WireCoercions.toBoolean(text("false")));
    assertEquals(1, WireCoercions.toInt(new WireValue.Bool(true)));
  }

  @Test
  void textRendering() {
    assertEquals("true", WireCoercions.toText(new WireValue.Bool(true)));
    assertEquals("12", WireCoercions.toText(new WireValue.Int(12)));
    assertEquals("10000000000", WireCoercions.toText(new WireValue.Decimal(new BigDecimal("1E+10"))));
    assertEquals("it's", WireCoercions.toText(text("it's")));
    assertEquals("hi", WireCoercions.toText(new WireValue.Bytes("hi".getBytes(StandardCharsets.UTF_8))));
  }

  @Test
  void bytesAreCopied() {
    byte[] raw = {1, 2, 3};
    WireValue v = new WireValue.Bytes(raw);
    byte[] copy = WireCoercions.toBytes(v);
    assertArrayEquals(raw, copy);
    assertNotSame(raw, copy);
  }

  @Test
  void temporalParsing() {
    assertEquals(Date.valueOf("2024-03-01"), WireCoercions.toDate(text("2024-03-01")));
    assertEquals(Date.valueOf("2024-03-01"), WireCoercions.toDate(text("2024-03-01 10:15:30")));
    assertEquals(Time.valueOf("10:15:30"), WireCoercions.toTime(text("10:15:30")));
    assertEquals(Timestamp.valueOf("2024-03-01 10:15:30.5"), WireCoercions.toTimestamp(text("2024-03-01 10:15:30.5")));
    assertEquals(Timestamp.valueOf("2024-03-01 00:00:00"), WireCoercions.toTimestamp(text("2024-03-01")));
    assertNull(WireCoercions.toDate(text("not a date")));
  }

  @Test
  void naturalObjects() {
    assertEquals(5, WireCoercions.toObject(new WireValue.Int(5), WireType.INTEGER));
    assertEquals(5L, WireCoercions.toObject(new WireValue.Int(5), WireType.BIGINT));
    assertEquals("hi", WireCoercions.toObject(text("hi"), WireType.VARCHAR));
    assertEquals(Boolean.TRUE, WireCoercions.toObject(new WireValue.Bool(true), WireType.BOOLEAN));
    assertEquals(Date.valueOf("2024-01-02"), WireCoercions.toObject(text("2024-01-02"), WireType.DATE));
    assertEquals("soon", WireCoercions.toObject(text("soon"), WireType.DATE));
  }
}
