package se.alipsa.jdax.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.DaxException;

/** Tests for {@link Coercions} and {@link Value}. */
class CoercionsTest {

  @Test
  void blankActsAsZeroFalseAndEmptyText() {
    assertEquals(0.0, Coercions.toNumber(Value.BLANK));
    assertFalse(Coercions.truthy(Value.BLANK));
    assertEquals("", Coercions.toText(Value.BLANK));
  }

  @Test
  void booleansCoerceToOneAndZero() {
    assertEquals(1.0, Coercions.toNumber(Value.of(true)));
    assertEquals(0.0, Coercions.toNumber(Value.of(false)));
    assertEquals("TRUE", Coercions.toText(Value.of(true)));
  }

  @Test
  void textNeverCoercesToNumberOrBoolean() {
    DaxException number = assertThrows(DaxException.class, () -> Coercions.toNumber(Value.of("12")));
    assertEquals(DaxException.ErrorKind.TYPE, number.getKind());
    DaxException bool = assertThrows(DaxException.class, () -> Coercions.truthy(Value.of("TRUE")));
    assertEquals(DaxException.ErrorKind.TYPE, bool.getKind());
  }

  @Test
  void numbersRenderWithoutTrailingZeros() {
    assertEquals("3", Coercions.toText(Value.of(3.0)));
    assertEquals("2.5", Coercions.toText(Value.of(2.5)));
    assertEquals("-0.125", Coercions.toText(Value.of(-0.125)));
    assertEquals("0", Coercions.toText(Value.of(-0.0)));
  }

  @Test
  void comparesTextWithBlankAsEmptyString() {
    assertTrue(Coercions.compare(Value.of("a"), Value.of("b")) < 0);
    assertEquals(0, Coercions.compare(Value.BLANK, Value.of("")));
    assertTrue(Coercions.compare(Value.of("a"), Value.BLANK) > 0);
  }

  @Test
  void comparesNumbersBooleansAndBlankNumerically() {
    assertEquals(0, Coercions.compare(Value.of(true), Value.of(1.0)));
    assertTrue(Coercions.compare(Value.BLANK, Value.of(0.5)) < 0);
    assertEquals(0, Coercions.compare(Value.BLANK, Value.of(0.0)));
  }

  @Test
  void comparingTextWithNumberIsATypeError() {
    DaxException e = assertThrows(DaxException.class, () -> Coercions.compare(Value.of("1"), Value.of(1.0)));
    assertEquals(DaxException.ErrorKind.TYPE, e.getKind());
  }

  @Test
  void fromObjectMapsJavaTypes() {
    assertSame(Value.BLANK, Value.fromObject(null));
    assertEquals(Value.of(4.0), Value.fromObject(4));
    assertEquals(Value.of(1.5), Value.fromObject(new BigDecimal("1.5")));
    assertEquals(Value.of(true), Value.fromObject(Boolean.TRUE));
    assertEquals(Value.of("x"), Value.fromObject("x"));
  }

  @Test
  void negativeZeroEqualsZero() {
    assertEquals(Value.of(0.0), Value.of(-0.0));
    assertEquals(Value.of(0.0).hashCode(), Value.of(-0.0).hashCode());
  }
}
