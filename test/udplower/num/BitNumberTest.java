package udplower.num;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BitNumberTest {

  @Test
  void testFromBinaryIsMsbFirst() {
    BitNumber num = BitNumber.fromBinary("1_0x");
    Assertions.assertEquals(3, num.getWidth());
    Assertions.assertEquals('x', num.getBit(0));
    Assertions.assertEquals('0', num.getBit(1));
    Assertions.assertEquals('1', num.getBit(2));
    Assertions.assertEquals("10x", num.toBinaryString());
    Assertions.assertEquals("3'b10x", num.toString());
    Assertions.assertTrue(num.isFourState());
  }

  @Test
  void testOfLong() {
    BitNumber num = BitNumber.ofLong(4, 0b1010);
    Assertions.assertEquals("1010", num.toBinaryString());
    Assertions.assertEquals(10, num.toLong());
    // Bits above the width are dropped.
    Assertions.assertEquals(BitNumber.fromBinary("11"), BitNumber.ofLong(2, 7));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1})
  void testWidthMustBePositive(int width) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new BitNumber(width));
  }

  @Test
  void testSetBit() {
    BitNumber num = new BitNumber(2);
    Assertions.assertTrue(num.isAllZero());
    num.setBit(1, 1).setBit(0, 'Z');
    Assertions.assertEquals("1z", num.toBinaryString());
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> num.setBit(2, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> num.setBit(0, 2));
    Assertions.assertThrows(IllegalArgumentException.class, () -> num.setBit(0, '?'));
  }

  @Test
  void testToLongRejectsUnknown() {
    Assertions.assertThrows(IllegalStateException.class, () -> BitNumber.fromBinary("1x").toLong());
  }

  @Test
  void testAnd() {
    BitNumber lhs = BitNumber.fromBinary("01xx1z");
    BitNumber rhs = BitNumber.fromBinary("110x1x");
    Assertions.assertEquals("010x1x", lhs.and(rhs).toBinaryString());
    Assertions.assertThrows(IllegalArgumentException.class, () -> lhs.and(BitNumber.fromBinary("1")));
  }

  @Test
  void testConcatLowPartAtBitZero() {
    BitNumber high = BitNumber.fromBinary("1");
    BitNumber low = BitNumber.fromBinary("0x");
    BitNumber num = high.concat(low);
    Assertions.assertEquals(3, num.getWidth());
    Assertions.assertEquals("10x", num.toBinaryString());
  }

  @Test
  void testLogicalEq() {
    Assertions.assertEquals(BitNumber.fromBinary("1"), BitNumber.fromBinary("01").logicalEq(BitNumber.fromBinary("01")));
    Assertions.assertEquals(BitNumber.fromBinary("0"), BitNumber.fromBinary("01").logicalEq(BitNumber.fromBinary("00")));
    // A known mismatch decides even with unknown bits elsewhere.
    Assertions.assertEquals(BitNumber.fromBinary("0"), BitNumber.fromBinary("x1").logicalEq(BitNumber.fromBinary("00")));
    Assertions.assertEquals(BitNumber.fromBinary("x"), BitNumber.fromBinary("x1").logicalEq(BitNumber.fromBinary("01")));
    Assertions.assertTrue(BitNumber.fromBinary("1").isTrue());
    Assertions.assertFalse(BitNumber.fromBinary("x").isTrue());
    Assertions.assertFalse(BitNumber.fromBinary("01").isTrue());
  }

  @Test
  void testCopyIsIndependent() {
    BitNumber num = BitNumber.fromBinary("00");
    BitNumber copy = num.copy();
    copy.setBit(0, '1');
    Assertions.assertEquals("00", num.toBinaryString());
    Assertions.assertNotEquals(num, copy);
    Assertions.assertEquals(num, BitNumber.fromBinary("00"));
    Assertions.assertEquals(num.hashCode(), BitNumber.fromBinary("00").hashCode());
    Assertions.assertNotEquals(BitNumber.fromBinary("x"), BitNumber.fromBinary("z"));
  }
}
