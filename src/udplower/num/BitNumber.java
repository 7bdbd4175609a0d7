package udplower.num;

import java.util.BitSet;
import java.util.Objects;

/**
 * Fixed-width four-state bit vector. Each bit is one of '0', '1', 'x' (unknown) or 'z' (high impedance).
 * <p>
 * Encoding per bit: value=0,unknown=0 is '0'; value=1,unknown=0 is '1'; value=0,unknown=1 is 'x'; value=1,unknown=1 is 'z'.
 * Bit 0 is the least significant bit.
 */
public class BitNumber {
  private final int width;
  private final BitSet value;
  private final BitSet unknown;

  /** Creates an all-zero number. */
  public BitNumber(int width) {
    if (width < 1)
      throw new IllegalArgumentException("BitNumber width must be positive, got " + width);
    this.width = width;
    this.value = new BitSet(width);
    this.unknown = new BitSet(width);
  }

  private BitNumber(int width, BitSet value, BitSet unknown) {
    this.width = width;
    this.value = value;
    this.unknown = unknown;
  }

  /** Creates a two-state number from the low {@code width} bits of a long. */
  public static BitNumber ofLong(int width, long val) {
    BitNumber ret = new BitNumber(width);
    for (int i = 0; i < width && i < 64; ++i)
      if (((val >>> i) & 1L) != 0)
        ret.value.set(i);
    return ret;
  }

  /**
   * Parses a string of bit characters, most significant bit first, e.g. "01x".
   * Underscores are ignored.
   */
  public static BitNumber fromBinary(String bits) {
    String digits = bits.replace("_", "");
    BitNumber ret = new BitNumber(digits.length());
    for (int i = 0; i < digits.length(); ++i)
      ret.setBit(digits.length() - 1 - i, digits.charAt(i));
    return ret;
  }

  public BitNumber copy() { return new BitNumber(width, (BitSet)value.clone(), (BitSet)unknown.clone()); }

  public int getWidth() { return width; }

  private void checkIndex(int index) {
    if (index < 0 || index >= width)
      throw new IndexOutOfBoundsException("Bit " + index + " out of range for width " + width);
  }

  /** Sets a bit to 0 or 1. */
  public BitNumber setBit(int index, int bit) {
    if (bit != 0 && bit != 1)
      throw new IllegalArgumentException("Two-state bit must be 0 or 1, got " + bit);
    return setBit(index, bit == 1 ? '1' : '0');
  }

  /** Sets a bit to one of '0', '1', 'x', 'z' (case insensitive for x/z). */
  public BitNumber setBit(int index, char bit) {
    checkIndex(index);
    switch (bit) {
    case '0':
      value.clear(index);
      unknown.clear(index);
      break;
    case '1':
      value.set(index);
      unknown.clear(index);
      break;
    case 'x':
    case 'X':
      value.clear(index);
      unknown.set(index);
      break;
    case 'z':
    case 'Z':
      value.set(index);
      unknown.set(index);
      break;
    default:
      throw new IllegalArgumentException("Illegal bit value '" + bit + "'");
    }
    return this;
  }

  /** Returns '0', '1', 'x' or 'z'. */
  public char getBit(int index) {
    checkIndex(index);
    if (unknown.get(index))
      return value.get(index) ? 'z' : 'x';
    return value.get(index) ? '1' : '0';
  }

  /** True if any bit is x or z. */
  public boolean isFourState() { return !unknown.isEmpty(); }

  public boolean isAllZero() { return value.isEmpty() && unknown.isEmpty(); }

  /** Value as long; only defined for two-state numbers of at most 64 bits. */
  public long toLong() {
    if (isFourState())
      throw new IllegalStateException("Four-state value " + this + " has no integer value");
    if (width > 64)
      throw new IllegalStateException("Value " + this + " does not fit a long");
    long ret = 0;
    for (int i = value.nextSetBit(0); i >= 0; i = value.nextSetBit(i + 1))
      ret |= 1L << i;
    return ret;
  }

  private void checkSameWidth(BitNumber other) {
    if (other.width != width)
      throw new IllegalArgumentException("Width mismatch: " + width + " vs " + other.width);
  }

  /** Four-state bitwise AND: a 0 on either side gives 0, two 1s give 1, everything else gives x. */
  public BitNumber and(BitNumber other) {
    checkSameWidth(other);
    BitNumber ret = new BitNumber(width);
    for (int i = 0; i < width; ++i) {
      char a = getBit(i);
      char b = other.getBit(i);
      if (a == '0' || b == '0')
        ret.setBit(i, '0');
      else if (a == '1' && b == '1')
        ret.setBit(i, '1');
      else
        ret.setBit(i, 'x');
    }
    return ret;
  }

  /** Concatenation {this, low}: this number forms the high-order bits. */
  public BitNumber concat(BitNumber low) {
    BitNumber ret = new BitNumber(width + low.width);
    for (int i = 0; i < low.width; ++i)
      ret.setBit(i, low.getBit(i));
    for (int i = 0; i < width; ++i)
      ret.setBit(low.width + i, getBit(i));
    return ret;
  }

  /**
   * Four-state equality (Verilog {@code ==}). Returns a one bit result:
   * 0 if some bit pair differs in known values, else x if some bit is x or z, else 1.
   */
  public BitNumber logicalEq(BitNumber other) {
    checkSameWidth(other);
    boolean sawUnknown = false;
    for (int i = 0; i < width; ++i) {
      char a = getBit(i);
      char b = other.getBit(i);
      boolean aKnown = (a == '0' || a == '1');
      boolean bKnown = (b == '0' || b == '1');
      if (aKnown && bKnown) {
        if (a != b)
          return new BitNumber(1);
      } else
        sawUnknown = true;
    }
    return new BitNumber(1).setBit(0, sawUnknown ? 'x' : '1');
  }

  /** True if this one bit number is a definite 1. */
  public boolean isTrue() { return width == 1 && getBit(0) == '1'; }

  /** Bit characters, most significant bit first. */
  public String toBinaryString() {
    StringBuilder sb = new StringBuilder(width);
    for (int i = width - 1; i >= 0; --i)
      sb.append(getBit(i));
    return sb.toString();
  }

  /** Case equality: same width and identical bits, x and z included. */
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    BitNumber other = (BitNumber)obj;
    return width == other.width && value.equals(other.value) && unknown.equals(other.unknown);
  }
  @Override
  public int hashCode() {
    return Objects.hash(width, value, unknown);
  }

  /** Verilog literal, e.g. {@code 2'b01} or {@code 1'bx}. */
  @Override
  public String toString() {
    return width + "'b" + toBinaryString();
  }
}
