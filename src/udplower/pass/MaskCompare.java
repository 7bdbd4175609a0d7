package udplower.pass;

import udplower.num.BitNumber;

/**
 * Match pattern of one table line: the line matches an input field value v iff {@code (v & mask) == cmp}.
 * @param mask 1 at every position that has to match
 * @param cmp the required values at the masked positions, 0 elsewhere
 */
public record MaskCompare(BitNumber mask, BitNumber cmp) {}
