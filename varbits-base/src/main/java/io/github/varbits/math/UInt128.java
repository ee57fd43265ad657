/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.varbits.math;

import java.math.BigInteger;

/**
 * An immutable unsigned 128-bit integer stored as a {@code (high, low)} pair of 64-bit words.
 * <p>
 * Both words are treated as unsigned. Arithmetic wraps modulo 2^128.
 */
public final class UInt128 implements Comparable<UInt128> {
    /** The value 0. */
    public static final UInt128 ZERO = new UInt128(0L, 0L);
    /** The value 1. */
    public static final UInt128 ONE = new UInt128(0L, 1L);
    /** The value 2^128 - 1. */
    public static final UInt128 MAX_VALUE = new UInt128(-1L, -1L);

    private static final BigInteger MAX_BIG = MAX_VALUE.toBigInteger();

    private final long high;
    private final long low;

    private UInt128(long high, long low) {
        this.high = high;
        this.low = low;
    }

    /**
     * Creates a value from its two words.
     *
     * @param high the most significant 64 bits
     * @param low the least significant 64 bits
     * @return the combined value
     */
    public static UInt128 of(long high, long low) {
        if (high == 0L && low == 0L) {
            return ZERO;
        }
        return new UInt128(high, low);
    }

    /**
     * Zero-extends a 64-bit word, interpreted as unsigned.
     */
    public static UInt128 valueOf(long unsignedValue) {
        return of(0L, unsignedValue);
    }

    /**
     * Converts a {@code BigInteger} in {@code [0, 2^128)}.
     *
     * @throws IllegalArgumentException if the value is negative or needs more than 128 bits
     */
    public static UInt128 valueOf(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(MAX_BIG) > 0) {
            throw new IllegalArgumentException("Value out of unsigned 128-bit range: " + value);
        }
        return of(value.shiftRight(Long.SIZE).longValue(), value.longValue());
    }

    /**
     * @return the most significant 64 bits
     */
    public long high() {
        return high;
    }

    /**
     * @return the least significant 64 bits
     */
    public long low() {
        return low;
    }

    public boolean isZero() {
        return high == 0L && low == 0L;
    }

    public UInt128 add(UInt128 other) {
        long sumLow = low + other.low;
        long carry = Long.compareUnsigned(sumLow, low) < 0 ? 1L : 0L;
        return of(high + other.high + carry, sumLow);
    }

    public UInt128 subtract(UInt128 other) {
        long borrow = Long.compareUnsigned(low, other.low) < 0 ? 1L : 0L;
        return of(high - other.high - borrow, low - other.low);
    }

    /**
     * Logical left shift. Shifts of 128 or more yield zero.
     *
     * @param shift non-negative shift distance
     */
    public UInt128 shiftLeft(int shift) {
        checkShift(shift);
        if (shift == 0) {
            return this;
        }
        if (shift >= 2 * Long.SIZE) {
            return ZERO;
        }
        if (shift >= Long.SIZE) {
            return of(low << (shift - Long.SIZE), 0L);
        }
        return of((high << shift) | (low >>> (Long.SIZE - shift)), low << shift);
    }

    /**
     * Logical right shift. Shifts of 128 or more yield zero.
     *
     * @param shift non-negative shift distance
     */
    public UInt128 shiftRight(int shift) {
        checkShift(shift);
        if (shift == 0) {
            return this;
        }
        if (shift >= 2 * Long.SIZE) {
            return ZERO;
        }
        if (shift >= Long.SIZE) {
            return of(0L, high >>> (shift - Long.SIZE));
        }
        return of(high >>> shift, (low >>> shift) | (high << (Long.SIZE - shift)));
    }

    public UInt128 and(UInt128 other) {
        return of(high & other.high, low & other.low);
    }

    public UInt128 or(UInt128 other) {
        return of(high | other.high, low | other.low);
    }

    public UInt128 xor(UInt128 other) {
        return of(high ^ other.high, low ^ other.low);
    }

    public UInt128 not() {
        return of(~high, ~low);
    }

    /**
     * Keeps only the low {@code bitCount} bits.
     *
     * @param bitCount number of bits to keep, in {@code [0, 128]}
     */
    public UInt128 mask(int bitCount) {
        if (bitCount < 0 || bitCount > 2 * Long.SIZE) {
            throw new IllegalArgumentException("Mask width must be between 0 and 128: " + bitCount);
        }
        if (bitCount >= 2 * Long.SIZE) {
            return this;
        }
        if (bitCount >= Long.SIZE) {
            long highMask = bitCount == Long.SIZE ? 0L : (1L << (bitCount - Long.SIZE)) - 1;
            return of(high & highMask, low);
        }
        long lowMask = bitCount == 0 ? 0L : (1L << bitCount) - 1;
        return of(0L, low & lowMask);
    }

    /**
     * @return the number of bits in the minimal representation, 0 for zero
     */
    public int bitLength() {
        if (high != 0L) {
            return 2 * Long.SIZE - Long.numberOfLeadingZeros(high);
        }
        return Long.SIZE - Long.numberOfLeadingZeros(low);
    }

    /**
     * Reinterprets the same 128 bits as a two's complement signed value.
     */
    public Int128 toInt128() {
        return Int128.of(high, low);
    }

    public BigInteger toBigInteger() {
        // leading zero byte keeps the magnitude non-negative
        byte[] bytes = new byte[17];
        for (int i = 0; i < Long.BYTES; i++) {
            bytes[1 + i] = (byte) (high >>> (56 - 8 * i));
            bytes[9 + i] = (byte) (low >>> (56 - 8 * i));
        }
        return new BigInteger(bytes);
    }

    /**
     * Unsigned ordering.
     */
    @Override
    public int compareTo(UInt128 other) {
        int cmp = Long.compareUnsigned(high, other.high);
        return cmp != 0 ? cmp : Long.compareUnsigned(low, other.low);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UInt128)) {
            return false;
        }
        UInt128 that = (UInt128) o;
        return high == that.high && low == that.low;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(high) + Long.hashCode(low);
    }

    /**
     * @return the value in decimal
     */
    @Override
    public String toString() {
        if (high == 0L) {
            return Long.toUnsignedString(low);
        }
        return toBigInteger().toString();
    }

    /**
     * @return the value as 32 zero-padded hex digits
     */
    public String toHexString() {
        return String.format("%016x%016x", high, low);
    }

    static void checkShift(int shift) {
        if (shift < 0) {
            throw new IllegalArgumentException("Shift distance must be non-negative: " + shift);
        }
    }
}
