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
 * An immutable signed 128-bit two's complement integer stored as a {@code (high, low)} pair.
 * <p>
 * {@code high} carries the sign; {@code low} is interpreted as unsigned. Arithmetic wraps modulo
 * 2^128 exactly like {@code long} arithmetic wraps modulo 2^64.
 */
public final class Int128 implements Comparable<Int128> {
    public static final Int128 ZERO = new Int128(0L, 0L);
    public static final Int128 ONE = new Int128(0L, 1L);
    public static final Int128 MINUS_ONE = new Int128(-1L, -1L);
    /** The value 2^127 - 1. */
    public static final Int128 MAX_VALUE = new Int128(Long.MAX_VALUE, -1L);
    /** The value -2^127. */
    public static final Int128 MIN_VALUE = new Int128(Long.MIN_VALUE, 0L);

    private final long high;
    private final long low;

    private Int128(long high, long low) {
        this.high = high;
        this.low = low;
    }

    /**
     * @param high the signed most significant word
     * @param low the least significant word, as unsigned
     */
    public static Int128 of(long high, long low) {
        if (high == 0L && low == 0L) {
            return ZERO;
        }
        return new Int128(high, low);
    }

    /**
     * Sign-extends a {@code long}.
     */
    public static Int128 valueOf(long value) {
        return of(value >> (Long.SIZE - 1), value);
    }

    /**
     * @throws IllegalArgumentException if the value does not fit in 128-bit two's complement
     */
    public static Int128 valueOf(BigInteger value) {
        if (value.bitLength() > 2 * Long.SIZE - 1) {
            throw new IllegalArgumentException("Value out of signed 128-bit range: " + value);
        }
        return of(value.shiftRight(Long.SIZE).longValue(), value.longValue());
    }

    public long high() {
        return high;
    }

    public long low() {
        return low;
    }

    public boolean isNegative() {
        return high < 0L;
    }

    public int signum() {
        if (high < 0L) {
            return -1;
        }
        return high == 0L && low == 0L ? 0 : 1;
    }

    public Int128 add(Int128 other) {
        long sumLow = low + other.low;
        long carry = Long.compareUnsigned(sumLow, low) < 0 ? 1L : 0L;
        return of(high + other.high + carry, sumLow);
    }

    public Int128 subtract(Int128 other) {
        long borrow = Long.compareUnsigned(low, other.low) < 0 ? 1L : 0L;
        return of(high - other.high - borrow, low - other.low);
    }

    public Int128 negate() {
        return not().add(ONE);
    }

    public Int128 shiftLeft(int shift) {
        UInt128.checkShift(shift);
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
     * Arithmetic right shift; the sign bit is replicated. Shifts of 128 or more yield 0 or -1.
     */
    public Int128 shiftRight(int shift) {
        UInt128.checkShift(shift);
        if (shift == 0) {
            return this;
        }
        long fill = high >> (Long.SIZE - 1);
        if (shift >= 2 * Long.SIZE) {
            return of(fill, fill);
        }
        if (shift >= Long.SIZE) {
            return of(fill, high >> (shift - Long.SIZE));
        }
        return of(high >> shift, (low >>> shift) | (high << (Long.SIZE - shift)));
    }

    public Int128 and(Int128 other) {
        return of(high & other.high, low & other.low);
    }

    public Int128 or(Int128 other) {
        return of(high | other.high, low | other.low);
    }

    public Int128 xor(Int128 other) {
        return of(high ^ other.high, low ^ other.low);
    }

    public Int128 not() {
        return of(~high, ~low);
    }

    /**
     * Reinterprets the same 128 bits as unsigned.
     */
    public UInt128 toUInt128() {
        return UInt128.of(high, low);
    }

    public BigInteger toBigInteger() {
        byte[] bytes = new byte[16];
        for (int i = 0; i < Long.BYTES; i++) {
            bytes[i] = (byte) (high >>> (56 - 8 * i));
            bytes[8 + i] = (byte) (low >>> (56 - 8 * i));
        }
        return new BigInteger(bytes);
    }

    /**
     * Signed ordering.
     */
    @Override
    public int compareTo(Int128 other) {
        int cmp = Long.compare(high, other.high);
        return cmp != 0 ? cmp : Long.compareUnsigned(low, other.low);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Int128)) {
            return false;
        }
        Int128 that = (Int128) o;
        return high == that.high && low == that.low;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(high) + Long.hashCode(low);
    }

    @Override
    public String toString() {
        if (high == (low >> (Long.SIZE - 1))) {
            return Long.toString(low);
        }
        return toBigInteger().toString();
    }
}
