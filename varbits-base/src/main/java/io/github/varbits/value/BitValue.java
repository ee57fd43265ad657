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

package io.github.varbits.value;

import io.github.varbits.exceptions.BitStreamException;
import io.github.varbits.math.Int128;
import io.github.varbits.math.UInt128;
import io.github.varbits.util.BitUtil;

import java.util.Objects;

/**
 * An immutable integer of 1 to 128 bits, tagged with its declared width and signedness.
 * <p>
 * The value is held in the smallest of the 8, 16, 32, 64 or 128-bit containers that covers the
 * declared bit count, identified by its {@link Kind}. Unsigned values are stored masked to exactly
 * {@code bitCount} bits. Signed values are truncated to their container width and sign-extended from
 * it, with no further masking.
 * <p>
 * Two values are equal only if they have the same bit count, the same kind (and therefore the same
 * signedness) and the same stored magnitude. An unsigned 8-bit {@code 0xFF} is not equal to a signed
 * 8-bit {@code -1}, even though both have the same bit pattern.
 */
public final class BitValue {

    /**
     * The storage container of a {@code BitValue}: five unsigned and five signed fixed widths.
     */
    public enum Kind {
        U8(8, false),
        U16(16, false),
        U32(32, false),
        U64(64, false),
        U128(128, false),
        I8(8, true),
        I16(16, true),
        I32(32, true),
        I64(64, true),
        I128(128, true);

        private final int storageBits;
        private final boolean signed;

        Kind(int storageBits, boolean signed) {
            this.storageBits = storageBits;
            this.signed = signed;
        }

        public int storageBits() {
            return storageBits;
        }

        public boolean isSigned() {
            return signed;
        }

        /**
         * @return the smallest unsigned kind holding {@code bitCount} bits
         */
        static Kind unsignedFor(int bitCount) {
            if (bitCount <= 8) {
                return U8;
            } else if (bitCount <= 16) {
                return U16;
            } else if (bitCount <= 32) {
                return U32;
            } else if (bitCount <= 64) {
                return U64;
            }
            return U128;
        }

        /**
         * @return the smallest signed kind holding {@code bitCount} bits
         */
        static Kind signedFor(int bitCount) {
            if (bitCount <= 8) {
                return I8;
            } else if (bitCount <= 16) {
                return I16;
            } else if (bitCount <= 32) {
                return I32;
            } else if (bitCount <= 64) {
                return I64;
            }
            return I128;
        }
    }

    private final Kind kind;
    private final int bitCount;
    // for kinds narrower than 128 bits, high is 0 (unsigned) or the sign extension of low (signed)
    private final long high;
    private final long low;

    private BitValue(Kind kind, int bitCount, long high, long low) {
        this.kind = kind;
        this.bitCount = bitCount;
        this.high = high;
        this.low = low;
    }

    /**
     * Creates an unsigned value, keeping only the low {@code bitCount} bits of {@code value}.
     * Widths above 64 produce a {@link Kind#U128} holding the zero-extended value.
     *
     * @param value the bits, interpreted as unsigned
     * @param bitCount the declared width, in {@code [1, 128]}
     * @return the tagged value
     * @throws BitStreamException of type {@code INVALID_BIT_COUNT} for widths outside {@code [1, 128]}
     */
    public static BitValue ofUnsigned(long value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        Kind kind = Kind.unsignedFor(bitCount);
        if (kind == Kind.U128) {
            return new BitValue(kind, bitCount, 0L, value);
        }
        return new BitValue(kind, bitCount, 0L, BitUtil.maskBits(value, bitCount));
    }

    /**
     * Creates an unsigned value from a wide integer, keeping only the low {@code bitCount} bits.
     *
     * @param value the bits
     * @param bitCount the declared width, in {@code [1, 128]}
     * @return the tagged value
     */
    public static BitValue ofUnsigned(UInt128 value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        UInt128 masked = value.mask(bitCount);
        return new BitValue(Kind.unsignedFor(bitCount), bitCount, masked.high(), masked.low());
    }

    /**
     * Creates a signed value in the smallest signed container covering {@code bitCount}. The value is
     * truncated to that container, not to {@code bitCount}: {@code ofSigned(200, 8)} stores
     * {@code -56}, while {@code ofSigned(200, 12)} stores {@code 200}.
     *
     * @param value the value
     * @param bitCount the declared width, in {@code [1, 64]}
     * @return the tagged value
     * @throws BitStreamException of type {@code INVALID_BIT_COUNT} for widths outside {@code [1, 64]}
     */
    public static BitValue ofSigned(long value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_BITS);
        return signedNarrow(Kind.signedFor(bitCount), bitCount, value);
    }

    /**
     * Creates a signed value from a wide integer. Widths up to 64 truncate the low word to the
     * chosen container; wider values are stored whole.
     *
     * @param value the value
     * @param bitCount the declared width, in {@code [1, 128]}
     * @return the tagged value
     */
    public static BitValue ofSigned(Int128 value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        Kind kind = Kind.signedFor(bitCount);
        if (kind == Kind.I128) {
            return new BitValue(kind, bitCount, value.high(), value.low());
        }
        return signedNarrow(kind, bitCount, value.low());
    }

    private static BitValue signedNarrow(Kind kind, int bitCount, long value) {
        long stored = switch (kind) {
            case I8 -> (byte) value;
            case I16 -> (short) value;
            case I32 -> (int) value;
            case I64 -> value;
            default -> throw new AssertionError("Not a narrow signed kind: " + kind);
        };
        return new BitValue(kind, bitCount, stored >> (Long.SIZE - 1), stored);
    }

    /** A signed 8-bit value. */
    public static BitValue fromByte(byte value) {
        return ofSigned(value, Byte.SIZE);
    }

    /** A signed 16-bit value. */
    public static BitValue fromShort(short value) {
        return ofSigned(value, Short.SIZE);
    }

    /** A signed 32-bit value. */
    public static BitValue fromInt(int value) {
        return ofSigned(value, Integer.SIZE);
    }

    /** A signed 64-bit value. */
    public static BitValue fromLong(long value) {
        return ofSigned(value, Long.SIZE);
    }

    /** An unsigned 128-bit value. */
    public static BitValue fromUInt128(UInt128 value) {
        return ofUnsigned(value, BitUtil.MAX_WIDE_BITS);
    }

    /** A signed 128-bit value. */
    public static BitValue fromInt128(Int128 value) {
        return ofSigned(value, BitUtil.MAX_WIDE_BITS);
    }

    /**
     * @return the declared width, in {@code [1, 128]}
     */
    public int bitCount() {
        return bitCount;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isSigned() {
        return kind.isSigned();
    }

    /**
     * @return the width of the storage container: 8, 16, 32, 64 or 128
     */
    public int storageBits() {
        return kind.storageBits();
    }

    /**
     * Returns the low 64 bits. Unsigned values are zero-extended and signed values sign-extended
     * before truncation, matching a native integer cast.
     *
     * @throws BitStreamException of type {@code INVALID_CONVERSION} if this is a negative
     *         {@link Kind#I128} value
     */
    public long toUInt64() {
        if (kind == Kind.I128 && high < 0L) {
            throw BitStreamException.invalidConversion(
                    "Negative 128-bit value " + this + " cannot be converted to unsigned 64-bit");
        }
        return low;
    }

    /**
     * Returns the value as a 128-bit word pair. Signed values yield their two's complement bit pattern.
     */
    public UInt128 toUInt128() {
        return UInt128.of(high, low);
    }

    /**
     * Returns the low 64 bits as a signed {@code long}. Wider values are truncated.
     */
    public long toInt64() {
        return low;
    }

    /**
     * Returns the value as a signed 128-bit integer. Unsigned 128-bit values with the top bit set
     * wrap to negative, like a native cast.
     */
    public Int128 toInt128() {
        return Int128.of(high, low);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitValue)) {
            return false;
        }
        BitValue that = (BitValue) o;
        return bitCount == that.bitCount && kind == that.kind && high == that.high && low == that.low;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bitCount, high, low);
    }

    @Override
    public String toString() {
        String number = isSigned() ? toInt128().toString() : toUInt128().toString();
        return number + " (" + bitCount + " bits, " + (isSigned() ? "signed" : "unsigned") + ")";
    }
}
