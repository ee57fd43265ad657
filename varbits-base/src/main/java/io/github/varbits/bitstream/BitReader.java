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

package io.github.varbits.bitstream;

import io.github.varbits.exceptions.BitStreamException;
import io.github.varbits.math.UInt128;
import io.github.varbits.util.BitUtil;
import io.github.varbits.value.BitValue;

/**
 * Reads LSB-first packed bit fields.
 * <p>
 * The first bit read becomes bit 0 of the result. Fields wider than 64 bits are read as their low
 * 64 bits followed by the remaining high bits. Implementations are stateful and NOT threadsafe.
 */
public interface BitReader {
    /**
     * Reads {@code bitCount} bits.
     *
     * @param bitCount number of bits, in {@code [1, 64]}
     * @return the bits as an unsigned value, first bit read in bit 0
     * @throws BitStreamException {@code INVALID_BIT_COUNT} for a width outside {@code [1, 64]},
     *         {@code END_OF_STREAM} if fewer bits remain, {@code IO} if the medium fails
     */
    long readBits(int bitCount);

    /**
     * Reads a single bit.
     */
    default boolean readBit() {
        return readBits(1) != 0;
    }

    /**
     * Reads up to 128 bits. Widths above 64 read the low 64 bits first, then the remaining
     * {@code bitCount - 64} high bits.
     *
     * @param bitCount number of bits, in {@code [1, 128]}
     * @return the bits as an unsigned 128-bit value
     */
    default UInt128 readBits128(int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        if (bitCount <= BitUtil.MAX_BITS) {
            return UInt128.valueOf(readBits(bitCount));
        }
        long low = readBits(BitUtil.MAX_BITS);
        long high = readBits(bitCount - BitUtil.MAX_BITS);
        return UInt128.of(high, low);
    }

    /**
     * Reads {@code bitCount} bits as an unsigned {@link BitValue} of that width.
     *
     * @param bitCount number of bits, in {@code [1, 128]}
     */
    default BitValue readBitValue(int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        if (bitCount <= BitUtil.MAX_BITS) {
            return BitValue.ofUnsigned(readBits(bitCount), bitCount);
        }
        return BitValue.ofUnsigned(readBits128(bitCount), bitCount);
    }

    /**
     * Reads {@code count} bytes of 8 bits each, starting at the current bit position,
     * which need not be byte aligned.
     */
    default byte[] readBytes(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        byte[] bytes = new byte[count];
        for (int i = 0; i < count; i++) {
            bytes[i] = (byte) readBits(Byte.SIZE);
        }
        return bytes;
    }

    /**
     * Discards {@code bitCount} bits.
     *
     * @throws BitStreamException {@code END_OF_STREAM} if fewer bits remain
     */
    default void skipBits(long bitCount) {
        if (bitCount < 0) {
            throw new IllegalArgumentException("bitCount must be non-negative: " + bitCount);
        }
        while (bitCount > 0) {
            int n = (int) Math.min(bitCount, BitUtil.MAX_BITS);
            readBits(n);
            bitCount -= n;
        }
    }

    /**
     * Discards the remaining bits of the current byte. Does nothing when already aligned.
     */
    void alignToByte();

    /**
     * @return true if no further bit can be read
     */
    boolean isAtEnd();

    /**
     * @return the number of bits consumed so far
     */
    long position();
}
