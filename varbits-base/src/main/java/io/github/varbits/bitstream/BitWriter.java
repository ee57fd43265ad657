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
 * Writes LSB-first packed bit fields.
 * <p>
 * Bit 0 of a value goes into the first free bit slot of the current byte. Fields wider than 64 bits
 * are written as their low 64 bits followed by the remaining high bits; this ordering is part of the
 * persisted format. Implementations are stateful and NOT threadsafe.
 */
public interface BitWriter {
    /**
     * Writes the low {@code bitCount} bits of {@code value}. Higher bits are ignored.
     *
     * @param value the bits to write
     * @param bitCount number of bits, in {@code [1, 64]}
     * @throws BitStreamException {@code INVALID_BIT_COUNT} for a width outside {@code [1, 64]},
     *         {@code IO} if the medium fails
     */
    void writeBits(long value, int bitCount);

    /**
     * Writes a single bit.
     */
    default void writeBit(boolean bit) {
        writeBits(bit ? 1L : 0L, 1);
    }

    /**
     * Writes the low {@code bitCount} bits of a 128-bit value: the low word first, then
     * {@code bitCount - 64} bits of the high word.
     *
     * @param value the bits to write
     * @param bitCount number of bits, in {@code [1, 128]}
     */
    default void writeBits128(UInt128 value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        UInt128 masked = value.mask(bitCount);
        if (bitCount <= BitUtil.MAX_BITS) {
            writeBits(masked.low(), bitCount);
            return;
        }
        writeBits(masked.low(), BitUtil.MAX_BITS);
        writeBits(masked.high(), bitCount - BitUtil.MAX_BITS);
    }

    /**
     * Writes {@code value} using its own bit count.
     */
    default void writeBitValue(BitValue value) {
        writeBitValue(value, value.bitCount());
    }

    /**
     * Writes the low {@code bitCount} bits of {@code value}. Signed values are written as their two's
     * complement bit pattern.
     *
     * @param value the value to write
     * @param bitCount number of bits, in {@code [1, 128]}, overriding the value's own width
     */
    default void writeBitValue(BitValue value, int bitCount) {
        writeBits128(value.toUInt128(), bitCount);
    }

    /**
     * Writes each byte as an 8-bit field, starting at the current bit position.
     */
    default void writeBytes(byte[] bytes) {
        for (byte b : bytes) {
            writeBits(b, Byte.SIZE);
        }
    }

    /**
     * Pads the current byte with zero bits so that the next write starts on a byte boundary.
     * Does nothing when already aligned.
     */
    void alignToByte();

    /**
     * @return the number of bits written so far
     */
    long position();
}
