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

package io.github.varbits.util;

import io.github.varbits.exceptions.BitStreamException;

/**
 * Utility methods for bit masks and bit-count validation.
 */
public final class BitUtil {
    /** Largest bit count accepted by the 64-bit read and write paths. */
    public static final int MAX_BITS = Long.SIZE;

    /** Largest bit count accepted by the 128-bit paths and by {@code BitValue}. */
    public static final int MAX_WIDE_BITS = 2 * Long.SIZE;

    private BitUtil() {
    }

    /**
     * Returns a mask with the low {@code bitCount} bits set.
     *
     * @param bitCount number of bits, in {@code [0, 64]}
     * @return the mask; all ones for 64
     */
    public static long mask(int bitCount) {
        return bitCount >= Long.SIZE ? -1L : (1L << bitCount) - 1;
    }

    /**
     * Keeps only the low {@code bitCount} bits of {@code value}.
     */
    public static long maskBits(long value, int bitCount) {
        return value & mask(bitCount);
    }

    /**
     * Validates that {@code bitCount} lies in {@code [1, maxBits]}.
     *
     * @param bitCount the requested width
     * @param maxBits the largest width the caller accepts
     * @return {@code bitCount}, for chaining
     * @throws BitStreamException of type {@code INVALID_BIT_COUNT} if the width is out of range
     */
    public static int checkBitCount(int bitCount, int maxBits) {
        if (bitCount < 1 || bitCount > maxBits) {
            throw BitStreamException.invalidBitCount(bitCount, maxBits);
        }
        return bitCount;
    }

    /**
     * Number of bytes needed to hold {@code bitCount} bits.
     */
    public static long bytesForBits(long bitCount) {
        return (bitCount + Byte.SIZE - 1) / Byte.SIZE;
    }
}
