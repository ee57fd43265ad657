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

/**
 * The per-byte step of LSB-first bit packing, shared by every reader and writer so that in-memory
 * and streaming variants produce identical bytes.
 * <p>
 * A field is moved in chunks: each chunk covers the bits from the current bit slot to the end of the
 * current byte, or to the end of the field, whichever comes first.
 */
final class BitPacking {
    private BitPacking() {
    }

    /**
     * @param bitPos the current bit slot, in {@code [0, 8)}
     * @param remaining bits of the field still to move
     * @return how many bits the current byte can take or give
     */
    static int chunk(int bitPos, int remaining) {
        return Math.min(Byte.SIZE - bitPos, remaining);
    }

    /**
     * Stores the low {@code bits} bits of {@code value} into {@code target} starting at slot
     * {@code bitPos}, leaving the other bits of {@code target} untouched.
     */
    static byte deposit(byte target, int bitPos, int bits, long value) {
        int mask = ((1 << bits) - 1) << bitPos;
        int payload = ((int) value << bitPos) & mask;
        return (byte) ((target & ~mask) | payload);
    }

    /**
     * @return {@code bits} bits of {@code source} starting at slot {@code bitPos}, right-aligned
     */
    static long extract(byte source, int bitPos, int bits) {
        return ((source & 0xFF) >>> bitPos) & ((1 << bits) - 1);
    }
}
